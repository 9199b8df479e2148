package com.murmur.gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.murmur.eventbus.log.InMemoryEventLog;
import com.murmur.gateway.GatewayTestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventLogController")
class EventLogControllerTest {

    private InMemoryEventLog eventLog;
    private EventLogController controller;

    @BeforeEach
    void setUp() {
        eventLog = new InMemoryEventLog();
        controller = new EventLogController(eventLog);
        for (int i = 0; i < 5; i++) {
            eventLog.append(GatewayTestEvents.messageSent("conv-1", "alice", "bob"));
        }
        eventLog.append(GatewayTestEvents.messageSent("conv-2", "bob", "alice"));
    }

    @Test
    @DisplayName("pages through an aggregate in sequence order")
    void pagesInOrder() {
        var firstPage = controller.aggregateEvents("conv-1", 0, 2);
        var secondPage = controller.aggregateEvents("conv-1", firstPage.lastSequence(), 2);
        var lastPage = controller.aggregateEvents("conv-1", secondPage.lastSequence(), 2);

        assertThat(firstPage.events()).extracting(EventView::aggregateSequence).containsExactly(1L, 2L);
        assertThat(firstPage.hasMore()).isTrue();
        assertThat(secondPage.events()).extracting(EventView::aggregateSequence).containsExactly(3L, 4L);
        assertThat(lastPage.events()).extracting(EventView::aggregateSequence).containsExactly(5L);
        assertThat(lastPage.hasMore()).isFalse();
    }

    @Test
    @DisplayName("returns an empty page past the end and keeps the cursor")
    void emptyPageKeepsCursor() {
        var page = controller.aggregateEvents("conv-1", 5, 10);

        assertThat(page.events()).isEmpty();
        assertThat(page.lastSequence()).isEqualTo(5);
    }

    @Test
    @DisplayName("exposes the envelope fields and JSON payload")
    void exposesEnvelope() {
        var event = GatewayTestEvents.messageSent("conv-3", "carol", "dave");
        eventLog.append(event);

        var response = controller.event(event.eventId());

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        var view = response.getBody();
        assertThat(view.eventType()).isEqualTo("MESSAGE_SENT");
        assertThat(view.correlationId()).isEqualTo("corr-conv-3");
        assertThat(view.payload().get("senderId").asText()).isEqualTo("carol");
    }

    @Test
    @DisplayName("returns 404 for an unknown event")
    void unknownEvent() {
        assertThat(controller.event("missing").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    @DisplayName("rejects limits outside 1..500")
    void rejectsBadLimit() {
        assertThatThrownBy(() -> controller.aggregateEvents("conv-1", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.aggregateEvents("conv-1", 0, EventLogController.MAX_LIMIT + 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.aggregateEvents("conv-1", -1, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
