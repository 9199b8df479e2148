package com.murmur.eventbus.dispatch;

import java.util.List;

/** Per-listener outcomes of one dispatch round, in registration order. */
public record DispatchReport(String eventId, List<ListenerOutcome> outcomes) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public static DispatchReport none(String eventId) {
        return new DispatchReport(eventId, List.of());
    }

    /**
     * True when every listener has settled the event. A listener skipped because another worker
     * holds the claim is not settled: that worker may still fail.
     */
    public boolean allSucceeded() {
        return outcomes.stream().allMatch(ListenerOutcome::isSettled);
    }

    public List<ListenerOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSettled()).toList();
    }
}
