package com.murmur.gateway.projection;

import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.payload.UserBlocked;
import com.murmur.eventmodel.payload.UserUnblocked;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Who has blocked whom, used to suppress fan-out between blocked pairs. */
@Component
public class BlockListListener {

    public static final String NAME = "block-list";

    private final Map<String, Set<String>> blockedByBlocker = new ConcurrentHashMap<>();

    public void onUserBlocked(EventEnvelope<UserBlocked> event) {
        UserBlocked blocked = event.payload();
        blockedByBlocker.computeIfAbsent(blocked.blockerId(), id -> ConcurrentHashMap.newKeySet())
                .add(blocked.blockedId());
    }

    public void onUserUnblocked(EventEnvelope<UserUnblocked> event) {
        UserUnblocked unblocked = event.payload();
        blockedByBlocker.computeIfPresent(unblocked.blockerId(), (id, blocked) -> {
            blocked.remove(unblocked.blockedId());
            return blocked.isEmpty() ? null : blocked;
        });
    }

    public boolean isBlocked(String blockerId, String blockedId) {
        Set<String> blocked = blockedByBlocker.get(blockerId);
        return blocked != null && blocked.contains(blockedId);
    }

    /** True when either user has blocked the other. */
    public boolean eitherBlocked(String userA, String userB) {
        return isBlocked(userA, userB) || isBlocked(userB, userA);
    }

    public Set<String> blockedBy(String blockerId) {
        Set<String> blocked = blockedByBlocker.get(blockerId);
        return blocked == null ? Set.of() : Set.copyOf(blocked);
    }
}
