package com.murmur.gateway.realtime;

import com.murmur.eventbus.publish.Broadcast;
import com.murmur.eventbus.publish.BroadcastRouter;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.payload.CallEnded;
import com.murmur.eventmodel.payload.CallInitiated;
import com.murmur.eventmodel.payload.ConversationCreated;
import com.murmur.eventmodel.payload.ConversationMemberAdded;
import com.murmur.eventmodel.payload.ConversationMemberLeft;
import com.murmur.eventmodel.payload.FriendRequestAccepted;
import com.murmur.eventmodel.payload.FriendRequestSent;
import com.murmur.eventmodel.payload.MessageDelivered;
import com.murmur.eventmodel.payload.MessageSeen;
import com.murmur.eventmodel.payload.MessageSent;
import com.murmur.eventmodel.payload.PrivacySettingsUpdated;
import com.murmur.eventmodel.payload.Unfriended;
import com.murmur.eventmodel.payload.UserBlocked;
import com.murmur.eventmodel.payload.UserUnblocked;
import com.murmur.pubsub.ChannelNames;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decides which channels an event is broadcast on.
 *
 * <p>Conversation traffic goes to the conversation channel. Receipts go back to the original
 * sender only. Membership, block, friendship, call and privacy events go to the per-user channels
 * of the users they concern. Media uploads are not broadcast; the message referencing the media is.
 */
@Component
public class ChatBroadcastRouter implements BroadcastRouter {

    @Override
    public List<Broadcast> route(EventEnvelope<? extends EventPayload> event) {
        Set<String> channels = channelsFor(event.payload());
        if (channels.isEmpty()) {
            return List.of();
        }
        RealtimeMessage message = RealtimeMessage.of(event);
        List<Broadcast> broadcasts = new ArrayList<>(channels.size());
        for (String channel : channels) {
            broadcasts.add(new Broadcast(channel, message));
        }
        return broadcasts;
    }

    Set<String> channelsFor(EventPayload payload) {
        Set<String> channels = new LinkedHashSet<>();
        if (payload instanceof MessageSent sent) {
            channels.add(ChannelNames.conversation(sent.conversationId()));
        } else if (payload instanceof MessageDelivered delivered) {
            channels.add(ChannelNames.receipts(delivered.senderId()));
        } else if (payload instanceof MessageSeen seen) {
            channels.add(ChannelNames.receipts(seen.senderId()));
        } else if (payload instanceof ConversationCreated created) {
            addUsers(channels, created.memberIds());
            addUser(channels, created.creatorId());
        } else if (payload instanceof ConversationMemberAdded added) {
            channels.add(ChannelNames.conversation(added.conversationId()));
            addUsers(channels, added.memberIds());
        } else if (payload instanceof ConversationMemberLeft left) {
            channels.add(ChannelNames.conversation(left.conversationId()));
            addUser(channels, left.userId());
        } else if (payload instanceof UserBlocked blocked) {
            addUser(channels, blocked.blockerId());
        } else if (payload instanceof UserUnblocked unblocked) {
            addUser(channels, unblocked.blockerId());
        } else if (payload instanceof FriendRequestSent request) {
            addUser(channels, request.toUserId());
        } else if (payload instanceof FriendRequestAccepted accepted) {
            addUser(channels, accepted.requesterId());
        } else if (payload instanceof Unfriended unfriended) {
            addUser(channels, unfriended.otherUserId());
        } else if (payload instanceof CallInitiated call) {
            addUsers(channels, call.calleeIds());
        } else if (payload instanceof CallEnded ended) {
            addUser(channels, ended.endedBy());
        } else if (payload instanceof PrivacySettingsUpdated privacy) {
            addUser(channels, privacy.userId());
        }
        return channels;
    }

    private static void addUsers(Set<String> channels, List<String> userIds) {
        if (userIds == null) {
            return;
        }
        for (String userId : userIds) {
            addUser(channels, userId);
        }
    }

    private static void addUser(Set<String> channels, String userId) {
        if (userId != null && !userId.isBlank()) {
            channels.add(ChannelNames.user(userId));
        }
    }
}
