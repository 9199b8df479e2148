package com.murmur.pubsub;

/**
 * Pure mapping from routing keys to channel names of the form {@code <domain>:<routingKey>}.
 *
 * <p>Any process can compute the channel for an entity without a directory lookup, so a gateway
 * subscribes to exactly the conversations and users it currently serves.
 */
public final class ChannelNames {

    public static final String CONVERSATION = "conv";
    public static final String RECEIPT = "receipt";
    public static final String TYPING = "typing";
    public static final String USER = "user";

    private static final char SEPARATOR = ':';

    private ChannelNames() {
        // utility class
    }

    /** Messages and membership changes of a conversation. */
    public static String conversation(String conversationId) {
        return of(CONVERSATION, conversationId);
    }

    /** Delivery and read receipts addressed to a message's sender. */
    public static String receipts(String userId) {
        return of(RECEIPT, userId);
    }

    /** Typing indicators of a conversation. */
    public static String typing(String conversationId) {
        return of(TYPING, conversationId);
    }

    /** Notifications addressed to one user regardless of conversation. */
    public static String user(String userId) {
        return of(USER, userId);
    }

    public static String of(String domain, String routingKey) {
        requireSegment("domain", domain);
        requireSegment("routingKey", routingKey);
        if (domain.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("domain must not contain '" + SEPARATOR + "'");
        }
        return domain + SEPARATOR + routingKey;
    }

    /**
     * Splits a channel name at its first separator.
     *
     * @throws IllegalArgumentException if the name is not {@code <domain>:<routingKey>}
     */
    public static ChannelName parse(String channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel must not be null");
        }
        int idx = channel.indexOf(SEPARATOR);
        if (idx <= 0 || idx == channel.length() - 1) {
            throw new IllegalArgumentException("Not a channel name: " + channel);
        }
        return new ChannelName(channel.substring(0, idx), channel.substring(idx + 1));
    }

    private static void requireSegment(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    /** A parsed channel name. */
    public record ChannelName(String domain, String routingKey) {

        @Override
        public String toString() {
            return domain + SEPARATOR + routingKey;
        }
    }
}
