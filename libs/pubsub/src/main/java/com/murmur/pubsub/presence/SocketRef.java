package com.murmur.pubsub.presence;

/**
 * A live client connection.
 *
 * @param gatewayInstance gateway process holding the socket
 * @param socketId connection identifier, unique within the gateway
 * @param deviceId client device
 */
public record SocketRef(String gatewayInstance, String socketId, String deviceId) {

    public SocketRef {
        if (gatewayInstance == null || gatewayInstance.isBlank()) {
            throw new IllegalArgumentException("gatewayInstance must not be null or blank");
        }
        if (socketId == null || socketId.isBlank()) {
            throw new IllegalArgumentException("socketId must not be null or blank");
        }
    }

    public boolean isOn(String instance) {
        return gatewayInstance.equals(instance);
    }
}
