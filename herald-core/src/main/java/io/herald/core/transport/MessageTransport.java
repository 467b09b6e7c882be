package io.herald.core.transport;

public interface MessageTransport {
    String name();

    void send(String channel, String message) throws DeliveryException;
}
