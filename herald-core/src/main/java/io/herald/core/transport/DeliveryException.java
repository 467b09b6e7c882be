package io.herald.core.transport;

public final class DeliveryException extends Exception {
    private final int httpStatus;

    public DeliveryException(String message) {
        this(message, -1, null);
    }

    public DeliveryException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public DeliveryException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * HTTP status of the failed call, or -1 when the request never got a response.
     */
    public int httpStatus() {
        return httpStatus;
    }
}
