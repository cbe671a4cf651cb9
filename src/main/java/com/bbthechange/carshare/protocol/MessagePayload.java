package com.bbthechange.carshare.protocol;

/**
 * Marker for the payload of an envelope. Each {@link MessageType} names exactly one payload class.
 */
public interface MessagePayload {

    /**
     * Reject payloads whose shape decoded but whose required content is missing.
     * Throws ValidationException.
     */
    default void validate() {
    }
}
