package com.bbthechange.carshare.protocol;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One message on the persistent channel.
 *
 * {@code clientId} names the sender ("backend" for messages the backend originates),
 * {@code correlationId} links a response to the {@code messageId} of the request it answers.
 */
public final class MessageEnvelope {

    public static final String BACKEND_SENDER = "backend";

    private final String clientId;
    private final String messageId;
    private final MessageType type;
    private final String correlationId;
    private final Instant timestamp;
    private final MessagePayload payload;

    public MessageEnvelope(String clientId, String messageId, MessageType type, String correlationId,
                           Instant timestamp, MessagePayload payload) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.messageId = Objects.requireNonNull(messageId, "messageId");
        this.type = Objects.requireNonNull(type, "type");
        this.correlationId = correlationId;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.payload = Objects.requireNonNull(payload, "payload");
        if (!type.accepts(payload)) {
            throw new IllegalArgumentException(type + " carries " + type.getPayloadType().getSimpleName()
                    + ", not " + payload.getClass().getSimpleName());
        }
    }

    /**
     * A backend-originated message with a fresh message id.
     */
    public static MessageEnvelope fromBackend(MessageType type, MessagePayload payload, String correlationId) {
        return fromBackend(UUID.randomUUID().toString(), type, payload, correlationId);
    }

    public static MessageEnvelope fromBackend(String messageId, MessageType type, MessagePayload payload, String correlationId) {
        return new MessageEnvelope(BACKEND_SENDER, messageId, type, correlationId, Instant.now(), payload);
    }

    /**
     * Response to this message: correlationId is this message's id.
     */
    public MessageEnvelope reply(MessageType responseType, MessagePayload responsePayload) {
        return fromBackend(responseType, responsePayload, messageId);
    }

    public String getClientId() {
        return clientId;
    }

    public String getMessageId() {
        return messageId;
    }

    public MessageType getType() {
        return type;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MessagePayload getPayload() {
        return payload;
    }

    @SuppressWarnings("unchecked")
    public <T extends MessagePayload> T payloadAs(Class<T> payloadClass) {
        if (!payloadClass.isInstance(payload)) {
            throw new IllegalStateException(type + " payload is " + payload.getClass().getSimpleName());
        }
        return (T) payload;
    }

    @Override
    public String toString() {
        return "MessageEnvelope{type=" + type + ", clientId='" + clientId + "', messageId='" + messageId
                + "', correlationId='" + correlationId + "'}";
    }
}
