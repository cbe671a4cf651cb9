package com.bbthechange.carshare.protocol;

import com.bbthechange.carshare.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * JSON form of {@link MessageEnvelope}.
 *
 * Decoding is strict about the envelope and the payload shape: an unknown type, a missing
 * clientId/messageId/type, or a payload that does not bind to the type's payload class is a
 * ValidationException. A missing timestamp is read as now; a missing payload as {}.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MessageEnvelope decode(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Envelope is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Envelope must be a JSON object");
        }

        String clientId = requiredText(root, "clientId");
        String messageId = requiredText(root, "messageId");
        String typeName = requiredText(root, "type");
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new ValidationException("Unknown message type: " + typeName));

        String correlationId = optionalText(root, "correlationId");
        Instant timestamp = parseTimestamp(optionalText(root, "timestamp"));

        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            payloadNode = objectMapper.createObjectNode();
        }
        if (!payloadNode.isObject()) {
            throw new ValidationException(type + " payload must be a JSON object");
        }

        MessagePayload payload;
        try {
            payload = objectMapper.treeToValue(payloadNode, type.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed " + type + " payload: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed " + type + " payload: " + e.getMessage(), e);
        }
        payload.validate();

        return new MessageEnvelope(clientId, messageId, type, correlationId, timestamp, payload);
    }

    public String encode(MessageEnvelope envelope) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("clientId", envelope.getClientId());
        root.put("messageId", envelope.getMessageId());
        root.put("type", envelope.getType().name());
        if (envelope.getCorrelationId() != null) {
            root.put("correlationId", envelope.getCorrelationId());
        } else {
            root.putNull("correlationId");
        }
        root.put("timestamp", envelope.getTimestamp().toString());
        root.set("payload", objectMapper.valueToTree(envelope.getPayload()));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope, e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Envelope field '" + field + "' is required");
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException("Envelope field '" + field + "' must be a string");
        }
        return node.asText();
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            // Zone-less timestamps are read as UTC
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new ValidationException("Envelope timestamp is not ISO-8601: " + value, inner);
            }
        }
    }
}
