package com.bbthechange.carshare.websocket;

import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.protocol.EnvelopeCodec;
import com.bbthechange.carshare.protocol.MessageEnvelope;
import com.bbthechange.carshare.protocol.MessageType;
import com.bbthechange.carshare.protocol.payload.CarCommandPayload;
import com.bbthechange.carshare.protocol.payload.NotifyPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Outbound side of the channel: encodes envelopes and writes them to connections.
 * A connection that fails a write is dropped from the registry. A command is written to a
 * given connection at most once, whether it arrives through the enqueue event or the
 * batch sent on CAR_CONNECT.
 */
@Component
public class ChannelMessageDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ChannelMessageDispatcher.class);

    private final EnvelopeCodec codec;
    private final ChannelSessionRegistry registry;

    public ChannelMessageDispatcher(EnvelopeCodec codec, ChannelSessionRegistry registry) {
        this.codec = codec;
        this.registry = registry;
    }

    public boolean send(ChannelConnection connection, MessageEnvelope envelope) {
        if (!connection.isOpen()) {
            logger.debug("Not sending {} to closed connection {}", envelope.getType(), connection.getId());
            registry.remove(connection.getId());
            return false;
        }
        try {
            connection.send(codec.encode(envelope));
            return true;
        } catch (IOException | IllegalStateException e) {
            logger.warn("Failed to send {} on connection {}: {}", envelope.getType(), connection.getId(), e.getMessage());
            registry.remove(connection.getId());
            return false;
        }
    }

    /**
     * NOTIFY a rider if the rider is connected.
     */
    public boolean notifyRider(String clientId, String message) {
        return registry.connectionForRider(clientId)
                .map(connection -> send(connection,
                        MessageEnvelope.fromBackend(MessageType.NOTIFY, new NotifyPayload(message), null)))
                .orElse(false);
    }

    /**
     * Push a queued command to its car if the car is connected. The envelope's messageId is the
     * command id, so the car's CAR_STATE_RESPONSE correlates back to the command.
     */
    public boolean pushCommand(CarCommand command) {
        return registry.connectionForCar(command.getVin())
                .map(connection -> pushOnce(connection, command))
                .orElse(false);
    }

    /**
     * Push a batch in order, stopping at the first failed write. Commands already written to
     * this connection are skipped and not counted.
     */
    public int pushCommands(ChannelConnection connection, List<CarCommand> commands) {
        int pushed = 0;
        for (CarCommand command : commands) {
            if (!registry.markPushed(connection.getId(), command.getId())) {
                logger.debug("Command {} already pushed on connection {}", command.getId(), connection.getId());
                continue;
            }
            if (!send(connection, commandEnvelope(command))) {
                break;
            }
            pushed++;
        }
        return pushed;
    }

    private boolean pushOnce(ChannelConnection connection, CarCommand command) {
        if (!registry.markPushed(connection.getId(), command.getId())) {
            logger.debug("Command {} already pushed on connection {}", command.getId(), connection.getId());
            return true;
        }
        return send(connection, commandEnvelope(command));
    }

    static MessageEnvelope commandEnvelope(CarCommand command) {
        MessageType type;
        switch (command.getKind()) {
            case UNLOCK:
                type = MessageType.CAR_UNLOCK;
                break;
            case LOCK:
                type = MessageType.CAR_LOCK;
                break;
            case STATE_QUERY:
                type = MessageType.CAR_STATE_QUERY;
                break;
            default:
                throw new IllegalArgumentException("Unsupported command kind: " + command.getKind());
        }
        return MessageEnvelope.fromBackend(command.getId(), type, new CarCommandPayload(command), null);
    }
}
