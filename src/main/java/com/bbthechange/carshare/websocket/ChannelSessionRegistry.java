package com.bbthechange.carshare.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Who is on which channel connection.
 *
 * A connection is bound to at most one rider or one car. Binding a rider or car that is
 * already bound elsewhere moves it to the new connection; closing a connection drops its bindings.
 */
@Component
public class ChannelSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ChannelSessionRegistry.class);

    private final ConcurrentMap<String, ChannelConnection> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> riderByConnection = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> connectionByRider = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> vinByConnection = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> connectionByVin = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> pushedCommandsByConnection = new ConcurrentHashMap<>();

    public void register(ChannelConnection connection) {
        connections.put(connection.getId(), connection);
        logger.debug("Channel connection {} opened ({} open)", connection.getId(), connections.size());
    }

    public void bindRider(String clientId, ChannelConnection connection) {
        register(connection);
        String previous = connectionByRider.put(clientId, connection.getId());
        if (previous != null && !previous.equals(connection.getId())) {
            riderByConnection.remove(previous, clientId);
        }
        String replacedRider = riderByConnection.put(connection.getId(), clientId);
        if (replacedRider != null && !replacedRider.equals(clientId)) {
            connectionByRider.remove(replacedRider, connection.getId());
        }
        logger.info("Rider {} bound to channel connection {}", clientId, connection.getId());
    }

    public void bindCar(String vin, ChannelConnection connection) {
        register(connection);
        String previous = connectionByVin.put(vin, connection.getId());
        if (previous != null && !previous.equals(connection.getId())) {
            vinByConnection.remove(previous, vin);
        }
        String replacedVin = vinByConnection.put(connection.getId(), vin);
        if (replacedVin != null && !replacedVin.equals(vin)) {
            connectionByVin.remove(replacedVin, connection.getId());
        }
        logger.info("Car {} bound to channel connection {}", vin, connection.getId());
    }

    public Optional<ChannelConnection> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<String> riderOf(String connectionId) {
        return Optional.ofNullable(riderByConnection.get(connectionId));
    }

    public Optional<String> carOf(String connectionId) {
        return Optional.ofNullable(vinByConnection.get(connectionId));
    }

    public Optional<ChannelConnection> connectionForRider(String clientId) {
        return Optional.ofNullable(connectionByRider.get(clientId)).map(connections::get);
    }

    public Optional<ChannelConnection> connectionForCar(String vin) {
        return Optional.ofNullable(connectionByVin.get(vin)).map(connections::get);
    }

    /**
     * Record that a command is being written to a connection.
     *
     * @return false if the command was already written to that connection
     */
    public boolean markPushed(String connectionId, String commandId) {
        return pushedCommandsByConnection
                .computeIfAbsent(connectionId, id -> ConcurrentHashMap.newKeySet())
                .add(commandId);
    }

    /**
     * Forget an acknowledged command; it is never pushed again.
     */
    public void forgetPushed(String connectionId, String commandId) {
        Set<String> pushed = pushedCommandsByConnection.get(connectionId);
        if (pushed != null) {
            pushed.remove(commandId);
        }
    }

    public void remove(String connectionId) {
        connections.remove(connectionId);
        pushedCommandsByConnection.remove(connectionId);
        String clientId = riderByConnection.remove(connectionId);
        if (clientId != null) {
            connectionByRider.remove(clientId, connectionId);
        }
        String vin = vinByConnection.remove(connectionId);
        if (vin != null) {
            connectionByVin.remove(vin, connectionId);
        }
        logger.debug("Channel connection {} removed (rider={}, car={})", connectionId, clientId, vin);
    }

    public int connectedRiders() {
        return connectionByRider.size();
    }

    public int connectedCars() {
        return connectionByVin.size();
    }
}
