package com.bbthechange.carshare.websocket;

import com.bbthechange.carshare.dto.ClientProfileDTO;
import com.bbthechange.carshare.dto.LoginResponse;
import com.bbthechange.carshare.dto.RentalResult;
import com.bbthechange.carshare.exception.CarNotFoundException;
import com.bbthechange.carshare.exception.CommandNotFoundException;
import com.bbthechange.carshare.exception.ConflictException;
import com.bbthechange.carshare.exception.PreconditionFailedException;
import com.bbthechange.carshare.exception.ResourceNotFoundException;
import com.bbthechange.carshare.exception.UnauthorizedException;
import com.bbthechange.carshare.exception.ValidationException;
import com.bbthechange.carshare.exception.VersionConflictException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.protocol.EnvelopeCodec;
import com.bbthechange.carshare.protocol.MessageEnvelope;
import com.bbthechange.carshare.protocol.MessageType;
import com.bbthechange.carshare.protocol.payload.CarConnectPayload;
import com.bbthechange.carshare.protocol.payload.CarStatePayload;
import com.bbthechange.carshare.protocol.payload.CarsResultPayload;
import com.bbthechange.carshare.protocol.payload.ErrorPayload;
import com.bbthechange.carshare.protocol.payload.NotifyPayload;
import com.bbthechange.carshare.protocol.payload.QueryCarsPayload;
import com.bbthechange.carshare.protocol.payload.RegisterClientPayload;
import com.bbthechange.carshare.protocol.payload.RegisteredPayload;
import com.bbthechange.carshare.protocol.payload.RentalRequestPayload;
import com.bbthechange.carshare.protocol.payload.RentalResultPayload;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.CommandChannelService;
import com.bbthechange.carshare.service.FleetService;
import com.bbthechange.carshare.service.RentalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Inbound side of the persistent channel at /ws.
 *
 * Riders bind a connection with REGISTER_CLIENT, cars with CAR_CONNECT; every other request is
 * answered for whoever is bound to the connection it arrived on. Responses carry the request's
 * messageId as correlationId.
 */
@Component
public class RentalChannelHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(RentalChannelHandler.class);

    private final EnvelopeCodec codec;
    private final ChannelSessionRegistry registry;
    private final ChannelMessageDispatcher dispatcher;
    private final AuthService authService;
    private final FleetService fleetService;
    private final RentalService rentalService;
    private final CommandChannelService commandChannelService;

    public RentalChannelHandler(EnvelopeCodec codec,
                                ChannelSessionRegistry registry,
                                ChannelMessageDispatcher dispatcher,
                                AuthService authService,
                                FleetService fleetService,
                                RentalService rentalService,
                                CommandChannelService commandChannelService) {
        this.codec = codec;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.authService = authService;
        this.fleetService = fleetService;
        this.rentalService = rentalService;
        this.commandChannelService = commandChannelService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        registry.register(new WebSocketChannelConnection(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChannelConnection connection = registry.connection(session.getId())
                .orElseGet(() -> {
                    ChannelConnection created = new WebSocketChannelConnection(session);
                    registry.register(created);
                    return created;
                });
        handle(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on channel connection {}: {}", session.getId(), exception.getMessage());
        registry.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.debug("Channel connection {} closed: {}", session.getId(), status);
        registry.remove(session.getId());
    }

    /**
     * Decode and answer one inbound frame.
     */
    public void handle(ChannelConnection connection, String frame) {
        MessageEnvelope request;
        try {
            request = codec.decode(frame);
        } catch (ValidationException e) {
            logger.warn("Rejected frame on connection {}: {}", connection.getId(), e.getMessage());
            dispatcher.send(connection, MessageEnvelope.fromBackend(MessageType.NOTIFY,
                    new NotifyPayload("Invalid message: " + e.getMessage()), null));
            return;
        }

        logger.debug("Received {} from {} on connection {}", request.getType(), request.getClientId(), connection.getId());
        try {
            dispatch(connection, request);
        } catch (RuntimeException e) {
            replyWithError(connection, request, e);
        }
    }

    private void dispatch(ChannelConnection connection, MessageEnvelope request) {
        switch (request.getType()) {
            case REGISTER_CLIENT:
                handleRegister(connection, request);
                break;
            case QUERY_CARS:
                handleQueryCars(connection, request);
                break;
            case START_RENTAL:
                handleStartRental(connection, request);
                break;
            case END_RENTAL:
                handleEndRental(connection, request);
                break;
            case CAR_CONNECT:
                handleCarConnect(connection, request);
                break;
            case CAR_STATE_RESPONSE:
                handleCarState(connection, request);
                break;
            default:
                dispatcher.send(connection, request.reply(MessageType.NOTIFY,
                        new NotifyPayload("Unsupported message type " + request.getType())));
        }
    }

    private void handleRegister(ChannelConnection connection, MessageEnvelope request) {
        RegisterClientPayload payload = request.payloadAs(RegisterClientPayload.class);

        ClientProfileDTO client;
        String token;
        if (payload.hasToken()) {
            String clientId = authService.authenticate(payload.getToken());
            client = authService.getProfile(clientId);
            token = payload.getToken();
        } else {
            authService.register(payload);
            LoginResponse login = authService.login(payload.getEmail(), payload.getPin());
            client = login.getClient();
            token = login.getToken();
        }

        registry.bindRider(client.getId(), connection);
        dispatcher.send(connection, request.reply(MessageType.REGISTER_CLIENT_OK, RegisteredPayload.rider(client, token)));
    }

    private void handleQueryCars(ChannelConnection connection, MessageEnvelope request) {
        String clientId = registry.riderOf(connection.getId()).orElse(null);
        if (clientId == null) {
            dispatcher.send(connection, request.reply(MessageType.QUERY_CARS_RESULT,
                    CarsResultPayload.failed("Client not registered")));
            return;
        }

        QueryCarsPayload payload = request.payloadAs(QueryCarsPayload.class);
        ClientProfileDTO client = payload.getLocation() != null
                ? authService.updateLocation(clientId, payload.getLocation())
                : authService.getProfile(clientId);
        dispatcher.send(connection, request.reply(MessageType.QUERY_CARS_RESULT,
                new CarsResultPayload(fleetService.listAvailable(client.getLocation()))));
    }

    private void handleStartRental(ChannelConnection connection, MessageEnvelope request) {
        String clientId = requireRider(connection);
        RentalRequestPayload payload = request.payloadAs(RentalRequestPayload.class);
        if (!payload.hasVin()) {
            throw new ValidationException("vin is required");
        }

        RentalResult result = rentalService.start(clientId, payload.getVin());
        dispatcher.send(connection, request.reply(MessageType.START_RENTAL_OK, new RentalResultPayload(result)));
    }

    private void handleEndRental(ChannelConnection connection, MessageEnvelope request) {
        String clientId = requireRider(connection);
        RentalRequestPayload payload = request.payloadAs(RentalRequestPayload.class);

        String vin = payload.hasVin() ? payload.getVin() : authService.getProfile(clientId).getActiveRentalVin();
        if (vin == null) {
            throw new ConflictException("No active rental");
        }

        RentalResult result = rentalService.end(clientId, vin);
        dispatcher.send(connection, request.reply(MessageType.END_RENTAL_OK, new RentalResultPayload(result)));
    }

    private void handleCarConnect(ChannelConnection connection, MessageEnvelope request) {
        CarConnectPayload payload = request.payloadAs(CarConnectPayload.class);
        String token = authService.registerCar(payload.getVin(), payload.getApiKey());

        registry.bindCar(payload.getVin(), connection);
        dispatcher.send(connection, request.reply(MessageType.REGISTER_CLIENT_OK,
                RegisteredPayload.car("Car " + payload.getVin() + " connected", token)));

        List<CarCommand> pending = commandChannelService.poll(payload.getVin());
        int pushed = dispatcher.pushCommands(connection, pending);
        logger.info("Car {} connected on {}, pushed {} of {} pending commands", payload.getVin(),
                connection.getId(), pushed, pending.size());
    }

    private void handleCarState(ChannelConnection connection, MessageEnvelope request) {
        CarStatePayload payload = request.payloadAs(CarStatePayload.class);
        String vin = registry.carOf(connection.getId())
                .orElseThrow(() -> new UnauthorizedException("Car not connected"));
        if (!vin.equals(payload.getVin())) {
            throw new UnauthorizedException("Connection is bound to car " + vin + ", not " + payload.getVin());
        }

        Car car = fleetService.applyTelematicsUpdate(vin, payload.toTelematicsUpdate());
        if (commandChannelService.findPending(vin, request.getCorrelationId()).isPresent()) {
            commandChannelService.ack(vin, request.getCorrelationId(), payload.isSuccessful(), payload.getNote());
            registry.forgetPushed(connection.getId(), request.getCorrelationId());
        }
        logger.debug("State of {} updated from channel, safety issues: {}", vin, car.safetyIssues());
    }

    private String requireRider(ChannelConnection connection) {
        return registry.riderOf(connection.getId())
                .orElseThrow(() -> new UnauthorizedException("Client not registered"));
    }

    private void replyWithError(ChannelConnection connection, MessageEnvelope request, RuntimeException e) {
        ErrorPayload error = toErrorPayload(e);
        if (error.getCode().equals("INTERNAL_ERROR")) {
            logger.error("Unexpected error handling {} from {}", request.getType(), request.getClientId(), e);
        } else {
            logger.warn("{} from {} rejected: {}", request.getType(), request.getClientId(), e.getMessage());
        }

        switch (request.getType()) {
            case REGISTER_CLIENT:
            case CAR_CONNECT:
                dispatcher.send(connection, request.reply(MessageType.REGISTER_CLIENT_ERROR, error));
                break;
            case START_RENTAL:
                dispatcher.send(connection, request.reply(MessageType.START_RENTAL_ERROR, error));
                break;
            case END_RENTAL:
                dispatcher.send(connection, request.reply(MessageType.END_RENTAL_ERROR, error));
                break;
            case QUERY_CARS:
                dispatcher.send(connection, request.reply(MessageType.QUERY_CARS_RESULT, CarsResultPayload.failed(error.getReason())));
                break;
            default:
                dispatcher.send(connection, request.reply(MessageType.NOTIFY, new NotifyPayload(error.getReason())));
        }
    }

    static ErrorPayload toErrorPayload(RuntimeException e) {
        if (e instanceof PreconditionFailedException precondition) {
            return new ErrorPayload(e.getMessage(), "PRECONDITION_FAILED", precondition.getIssues(),
                    recommendedAction(precondition.getIssues()));
        }
        if (e instanceof ValidationException) {
            return new ErrorPayload(e.getMessage(), "VALIDATION_ERROR");
        }
        if (e instanceof UnauthorizedException) {
            return new ErrorPayload(e.getMessage(), "UNAUTHORIZED");
        }
        if (e instanceof CarNotFoundException) {
            return new ErrorPayload(e.getMessage(), "CAR_NOT_FOUND");
        }
        if (e instanceof CommandNotFoundException) {
            return new ErrorPayload(e.getMessage(), "COMMAND_NOT_FOUND");
        }
        if (e instanceof ResourceNotFoundException) {
            return new ErrorPayload(e.getMessage(), "NOT_FOUND");
        }
        if (e instanceof ConflictException) {
            return new ErrorPayload(e.getMessage(), "CONFLICT");
        }
        if (e instanceof VersionConflictException) {
            return new ErrorPayload("Request conflicted with a concurrent update, please retry", "VERSION_CONFLICT");
        }
        return new ErrorPayload("Internal error", "INTERNAL_ERROR");
    }

    private static String recommendedAction(List<String> issues) {
        return issues.stream()
                .map(issue -> {
                    switch (issue) {
                        case Car.ISSUE_DOORS_OPEN:
                            return "Close all doors";
                        case Car.ISSUE_LIGHTS_ON:
                            return "Turn off lights";
                        case Car.ISSUE_ENGINE_ON:
                            return "Turn off engine";
                        default:
                            return issue;
                    }
                })
                .collect(Collectors.joining("; "));
    }
}
