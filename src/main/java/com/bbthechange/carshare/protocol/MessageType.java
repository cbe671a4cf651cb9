package com.bbthechange.carshare.protocol;

import com.bbthechange.carshare.protocol.payload.CarCommandPayload;
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

import java.util.Arrays;
import java.util.Optional;

/**
 * Every message kind carried on the persistent channel, with the payload class it carries.
 */
public enum MessageType {
    REGISTER_CLIENT(RegisterClientPayload.class),
    REGISTER_CLIENT_OK(RegisteredPayload.class),
    REGISTER_CLIENT_ERROR(ErrorPayload.class),
    QUERY_CARS(QueryCarsPayload.class),
    QUERY_CARS_RESULT(CarsResultPayload.class),
    START_RENTAL(RentalRequestPayload.class),
    START_RENTAL_OK(RentalResultPayload.class),
    START_RENTAL_ERROR(ErrorPayload.class),
    END_RENTAL(RentalRequestPayload.class),
    END_RENTAL_OK(RentalResultPayload.class),
    END_RENTAL_ERROR(ErrorPayload.class),
    CAR_CONNECT(CarConnectPayload.class),
    CAR_UNLOCK(CarCommandPayload.class),
    CAR_LOCK(CarCommandPayload.class),
    CAR_STATE_QUERY(CarCommandPayload.class),
    CAR_STATE_RESPONSE(CarStatePayload.class),
    NOTIFY(NotifyPayload.class);

    private final Class<? extends MessagePayload> payloadType;

    MessageType(Class<? extends MessagePayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends MessagePayload> getPayloadType() {
        return payloadType;
    }

    public boolean accepts(MessagePayload payload) {
        return payloadType.isInstance(payload);
    }

    public static Optional<MessageType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equals(name))
                .findFirst();
    }
}
