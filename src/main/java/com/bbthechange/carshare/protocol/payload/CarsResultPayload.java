package com.bbthechange.carshare.protocol.payload;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.protocol.MessagePayload;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CarsResultPayload implements MessagePayload {

    private List<CarDTO> cars = new ArrayList<>();
    private String error;

    public CarsResultPayload(List<CarDTO> cars) {
        this.cars = cars;
    }

    public static CarsResultPayload failed(String error) {
        return new CarsResultPayload(new ArrayList<>(), error);
    }
}
