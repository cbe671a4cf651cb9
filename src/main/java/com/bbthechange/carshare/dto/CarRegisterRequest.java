package com.bbthechange.carshare.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CarRegisterRequest {

    @NotBlank(message = "vin is required")
    private String vin;

    @NotBlank(message = "api_key is required")
    @JsonProperty("api_key")
    @JsonAlias("apiKey")
    private String apiKey;
}
