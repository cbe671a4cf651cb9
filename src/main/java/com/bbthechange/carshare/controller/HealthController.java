package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.repository.CarRepository;
import com.bbthechange.carshare.repository.ClientRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ClientRepository clientRepository;
    private final CarRepository carRepository;

    public HealthController(ClientRepository clientRepository, CarRepository carRepository) {
        this.clientRepository = clientRepository;
        this.carRepository = carRepository;
    }

    @GetMapping("/")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("clients", clientRepository.count());
        body.put("cars", carRepository.count());
        return body;
    }
}
