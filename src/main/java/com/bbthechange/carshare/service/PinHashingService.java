package com.bbthechange.carshare.service;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class PinHashingService {

    private final BCryptPasswordEncoder pinEncoder = new BCryptPasswordEncoder();

    public String hashPin(String plainPin) {
        return pinEncoder.encode(plainPin);
    }

    public boolean matches(String plainPin, String hashedPin) {
        if (plainPin == null || hashedPin == null) {
            return false;
        }
        return pinEncoder.matches(plainPin, hashedPin);
    }
}
