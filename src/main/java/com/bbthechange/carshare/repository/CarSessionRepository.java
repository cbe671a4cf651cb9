package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.CarSession;

import java.util.Optional;

public interface CarSessionRepository {

    CarSession save(CarSession session);

    Optional<CarSession> findById(String sessionId);
}
