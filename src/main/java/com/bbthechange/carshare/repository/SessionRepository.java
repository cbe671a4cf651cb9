package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.Session;

import java.util.Optional;

public interface SessionRepository {

    Session save(Session session);

    Optional<Session> findById(String sessionId);
}
