package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.model.CarSession;
import com.bbthechange.carshare.repository.CarSessionRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class InMemoryCarSessionRepositoryImpl implements CarSessionRepository {

    private final InMemoryItemStore<CarSession> store = new InMemoryItemStore<>("CarSession", CarSession::new);

    @Override
    public CarSession save(CarSession session) {
        return store.insert(session);
    }

    @Override
    public Optional<CarSession> findById(String sessionId) {
        return store.find(sessionId);
    }
}
