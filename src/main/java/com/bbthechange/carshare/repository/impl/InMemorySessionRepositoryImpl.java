package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.model.Session;
import com.bbthechange.carshare.repository.SessionRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class InMemorySessionRepositoryImpl implements SessionRepository {

    private final InMemoryItemStore<Session> store = new InMemoryItemStore<>("Session", Session::new);

    @Override
    public Session save(Session session) {
        return store.insert(session);
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        return store.find(sessionId);
    }
}
