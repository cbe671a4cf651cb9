package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.exception.VersionConflictException;
import com.bbthechange.carshare.model.Client;
import com.bbthechange.carshare.repository.ClientRepository;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryClientRepositoryImpl implements ClientRepository {

    private final InMemoryItemStore<Client> store = new InMemoryItemStore<>("Client", Client::new);
    private final ConcurrentMap<String, String> clientIdsByEmail = new ConcurrentHashMap<>();

    @Override
    public Client save(Client client) {
        String email = normalize(client.getEmail());
        String existing = clientIdsByEmail.putIfAbsent(email, client.getId());
        if (existing != null) {
            throw new VersionConflictException("Email already registered: " + email);
        }
        return store.insert(client);
    }

    @Override
    public Optional<Client> findById(String clientId) {
        return store.find(clientId);
    }

    @Override
    public Optional<Client> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clientIdsByEmail.get(normalize(email))).flatMap(store::find);
    }

    @Override
    public Client update(Client client) {
        return store.update(client);
    }

    @Override
    public long count() {
        return store.count();
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
