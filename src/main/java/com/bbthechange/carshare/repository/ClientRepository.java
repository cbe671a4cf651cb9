package com.bbthechange.carshare.repository;

import com.bbthechange.carshare.model.Client;

import java.util.Optional;

public interface ClientRepository {

    /**
     * Store a newly registered client. Fails with VersionConflictException if the email is taken.
     */
    Client save(Client client);

    Optional<Client> findById(String clientId);

    /**
     * Lookup by lower-cased email
     */
    Optional<Client> findByEmail(String email);

    /**
     * Compare-and-set on the client's version
     */
    Client update(Client client);

    long count();
}
