package dev.gazettemonitor.service;

import dev.gazettemonitor.model.Session;

import java.util.Optional;

/**
 * Durable storage for the operator's credential, surviving restarts.
 */
public interface CredentialStore {

    Optional<Session> load();

    void save(Session session);

    void clear();
}
