package dev.gazettemonitor.service;

import dev.gazettemonitor.entity.StoredCredential;
import dev.gazettemonitor.model.Session;
import dev.gazettemonitor.model.UserInfo;
import dev.gazettemonitor.repository.StoredCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Credential store backed by the local SQLite database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaCredentialStore implements CredentialStore {

    private final StoredCredentialRepository repository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> load() {
        return repository.findById(StoredCredential.SINGLETON_ID)
                .filter(stored -> stored.getToken() != null && !stored.getToken().isBlank())
                .map(stored -> new Session(
                        stored.getToken(),
                        new UserInfo(stored.getUsername(), stored.getRole()),
                        null));
    }

    @Override
    @Transactional
    public void save(Session session) {
        repository.save(StoredCredential.builder()
                .id(StoredCredential.SINGLETON_ID)
                .token(session.token())
                .username(session.username())
                .role(session.user() != null ? session.user().role() : null)
                .storedAt(LocalDateTime.now(clock))
                .build());
        log.debug("Stored credential for {}", session.username());
    }

    @Override
    @Transactional
    public void clear() {
        repository.deleteAll();
        log.debug("Cleared stored credential");
    }
}
