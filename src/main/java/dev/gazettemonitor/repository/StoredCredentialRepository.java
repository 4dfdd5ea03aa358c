package dev.gazettemonitor.repository;

import dev.gazettemonitor.entity.StoredCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StoredCredentialRepository extends JpaRepository<StoredCredential, Long> {
}
