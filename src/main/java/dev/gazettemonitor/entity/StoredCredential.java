package dev.gazettemonitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * The operator's persisted bearer credential. At most one row exists.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "stored_credentials")
public class StoredCredential {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false, length = 4096)
    private String token;

    @Column(nullable = false)
    private String username;

    private String role;

    @Column(nullable = false)
    private LocalDateTime storedAt;
}
