package com.example.syncengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored OAuth credential pair for one user, provider and service.
 * Token columns only ever hold ciphertext.
 */
@Entity
@Table(name = "integrations", uniqueConstraints = {
        @UniqueConstraint(name = "uq_integrations_user_provider_service",
                columnNames = {"user_id", "provider", "service"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"accessToken", "refreshToken"})
public class Integration extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "provider", nullable = false, length = 30, updatable = false)
    private String provider;

    @Enumerated(EnumType.STRING)
    @Column(name = "service", nullable = false, length = 20, updatable = false)
    private ServiceType service;

    @Column(name = "access_token", columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "expiry_date")
    private Instant expiryDate;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /**
     * Replace the encrypted token triple. Identity columns are left untouched.
     * A null refresh token keeps the existing one.
     */
    public void rotateTokens(String encryptedAccessToken, String encryptedRefreshToken, Instant expiryDate) {
        this.accessToken = encryptedAccessToken;
        if (encryptedRefreshToken != null) {
            this.refreshToken = encryptedRefreshToken;
        }
        this.expiryDate = expiryDate;
    }
}
