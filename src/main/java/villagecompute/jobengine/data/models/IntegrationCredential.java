/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * OAuth credential a tenant holds for an external integration (marketplace, channel, translation provider).
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code tenant_id} (TEXT) - Owning tenant</li>
 * <li>{@code provider} (TEXT) - Integration name, e.g. {@code shopify}</li>
 * <li>{@code token_endpoint} (TEXT) - OAuth token URL used for the refresh_token grant</li>
 * <li>{@code client_id} / {@code client_secret} - Application credentials</li>
 * <li>{@code access_token} / {@code refresh_token} - Current tokens (encrypted at rest via TDE)</li>
 * <li>{@code expires_at} - Access token expiry</li>
 * <li>{@code last_refreshed_at} / {@code last_error} - Last refresh outcome</li>
 * <li>{@code revoked} - Set when the provider rejects the refresh token</li>
 * </ul>
 *
 * <p>
 * Never log full tokens. Refreshed by {@code system:token_refresh}.
 */
@Entity
@Table(
        name = "integration_credentials")
public class IntegrationCredential extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            nullable = false)
    public String provider;

    @Column(
            name = "token_endpoint",
            nullable = false)
    public String tokenEndpoint;

    @Column(
            name = "client_id")
    public String clientId;

    @Column(
            name = "client_secret")
    public String clientSecret;

    @Column(
            name = "access_token",
            length = 4000)
    public String accessToken;

    @Column(
            name = "refresh_token",
            length = 4000)
    public String refreshToken;

    @Column(
            name = "expires_at")
    public Instant expiresAt;

    @Column(
            name = "last_refreshed_at")
    public Instant lastRefreshedAt;

    @Column(
            name = "last_error",
            length = 2000)
    public String lastError;

    @Column(
            nullable = false)
    public boolean revoked;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Credentials with a refresh token whose access token expires before {@code threshold}.
     */
    public static List<IntegrationCredential> findExpiringBefore(Instant threshold) {
        return find("revoked = false AND refreshToken IS NOT NULL AND expiresAt IS NOT NULL AND expiresAt < ?1 "
                + "ORDER BY expiresAt ASC", threshold).list();
    }
}
