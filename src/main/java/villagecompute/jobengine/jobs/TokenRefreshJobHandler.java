/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.jobs;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.types.OAuthTokenResponseType;
import villagecompute.jobengine.data.models.IntegrationCredential;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.exceptions.TransientExecutionException;
import villagecompute.jobengine.integration.oauth.OAuthTokenClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Refreshes integration OAuth tokens that expire within {@code jobengine.handlers.token-refresh.expiry-window-minutes}.
 *
 * <p>
 * Runs inline from the hourly {@code system:token_refresh} schedule. Each credential is refreshed in its own
 * transaction, so one failure does not roll back the others.
 *
 * <p>
 * <b>Error Handling:</b> a credential whose refresh token is rejected ({@code invalid_grant}) is marked revoked and
 * skipped from then on. The firing fails only when every attempted credential failed, which is what drives the
 * schedule's consecutive-failure count.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {} // Empty payload - processes all expiring credentials
 * </pre>
 */
@ApplicationScoped
public class TokenRefreshJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(TokenRefreshJobHandler.class);

    public static final String TYPE = "system:token_refresh";

    @Inject
    OAuthTokenClient tokenClient;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "jobengine.handlers.token-refresh.expiry-window-minutes",
            defaultValue = "60")
    long expiryWindowMinutes;

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.INLINE;
    }

    @Override
    public String description() {
        return "Refreshes integration OAuth tokens before they expire";
    }

    @Override
    public Map<String, Object> execute(Job job, JobContext context) {
        Span span = tracer.spanBuilder("job.token_refresh").startSpan();
        int refreshed = 0;
        int revoked = 0;
        int failed = 0;

        try (Scope scope = span.makeCurrent()) {
            Instant threshold = Instant.now().plusSeconds(expiryWindowMinutes * 60);
            List<Long> ids = QuarkusTransaction.requiringNew().call(() -> IntegrationCredential
                    .findExpiringBefore(threshold).stream().map(credential -> credential.id).toList());
            LOG.infof("Found %d integration credentials expiring before %s", ids.size(), threshold);
            span.setAttribute("credentials_total", ids.size());

            for (int i = 0; i < ids.size(); i++) {
                context.throwIfCancellationRequested();
                Outcome outcome = refreshOne(ids.get(i));
                switch (outcome) {
                    case REFRESHED -> refreshed++;
                    case REVOKED -> revoked++;
                    case FAILED -> failed++;
                }
                meterRegistry
                        .counter("jobengine_token_refresh_total", "outcome", outcome.name().toLowerCase(Locale.ROOT))
                        .increment();
                context.updateProgress((i + 1) * 100 / ids.size(), "Refreshed " + (i + 1) + " of " + ids.size());
            }

            span.setAttribute("credentials_refreshed", refreshed);
            span.setAttribute("credentials_failed", failed + revoked);
            LOG.infof("Token refresh finished: %d refreshed, %d revoked, %d failed", refreshed, revoked, failed);

            if (!ids.isEmpty() && refreshed == 0 && failed > 0) {
                throw new TransientExecutionException("All " + ids.size() + " token refreshes failed");
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("candidates", ids.size());
            result.put("refreshed", refreshed);
            result.put("revoked", revoked);
            result.put("failed", failed);
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Outcome refreshOne(Long credentialId) {
        IntegrationCredential snapshot = QuarkusTransaction.requiringNew()
                .call(() -> IntegrationCredential.<IntegrationCredential>findById(credentialId));
        if (snapshot == null || snapshot.revoked) {
            return Outcome.FAILED;
        }
        try {
            OAuthTokenResponseType response = tokenClient.refresh(snapshot);
            QuarkusTransaction.requiringNew().run(() -> {
                IntegrationCredential credential = IntegrationCredential.findById(credentialId);
                Instant now = Instant.now();
                credential.accessToken = response.accessToken();
                if (response.refreshToken() != null) {
                    credential.refreshToken = response.refreshToken();
                }
                credential.expiresAt = response.expiresIn() == null ? null : now.plusSeconds(response.expiresIn());
                credential.lastRefreshedAt = now;
                credential.lastError = null;
                credential.updatedAt = now;
            });
            LOG.debugf("Refreshed %s credential %d for tenant %s", snapshot.provider, credentialId, snapshot.tenantId);
            return Outcome.REFRESHED;
        } catch (PermanentExecutionException e) {
            recordError(credentialId, e.getMessage(), true);
            LOG.warnf("Marked %s credential %d for tenant %s revoked: %s", snapshot.provider, credentialId,
                    snapshot.tenantId, e.getMessage());
            return Outcome.REVOKED;
        } catch (RuntimeException e) {
            recordError(credentialId, e.getMessage(), false);
            LOG.errorf(e, "Failed to refresh %s credential %d for tenant %s (continuing)", snapshot.provider,
                    credentialId, snapshot.tenantId);
            return Outcome.FAILED;
        }
    }

    private void recordError(Long credentialId, String error, boolean revoke) {
        QuarkusTransaction.requiringNew().run(() -> {
            IntegrationCredential credential = IntegrationCredential.findById(credentialId);
            credential.lastError = error;
            credential.updatedAt = Instant.now();
            if (revoke) {
                credential.revoked = true;
            }
        });
    }

    private enum Outcome {
        REFRESHED, REVOKED, FAILED
    }
}
