/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.jobs;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.integration.catalog.CatalogBatch;
import villagecompute.jobengine.integration.catalog.CatalogConnector;
import villagecompute.jobengine.integration.catalog.CatalogConnectorRegistry;
import villagecompute.jobengine.util.PayloadValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paged catalog transfer between a tenant and an external system through a {@link CatalogConnector}.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Resolve the connector named in the payload</li>
 * <li>Resume from the {@code cursor} checkpoint of an earlier attempt, if any</li>
 * <li>Move one page, then checkpoint the next cursor and the running totals</li>
 * <li>Check for cancellation between pages</li>
 * </ol>
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "connector": "shopify",
 *   "options": {"collection": "summer"},  // optional, passed to the connector
 *   "max_pages": 500                      // optional safety limit
 * }
 * </pre>
 */
public abstract class CatalogSyncJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CatalogSyncJobHandler.class);

    static final String CHECKPOINT_CURSOR = "cursor";
    static final String CHECKPOINT_PROCESSED = "processed";
    static final String CHECKPOINT_FAILED = "failed";
    static final int DEFAULT_MAX_PAGES = 10_000;

    @Inject
    CatalogConnectorRegistry connectors;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Moves one page in this handler's direction.
     */
    protected abstract CatalogBatch transferPage(CatalogConnector connector, String tenantId,
            Map<String, Object> options, String cursor) throws Exception;

    /**
     * Short verb used in logs, metrics and progress messages, e.g. {@code import}.
     */
    protected abstract String direction();

    @Override
    public Map<String, Object> execute(Job job, JobContext context) throws Exception {
        String connectorName = PayloadValues.requireString(job.payload, "connector");
        Map<String, Object> options = PayloadValues.optionalMap(job.payload, "options");
        int maxPages = PayloadValues.optionalInt(job.payload, "max_pages", DEFAULT_MAX_PAGES);
        CatalogConnector connector = connectors.resolve(connectorName);

        String cursor = context.checkpointValue(CHECKPOINT_CURSOR).map(String::valueOf).orElse(null);
        long processed = context.checkpointValue(CHECKPOINT_PROCESSED).map(CatalogSyncJobHandler::asLong).orElse(0L);
        long failed = context.checkpointValue(CHECKPOINT_FAILED).map(CatalogSyncJobHandler::asLong).orElse(0L);
        if (cursor != null) {
            LOG.infof("Resuming catalog %s via %s for tenant %s at cursor %s (%d items done)", direction(),
                    connectorName, context.tenantId(), cursor, processed);
        }

        Span span = tracer.spanBuilder("job.catalog_" + direction()).setAttribute("catalog.connector", connectorName)
                .startSpan();
        int pages = 0;
        try (Scope scope = span.makeCurrent()) {
            while (pages < maxPages) {
                context.throwIfCancellationRequested();
                CatalogBatch batch = transferPage(connector, context.tenantId(), options, cursor);
                pages++;
                processed += batch.processed();
                failed += batch.failed();
                cursor = batch.nextCursor();

                context.checkpoint(CHECKPOINT_CURSOR, cursor);
                context.checkpoint(CHECKPOINT_PROCESSED, processed);
                context.checkpoint(CHECKPOINT_FAILED, failed);
                meterRegistry.counter("jobengine_catalog_items_total", "direction", direction(), "connector",
                        connectorName).increment(batch.processed());
                context.updateProgress(progress(processed + failed, batch), String.format("%sed %d items (%d pages)",
                        capitalize(direction()), processed, pages));

                if (!batch.hasMore()) {
                    break;
                }
            }
            if (cursor != null && !cursor.isBlank()) {
                LOG.warnf("Catalog %s via %s stopped at max_pages=%d with cursor %s", direction(), connectorName,
                        maxPages, cursor);
            }

            span.setAttribute("catalog.items_processed", processed);
            span.setAttribute("catalog.items_failed", failed);
            span.setStatus(StatusCode.OK);
            LOG.infof("Catalog %s via %s for tenant %s finished: %d processed, %d failed, %d pages", direction(),
                    connectorName, context.tenantId(), processed, failed, pages);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("connector", connectorName);
            result.put("processed", processed);
            result.put("failed", failed);
            result.put("pages", pages);
            result.put("complete", cursor == null || cursor.isBlank());
            return result;
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private static int progress(long done, CatalogBatch batch) {
        if (!batch.hasMore()) {
            return 100;
        }
        if (batch.totalEstimate() != null && batch.totalEstimate() > 0) {
            return (int) Math.min(99, done * 100 / batch.totalEstimate());
        }
        return 50;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : Long.parseLong(value.toString());
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
