package villagecompute.jobengine.integration.catalog;

import java.util.Map;

/**
 * Connector to an external catalog (marketplace, PIM, storefront) used by the {@code catalog:import} and
 * {@code catalog:export} handlers.
 *
 * <p>
 * Implementations are CDI beans. The handlers own paging, checkpointing, progress and cancellation; a connector only
 * moves one page at a time and reports where the next page starts. Pages must be idempotent: after a crash the page
 * at the last saved cursor is moved again.
 */
public interface CatalogConnector {

    /**
     * Name referenced by the {@code connector} payload field, e.g. {@code shopify}.
     */
    String name();

    /**
     * Reads one page from the remote catalog and applies it to the tenant's catalog.
     *
     * @param cursor
     *            null for the first page
     */
    CatalogBatch importPage(String tenantId, Map<String, Object> options, String cursor) throws Exception;

    /**
     * Pushes one page of the tenant's catalog to the remote system.
     *
     * @param cursor
     *            null for the first page
     */
    CatalogBatch exportPage(String tenantId, Map<String, Object> options, String cursor) throws Exception;
}
