package villagecompute.jobengine.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.jobengine.integration.catalog.CatalogBatch;
import villagecompute.jobengine.integration.catalog.CatalogConnector;

import java.util.Map;

/**
 * Imports a tenant's catalog from an external system, page by page.
 */
@ApplicationScoped
public class CatalogImportJobHandler extends CatalogSyncJobHandler {

    public static final String TYPE = "catalog:import";

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public String description() {
        return "Imports products from an external catalog connector";
    }

    @Override
    protected String direction() {
        return "import";
    }

    @Override
    protected CatalogBatch transferPage(CatalogConnector connector, String tenantId, Map<String, Object> options,
            String cursor) throws Exception {
        return connector.importPage(tenantId, options, cursor);
    }
}
