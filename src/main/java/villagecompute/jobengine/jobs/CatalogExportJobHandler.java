package villagecompute.jobengine.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.jobengine.integration.catalog.CatalogBatch;
import villagecompute.jobengine.integration.catalog.CatalogConnector;

import java.util.Map;

@ApplicationScoped
public class CatalogExportJobHandler extends CatalogSyncJobHandler {

    public static final String TYPE = "catalog:export";

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public String description() {
        return "Exports products to an external catalog connector";
    }

    @Override
    protected String direction() {
        return "export";
    }

    @Override
    protected CatalogBatch transferPage(CatalogConnector connector, String tenantId, Map<String, Object> options,
            String cursor) throws Exception {
        return connector.exportPage(tenantId, options, cursor);
    }
}
