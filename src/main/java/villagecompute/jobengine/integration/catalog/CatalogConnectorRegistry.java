package villagecompute.jobengine.integration.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.jobengine.exceptions.PermanentExecutionException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up {@link CatalogConnector} beans by name.
 */
@ApplicationScoped
public class CatalogConnectorRegistry {

    private static final Logger LOG = Logger.getLogger(CatalogConnectorRegistry.class);

    private final Map<String, CatalogConnector> connectors = new TreeMap<>();

    @Inject
    public CatalogConnectorRegistry(Instance<CatalogConnector> discovered) {
        for (CatalogConnector connector : discovered) {
            CatalogConnector previous = connectors.putIfAbsent(connector.name(), connector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate catalog connector '" + connector.name() + "': "
                        + previous.getClass().getName() + " and " + connector.getClass().getName());
            }
        }
        LOG.infof("Registered %d catalog connectors: %s", connectors.size(), connectors.keySet());
    }

    /**
     * @throws PermanentExecutionException
     *             when no connector has that name
     */
    public CatalogConnector resolve(String name) {
        CatalogConnector connector = connectors.get(name);
        if (connector == null) {
            throw new PermanentExecutionException("Unknown catalog connector '" + name + "'");
        }
        return connector;
    }

    public List<String> names() {
        return List.copyOf(connectors.keySet());
    }
}
