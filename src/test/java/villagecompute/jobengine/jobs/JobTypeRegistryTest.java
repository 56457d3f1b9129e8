package villagecompute.jobengine.jobs;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.exceptions.HandlerNotFoundException;
import villagecompute.jobengine.testing.H2TestResource;
import villagecompute.jobengine.testing.InlineTestJobHandler;
import villagecompute.jobengine.testing.QueuedTestJobHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class JobTypeRegistryTest {

    @Inject
    JobTypeRegistry registry;

    @Test
    void testBuiltInHandlersRegistered() {
        assertTrue(registry.isRegistered(TokenRefreshJobHandler.TYPE));
        assertTrue(registry.isRegistered(DailyCreditDeductionJobHandler.TYPE));
        assertTrue(registry.isRegistered(CleanupJobHandler.TYPE));
        assertTrue(registry.isRegistered(WebhookJobHandler.TYPE));
        assertTrue(registry.isRegistered(CatalogImportJobHandler.TYPE));
        assertTrue(registry.isRegistered(CatalogExportJobHandler.TYPE));
        assertTrue(registry.isRegistered(TranslationBulkJobHandler.TYPE));
    }

    @Test
    void testExecutionModes() {
        assertEquals(ExecutionMode.INLINE, registry.resolve(TokenRefreshJobHandler.TYPE).executionMode());
        assertEquals(ExecutionMode.INLINE, registry.resolve(DailyCreditDeductionJobHandler.TYPE).executionMode());
        assertEquals(ExecutionMode.QUEUED, registry.resolve(CleanupJobHandler.TYPE).executionMode());
        assertEquals(ExecutionMode.QUEUED, registry.resolve(CatalogImportJobHandler.TYPE).executionMode());
        assertEquals(ExecutionMode.INLINE, registry.resolve(InlineTestJobHandler.TYPE).executionMode());
        assertEquals(ExecutionMode.QUEUED, registry.resolve(QueuedTestJobHandler.TYPE).executionMode());
    }

    @Test
    void testPluginActionsRegisteredUnderPluginPrefix() {
        String type = PluginActionJobHandler.typeFor("acme", "sync");
        assertEquals("plugin:acme:sync", type);
        JobHandler handler = registry.resolve(type);
        assertInstanceOf(PluginActionJobHandler.class, handler);
        assertEquals(type, handler.handlesType());
    }

    @Test
    void testResolve_unknownTypeThrows() {
        assertThrows(HandlerNotFoundException.class, () -> registry.resolve("nope:missing"));
        assertThrows(HandlerNotFoundException.class, () -> registry.resolve(null));
        assertTrue(registry.find("nope:missing").isEmpty());
        assertFalse(registry.isRegistered(null));
    }

    @Test
    void testRegister_duplicateTypeRejected() {
        JobHandler duplicate = registry.resolve(QueuedTestJobHandler.TYPE);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.register(QueuedTestJobHandler.TYPE, duplicate));
        assertTrue(e.getMessage().contains(QueuedTestJobHandler.TYPE));
    }

    @Test
    void testRegister_blankTypeRejected() {
        JobHandler handler = registry.resolve(QueuedTestJobHandler.TYPE);
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", handler));
    }

    @Test
    void testListHandlers_sortedByType() {
        List<String> types = registry.listHandlers().stream().map(JobHandler::handlesType).toList();
        assertEquals(types.stream().sorted().toList(), types);
        assertTrue(types.contains(QueuedTestJobHandler.TYPE));
    }

    @Test
    void testFindSchedulesWithUnknownType() {
        CronJob known = new CronJob();
        known.jobType = QueuedTestJobHandler.TYPE;
        CronJob unknown = new CronJob();
        unknown.jobType = "legacy:removed";

        List<CronJob> found = registry.findSchedulesWithUnknownType(List.of(known, unknown));

        assertEquals(1, found.size());
        assertSame(unknown, found.get(0));
    }
}
