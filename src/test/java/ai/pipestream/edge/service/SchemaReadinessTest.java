package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.InitMarker;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the readiness marker gate.
 */
@QuarkusTest
public class SchemaReadinessTest {

    @Inject
    SchemaReadiness schemaReadiness;

    @Inject
    UserTableService tableService;

    @Inject
    DatasetMirrorService mirrorService;

    @Transactional
    void removeMarker() {
        InitMarker.deleteAll();
    }

    @Test
    void testMarkerWrittenOnStartup() {
        assertTrue(schemaReadiness.isReady());
        assertDoesNotThrow(() -> schemaReadiness.requireReady());
    }

    @Test
    void testOperationsRefusedUntilMarkerWritten() {
        removeMarker();
        schemaReadiness.reset();
        try {
            assertFalse(schemaReadiness.isReady());

            EdgeStoreException e = assertThrows(EdgeStoreException.class,
                () -> tableService.listTables(Capability.READER, "u1"));
            assertEquals(ErrorKind.NOT_INITIALIZED, e.kind());

            // readiness is checked before the capability
            e = assertThrows(EdgeStoreException.class,
                () -> mirrorService.getLatestVersion(null, "ds"));
            assertEquals(ErrorKind.NOT_INITIALIZED, e.kind());

            assertTrue(schemaReadiness.markProvisioned());
            assertFalse(schemaReadiness.markProvisioned());
            assertTrue(tableService.listTables(Capability.READER, "u1").isEmpty());
        } finally {
            schemaReadiness.markProvisioned();
        }
    }

    @Test
    void testResetRereadsMarker() {
        schemaReadiness.reset();
        // the marker row is still there, so the fresh check passes
        assertTrue(schemaReadiness.isReady());
    }
}
