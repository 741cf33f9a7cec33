package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalMirrorVersion;
import ai.pipestream.edge.entity.GlobalRow;
import ai.pipestream.edge.entity.UserContext;
import ai.pipestream.edge.entity.UserView;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static ai.pipestream.edge.service.DatasetMirrorServiceTest.rows;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ViewMaterializerService: materialization, view reads and transform selection.
 */
@QuarkusTest
public class ViewMaterializerServiceTest {

    private static final Capability WRITER = Capability.WRITER;
    private static final Capability READER = Capability.READER;

    @Inject
    ViewMaterializerService viewService;

    @Inject
    DatasetMirrorService mirrorService;

    @Inject
    UserContextService contextService;

    @Inject
    ViewTransformRegistry transformRegistry;

    @Inject
    RecordingChangeObserver observer;

    @BeforeEach
    @Transactional
    void setUp() {
        UserView.deleteAll();
        UserContext.deleteAll();
        GlobalRow.deleteAll();
        GlobalMirrorVersion.deleteAll();
        observer.clear();
    }

    private static ObjectNode ctx(String json) {
        return JsonDocuments.parseObject(json);
    }

    private static List<String> field(List<UserView> views, String name) {
        List<String> values = new ArrayList<>();
        for (UserView view : views) {
            values.add(JsonDocuments.parse(view.item).path(name).asText());
        }
        return values;
    }

    @Test
    void testMaterializeView_OverlaysContextOnEveryRow() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "abc123", rows("A1", "A2"), 1000);
        contextService.setContext(WRITER, "u1", "catalog", ctx("{\"region\":\"EU\"}"), 1);

        MaterializationResult result = viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals("v1", result.version);
        assertEquals("abc123", result.checksum);
        assertEquals(2, result.appended);

        List<UserView> views = viewService.getView(READER, "u1", "catalog", "v1", 0);
        assertEquals(2, views.size());
        assertEquals(List.of("A1", "A2"), field(views, "sku"));
        assertEquals(List.of("EU", "EU"), field(views, "region"));
        for (UserView view : views) {
            assertEquals("v1", view.version);
            assertEquals(result.ts, view.ts);
        }
        assertEquals(1, observer.ofType(EdgeChangeEvent.Type.VIEW_MATERIALIZED).size());
    }

    @Test
    void testMaterializeView_UsesLatestVersion() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2", rows("B1", "B2", "B3"), 2000);

        MaterializationResult result = viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals("v2", result.version);
        assertEquals(3, result.appended);
        assertTrue(viewService.getView(READER, "u1", "catalog", "v1", 0).isEmpty());
        assertEquals(List.of("B1", "B2", "B3"), field(viewService.getView(READER, "u1", "catalog", "v2", 0), "sku"));
    }

    @Test
    void testMaterializeView_WithoutContextCopiesRows() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1", "A2", "A3"), 1000);

        MaterializationResult result = viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals(3, result.appended);
        assertEquals(List.of("A1", "A2", "A3"), field(viewService.getView(READER, "u1", "catalog", "v1", 0), "sku"));
    }

    @Test
    void testMaterializeView_FiltersAndSorts() {
        List<JsonNode> rows = List.of(
            JsonDocuments.parse("{\"sku\":\"A1\",\"color\":\"red\",\"price\":30}"),
            JsonDocuments.parse("{\"sku\":\"A2\",\"color\":\"blue\",\"price\":10}"),
            JsonDocuments.parse("{\"sku\":\"A3\",\"color\":\"green\",\"price\":20}"),
            JsonDocuments.parse("{\"sku\":\"A4\",\"color\":\"red\",\"price\":5}"));
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows, 1000);
        contextService.setContext(WRITER, "u1", "catalog",
            ctx("{\"filters\":{\"color\":[\"red\",\"green\"]},\"sort\":{\"by\":\"price\",\"desc\":true}}"), 1);

        MaterializationResult result = viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals(3, result.appended);
        List<UserView> views = viewService.getView(READER, "u1", "catalog", "v1", 0);
        assertEquals(List.of("A1", "A3", "A4"), field(views, "sku"));
        assertFalse(JsonDocuments.parse(views.get(0).item).has("filters"));
    }

    @Test
    void testMaterializeView_RepeatedRunsAppend() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1", "A2"), 1000);

        viewService.materializeView(WRITER, "u1", "catalog");
        viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals(4, viewService.getView(READER, "u1", "catalog", "v1", 0).size());
        assertEquals(2, observer.ofType(EdgeChangeEvent.Type.VIEW_MATERIALIZED).size());
    }

    @Test
    void testMaterializeView_NoVersionNotFound() {
        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            viewService.materializeView(WRITER, "u1", "missing"));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(observer.ofType(EdgeChangeEvent.Type.VIEW_MATERIALIZED).isEmpty());
    }

    @Test
    void testMaterializeView_TransformBeanSelectedByDataset() {
        mirrorService.publishVersion(WRITER, "upper-catalog", "v1", "c1", rows("a1"), 1000);

        viewService.materializeView(WRITER, "u1", "upper-catalog");

        assertEquals(List.of("A1"), field(viewService.getView(READER, "u1", "upper-catalog", "v1", 0), "sku"));
    }

    @Test
    void testMaterializeView_RegisteredTransformTakesPrecedence() {
        mirrorService.publishVersion(WRITER, "upper-special", "v1", "c1", rows("a1", "a2"), 1000);
        transformRegistry.register("upper-special", new ViewTransform() {
            @Override
            public boolean appliesTo(String datasetId) {
                return true;
            }

            @Override
            public JsonNode derive(JsonNode row, ObjectNode context) {
                return "a2".equals(row.path("sku").asText()) ? null : row;
            }
        });
        try {
            MaterializationResult result = viewService.materializeView(WRITER, "u1", "upper-special");

            assertEquals(1, result.appended);
            assertEquals(List.of("a1"), field(viewService.getView(READER, "u1", "upper-special", "v1", 0), "sku"));
        } finally {
            assertTrue(transformRegistry.unregister("upper-special"));
        }
    }

    @Test
    void testMaterializeView_VersionPublishedMidwayIsNotMixedIn() {
        mirrorService.publishVersion(WRITER, "moving", "v1", "c1", rows("A1", "A2", "A3", "A4", "A5"), 1000);
        AtomicBoolean published = new AtomicBoolean();
        transformRegistry.register("moving", new ViewTransform() {
            @Override
            public boolean appliesTo(String datasetId) {
                return true;
            }

            @Override
            public JsonNode derive(JsonNode row, ObjectNode context) {
                if (published.compareAndSet(false, true)) {
                    // a publisher on another thread commits v2 while v1 is still being read
                    CompletableFuture.runAsync(() -> mirrorService.publishVersion(WRITER, "moving", "v2", "c2",
                        rows("B1", "B2", "B3"), 2000)).join();
                }
                return row;
            }
        });
        try {
            MaterializationResult result = viewService.materializeView(WRITER, "u1", "moving");

            assertTrue(published.get());
            assertEquals("v1", result.version);
            assertEquals(5, result.appended);
            List<UserView> views = viewService.getView(READER, "u1", "moving", "v1", 0);
            assertEquals(List.of("A1", "A2", "A3", "A4", "A5"), field(views, "sku"));
            for (UserView view : views) {
                assertEquals("v1", view.version);
            }
            assertTrue(viewService.getView(READER, "u1", "moving", "v2", 0).isEmpty());
            assertEquals("v2", mirrorService.getLatestVersion(READER, "moving").version);
        } finally {
            transformRegistry.unregister("moving");
        }
    }

    @Test
    void testMaterializeView_FailingTransformRollsBack() {
        mirrorService.publishVersion(WRITER, "broken", "v1", "c1", rows("A1", "A2"), 1000);
        transformRegistry.register("broken", new ViewTransform() {
            @Override
            public boolean appliesTo(String datasetId) {
                return true;
            }

            @Override
            public JsonNode derive(JsonNode row, ObjectNode context) {
                throw new IllegalStateException("cannot derive " + row);
            }
        });
        try {
            EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
                viewService.materializeView(WRITER, "u1", "broken"));

            assertEquals(ErrorKind.TRANSACTION_ABORTED, e.kind());
            assertTrue(viewService.getView(READER, "u1", "broken", "v1", 0).isEmpty());
        } finally {
            transformRegistry.unregister("broken");
        }
    }

    @Test
    void testGetView_SinceTimestamp() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);
        MaterializationResult first = viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals(1, viewService.getView(READER, "u1", "catalog", "v1", first.ts).size());
        assertTrue(viewService.getView(READER, "u1", "catalog", "v1", first.ts + 1).isEmpty());
        assertTrue(viewService.getView(READER, "u2", "catalog", "v1", 0).isEmpty());
    }

    @Test
    void testGetLatestView_LastItemPerKey() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1", "A2"), 1000);
        contextService.setContext(WRITER, "u1", "catalog", ctx("{\"region\":\"EU\"}"), 1);
        viewService.materializeView(WRITER, "u1", "catalog");
        contextService.setContext(WRITER, "u1", "catalog", ctx("{\"region\":\"US\"}"), 2);
        viewService.materializeView(WRITER, "u1", "catalog");

        assertEquals(4, viewService.getView(READER, "u1", "catalog", "v1", 0).size());

        List<JsonNode> latest = viewService.getLatestView(READER, "u1", "catalog", "v1", "sku");
        assertEquals(2, latest.size());
        assertEquals("A1", latest.get(0).get("sku").asText());
        assertEquals("US", latest.get(0).get("region").asText());
        assertEquals("A2", latest.get(1).get("sku").asText());
        assertEquals("US", latest.get(1).get("region").asText());
    }

    @Test
    void testGetLatestView_InvalidKeyPath() {
        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            viewService.getLatestView(READER, "u1", "catalog", "v1", "$..sku"));
        assertEquals(ErrorKind.INVALID_PATH, e.kind());
    }
}
