package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalMirrorVersion;
import ai.pipestream.edge.entity.GlobalRow;
import ai.pipestream.edge.util.Checksums;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DatasetMirrorService: publishing, idempotency and version reads.
 */
@QuarkusTest
public class DatasetMirrorServiceTest {

    private static final Capability WRITER = Capability.WRITER;
    private static final Capability READER = Capability.READER;

    @Inject
    DatasetMirrorService mirrorService;

    @Inject
    RecordingChangeObserver observer;

    @BeforeEach
    @Transactional
    void setUp() {
        GlobalRow.deleteAll();
        GlobalMirrorVersion.deleteAll();
        observer.clear();
    }

    static List<JsonNode> rows(String... skus) {
        List<JsonNode> rows = new ArrayList<>();
        for (String sku : skus) {
            rows.add(JsonDocuments.parse("{\"sku\":\"" + sku + "\"}"));
        }
        return rows;
    }

    private static List<String> skus(Iterable<JsonNode> rows) {
        List<String> skus = new ArrayList<>();
        for (JsonNode row : rows) {
            skus.add(row.get("sku").asText());
        }
        return skus;
    }

    @Test
    void testPublishVersion_StoresRowsInOrder() {
        PublishResult result = mirrorService.publishVersion(WRITER, "catalog", "v1", "abc123",
            rows("A1", "A2", "A3", "A4", "A5"), 1000);

        assertTrue(result.created);
        assertEquals(5, result.rowCount);
        // test page size is 2, so this reads three pages
        assertEquals(List.of("A1", "A2", "A3", "A4", "A5"), skus(mirrorService.getRows(READER, "catalog", "v1")));
        assertEquals(1, observer.ofType(EdgeChangeEvent.Type.MIRROR_PUBLISHED).size());
    }

    @Test
    void testPublishVersion_SameChecksumIsNoOp() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "abc123", rows("A1", "A2"), 1000);
        PublishResult again = mirrorService.publishVersion(WRITER, "catalog", "v1", "abc123", rows("A1", "A2"), 1000);

        assertFalse(again.created);
        assertEquals(2, again.rowCount);
        assertEquals(2, mirrorService.listVersions(READER, "catalog", 0).get(0).rowCount);
        assertEquals(1, observer.ofType(EdgeChangeEvent.Type.MIRROR_PUBLISHED).size());
    }

    @Test
    void testPublishVersion_ChecksumMismatchLeavesStoredVersion() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "abc123", rows("A1", "A2"), 1000);

        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            mirrorService.publishVersion(WRITER, "catalog", "v1", "def456", rows("B1"), 2000));

        assertEquals(ErrorKind.CHECKSUM_MISMATCH, e.kind());
        assertFalse(e.isRecoverable());
        GlobalMirrorVersion stored = mirrorService.getVersion(READER, "catalog", "v1");
        assertEquals("abc123", stored.checksum);
        assertEquals(1000L, stored.ts);
        assertEquals(List.of("A1", "A2"), skus(mirrorService.getRows(READER, "catalog", "v1")));
    }

    @Test
    void testPublishVersion_EmptyRows() {
        PublishResult result = mirrorService.publishVersion(WRITER, "catalog", "empty", "e0", List.of(), 1000);

        assertTrue(result.created);
        assertFalse(mirrorService.getRows(READER, "catalog", "empty").iterator().hasNext());
    }

    @Test
    void testPublishVersion_Validation() {
        EdgeStoreException blank = assertThrows(EdgeStoreException.class, () ->
            mirrorService.publishVersion(WRITER, "catalog", " ", "abc", rows("A1"), 1000));
        assertEquals(ErrorKind.INVALID_ARGUMENT, blank.kind());

        EdgeStoreException timeout = assertThrows(EdgeStoreException.class, () ->
            mirrorService.publishVersion(WRITER, "catalog", "v1", "abc", rows("A1"), 1000, Duration.ZERO));
        assertEquals(ErrorKind.INVALID_ARGUMENT, timeout.kind());

        assertTrue(mirrorService.listVersions(READER, "catalog", 0).isEmpty());
    }

    @Test
    void testPublishVersion_WithTimeout() {
        PublishResult result = mirrorService.publishVersion(WRITER, "catalog", "v1", "abc", rows("A1"), 1000,
            Duration.ofSeconds(5));

        assertTrue(result.created);
    }

    @Test
    void testPublish_DerivesVersionFromContent() {
        PublishResult result = mirrorService.publish(WRITER, "catalog", rows("A1"));

        assertEquals(Checksums.sha256Hex("[{\"sku\":\"A1\"}]"), result.checksum);
        assertEquals("v" + result.ts + "." + result.checksum.substring(0, 8), result.version);
        assertEquals(result.version, mirrorService.getLatestVersion(READER, "catalog").version);
    }

    @Test
    void testGetLatestVersion_GreatestTs() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2", rows("A2"), 2000);
        mirrorService.publishVersion(WRITER, "catalog", "v3", "c3", rows("A3"), 1500);

        GlobalMirrorVersion latest = mirrorService.getLatestVersion(READER, "catalog");
        assertEquals("v2", latest.version);
        assertEquals("c2", latest.checksum);
    }

    @Test
    void testGetLatestVersion_TieBrokenByInsertionOrder() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2", rows("A2"), 1000);

        assertEquals("v2", mirrorService.getLatestVersion(READER, "catalog").version);
    }

    @Test
    void testGetLatestVersion_NotFound() {
        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            mirrorService.getLatestVersion(READER, "nothing"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void testGetRows_UnknownVersionFailsImmediately() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);

        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            mirrorService.getRows(READER, "catalog", "v9"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void testGetRows_RestartableAndFinite() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1", "A2", "A3"), 1000);
        RowSequence sequence = mirrorService.getRows(READER, "catalog", "v1");

        assertEquals(List.of("A1", "A2", "A3"), skus(sequence));
        assertEquals(List.of("A1", "A2", "A3"), skus(sequence));

        Iterator<JsonNode> iterator = sequence.iterator();
        iterator.next();
        iterator.next();
        iterator.next();
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void testListVersions_NewestFirstWithCounts() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2", rows("A1", "A2", "A3"), 2000);
        mirrorService.publishVersion(WRITER, "other", "v1", "o1", rows("X"), 3000);

        List<VersionSummary> versions = mirrorService.listVersions(READER, "catalog", 0);
        assertEquals(2, versions.size());
        assertEquals("v2", versions.get(0).version);
        assertEquals(3, versions.get(0).rowCount);
        assertEquals("v1", versions.get(1).version);
        assertEquals(1, versions.get(1).rowCount);

        assertEquals(1, mirrorService.listVersions(READER, "catalog", 1).size());
    }

    @Test
    void testGetVersionDiff_AddedAndRemovedRows() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1", "A2", "A3", "A2"), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2", rows("A2", "A4", "A1", "A5"), 2000);

        VersionDiff diff = mirrorService.getVersionDiff(READER, "catalog", "v1", "v2");

        assertEquals(List.of("A4", "A5"), skus(diff.added));
        // A2 was stored twice in v1 and only once in v2
        assertEquals(List.of("A3", "A2"), skus(diff.removed));
        assertEquals(2, diff.unchanged);
        assertFalse(diff.isEmpty());

        VersionDiff reverse = mirrorService.getVersionDiff(READER, "catalog", "v2", "v1");
        assertEquals(List.of("A2", "A3"), skus(reverse.added));
        assertEquals(List.of("A4", "A5"), skus(reverse.removed));
    }

    @Test
    void testGetVersionDiff_MemberOrderDoesNotMatter() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1",
            List.of(JsonDocuments.parse("{\"sku\":\"A1\",\"attrs\":{\"size\":\"M\",\"color\":\"red\"}}")), 1000);
        mirrorService.publishVersion(WRITER, "catalog", "v2", "c2",
            List.of(JsonDocuments.parse("{\"attrs\":{\"color\":\"red\",\"size\":\"M\"},\"sku\":\"A1\"}")), 2000);

        VersionDiff diff = mirrorService.getVersionDiff(READER, "catalog", "v1", "v2");

        assertTrue(diff.isEmpty());
        assertEquals(1, diff.unchanged);
        assertTrue(mirrorService.getVersionDiff(READER, "catalog", "v1", "v1").isEmpty());
    }

    @Test
    void testGetVersionDiff_UnknownVersion() {
        mirrorService.publishVersion(WRITER, "catalog", "v1", "c1", rows("A1"), 1000);

        EdgeStoreException e = assertThrows(EdgeStoreException.class,
            () -> mirrorService.getVersionDiff(READER, "catalog", "v1", "v9"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        e = assertThrows(EdgeStoreException.class,
            () -> mirrorService.getVersionDiff(READER, "catalog", "v0", "v1"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        e = assertThrows(EdgeStoreException.class,
            () -> mirrorService.getVersionDiff(null, "catalog", "v1", "v1"));
        assertEquals(ErrorKind.UNAUTHORIZED, e.kind());
    }
}
