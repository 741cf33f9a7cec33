package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.UserContext;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UserContextService with the default (unconditional) write policy.
 */
@QuarkusTest
public class UserContextServiceTest {

    @Inject
    UserContextService contextService;

    @BeforeEach
    @Transactional
    void setUp() {
        UserContext.deleteAll();
    }

    private static ObjectNode ctx(String json) {
        return JsonDocuments.parseObject(json);
    }

    @Test
    void testSetContext_InsertThenRead() {
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"region\":\"EU\"}"), 100);

        UserContext stored = contextService.getContext(Capability.READER, "u1", "catalog");
        assertEquals("EU", JsonDocuments.parse(stored.ctx).get("region").asText());
        assertEquals(100L, stored.ts);
    }

    @Test
    void testSetContext_ReplacesWholeContext() {
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"region\":\"EU\",\"tier\":\"gold\"}"), 100);
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"region\":\"US\"}"), 200);

        UserContext stored = contextService.getContext(Capability.READER, "u1", "catalog");
        assertEquals(ctx("{\"region\":\"US\"}"), JsonDocuments.parse(stored.ctx));
        assertEquals(200L, stored.ts);
    }

    @Test
    void testSetContext_OlderTimestampAcceptedByDefault() {
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"v\":2}"), 200);
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"v\":1}"), 100);

        UserContext stored = contextService.getContext(Capability.READER, "u1", "catalog");
        assertEquals(1, JsonDocuments.parse(stored.ctx).get("v").asInt());
        assertEquals(100L, stored.ts);
    }

    @Test
    void testSetContext_ClockTimestamp() {
        long before = System.currentTimeMillis() / 1000;
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{}"));

        UserContext stored = contextService.getContext(Capability.READER, "u1", "catalog");
        assertTrue(stored.ts >= before);
    }

    @Test
    void testSetContext_ScopedPerUserAndDataset() {
        contextService.setContext(Capability.WRITER, "u1", "catalog", ctx("{\"who\":\"u1\"}"), 1);
        contextService.setContext(Capability.WRITER, "u2", "catalog", ctx("{\"who\":\"u2\"}"), 1);
        contextService.setContext(Capability.WRITER, "u1", "prices", ctx("{\"who\":\"u1-prices\"}"), 1);

        assertEquals("u2", JsonDocuments.parse(contextService.getContext(Capability.READER, "u2", "catalog").ctx)
            .get("who").asText());
        assertEquals("u1-prices", JsonDocuments.parse(contextService.getContext(Capability.READER, "u1", "prices").ctx)
            .get("who").asText());
    }

    @Test
    void testGetContext_NotFound() {
        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            contextService.getContext(Capability.READER, "u1", "catalog"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void testSetContext_RequiresIds() {
        EdgeStoreException e = assertThrows(EdgeStoreException.class, () ->
            contextService.setContext(Capability.WRITER, "", "catalog", ctx("{}"), 1));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }
}
