package ai.pipestream.edge.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for physical table name derivation and validation.
 */
public class PhysicalTableNamesTest {

    @Test
    void testDerive_Deterministic() {
        String first = PhysicalTableNames.derive("u1", "orders");
        String second = PhysicalTableNames.derive("u1", "orders");

        assertEquals(first, second);
        assertEquals("udb_" + Checksums.sha1Hex("u1:orders").substring(0, 16), first);
        assertEquals(20, first.length());
        assertTrue(PhysicalTableNames.isValid(first));
    }

    @Test
    void testDerive_DifferentTenantsDifferentNames() {
        assertNotEquals(PhysicalTableNames.derive("u1", "orders"), PhysicalTableNames.derive("u2", "orders"));
        assertNotEquals(PhysicalTableNames.derive("u1", "orders"), PhysicalTableNames.derive("u1", "invoices"));
    }

    @Test
    void testIsValid() {
        assertTrue(PhysicalTableNames.isValid("t_u1_orders"));
        assertFalse(PhysicalTableNames.isValid(null));
        assertFalse(PhysicalTableNames.isValid(""));
        assertFalse(PhysicalTableNames.isValid("orders; DROP TABLE x"));
        assertFalse(PhysicalTableNames.isValid("t-u1"));
        assertFalse(PhysicalTableNames.isValid("x".repeat(65)));
    }

    @Test
    void testChecksums_KnownDigests() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", Checksums.sha1Hex("abc"));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Checksums.sha256Hex("abc"));
    }
}
