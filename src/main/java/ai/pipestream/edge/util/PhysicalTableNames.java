package ai.pipestream.edge.util;

import java.util.regex.Pattern;

/**
 * Physical identifiers for UserDB tables.
 * <p>
 * physical name = "udb_" + first 16 hex chars of sha1(userId + ":" + tableName)
 */
public final class PhysicalTableNames {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_]{1,64}$");

    private PhysicalTableNames() {}

    /**
     * Derive the physical name for a logical table. Deterministic: the same (user, table) pair
     * always yields the same name.
     */
    public static String derive(String userId, String tableName) {
        return "udb_" + Checksums.sha1Hex(userId + ":" + tableName).substring(0, 16);
    }

    public static boolean isValid(String phyTable) {
        return phyTable != null && VALID.matcher(phyTable).matches();
    }
}
