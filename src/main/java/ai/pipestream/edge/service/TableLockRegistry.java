package ai.pipestream.edge.service;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide locks for UserDB tables.
 * <p>
 * Each (user, table) pair gets a read/write lock, created on first use: document writes hold the
 * read side, metadata changes hold the write side. Entries outlive a dropped table so that a
 * thread still waiting on the old lock and one arriving after a re-create share one instance.
 * Writes to the same primary key are additionally serialized on a fixed set of key stripes.
 */
@ApplicationScoped
public class TableLockRegistry {

    private static final int KEY_STRIPES = 64;

    private final ConcurrentMap<String, ReentrantReadWriteLock> tableLocks = new ConcurrentHashMap<>();
    private final ReentrantLock[] keyStripes = new ReentrantLock[KEY_STRIPES];

    public TableLockRegistry() {
        for (int i = 0; i < KEY_STRIPES; i++) {
            keyStripes[i] = new ReentrantLock();
        }
    }

    public ReentrantReadWriteLock tableLock(String userId, String tableName) {
        return tableLocks.computeIfAbsent(tableKey(userId, tableName), k -> new ReentrantReadWriteLock());
    }

    /**
     * Lock stripe guarding writes of one primary key in one physical table.
     */
    public ReentrantLock keyLock(String phyTable, String pk) {
        int hash = (phyTable + '\u0000' + pk).hashCode();
        return keyStripes[Math.floorMod(hash, KEY_STRIPES)];
    }

    private static String tableKey(String userId, String tableName) {
        return userId + '\u0000' + tableName;
    }
}
