package ai.pipestream.edge.repository;

import ai.pipestream.edge.entity.ColumnType;
import ai.pipestream.edge.entity.UserDbTable;
import ai.pipestream.edge.entity.UserDbTableIndex;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Repository for UserDB metadata: {@code userdb_tables} and {@code userdb_table_indexes}.
 * <p>
 * Metadata rows only; documents and index entries live in {@link UserDocumentRepository}.
 * Callers serialize metadata changes per table through the table lock registry.
 */
@ApplicationScoped
public class UserTableRepository {

    private static final Logger LOG = Logger.getLogger(UserTableRepository.class);

    @Inject
    EntityManager entityManager;

    // ========================================================================
    // Tables
    // ========================================================================

    /**
     * @return the table or null if not registered
     */
    @Transactional
    public UserDbTable findTable(String userId, String tableName) {
        return UserDbTable.find("userId = ?1 AND tableName = ?2", userId, tableName).firstResult();
    }

    /**
     * @return the table owning this physical name, or null
     */
    @Transactional
    public UserDbTable findByPhysicalName(String phyTable) {
        return UserDbTable.find("phyTable", phyTable).firstResult();
    }

    @Transactional
    public List<UserDbTable> listTables(String userId) {
        return entityManager.createQuery(
                "FROM UserDbTable t WHERE t.userId = :userId ORDER BY t.tableName ASC", UserDbTable.class)
            .setParameter("userId", userId)
            .getResultList();
    }

    @Transactional
    public UserDbTable createTable(String userId, String tableName, String phyTable,
                                   String pkPath, String tsPath, long createdAt) {
        UserDbTable table = new UserDbTable(userId, tableName, phyTable, pkPath, tsPath, createdAt);
        table.persist();
        entityManager.flush();
        LOG.infof("Registered table %s/%s as %s (pk %s, ts %s)", userId, tableName, phyTable, pkPath, table.tsPath);
        return table;
    }

    /**
     * Delete the table record and all of its index definitions.
     *
     * @return true if the table existed
     */
    @Transactional
    public boolean deleteTable(String userId, String tableName) {
        long indexes = UserDbTableIndex.delete("userId = ?1 AND tableName = ?2", userId, tableName);
        long tables = UserDbTable.delete("userId = ?1 AND tableName = ?2", userId, tableName);
        LOG.infof("Deleted table %s/%s metadata (%d index definitions)", userId, tableName, indexes);
        return tables > 0;
    }

    // ========================================================================
    // Index definitions
    // ========================================================================

    @Transactional
    public List<UserDbTableIndex> listIndexes(String userId, String tableName) {
        return entityManager.createQuery(
                "FROM UserDbTableIndex i WHERE i.userId = :userId AND i.tableName = :tableName "
                    + "ORDER BY i.colName ASC",
                UserDbTableIndex.class)
            .setParameter("userId", userId)
            .setParameter("tableName", tableName)
            .getResultList();
    }

    /**
     * @return the index definition or null if not declared
     */
    @Transactional
    public UserDbTableIndex findIndex(String userId, String tableName, String colName) {
        return UserDbTableIndex.find("userId = ?1 AND tableName = ?2 AND colName = ?3",
                userId, tableName, colName)
            .firstResult();
    }

    @Transactional
    public UserDbTableIndex createIndex(String userId, String tableName, String colName,
                                        String jsonPath, ColumnType colType) {
        UserDbTableIndex index = new UserDbTableIndex(userId, tableName, colName, jsonPath, colType);
        index.persist();
        entityManager.flush();
        LOG.infof("Declared index %s on %s/%s (%s %s)", colName, userId, tableName, jsonPath, colType.wireName());
        return index;
    }

    /**
     * @return true if the index definition existed
     */
    @Transactional
    public boolean deleteIndex(String userId, String tableName, String colName) {
        return UserDbTableIndex.delete("userId = ?1 AND tableName = ?2 AND colName = ?3",
            userId, tableName, colName) > 0;
    }
}
