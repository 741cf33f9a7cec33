package ai.pipestream.edge.repository;

import ai.pipestream.edge.entity.UserDocument;
import ai.pipestream.edge.entity.UserDocumentIndexEntry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Repository for UserDB documents ({@code userdb_documents}) and their typed index entries
 * ({@code userdb_index_entries}).
 * <p>
 * Provides transactional access with support for:
 * <ul>
 *   <li>Compare-and-set document writes on the stored timestamp</li>
 *   <li>Replacing a document's index entries alongside the document write</li>
 *   <li>Index lookups narrowed on the typed value column</li>
 *   <li>Id-ordered paging for backfills and full scans</li>
 *   <li>Explicit cascade deletes per document, per index column and per table</li>
 * </ul>
 * Everything is addressed by physical table name; callers resolve the logical table first.
 */
@ApplicationScoped
public class UserDocumentRepository {

    private static final Logger LOG = Logger.getLogger(UserDocumentRepository.class);

    private static final Set<String> VALUE_ATTRIBUTES =
        Set.of("stringValue", "numberValue", "longValue", "booleanValue");
    private static final Set<String> OPERATORS = Set.of("=", "<>", ">", ">=", "<", "<=", "IN");
    private static final int IN_CHUNK = 500;

    @Inject
    EntityManager entityManager;

    // ========================================================================
    // Documents
    // ========================================================================

    /**
     * @return the document or null if not found
     */
    @Transactional
    public UserDocument findDocument(String phyTable, String pk) {
        return UserDocument.find("phyTable = ?1 AND pk = ?2", phyTable, pk).firstResult();
    }

    @Transactional
    public boolean documentExists(String phyTable, String pk) {
        return UserDocument.count("phyTable = ?1 AND pk = ?2", phyTable, pk) > 0;
    }

    /**
     * Overwrite an existing document only if its stored timestamp is older than {@code ts}
     * (or unconditionally when {@code force} is set). The row lock taken by the update serializes
     * concurrent writers of the same key until commit.
     *
     * @return number of rows updated (0 or 1)
     */
    @Transactional
    public int compareAndSet(String phyTable, String pk, String itemJson, long ts, boolean force) {
        String jpql = "UPDATE UserDocument d SET d.item = :item, d.ts = :ts "
            + "WHERE d.phyTable = :phyTable AND d.pk = :pk" + (force ? "" : " AND d.ts < :ts");
        return entityManager.createQuery(jpql)
            .setParameter("item", itemJson)
            .setParameter("ts", ts)
            .setParameter("phyTable", phyTable)
            .setParameter("pk", pk)
            .executeUpdate();
    }

    /**
     * Insert a new document and flush so that a concurrent insert of the same key surfaces as a
     * constraint violation inside the caller's transaction.
     */
    @Transactional
    public UserDocument insertDocument(String phyTable, String pk, String itemJson, long ts) {
        UserDocument document = new UserDocument(phyTable, pk, itemJson, ts);
        document.persist();
        entityManager.flush();
        return document;
    }

    /**
     * Delete a document and its index entries.
     *
     * @return true if the document existed
     */
    @Transactional
    public boolean deleteDocument(String phyTable, String pk) {
        UserDocumentIndexEntry.delete("phyTable = ?1 AND pk = ?2", phyTable, pk);
        return UserDocument.delete("phyTable = ?1 AND pk = ?2", phyTable, pk) > 0;
    }

    /**
     * Delete every document and index entry of a table.
     *
     * @return number of documents deleted
     */
    @Transactional
    public long deleteAllForTable(String phyTable) {
        long entries = UserDocumentIndexEntry.delete("phyTable", phyTable);
        long documents = UserDocument.delete("phyTable", phyTable);
        LOG.infof("Deleted %d documents and %d index entries from %s", documents, entries, phyTable);
        return documents;
    }

    @Transactional
    public long countDocuments(String phyTable) {
        return UserDocument.count("phyTable", phyTable);
    }

    /**
     * One page of documents in id order, starting after {@code afterId}.
     */
    @Transactional
    public List<UserDocument> findDocumentsPage(String phyTable, long afterId, int pageSize) {
        return entityManager.createQuery(
                "FROM UserDocument d WHERE d.phyTable = :phyTable AND d.id > :afterId ORDER BY d.id ASC",
                UserDocument.class)
            .setParameter("phyTable", phyTable)
            .setParameter("afterId", afterId)
            .setMaxResults(pageSize)
            .getResultList();
    }

    /**
     * Documents for a set of primary keys (unordered).
     */
    @Transactional
    public List<UserDocument> findDocuments(String phyTable, Collection<String> pks) {
        List<UserDocument> result = new ArrayList<>(pks.size());
        List<String> all = new ArrayList<>(pks);
        for (int from = 0; from < all.size(); from += IN_CHUNK) {
            List<String> chunk = all.subList(from, Math.min(all.size(), from + IN_CHUNK));
            result.addAll(entityManager.createQuery(
                    "FROM UserDocument d WHERE d.phyTable = :phyTable AND d.pk IN :pks", UserDocument.class)
                .setParameter("phyTable", phyTable)
                .setParameter("pks", chunk)
                .getResultList());
        }
        return result;
    }

    /**
     * Documents with {@code ts >= sinceTs}, ordered by ts (then pk).
     *
     * @param limit maximum number of results (0 = no limit)
     */
    @Transactional
    public List<UserDocument> findUpdatedSince(String phyTable, long sinceTs, int limit, boolean ascending) {
        String direction = ascending ? "ASC" : "DESC";
        var query = entityManager.createQuery(
                "FROM UserDocument d WHERE d.phyTable = :phyTable AND d.ts >= :sinceTs "
                    + "ORDER BY d.ts " + direction + ", d.pk " + direction,
                UserDocument.class)
            .setParameter("phyTable", phyTable)
            .setParameter("sinceTs", sinceTs);
        if (limit > 0) {
            query.setMaxResults(limit);
        }
        return query.getResultList();
    }

    // ========================================================================
    // Index entries
    // ========================================================================

    /**
     * Replace all index entries of one document with {@code entries}.
     */
    @Transactional
    public void replaceEntries(String phyTable, String pk, List<UserDocumentIndexEntry> entries) {
        UserDocumentIndexEntry.delete("phyTable = ?1 AND pk = ?2", phyTable, pk);
        for (UserDocumentIndexEntry entry : entries) {
            entry.persist();
        }
        entityManager.flush();
    }

    /**
     * Insert (or replace) entries for one index column, used by backfills.
     */
    @Transactional
    public void upsertEntries(String phyTable, String colName, List<UserDocumentIndexEntry> entries) {
        for (UserDocumentIndexEntry entry : entries) {
            UserDocumentIndexEntry.delete("phyTable = ?1 AND colName = ?2 AND pk = ?3", phyTable, colName, entry.pk);
            entry.persist();
        }
        entityManager.flush();
    }

    /**
     * @return number of entries deleted
     */
    @Transactional
    public long deleteEntriesForColumn(String phyTable, String colName) {
        return UserDocumentIndexEntry.delete("phyTable = ?1 AND colName = ?2", phyTable, colName);
    }

    @Transactional
    public long countEntries(String phyTable, String colName) {
        return UserDocumentIndexEntry.count("phyTable = ?1 AND colName = ?2", phyTable, colName);
    }

    @Transactional
    public List<UserDocumentIndexEntry> findEntries(String phyTable, String colName) {
        return UserDocumentIndexEntry.list("phyTable = ?1 AND colName = ?2", phyTable, colName);
    }

    /**
     * Entries whose typed value satisfies {@code attribute operator operand}.
     *
     * @param attribute one of stringValue, numberValue, longValue, booleanValue
     * @param operator one of =, &lt;&gt;, &gt;, &gt;=, &lt;, &lt;=, IN (operand is then a collection)
     */
    @Transactional
    public List<UserDocumentIndexEntry> findEntriesMatching(String phyTable, String colName,
                                                            String attribute, String operator, Object operand) {
        if (!VALUE_ATTRIBUTES.contains(attribute) || !OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unsupported index filter: " + attribute + " " + operator);
        }
        String rhs = "IN".equals(operator) ? "IN :operand" : operator + " :operand";
        return entityManager.createQuery(
                "FROM UserDocumentIndexEntry e WHERE e.phyTable = :phyTable AND e.colName = :colName "
                    + "AND e." + attribute + " " + rhs,
                UserDocumentIndexEntry.class)
            .setParameter("phyTable", phyTable)
            .setParameter("colName", colName)
            .setParameter("operand", operand)
            .getResultList();
    }
}
