package ai.pipestream.edge.repository;

import ai.pipestream.edge.entity.GlobalMirrorVersion;
import ai.pipestream.edge.entity.GlobalRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Repository for the global mirror ({@code global_mirror_versions} and {@code global_rows}).
 * <p>
 * Provides transactional access with support for:
 * <ul>
 *   <li>Inserting a version record together with its full row batch</li>
 *   <li>Derived "latest version" lookup (max ts, tie-broken by insertion order)</li>
 *   <li>Keyset-paged row reads in insertion order</li>
 *   <li>Version listings with row counts</li>
 * </ul>
 * Versions and rows are never updated or deleted here.
 */
@ApplicationScoped
public class GlobalMirrorRepository {

    private static final Logger LOG = Logger.getLogger(GlobalMirrorRepository.class);

    @Inject
    EntityManager entityManager;

    /**
     * Find a version record.
     *
     * @return the version or null if not found
     */
    @Transactional
    public GlobalMirrorVersion findVersion(String datasetId, String version) {
        return GlobalMirrorVersion.find("datasetId = ?1 AND version = ?2", datasetId, version)
            .firstResult();
    }

    /**
     * Insert a version record and all of its rows, then flush so that unique-key violations
     * surface inside the caller's transaction.
     *
     * @param rowsJson rows as JSON text, in publication order
     * @return the persisted version record
     */
    @Transactional
    public GlobalMirrorVersion insertVersion(String datasetId, String version, String checksum,
                                             long ts, List<String> rowsJson) {
        GlobalMirrorVersion record = new GlobalMirrorVersion(datasetId, version, checksum, ts);
        record.persist();
        for (String item : rowsJson) {
            new GlobalRow(datasetId, version, item).persist();
        }
        entityManager.flush();

        LOG.infof("Inserted dataset version %s/%s (%d rows, checksum %s)",
            datasetId, version, rowsJson.size(), checksum);
        return record;
    }

    /**
     * Latest version of a dataset: greatest ts, ties broken by highest id.
     *
     * @return the version or null if the dataset has none
     */
    @Transactional
    public GlobalMirrorVersion findLatestVersion(String datasetId) {
        List<GlobalMirrorVersion> result = entityManager.createQuery(
                "FROM GlobalMirrorVersion v WHERE v.datasetId = :datasetId ORDER BY v.ts DESC, v.id DESC",
                GlobalMirrorVersion.class)
            .setParameter("datasetId", datasetId)
            .setMaxResults(1)
            .getResultList();
        return result.isEmpty() ? null : result.get(0);
    }

    /**
     * List versions newest first.
     *
     * @param limit maximum number of results (0 = no limit)
     */
    @Transactional
    public List<GlobalMirrorVersion> listVersions(String datasetId, int limit) {
        var query = entityManager.createQuery(
                "FROM GlobalMirrorVersion v WHERE v.datasetId = :datasetId ORDER BY v.ts DESC, v.id DESC",
                GlobalMirrorVersion.class)
            .setParameter("datasetId", datasetId);
        if (limit > 0) {
            query.setMaxResults(limit);
        }
        return query.getResultList();
    }

    @Transactional
    public long countRows(String datasetId, String version) {
        return GlobalRow.count("datasetId = ?1 AND version = ?2", datasetId, version);
    }

    /**
     * One page of rows in insertion order, starting after {@code afterId}.
     *
     * @param afterId id of the last row of the previous page (0 for the first page)
     * @param pageSize maximum rows returned
     */
    @Transactional
    public List<GlobalRow> findRowsPage(String datasetId, String version, long afterId, int pageSize) {
        return entityManager.createQuery(
                "FROM GlobalRow r WHERE r.datasetId = :datasetId AND r.version = :version AND r.id > :afterId "
                    + "ORDER BY r.id ASC",
                GlobalRow.class)
            .setParameter("datasetId", datasetId)
            .setParameter("version", version)
            .setParameter("afterId", afterId)
            .setMaxResults(pageSize)
            .getResultList();
    }
}
