package ai.pipestream.edge.repository;

import ai.pipestream.edge.entity.UserView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Repository for the append-only {@code user_views} log. Rows are inserted, never updated or
 * deleted.
 */
@ApplicationScoped
public class UserViewRepository {

    private static final Logger LOG = Logger.getLogger(UserViewRepository.class);

    @Inject
    EntityManager entityManager;

    /**
     * Append derived items for one materialization run.
     *
     * @param itemsJson derived items as JSON text, in output order
     * @return number of rows appended
     */
    @Transactional
    public int append(String userId, String datasetId, String version, List<String> itemsJson, long ts) {
        for (String item : itemsJson) {
            new UserView(userId, datasetId, version, item, ts).persist();
        }
        entityManager.flush();
        LOG.debugf("Appended %d view rows for user %s, dataset %s, version %s",
            itemsJson.size(), userId, datasetId, version);
        return itemsJson.size();
    }

    /**
     * View rows with {@code ts >= sinceTs}, ordered by ts then insertion order.
     *
     * @param limit maximum number of results (0 = no limit)
     */
    @Transactional
    public List<UserView> findSince(String userId, String datasetId, String version, long sinceTs, int limit) {
        var query = entityManager.createQuery(
                "FROM UserView v WHERE v.userId = :userId AND v.datasetId = :datasetId "
                    + "AND v.version = :version AND v.ts >= :sinceTs ORDER BY v.ts ASC, v.id ASC",
                UserView.class)
            .setParameter("userId", userId)
            .setParameter("datasetId", datasetId)
            .setParameter("version", version)
            .setParameter("sinceTs", sinceTs);
        if (limit > 0) {
            query.setMaxResults(limit);
        }
        return query.getResultList();
    }

    @Transactional
    public long count(String userId, String datasetId, String version) {
        return UserView.count("userId = ?1 AND datasetId = ?2 AND version = ?3", userId, datasetId, version);
    }
}
