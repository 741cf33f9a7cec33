package ai.pipestream.edge.repository;

import ai.pipestream.edge.entity.UserContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

/**
 * Repository for {@code user_contexts}: one JSON context per (user, dataset), overwritten in place.
 */
@ApplicationScoped
public class UserContextRepository {

    private static final Logger LOG = Logger.getLogger(UserContextRepository.class);

    /**
     * @return the context or null if not found
     */
    @Transactional
    public UserContext find(String userId, String datasetId) {
        return UserContext.find("userId = ?1 AND datasetId = ?2", userId, datasetId).firstResult();
    }

    /**
     * Find a context and lock its row for the rest of the transaction.
     *
     * @return the locked context or null if not found
     */
    @Transactional
    public UserContext findForUpdate(String userId, String datasetId) {
        return UserContext.find("userId = ?1 AND datasetId = ?2", userId, datasetId)
            .withLock(LockModeType.PESSIMISTIC_WRITE)
            .firstResult();
    }

    /**
     * Insert or overwrite the context.
     *
     * @param existing the current row (from {@link #findForUpdate}) or null to insert
     * @return the stored context
     */
    @Transactional
    public UserContext save(UserContext existing, String userId, String datasetId, String ctxJson, long ts) {
        if (existing == null) {
            UserContext created = new UserContext(userId, datasetId, ctxJson, ts);
            created.persist();
            LOG.infof("Created context for user %s on dataset %s", userId, datasetId);
            return created;
        }
        existing.ctx = ctxJson;
        existing.ts = ts;
        existing.persist();
        LOG.infof("Replaced context for user %s on dataset %s", userId, datasetId);
        return existing;
    }
}
