package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.UserContext;
import ai.pipestream.edge.repository.UserContextRepository;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Per-tenant, per-dataset JSON context used to personalize views.
 * <p>
 * One context per (user, dataset), replaced wholesale on every write. Writes are unconditional
 * unless {@code edge.context.enforce-monotonic-ts} is set, in which case a write carrying an
 * older timestamp than the stored one is refused with {@link ErrorKind#STALE_WRITE}.
 */
@ApplicationScoped
public class UserContextService {

    private static final Logger LOG = Logger.getLogger(UserContextService.class);

    @Inject
    UserContextRepository contextRepository;

    @Inject
    TransactionRunner transactions;

    @Inject
    AccessGuard accessGuard;

    @Inject
    Clock clock;

    @ConfigProperty(name = "edge.context.enforce-monotonic-ts", defaultValue = "false")
    boolean enforceMonotonicTs;

    public UserContext setContext(Capability capability, String userId, String datasetId, ObjectNode ctx) {
        return setContext(capability, userId, datasetId, ctx, clock.instant().getEpochSecond());
    }

    /**
     * Store (insert or replace) the context for a user and dataset.
     *
     * @param ts epoch seconds recorded with the context
     */
    public UserContext setContext(Capability capability, String userId, String datasetId, ObjectNode ctx, long ts) {
        accessGuard.checkWrite(capability, "setContext");
        if (userId == null || userId.isBlank() || datasetId == null || datasetId.isBlank()) {
            throw EdgeStoreException.invalidArgument("userId and datasetId are required");
        }
        if (ctx == null) {
            throw EdgeStoreException.invalidArgument("ctx is required");
        }
        String ctxJson = JsonDocuments.toJson(ctx);
        try {
            return save(userId, datasetId, ctxJson, ts);
        } catch (EdgeStoreException e) {
            if (e.kind() != ErrorKind.TRANSACTION_ABORTED || !TransactionRunner.isConstraintViolation(e)) {
                throw e;
            }
            // first write raced another first write; the row exists now and can be locked
            LOG.debugf("Concurrent first context write for user %s on dataset %s, retrying", userId, datasetId);
            return save(userId, datasetId, ctxJson, ts);
        }
    }

    /**
     * @throws EdgeStoreException NOT_FOUND if no context is stored
     */
    public UserContext getContext(Capability capability, String userId, String datasetId) {
        accessGuard.checkRead(capability, "getContext");
        UserContext context = contextRepository.find(userId, datasetId);
        if (context == null) {
            throw EdgeStoreException.notFound("No context for user " + userId + " on dataset " + datasetId);
        }
        return context;
    }

    private UserContext save(String userId, String datasetId, String ctxJson, long ts) {
        return transactions.inTransaction("setContext", () -> {
            UserContext existing = contextRepository.findForUpdate(userId, datasetId);
            if (existing != null && enforceMonotonicTs && existing.ts > ts) {
                LOG.warnf("Rejected context for user %s on dataset %s: ts %d is older than stored %d",
                    userId, datasetId, ts, existing.ts);
                throw new EdgeStoreException(ErrorKind.STALE_WRITE, "Context for " + userId + "/" + datasetId
                    + " is newer (" + existing.ts + ") than " + ts);
            }
            return contextRepository.save(existing, userId, datasetId, ctxJson, ts);
        });
    }
}
