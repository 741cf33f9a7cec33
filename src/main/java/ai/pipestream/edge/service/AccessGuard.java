package ai.pipestream.edge.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Entry check shared by every store operation: readiness first, then capability.
 */
@ApplicationScoped
public class AccessGuard {

    private static final Logger LOG = Logger.getLogger(AccessGuard.class);

    @Inject
    SchemaReadiness schemaReadiness;

    public void checkRead(Capability capability, String operation) {
        schemaReadiness.requireReady();
        if (capability == null) {
            throw new EdgeStoreException(ErrorKind.UNAUTHORIZED, "No capability presented for " + operation);
        }
    }

    public void checkWrite(Capability capability, String operation) {
        schemaReadiness.requireReady();
        if (capability == null || !capability.canWrite()) {
            LOG.warnf("Rejected %s under capability %s", operation, capability);
            throw new EdgeStoreException(ErrorKind.UNAUTHORIZED,
                operation + " requires the writer capability");
        }
    }
}
