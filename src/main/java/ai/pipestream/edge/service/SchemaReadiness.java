package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.InitMarker;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Tracks the process-wide readiness marker ({@code init_complete}).
 * <p>
 * Schema objects are provisioned by Hibernate at boot; once that has happened the marker row is
 * written exactly once. Every store operation checks {@link #requireReady()} first and is refused
 * with {@link ErrorKind#NOT_INITIALIZED} while the marker is absent. A positive check is cached;
 * {@link #reset()} drops the cache.
 */
@ApplicationScoped
public class SchemaReadiness {

    private static final Logger LOG = Logger.getLogger(SchemaReadiness.class);

    @ConfigProperty(name = "edge.schema.provision-on-startup", defaultValue = "true")
    boolean provisionOnStartup;

    private volatile boolean ready;

    void onStart(@Observes StartupEvent event) {
        if (provisionOnStartup) {
            markProvisioned();
        } else {
            LOG.info("Schema provisioning on startup disabled; waiting for external readiness marker");
        }
    }

    /**
     * Write the readiness marker if it is not present yet.
     *
     * @return true if this call wrote the marker
     */
    @Transactional
    public boolean markProvisioned() {
        InitMarker existing = InitMarker.findById(InitMarker.MARKER_ID);
        if (existing != null) {
            LOG.debugf("Readiness marker already present (completed_at=%s)", existing.completedAt);
            ready = true;
            return false;
        }
        InitMarker marker = new InitMarker();
        marker.completedAt = OffsetDateTime.now(ZoneOffset.UTC);
        marker.persist();
        ready = true;
        LOG.infof("Schema provisioning complete; readiness marker written at %s", marker.completedAt);
        return true;
    }

    @Transactional
    public boolean isReady() {
        if (ready) {
            return true;
        }
        ready = InitMarker.findById(InitMarker.MARKER_ID) != null;
        return ready;
    }

    /**
     * @throws EdgeStoreException with {@link ErrorKind#NOT_INITIALIZED} if the marker is absent
     */
    public void requireReady() {
        if (!isReady()) {
            throw new EdgeStoreException(ErrorKind.NOT_INITIALIZED, "Edge store schema is not yet initialized");
        }
    }

    /**
     * Forget the cached readiness state so that the next check reads the marker again.
     */
    public void reset() {
        ready = false;
    }
}
