package ai.pipestream.edge.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chooses the {@link ViewTransform} for a dataset: a transform registered for the dataset first,
 * then the first {@link ViewTransform} bean that applies to it, then {@link ContextOverlayTransform}.
 */
@ApplicationScoped
public class ViewTransformRegistry {

    private static final Logger LOG = Logger.getLogger(ViewTransformRegistry.class);

    private final ViewTransform fallback = new ContextOverlayTransform();
    private final Map<String, ViewTransform> registered = new ConcurrentHashMap<>();

    @Inject
    Instance<ViewTransform> transformBeans;

    public void register(String datasetId, ViewTransform transform) {
        registered.put(datasetId, transform);
        LOG.infof("Registered view transform %s for dataset %s", transform.getClass().getSimpleName(), datasetId);
    }

    /**
     * @return true if a transform was registered for the dataset
     */
    public boolean unregister(String datasetId) {
        return registered.remove(datasetId) != null;
    }

    public ViewTransform transformFor(String datasetId) {
        ViewTransform transform = registered.get(datasetId);
        if (transform != null) {
            return transform;
        }
        for (ViewTransform bean : transformBeans) {
            if (bean.appliesTo(datasetId)) {
                return bean;
            }
        }
        return fallback;
    }
}
