package ai.pipestream.edge.service;

/**
 * Result of writing one document.
 */
public final class UpsertOutcome {

    public enum Status {
        INSERTED,
        UPDATED,
        /** Rejected: the stored document is at least as new. Storage unchanged. */
        STALE
    }

    public final String pk;
    public final long ts;
    public final Status status;

    public UpsertOutcome(String pk, long ts, Status status) {
        this.pk = pk;
        this.ts = ts;
        this.status = status;
    }

    public boolean applied() {
        return status != Status.STALE;
    }

    @Override
    public String toString() {
        return pk + "@" + ts + ":" + status;
    }
}
