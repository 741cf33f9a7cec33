package ai.pipestream.edge.service;

/**
 * Conflict policy for UserDB writes.
 */
public enum UpsertMode {
    /** Reject the write when the stored timestamp is greater than or equal to the incoming one. */
    LAST_WRITER_WINS,
    /** Overwrite regardless of timestamps. */
    FORCE
}
