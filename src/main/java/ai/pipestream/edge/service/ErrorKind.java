package ai.pipestream.edge.service;

/**
 * Stable error kinds reported by the edge store. Callers branch on the kind, never on messages or
 * storage-engine exceptions.
 */
public enum ErrorKind {
    /** A concurrent publish of the same dataset version won the race; retry to resolve. */
    DUPLICATE_VERSION,
    /** The dataset version already exists with a different checksum. */
    CHECKSUM_MISMATCH,
    NOT_FOUND,
    ALREADY_EXISTS,
    /** The stored timestamp is newer than or equal to the incoming one. Recoverable. */
    STALE_WRITE,
    /** A JSON path is malformed, does not resolve, or resolves to a value of the wrong type. */
    INVALID_PATH,
    UNAUTHORIZED,
    /** Timeout or storage failure; the unit of work was rolled back. */
    TRANSACTION_ABORTED,
    INVALID_ARGUMENT,
    /** The readiness marker is absent. */
    NOT_INITIALIZED
}
