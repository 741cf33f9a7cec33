package ai.pipestream.edge.service;

/**
 * Failure of an edge store operation, tagged with a stable {@link ErrorKind}.
 */
public class EdgeStoreException extends RuntimeException {

    private final ErrorKind kind;

    public EdgeStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EdgeStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Recoverable failures are expected outcomes the caller may retry, merge or discard.
     */
    public boolean isRecoverable() {
        return kind == ErrorKind.STALE_WRITE || kind == ErrorKind.DUPLICATE_VERSION;
    }

    public static EdgeStoreException notFound(String message) {
        return new EdgeStoreException(ErrorKind.NOT_FOUND, message);
    }

    public static EdgeStoreException alreadyExists(String message) {
        return new EdgeStoreException(ErrorKind.ALREADY_EXISTS, message);
    }

    public static EdgeStoreException invalidPath(String message) {
        return new EdgeStoreException(ErrorKind.INVALID_PATH, message);
    }

    public static EdgeStoreException invalidArgument(String message) {
        return new EdgeStoreException(ErrorKind.INVALID_ARGUMENT, message);
    }

    @Override
    public String toString() {
        return "EdgeStoreException[" + kind + "]: " + getMessage();
    }
}
