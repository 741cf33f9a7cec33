package ai.pipestream.edge.service;

/**
 * Fixed access levels. {@code WRITER} may read and mutate everything; {@code READER} may only read.
 */
public enum Capability {
    WRITER,
    READER;

    public boolean canWrite() {
        return this == WRITER;
    }
}
