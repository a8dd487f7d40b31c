package ai.gently.model;

/** Schema version written into every persisted document. Documents without one are read as version 1. */
public final class SchemaVersion {
    public static final int CURRENT = 1;

    private SchemaVersion() {}
}
