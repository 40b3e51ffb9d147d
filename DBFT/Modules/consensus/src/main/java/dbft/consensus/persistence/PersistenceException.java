package dbft.consensus.persistence;

public class PersistenceException extends Exception {
    public enum Kind {
        /** The backing store failed. */
        STORE,
        /** The stored snapshot cannot be decoded or does not fit the roster. */
        SNAPSHOT
    }

    private final Kind kind;

    public PersistenceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PersistenceException store(String message, Throwable cause) {
        return new PersistenceException(Kind.STORE, message, cause);
    }

    public static PersistenceException snapshot(String message, Throwable cause) {
        return new PersistenceException(Kind.SNAPSHOT, message, cause);
    }

    public Kind kind() { return kind; }
}
