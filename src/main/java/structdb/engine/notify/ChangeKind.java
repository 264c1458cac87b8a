package structdb.engine.notify;

/**
 * Kind of committed record mutation. {@link #wireName()} is the lower-case
 * tag used in transport messages.
 */
public enum ChangeKind {
    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String wireName;

    ChangeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
