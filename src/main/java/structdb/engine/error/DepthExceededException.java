package structdb.engine.error;

/**
 * Schema or document nesting went past the configured maximum depth.
 */
public class DepthExceededException extends StructureStoreException {
    private final String path;
    private final int maxDepth;

    public DepthExceededException(String path, int maxDepth) {
        super("Nesting deeper than " + maxDepth + " levels at '" + path + "'");
        this.path = path;
        this.maxDepth = maxDepth;
    }

    public String path() { return path; }
    public int maxDepth() { return maxDepth; }
}
