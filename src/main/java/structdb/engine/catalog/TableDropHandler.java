package structdb.engine.catalog;

/**
 * Receives a dropped structure's last table layout so its rows and file can be discarded.
 */
public interface TableDropHandler {
    void dropTable(TableSchema layout);
}
