package structdb.engine.storage;

/**
 * Simple carrier tying a heap record to its RID for scans.
 */
public record TableRow(RID rid, HeapRecord record) {}
