package structdb.engine.storage;

/**
 * Row Identifier: identifies a row by (pageId, slotId) within a table's heap file.
 */
public record RID(int pageId, int slotId) {
	@Override
	public String toString() {
		return "(" + pageId + "," + slotId + ")";
	}
}
