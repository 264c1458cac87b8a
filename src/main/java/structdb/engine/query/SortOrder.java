package structdb.engine.query;

public enum SortOrder { ASC, DESC }
