package structdb.engine.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Paging, ordering and filtering of a record listing. Instances are immutable;
 * the {@code with*} methods return modified copies.
 *
 * A null limit means "use the engine default"; 0 means unlimited.
 * Without a sort field rows come back in id order.
 */
public final class ListQuery {
    private final Integer limit;
    private final int offset;
    private final String sortField;
    private final SortOrder sortOrder;
    private final List<FilterCondition> filters;

    private ListQuery(Integer limit, int offset, String sortField, SortOrder sortOrder, List<FilterCondition> filters) {
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0 (got " + limit + ")");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0 (got " + offset + ")");
        this.limit = limit;
        this.offset = offset;
        this.sortField = sortField;
        this.sortOrder = sortOrder == null ? SortOrder.ASC : sortOrder;
        this.filters = List.copyOf(filters);
    }

    public static ListQuery all() {
        return new ListQuery(null, 0, null, SortOrder.ASC, List.of());
    }

    public ListQuery withLimit(int limit) {
        return new ListQuery(limit, offset, sortField, sortOrder, filters);
    }

    public ListQuery withOffset(int offset) {
        return new ListQuery(limit, offset, sortField, sortOrder, filters);
    }

    public ListQuery sortedBy(String field, SortOrder order) {
        return new ListQuery(limit, offset, field, order, filters);
    }

    public ListQuery where(String field, FilterCondition.Op op, Object value) {
        List<FilterCondition> next = new ArrayList<>(filters);
        next.add(FilterCondition.of(field, op, value));
        return new ListQuery(limit, offset, sortField, sortOrder, next);
    }

    public ListQuery withFilters(List<FilterCondition> newFilters) {
        return new ListQuery(limit, offset, sortField, sortOrder, newFilters);
    }

    public Integer limit() { return limit; }
    public int offset() { return offset; }
    public String sortField() { return sortField; }
    public SortOrder sortOrder() { return sortOrder; }
    public List<FilterCondition> filters() { return filters; }

    /** Effective limit given the engine default. */
    public int effectiveLimit(int defaultLimit) {
        return limit == null ? defaultLimit : limit;
    }

    @Override
    public String toString() {
        return "ListQuery{limit=" + limit + ", offset=" + offset + ", sort=" + sortField + " " + sortOrder + ", filters=" + filters + "}";
    }
}
