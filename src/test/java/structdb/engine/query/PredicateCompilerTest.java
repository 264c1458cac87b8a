package structdb.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonPrimitive;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.SchemaParser;
import structdb.engine.catalog.SchemaParser.ParsedSchema;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.catalog.TableSchema;
import structdb.engine.catalog.TypeMapper;
import structdb.engine.error.UnfilterableFieldException;
import structdb.engine.exec.Predicate;
import structdb.engine.exec.Row;
import structdb.engine.storage.HeapRecord;
import structdb.engine.storage.RID;

public class PredicateCompilerTest {
    private static final Instant T1 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-02T00:00:00Z");

    private final TypeMapper typeMapper = new TypeMapper();
    private final PredicateCompiler compiler = new PredicateCompiler(typeMapper);

    private StructureDefinition def() {
        ParsedSchema parsed = new SchemaParser(5, typeMapper).parse("""
            {"type":"object","properties":{
              "name":{"type":"string"},
              "price":{"type":"number"},
              "qty":{"type":"integer"},
              "vegan":{"type":"boolean"},
              "old":{"type":"string"},
              "tags":{"type":"array","items":{"type":"string"}},
              "meta":{"type":"object","properties":{"chef":{"type":"string"}}}}}
            """);
        return new StructureDefinition("menu", parsed.document(), parsed.root(), parsed.maxDepth(), 1, T1, T1);
    }

    private TableSchema layout() {
        return new TableSchema("menu", List.of(
            new ColumnSchema(TableSchema.ID, DataType.BIGINT, 0, false),
            new ColumnSchema(TableSchema.PARENT_ID, DataType.BIGINT, 0, false),
            new ColumnSchema(TableSchema.DOCUMENT, DataType.TEXT, 0, false),
            new ColumnSchema("f_name", DataType.TEXT, 0, false),
            new ColumnSchema("f_price", DataType.DOUBLE, 0, false),
            new ColumnSchema("f_qty", DataType.BIGINT, 0, false),
            new ColumnSchema("f_vegan", DataType.BOOLEAN, 0, false),
            new ColumnSchema("f_old", DataType.TEXT, 0, true),
            new ColumnSchema(TableSchema.CREATED_AT, DataType.TIMESTAMP, 0, false),
            new ColumnSchema(TableSchema.UPDATED_AT, DataType.TIMESTAMP, 0, false)
        ), "menu.tbl");
    }

    private List<Row> rows() {
        TableSchema ts = layout();
        List<Row> out = new ArrayList<>();
        out.add(row(ts, 0, Arrays.asList(1L, null, "{}", "Soup", 4.5, 2L, true, null, T1, T1)));
        out.add(row(ts, 1, Arrays.asList(2L, 1L, "{}", "Steak", 21.0, 1L, false, null, T1, T2)));
        out.add(row(ts, 2, Arrays.asList(3L, 1L, "{}", null, null, null, null, null, T2, T2)));
        out.add(row(ts, 3, Arrays.asList(4L, null, "{}", "Salad", 9.0, 5L, true, null, T2, T2)));
        return out;
    }

    private Row row(TableSchema ts, int slot, List<Object> values) {
        return Row.of(new HeapRecord(values), new RID(0, slot), ts.columns());
    }

    private List<Long> matching(FilterCondition... filters) {
        Predicate p = compiler.compile(def(), layout(), List.of(filters));
        List<Long> ids = new ArrayList<>();
        for (Row r : rows()) {
            if (p.test(r)) ids.add((Long) r.value(0));
        }
        return ids;
    }

    @Test
    void compilesComparisonsAgainstProjectedColumns() {
        assertEquals(List.of(1L, 4L), matching(FilterCondition.of("price", FilterCondition.Op.LT, 10)));
        assertEquals(List.of(2L, 4L), matching(FilterCondition.of("qty", FilterCondition.Op.NE, 2)));
        assertEquals(List.of(4L), matching(FilterCondition.of("qty", FilterCondition.Op.GTE, "3")));
        assertEquals(List.of(2L), matching(FilterCondition.of("name", FilterCondition.Op.EQ, "Steak")));
        assertEquals(List.of(1L, 4L), matching(
                FilterCondition.of("vegan", FilterCondition.Op.EQ, true),
                FilterCondition.of("price", FilterCondition.Op.GT, 1.5)));
    }

    @Test
    void reservedFieldsAreFilterable() {
        assertEquals(List.of(2L, 3L), matching(FilterCondition.of("parent_id", FilterCondition.Op.EQ, 1)));
        assertEquals(List.of(1L, 4L), matching(FilterCondition.of("parent_id", FilterCondition.Op.EQ, null)));
        assertEquals(List.of(3L, 4L), matching(FilterCondition.of("created_at", FilterCondition.Op.GTE, "2024-03-02T00:00:00Z")));
        assertEquals(List.of(1L), matching(FilterCondition.of("updated_at", FilterCondition.Op.LT, T2)));
        assertEquals(List.of(4L), matching(FilterCondition.of("id", FilterCondition.Op.GT, 3)));
    }

    @Test
    void nullLiteralTestsForMissingValues() {
        assertEquals(List.of(3L), matching(FilterCondition.of("name", FilterCondition.Op.EQ, null)));
        assertEquals(List.of(1L, 2L, 4L), matching(FilterCondition.of("name", FilterCondition.Op.NE, null)));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("name", FilterCondition.Op.LT, null)));
    }

    @Test
    void containsAndJsonLiterals() {
        assertEquals(List.of(2L), matching(FilterCondition.of("name", FilterCondition.Op.CONTAINS, "ST")));
        assertEquals(List.of(4L), matching(FilterCondition.of("name", FilterCondition.Op.CONTAINS, new JsonPrimitive("ALA"))));
        assertEquals(List.of(2L), matching(FilterCondition.of("price", FilterCondition.Op.EQ, new JsonPrimitive(21))));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("price", FilterCondition.Op.CONTAINS, "1")));
    }

    @Test
    void rejectsBadLiteralsAndOperators() {
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("qty", FilterCondition.Op.EQ, 2.5)));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("qty", FilterCondition.Op.EQ, "two")));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("vegan", FilterCondition.Op.GT, true)));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("name", FilterCondition.Op.EQ, 5)));
        assertThrows(IllegalArgumentException.class, () -> matching(FilterCondition.of("created_at", FilterCondition.Op.EQ, "yesterday")));
    }

    @Test
    void unprojectedFieldsAreUnfilterable() {
        UnfilterableFieldException e = assertThrows(UnfilterableFieldException.class,
                () -> matching(FilterCondition.of("meta", FilterCondition.Op.EQ, "x")));
        assertEquals("meta", e.field());
        assertThrows(UnfilterableFieldException.class, () -> matching(FilterCondition.of("tags", FilterCondition.Op.EQ, "x")));
        assertThrows(UnfilterableFieldException.class, () -> matching(FilterCondition.of("meta.chef", FilterCondition.Op.EQ, "x")));
        assertThrows(UnfilterableFieldException.class, () -> matching(FilterCondition.of("nope", FilterCondition.Op.EQ, "x")));
        // deprecated column
        assertThrows(UnfilterableFieldException.class, () -> matching(FilterCondition.of("old", FilterCondition.Op.EQ, "x")));
    }

    @Test
    void comparatorOrdersNullsFirstAndBreaksTiesById() {
        List<Row> rows = rows();
        Comparator<Row> asc = compiler.comparator(def(), layout(), "price", SortOrder.ASC);
        rows.sort(asc);
        assertEquals(List.of(3L, 1L, 4L, 2L), ids(rows));

        rows.sort(compiler.comparator(def(), layout(), "price", SortOrder.DESC));
        assertEquals(List.of(2L, 4L, 1L, 3L), ids(rows));

        rows.sort(compiler.comparator(def(), layout(), "vegan", SortOrder.ASC));
        assertEquals(List.of(3L, 2L, 1L, 4L), ids(rows));

        rows.sort(compiler.comparator(def(), layout(), null, SortOrder.DESC));
        assertEquals(List.of(4L, 3L, 2L, 1L), ids(rows));
    }

    private static List<Long> ids(List<Row> rows) {
        List<Long> out = new ArrayList<>();
        for (Row r : rows) out.add((Long) r.value(0));
        return out;
    }
}
