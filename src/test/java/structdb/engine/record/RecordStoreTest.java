package structdb.engine.record;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import structdb.engine.EngineConfig;
import structdb.engine.StructureStore;
import structdb.engine.catalog.TestCatalogManager;
import structdb.engine.error.NotFoundException;
import structdb.engine.error.UnfilterableFieldException;
import structdb.engine.error.ValidationException;
import structdb.engine.notify.ChangeEvent;
import structdb.engine.notify.ChangeKind;
import structdb.engine.notify.Subscription;
import structdb.engine.query.FilterCondition;
import structdb.engine.query.ListQuery;
import structdb.engine.query.SortOrder;

public class RecordStoreTest {
    private static final String MENU = """
        {"type":"object",
         "properties":{
           "label":{"type":"string","maxLength":40},
           "url":{"type":"string"},
           "active":{"type":"boolean","default":true},
           "order":{"type":"integer"},
           "meta":{"type":"object","properties":{"icon":{"type":"string"}}},
           "children":{"type":"array","items":{"$ref":"#"}}},
         "required":["label"]}
        """;

    @TempDir
    Path dir;

    private StructureStore store;
    private RecordStore records;

    @BeforeEach
    void setUp() {
        store = StructureStore.open(EngineConfig.defaultConfig(dir), new TestCatalogManager());
        store.registry().define("menu", MENU);
        records = store.records();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static JsonObject json(String s) {
        return JsonParser.parseString(s).getAsJsonObject();
    }

    private static List<Long> ids(List<StoredRecord> recs) {
        List<Long> out = new ArrayList<>();
        for (StoredRecord r : recs) out.add(r.id());
        return out;
    }

    private List<ChangeEvent> drain(Subscription sub) throws InterruptedException {
        List<ChangeEvent> out = new ArrayList<>();
        ChangeEvent e;
        while ((e = sub.poll(Duration.ZERO)) != null) out.add(e);
        return out;
    }

    @Test
    void menuLifecycle() throws Exception {
        Subscription sub = store.notifier().subscribe("menu");

        StoredRecord home = records.create("menu", json("{\"label\":\"Home\",\"url\":\"/\"}"));
        assertEquals(1, home.id());
        assertNull(home.parentId());
        JsonObject homeJson = home.toJson();
        assertEquals("Home", homeJson.get("label").getAsString());
        assertEquals("/", homeJson.get("url").getAsString());
        assertTrue(homeJson.get("parent_id").isJsonNull());
        assertTrue(home.document().get("active").getAsBoolean());

        StoredRecord child = records.create("menu", json("{\"label\":\"Child\",\"url\":\"/c\",\"parent_id\":1}"));
        assertEquals(2, child.id());
        assertEquals(1L, child.parentId());
        assertFalse(child.document().has("parent_id"));

        assertEquals(List.of(2L, 1L), records.delete("menu", 1));
        assertThrows(NotFoundException.class, () -> records.get("menu", 1));
        assertThrows(NotFoundException.class, () -> records.get("menu", 2));

        List<ChangeEvent> events = drain(sub);
        assertEquals(4, events.size());
        assertEquals(ChangeKind.CREATED, events.get(0).kind());
        assertEquals(ChangeKind.CREATED, events.get(1).kind());
        assertEquals(ChangeKind.DELETED, events.get(2).kind());
        assertEquals(2, events.get(2).recordId());
        assertEquals(ChangeKind.DELETED, events.get(3).kind());
        assertEquals(1, events.get(3).recordId());
        assertEquals("Home", events.get(3).payload().get("label").getAsString());
    }

    @Test
    void deleteRemovesDescendantsBeforeParents() throws Exception {
        long root = records.create("menu", json("{\"label\":\"r\"}")).id();
        long a = records.create("menu", root, json("{\"label\":\"a\"}")).id();
        long b = records.create("menu", root, json("{\"label\":\"b\"}")).id();
        long a1 = records.create("menu", a, json("{\"label\":\"a1\"}")).id();
        long other = records.create("menu", json("{\"label\":\"other\"}")).id();
        Subscription sub = store.notifier().subscribe("menu");

        List<Long> removed = records.delete("menu", root);
        assertEquals(4, removed.size());
        assertTrue(removed.indexOf(a1) < removed.indexOf(a));
        assertTrue(removed.indexOf(a) < removed.indexOf(root));
        assertTrue(removed.indexOf(b) < removed.indexOf(root));
        assertEquals(root, removed.get(3));

        List<ChangeEvent> events = drain(sub);
        assertEquals(4, events.size());
        for (int i = 0; i < 4; i++) {
            assertEquals(ChangeKind.DELETED, events.get(i).kind());
            assertEquals(removed.get(i), events.get(i).recordId());
        }
        assertEquals(other, records.get("menu", other).id());
        assertEquals(1, records.count("menu", List.of()));
    }

    @Test
    void rejectedDocumentsAreNotStored() throws Exception {
        Subscription sub = store.notifier().subscribe("menu");
        ValidationException e = assertThrows(ValidationException.class, () -> records.create("menu", json("{}")));
        assertTrue(e.hasViolation("label", "required"));
        assertThrows(ValidationException.class, () -> records.create("menu", json("{\"label\":\"x\",\"id\":5}")));
        assertThrows(ValidationException.class, () -> records.create("menu", json("{\"label\":\"x\",\"parent_id\":\"one\"}")));
        assertThrows(NotFoundException.class, () -> records.create("menu", json("{\"label\":\"x\",\"parent_id\":42}")));
        assertEquals(0, records.count("menu", List.of()));
        assertTrue(drain(sub).isEmpty());
        assertEquals(1, records.create("menu", json("{\"label\":\"first\"}")).id());
    }

    @Test
    void explicitParentArgumentWinsOverDocumentKey() {
        long a = records.create("menu", json("{\"label\":\"a\"}")).id();
        long b = records.create("menu", json("{\"label\":\"b\"}")).id();
        StoredRecord c = records.create("menu", b, json("{\"label\":\"c\",\"parent_id\":" + a + "}"));
        assertEquals(b, c.parentId());
    }

    @Test
    void unknownStructureIsNotFound() {
        assertThrows(NotFoundException.class, () -> records.create("nope", json("{}")));
        assertThrows(NotFoundException.class, () -> records.list("nope", ListQuery.all()));
        assertThrows(NotFoundException.class, () -> records.get("menu", 99));
    }

    @Test
    void updateMergesTopLevelFields() throws Exception {
        StoredRecord created = records.create("menu", json("{\"label\":\"Home\",\"url\":\"/\",\"order\":1}"));
        Subscription sub = store.notifier().subscribe("menu");

        StoredRecord updated = records.update("menu", created.id(), json("{\"url\":null,\"order\":2,\"id\":1}"));
        assertEquals("Home", updated.document().get("label").getAsString());
        assertFalse(updated.document().has("url"));
        assertEquals(2, updated.document().get("order").getAsLong());
        assertEquals(created.createdAt(), updated.createdAt());
        assertFalse(updated.updatedAt().isBefore(created.updatedAt()));

        StoredRecord fetched = records.get("menu", created.id());
        assertEquals(updated.document(), fetched.document());
        assertEquals(List.of(1L), ids(records.list("menu", ListQuery.all().where("order", FilterCondition.Op.EQ, 2))));

        List<ChangeEvent> events = drain(sub);
        assertEquals(1, events.size());
        assertEquals(ChangeKind.UPDATED, events.get(0).kind());

        assertThrows(ValidationException.class, () -> records.update("menu", 1, json("{\"id\":2}")));
        assertThrows(ValidationException.class, () -> records.update("menu", 1, json("{\"label\":null}")));
        assertThrows(NotFoundException.class, () -> records.update("menu", 7, json("{\"order\":1}")));
        assertEquals(2, records.get("menu", 1).document().get("order").getAsLong());
    }

    @Test
    void fieldAddedWithDefaultOnlyAppliesToNewWrites() {
        long before = records.create("menu", json("{\"label\":\"old\"}")).id();
        store.registry().update("menu", MENU.replace("\"order\":{\"type\":\"integer\"}",
                "\"order\":{\"type\":\"integer\"},\"color\":{\"type\":\"string\",\"default\":\"blue\"}"));

        StoredRecord red = records.create("menu", json("{\"label\":\"new\",\"color\":\"red\"}"));
        assertEquals("red", records.get("menu", red.id()).document().get("color").getAsString());
        assertEquals("blue", records.create("menu", json("{\"label\":\"plain\"}")).document().get("color").getAsString());
        assertFalse(records.get("menu", before).document().has("color"));
        assertEquals(List.of(red.id()), ids(records.list("menu", ListQuery.all().where("color", FilterCondition.Op.EQ, "red"))));
        // the old row reads the appended column as null
        assertEquals(List.of(before), ids(records.list("menu", ListQuery.all().where("color", FilterCondition.Op.EQ, null))));

        StoredRecord touched = records.update("menu", before, json("{\"url\":\"/old\"}"));
        assertEquals("blue", touched.document().get("color").getAsString());
    }

    @Test
    void reparentingRejectsCycles() {
        long a = records.create("menu", json("{\"label\":\"a\"}")).id();
        long b = records.create("menu", a, json("{\"label\":\"b\"}")).id();
        long c = records.create("menu", b, json("{\"label\":\"c\"}")).id();

        ValidationException cycle = assertThrows(ValidationException.class,
                () -> records.update("menu", a, json("{\"parent_id\":" + c + "}")));
        assertTrue(cycle.hasViolation("parent_id", "parent_cycle"));
        ValidationException self = assertThrows(ValidationException.class,
                () -> records.update("menu", a, json("{\"parent_id\":" + a + "}")));
        assertTrue(self.hasViolation("parent_id", "parent_cycle"));
        assertThrows(NotFoundException.class, () -> records.update("menu", a, json("{\"parent_id\":99}")));

        StoredRecord moved = records.update("menu", c, json("{\"parent_id\":" + a + "}"));
        assertEquals(a, moved.parentId());
        assertEquals(List.of(b, c), ids(records.children("menu", a)));
        assertTrue(records.children("menu", b).isEmpty());

        StoredRecord orphan = records.update("menu", b, json("{\"parent_id\":null}"));
        assertNull(orphan.parentId());
        assertEquals(List.of(c), ids(records.children("menu", a)));
    }

    @Test
    void listFiltersSortsAndPages() {
        for (int i = 1; i <= 6; i++) {
            records.create("menu", json("{\"label\":\"item" + i + "\",\"order\":" + (10 - i) + ",\"active\":" + (i % 2 == 0) + "}"));
        }
        records.create("menu", json("{\"label\":\"no order\"}"));

        // the last record takes the default active=true
        assertEquals(List.of(2L, 4L, 6L, 7L),
                ids(records.list("menu", ListQuery.all().where("active", FilterCondition.Op.EQ, true))));
        assertEquals(List.of(6L, 5L, 4L),
                ids(records.list("menu", ListQuery.all().sortedBy("order", SortOrder.ASC).where("order", FilterCondition.Op.LT, 7))));
        assertEquals(List.of(7L, 6L, 5L),
                ids(records.list("menu", ListQuery.all().sortedBy("order", SortOrder.ASC).withLimit(3))));
        assertEquals(List.of(2L, 3L),
                ids(records.list("menu", ListQuery.all().sortedBy("order", SortOrder.DESC).withOffset(1).withLimit(2))));
        assertEquals(7, records.list("menu", ListQuery.all().withLimit(0)).size());
        assertEquals(List.of(7L),
                ids(records.list("menu", ListQuery.all().where("label", FilterCondition.Op.CONTAINS, "ORDER"))));
        assertEquals(3, records.count("menu", List.of(FilterCondition.of("active", FilterCondition.Op.EQ, false))));

        UnfilterableFieldException e = assertThrows(UnfilterableFieldException.class,
                () -> records.list("menu", ListQuery.all().where("meta", FilterCondition.Op.EQ, "x")));
        assertEquals("meta", e.field());
        assertThrows(UnfilterableFieldException.class,
                () -> records.list("menu", ListQuery.all().sortedBy("children", SortOrder.ASC)));
    }

    @Test
    void cursorStreamsLazily() {
        for (int i = 1; i <= 5; i++) records.create("menu", json("{\"label\":\"n" + i + "\"}"));
        List<Long> seen = new ArrayList<>();
        try (RecordCursor cursor = records.cursor("menu", ListQuery.all().withLimit(0))) {
            while (cursor.hasNext()) seen.add(cursor.next().id());
            assertFalse(cursor.hasNext());
        }
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), seen);

        RecordCursor partial = records.cursor("menu", ListQuery.all());
        assertEquals(1, partial.next().id());
        partial.close();
        assertFalse(partial.hasNext());
        // an abandoned cursor holds no lock
        records.create("menu", json("{\"label\":\"after\"}"));
    }

    @Test
    void integerMaxLimitListsEverything() {
        for (int i = 1; i <= 3; i++) records.create("menu", json("{\"label\":\"n" + i + "\",\"order\":" + i + "}"));
        assertEquals(List.of(1L, 2L, 3L), ids(records.list("menu", ListQuery.all().withLimit(Integer.MAX_VALUE))));
        assertEquals(List.of(2L, 1L), ids(records.list("menu",
                ListQuery.all().sortedBy("order", SortOrder.DESC).withOffset(1).withLimit(Integer.MAX_VALUE))));
        assertEquals(List.of(1L, 2L), ids(records.list("menu",
                ListQuery.all().sortedBy("order", SortOrder.ASC).withLimit(500_000_000).where("order", FilterCondition.Op.LT, 3))));
    }

    @Test
    void rowsLargerThanAPageAreRejectedWithoutTakingAnId() {
        String big = "x".repeat(9000);
        ValidationException e = assertThrows(ValidationException.class,
                () -> records.create("menu", json("{\"label\":\"big\",\"url\":\"" + big + "\"}")));
        assertTrue(e.hasViolation("", "maxSize"));
        assertEquals(0, records.count("menu", List.of()));
        assertEquals(1, records.create("menu", json("{\"label\":\"small\"}")).id());

        assertThrows(ValidationException.class,
                () -> records.update("menu", 1, json("{\"url\":\"" + big + "\"}")));
        assertFalse(records.get("menu", 1).document().has("url"));

        String fits = "x".repeat(5000);
        assertEquals(2, records.create("menu", json("{\"label\":\"fits\",\"url\":\"" + fits + "\"}")).id());
        assertEquals(fits, records.get("menu", 2).document().get("url").getAsString());
    }

    @Test
    void idOrderedCursorReadsRowsAsItAdvances() {
        for (int i = 1; i <= 100; i++) records.create("menu", json("{\"label\":\"n" + i + "\"}"));
        List<Long> rest = new ArrayList<>();
        try (RecordCursor cursor = records.cursor("menu", ListQuery.all().withLimit(0))) {
            assertEquals(1, cursor.next().id());
            records.delete("menu", 2);
            records.delete("menu", 80);
            records.update("menu", 3, json("{\"label\":\"renamed\"}"));
            records.create("menu", json("{\"label\":\"late\"}"));

            StoredRecord third = cursor.next();
            assertEquals(3, third.id());
            assertEquals("renamed", third.document().get("label").getAsString());
            rest.add(third.id());
            while (cursor.hasNext()) rest.add(cursor.next().id());
        }
        assertEquals(98, rest.size());
        assertFalse(rest.contains(2L));
        assertFalse(rest.contains(80L));
        assertEquals(101L, rest.get(rest.size() - 1));
    }
}
