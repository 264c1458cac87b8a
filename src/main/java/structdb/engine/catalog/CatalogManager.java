package structdb.engine.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.SerializedName;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import structdb.engine.error.StorageException;

/**
 * Persistent catalog: structure rows, table layouts and migration history in
 * one JSON file. Every change writes a complete new snapshot to a temp file and
 * moves it over the old one, so a structure row and its table layout always
 * change together or not at all. Readers see an immutable snapshot.
 */
public class CatalogManager {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogManager.class);

    /** Registry row as persisted: {name, schema_json, version, created_at, updated_at}. */
    public record StructureRow(String name,
                               @SerializedName("schema_json") String schemaJson,
                               int version,
                               @SerializedName("created_at") Instant createdAt,
                               @SerializedName("updated_at") Instant updatedAt) {}

    // Persisted snapshot; maps are sorted by structure name
    record CatalogFile(Map<String, StructureRow> structures,
                       Map<String, TableSchema> tables,
                       Map<String, List<MigrationEntry>> migrations) {
        static CatalogFile empty() {
            return new CatalogFile(Map.of(), Map.of(), Map.of());
        }

        CatalogFile normalized() {
            return new CatalogFile(
                    Collections.unmodifiableMap(new TreeMap<>(structures == null ? Map.of() : structures)),
                    Collections.unmodifiableMap(new TreeMap<>(tables == null ? Map.of() : tables)),
                    Collections.unmodifiableMap(new TreeMap<>(migrations == null ? Map.of() : migrations)));
        }
    }

    private final Path catalogFile; // null keeps the catalog in memory only
    private final Gson gson;
    private volatile CatalogFile state = CatalogFile.empty();

    public CatalogManager(Path catalogFile) {
        this.catalogFile = catalogFile;
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
                .setPrettyPrinting()
                .create();
        loadCatalog();
    }

    public StructureRow getStructure(String name) { return state.structures().get(name); }

    public Map<String, StructureRow> allStructures() { return state.structures(); }

    public TableSchema getTableSchema(String name) { return state.tables().get(name); }

    public Map<String, TableSchema> allTables() { return state.tables(); }

    public List<MigrationEntry> history(String name) {
        return state.migrations().getOrDefault(name, List.of());
    }

    /**
     * Atomically installs a structure row, its table layout and (optionally) one
     * more migration history entry. Nothing changes if the snapshot can not be written.
     */
    public synchronized void commit(String name, StructureRow structure, TableSchema table, MigrationEntry migration) {
        CatalogFile current = state;
        Map<String, StructureRow> structures = new TreeMap<>(current.structures());
        Map<String, TableSchema> tables = new TreeMap<>(current.tables());
        Map<String, List<MigrationEntry>> migrations = new TreeMap<>(current.migrations());
        if (structure != null) structures.put(name, structure);
        if (table != null) tables.put(name, table);
        if (migration != null) {
            List<MigrationEntry> entries = new ArrayList<>(migrations.getOrDefault(name, List.of()));
            entries.add(migration);
            migrations.put(name, List.copyOf(entries));
        }
        CatalogFile next = new CatalogFile(structures, tables, migrations).normalized();
        persist(next);
        state = next;
    }

    /** Atomically removes every catalog entry of a structure. */
    public synchronized void remove(String name) {
        CatalogFile current = state;
        Map<String, StructureRow> structures = new TreeMap<>(current.structures());
        Map<String, TableSchema> tables = new TreeMap<>(current.tables());
        Map<String, List<MigrationEntry>> migrations = new TreeMap<>(current.migrations());
        structures.remove(name);
        tables.remove(name);
        migrations.remove(name);
        CatalogFile next = new CatalogFile(structures, tables, migrations).normalized();
        persist(next);
        state = next;
    }

    /** Write the snapshot durably before it becomes visible. */
    protected void persist(CatalogFile snapshot) {
        if (catalogFile == null) return;
        Path tmp = catalogFile.resolveSibling(catalogFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(catalogFile.getParent());
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(snapshot, writer);
            }
            try {
                Files.move(tmp, catalogFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, catalogFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed saving catalog file: " + catalogFile, e);
        }
    }

    private void loadCatalog() {
        if (catalogFile == null || !Files.exists(catalogFile)) return;
        try (Reader reader = Files.newBufferedReader(catalogFile, StandardCharsets.UTF_8)) {
            CatalogFile loaded = gson.fromJson(reader, CatalogFile.class);
            if (loaded != null) {
                state = loaded.normalized();
            }
            LOG.info("Loaded catalog {} with {} structure(s)", catalogFile, state.structures().size());
        } catch (IOException | JsonParseException e) {
            LOG.error("Failed loading catalog file {}", catalogFile, e);
            throw new StorageException("Failed loading catalog file: " + catalogFile, e);
        }
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            return Instant.parse(in.nextString());
        }
    }
}
