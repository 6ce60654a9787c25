package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest SPC documents in memory and mirrors them to disk so a
 * restart can serve the last known outlooks before the first refresh lands.
 *
 * <p>
 * Each document is stored as {@code {"updated": ISO, "data": <document>}} in
 * {@code day1.json}..{@code day3.json} and {@code mcd.json}. Readers always get
 * a complete {@link SpcSnapshot}; writers swap the whole snapshot.
 * </p>
 */
public final class SpcOutlookCache {
    private static final Logger log = LoggerFactory.getLogger(SpcOutlookCache.class);

    static final String MESOSCALE_FILE = "mcd.json";

    private final Path dir;
    private final ObjectMapper om;
    private final AtomicReference<SpcSnapshot> current = new AtomicReference<>(SpcSnapshot.empty());

    public SpcOutlookCache(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om;
    }

    public SpcSnapshot snapshot() {
        return current.get();
    }

    void replace(SpcSnapshot next) {
        current.set(next);
    }

    static String outlookFile(int dayIndex) {
        return "day" + (dayIndex + 1) + ".json";
    }

    /**
     * Seeds the in-memory snapshot from the cache directory. Missing or
     * unreadable files are skipped.
     */
    public void loadFromDisk() {
        SpcSnapshot snap = SpcSnapshot.empty();
        Instant newest = null;
        for (int i = 0; i < SpcClient.OUTLOOK_DAYS; i++) {
            Stored stored = read(dir.resolve(outlookFile(i)));
            if (stored != null) {
                snap = snap.withOutlook(i, stored.data());
                newest = newer(newest, stored.updated());
            }
        }
        Stored mcd = read(dir.resolve(MESOSCALE_FILE));
        if (mcd != null) {
            snap = snap.withMesoscale(mcd.data());
            newest = newer(newest, mcd.updated());
        }
        current.set(snap.withUpdatedAt(newest));
        log.info("Loaded SPC cache from {} (outlook days={}, mesoscale={})", dir,
                snap.availableOutlooks().size(), mcd != null);
    }

    void persistOutlook(int dayIndex, JsonNode doc, Instant updated) throws IOException {
        write(dir.resolve(outlookFile(dayIndex)), doc, updated);
    }

    void persistMesoscale(JsonNode doc, Instant updated) throws IOException {
        write(dir.resolve(MESOSCALE_FILE), doc, updated);
    }

    private void write(Path file, JsonNode doc, Instant updated) throws IOException {
        Files.createDirectories(dir);
        ObjectNode wrapper = om.createObjectNode();
        wrapper.put("updated", updated.toString());
        wrapper.set("data", doc);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, om.writeValueAsBytes(wrapper));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Stored read(Path file) {
        if (!Files.exists(file))
            return null;
        try {
            JsonNode wrapper = om.readTree(file.toFile());
            JsonNode data = wrapper.get("data");
            if (data == null || data.isNull()) {
                log.warn("SPC cache file {} has no data, skipping", file);
                return null;
            }
            return new Stored(parseInstant(wrapper.path("updated").asText(null)), data);
        } catch (IOException e) {
            log.warn("Unable to read SPC cache file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static Instant parseInstant(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant newer(Instant a, Instant b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return b.isAfter(a) ? b : a;
    }

    private record Stored(Instant updated, JsonNode data) {
    }
}
