package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable view of the cached SPC documents handed to one merge.
 *
 * @param outlooks  day 1..3 outlooks in day order; a slot is null when that
 *                  day has never been fetched
 * @param mesoscale mesoscale discussion feature collection, or null
 * @param updatedAt time of the last successful refresh, or null
 */
public record SpcSnapshot(List<JsonNode> outlooks, JsonNode mesoscale, Instant updatedAt) {

    public SpcSnapshot {
        outlooks = Collections.unmodifiableList(new ArrayList<>(outlooks == null ? List.of() : outlooks));
    }

    public static SpcSnapshot empty() {
        return new SpcSnapshot(List.of(), null, null);
    }

    /**
     * Outlooks up to the last day that has a document, so a partially filled
     * cache still produces one risk record per fetched day.
     */
    public List<JsonNode> availableOutlooks() {
        int last = -1;
        for (int i = 0; i < outlooks.size(); i++) {
            if (outlooks.get(i) != null)
                last = i;
        }
        return outlooks.subList(0, last + 1);
    }

    /**
     * Returns a copy with one outlook day replaced.
     */
    SpcSnapshot withOutlook(int dayIndex, JsonNode doc) {
        List<JsonNode> next = new ArrayList<>(outlooks);
        while (next.size() <= dayIndex)
            next.add(null);
        next.set(dayIndex, doc);
        return new SpcSnapshot(next, mesoscale, updatedAt);
    }

    SpcSnapshot withMesoscale(JsonNode doc) {
        return new SpcSnapshot(outlooks, doc, updatedAt);
    }

    SpcSnapshot withUpdatedAt(Instant t) {
        return new SpcSnapshot(outlooks, mesoscale, t);
    }
}
