package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.diagnostics.Diagnostics;
import space.sparkradar.geo.GeoJsonGeometry;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.units.IsoTime;
import space.sparkradar.units.SafeParse;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps the mesoscale discussions that cover the query point and have not
 * expired.
 *
 * <p>
 * Feed features carry {@code folderpath} ("MD 0045 Active Till 2345 UTC"),
 * {@code idp_filedate} (issue time, epoch millis or ISO text), {@code name}
 * ("MD 0045") and {@code popupinfo} (product URL). The feed gives expiry as a
 * bare HHMM, so the expiry instant is that offset from UTC midnight of the date of
 * issue. A discussion with no readable expiry is kept.
 * </p>
 */
public final class MesoscaleFilter {
    public static final String SECTION = "mesoscale_discussions";

    private static final String TILL = "Till";
    private static final Pattern HHMM = Pattern.compile("^(\\d{2})(\\d{2})$");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\s*(\\d+)");

    /**
     * Utility class; do not instantiate.
     */
    private MesoscaleFilter() {
    }

    /**
     * Filters a feature collection. Any failure empties the whole result.
     */
    public static List<MesoscaleDiscussion> filter(JsonNode feed, GeoPoint point, Instant now,
            Diagnostics diagnostics) {
        try {
            return filterUnchecked(feed, point, now);
        } catch (RuntimeException e) {
            diagnostics.sectionFailed(SECTION, e);
            return new ArrayList<>();
        }
    }

    static List<MesoscaleDiscussion> filterUnchecked(JsonNode feed, GeoPoint point, Instant now) {
        List<MesoscaleDiscussion> out = new ArrayList<>();
        JsonNode features = feed == null ? null : feed.path("features");
        if (features == null || !features.isArray())
            return out;

        for (JsonNode feature : features) {
            JsonNode geometry = feature.get("geometry");
            if (geometry == null || geometry.isNull())
                continue;

            JsonNode props = feature.path("properties");
            String folder = SafeParse.text(props.path("folderpath"));
            String name = SafeParse.text(props.path("name"));
            Instant issued = issuedAt(props.path("idp_filedate"));
            Instant expires = expiry(folder, issued);

            if (!GeoJsonGeometry.contains(geometry, point))
                continue;
            if (expires != null && now.isAfter(expires))
                continue;

            out.add(new MesoscaleDiscussion(
                    geometry.deepCopy(),
                    number(name),
                    IsoTime.instant(issued),
                    IsoTime.instant(expires),
                    SafeParse.text(props.path("popupinfo")),
                    folder != null ? folder : name));
        }
        return out;
    }

    /**
     * Expiry instant from a folder path and the issue time, or null when either
     * is missing or the token after "Till" is not four digits.
     */
    static Instant expiry(String folderPath, Instant issued) {
        if (folderPath == null || issued == null)
            return null;
        int at = folderPath.indexOf(TILL);
        if (at < 0)
            return null;

        String token = folderPath.substring(at + TILL.length()).replace("UTC", "").trim();
        Matcher m = HHMM.matcher(token);
        if (!m.matches())
            return null;
        int hh = Integer.parseInt(m.group(1));
        int mm = Integer.parseInt(m.group(2));

        // "2400" and the like roll over into the next day
        LocalDate day = LocalDate.ofInstant(issued, ZoneOffset.UTC);
        return day.atStartOfDay(ZoneOffset.UTC).plusHours(hh).plusMinutes(mm).toInstant();
    }

    /**
     * Issue time from epoch millis (number or numeric text) or ISO-8601 text.
     */
    static Instant issuedAt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        if (node.isNumber())
            return Instant.ofEpochMilli(node.asLong());

        String s = SafeParse.text(node);
        if (s == null)
            return null;
        Long millis = SafeParse.toLong(node);
        if (millis != null)
            return Instant.ofEpochMilli(millis);
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * Discussion number from a name like "MD 0045".
     */
    static Integer number(String name) {
        if (name == null)
            return null;
        Matcher m = LEADING_DIGITS.matcher(name.replace("MD ", ""));
        if (!m.find())
            return null;
        try {
            int n = Integer.parseInt(m.group(1));
            return n == 0 ? null : n;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
