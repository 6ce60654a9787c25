package space.sparkradar.alerts;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.diagnostics.Diagnostics;
import space.sparkradar.units.SafeParse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns an api.weather.gov active-alerts feature collection into
 * {@link Alert}s.
 *
 * <p>
 * Outlook products ("Hazardous Weather Outlook", "Excessive Rainfall Outlook")
 * are dropped; outlook risk is reported through the SPC risk records instead.
 * Each feature is handled on its own: one bad feature is reported and skipped.
 * </p>
 */
public final class AlertNormalizer {
    static final String SECTION = "alerts";

    /**
     * Utility class; do not instantiate.
     */
    private AlertNormalizer() {
    }

    public static List<Alert> normalize(JsonNode alertFeed, Diagnostics diagnostics) {
        List<Alert> out = new ArrayList<>();
        JsonNode features = alertFeed == null ? null : alertFeed.path("features");
        if (features == null || !features.isArray())
            return out;

        int i = 0;
        for (JsonNode feature : features) {
            try {
                Alert alert = toAlert(feature);
                if (alert != null)
                    out.add(alert);
            } catch (RuntimeException e) {
                diagnostics.itemSkipped(SECTION, "#" + i, e);
            }
            i++;
        }
        return out;
    }

    /**
     * Builds one alert, or returns null for an outlook product.
     */
    static Alert toAlert(JsonNode feature) {
        JsonNode p = feature.path("properties");
        if (!p.isObject())
            throw new IllegalArgumentException("alert feature has no properties");

        String event = SafeParse.text(p.path("event"));
        if (isOutlook(event))
            return null;

        Alert.Timing timing = new Alert.Timing(
                SafeParse.text(p.path("id")),
                SafeParse.text(p.path("sent")),
                SafeParse.text(p.path("effective")),
                SafeParse.text(p.path("expires")),
                SafeParse.text(p.path("severity")));

        Alert.Product product = new Alert.Product(
                SafeParse.text(p.path("areaDesc")),
                event,
                AlertColors.colorFor(event),
                SafeParse.text(p.path("headline")),
                singleLine(SafeParse.text(p.path("description"))),
                singleLine(SafeParse.text(p.path("instruction"))));

        return new Alert(timing, product);
    }

    static boolean isOutlook(String event) {
        return event != null && event.toLowerCase(Locale.ROOT).contains("outlook");
    }

    /**
     * Collapses paragraph breaks, then joins the remaining lines with spaces.
     */
    static String singleLine(String text) {
        if (text == null)
            return null;
        return text.replace("\n\n", "\n").replace("\n", " ");
    }
}
