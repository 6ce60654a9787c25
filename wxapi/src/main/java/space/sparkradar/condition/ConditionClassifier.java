package space.sparkradar.condition;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Maps free-text weather descriptions from either upstream ("Chance Rain
 * Showers", "light snow", "Partly Sunny", "overcast clouds") onto a
 * {@link Condition}.
 *
 * <p>
 * Matching is case-insensitive substring search over {@link #RULES}, tried in
 * order. The first rule whose trigger matches decides the result on its own:
 * if its sub-match fails (e.g. "showers" with neither "rain" nor "snow") the
 * text is unclassified and later rules are not consulted.
 * </p>
 */
public final class ConditionClassifier {

    /**
     * One step of the cascade: a trigger on the lower-cased text and the
     * classification it owns. {@code classify} may return null.
     */
    record Rule(String name, Predicate<String> trigger, Function<String, Condition> classify) {
    }

    static final List<Rule> RULES = List.of(
            new Rule("shower", t -> t.contains("shower"), ConditionClassifier::showers),
            new Rule("rain", t -> t.contains("rain"),
                    t -> byIntensity(t, "Light Rain", 611, "Heavy Rain", 613, "Rain", 612)),
            new Rule("snow", t -> t.contains("snow"),
                    t -> byIntensity(t, "Light Snow", 621, "Heavy Snow", 623, "Snow", 622)),
            new Rule("storm", t -> t.contains("storm") || t.contains("thunder"),
                    t -> byIntensity(t, "Light Storm", 631, "Heavy Storm", 633, "Storm", 632)),
            new Rule("fog", t -> t.contains("fog") || t.contains("mist"), t -> Condition.of("Fog", 800)),
            new Rule("haze", t -> t.contains("haze") || t.contains("hazy"), t -> Condition.of("Haze", 700)),
            new Rule("cloud", t -> t.contains("cloud"), ConditionClassifier::clouds),
            new Rule("clear", t -> t.contains("clear") || t.contains("sun") || t.contains("fair"),
                    ConditionClassifier::clear));

    /**
     * Utility class; do not instantiate.
     */
    private ConditionClassifier() {
    }

    /**
     * Classifies text, or returns null for null/empty or unrecognized text.
     */
    public static Condition classify(String text) {
        if (text == null || text.isEmpty())
            return null;
        String t = text.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.trigger().test(t)) {
                return rule.classify().apply(t);
            }
        }
        return null;
    }

    /**
     * Tries each text in turn and falls back to {@link Condition#unknown}
     * carrying the first non-empty text offered.
     */
    public static Condition classifyOrUnknown(String... candidates) {
        String firstRaw = null;
        for (String c : candidates) {
            Condition parsed = classify(c);
            if (parsed != null)
                return parsed;
            if (firstRaw == null && c != null && !c.isEmpty())
                firstRaw = c;
        }
        return Condition.unknown(firstRaw);
    }

    private static Condition showers(String t) {
        boolean rain = t.contains("rain");
        boolean snow = t.contains("snow");
        if (t.contains("light")) {
            if (rain)
                return Condition.of("Light Rain Showers", 612);
            if (snow)
                return Condition.of("Light Snow Showers", 611);
        } else if (t.contains("heavy")) {
            if (rain)
                return Condition.of("Heavy Rain Showers", 632);
            if (snow)
                return Condition.of("Heavy Snow Showers", 631);
        } else {
            if (rain)
                return Condition.of("Rain Showers", 622);
            if (snow)
                return Condition.of("Snow Showers", 621);
        }
        return null;
    }

    private static Condition byIntensity(String t,
            String lightName, int lightCode,
            String heavyName, int heavyCode,
            String moderateName, int moderateCode) {
        if (t.contains("light"))
            return Condition.of(lightName, lightCode);
        if (t.contains("heavy"))
            return Condition.of(heavyName, heavyCode);
        return Condition.of(moderateName, moderateCode);
    }

    private static Condition clouds(String t) {
        if (t.contains("mostly"))
            return Condition.of("Mostly Cloudy", 540);
        if (t.contains("partly") || t.contains("broken"))
            return Condition.of("Partly Cloudy", 330);
        return Condition.of("Cloudy", 500);
    }

    private static Condition clear(String t) {
        if (t.contains("mostly"))
            return Condition.of("Mostly Clear", 240);
        if (t.contains("partly"))
            return Condition.of("Partly Cloudy", 330);
        return Condition.of("Clear", 100);
    }
}
