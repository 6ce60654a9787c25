package space.sparkradar.condition;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionClassifierTest {

    @Test
    void classifiesKnownPhrases() {
        assertEquals(Condition.of("Light Snow Showers", 611), ConditionClassifier.classify("Light Snow Showers"));
        assertEquals(Condition.of("Heavy Storm", 633), ConditionClassifier.classify("Heavy Thunderstorm"));
        assertEquals(Condition.of("Partly Cloudy", 330), ConditionClassifier.classify("partly sunny"));
        assertEquals(Condition.of("Mostly Cloudy", 540), ConditionClassifier.classify("Mostly Cloudy"));
        assertEquals(Condition.of("Cloudy", 500), ConditionClassifier.classify("overcast clouds"));
        assertEquals(Condition.of("Clear", 100), ConditionClassifier.classify("Fair"));
        assertEquals(Condition.of("Fog", 800), ConditionClassifier.classify("mist"));
        assertEquals(Condition.of("Haze", 700), ConditionClassifier.classify("Hazy"));
    }

    @Test
    void emptyTextIsNull() {
        assertNull(ConditionClassifier.classify(""));
        assertNull(ConditionClassifier.classify(null));
        assertNull(ConditionClassifier.classify("volcanic ash"));
    }

    @Test
    void showerWithoutPrecipTypeDoesNotFallThrough() {
        // "showers" owns the text even though "thunder" would match later
        assertNull(ConditionClassifier.classify("Showers And Thunderstorms"));
    }

    @Test
    void showerBeatsGenericRain() {
        assertEquals(Condition.of("Rain Showers", 622), ConditionClassifier.classify("Chance Rain Showers"));
        assertEquals(Condition.of("Heavy Rain Showers", 632), ConditionClassifier.classify("heavy rain showers"));
        assertEquals(Condition.of("Light Rain", 611), ConditionClassifier.classify("light rain"));
    }

    @Test
    void ruleOrderIsFixed() {
        List<String> names = ConditionClassifier.RULES.stream()
                .map(ConditionClassifier.Rule::name)
                .collect(Collectors.toList());
        assertEquals(List.of("shower", "rain", "snow", "storm", "fog", "haze", "cloud", "clear"), names);
    }

    @Test
    void unknownFallbackKeepsFirstText() {
        Condition c = ConditionClassifier.classifyOrUnknown(null, "Smoke", "Ash");
        assertTrue(c.isUnknown());
        assertEquals("Smoke", c.raw());
        assertEquals(Condition.of("Snow", 622), ConditionClassifier.classifyOrUnknown("Blowing Dust", "snow"));
        assertNull(ConditionClassifier.classifyOrUnknown().raw());
    }
}
