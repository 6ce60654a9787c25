package space.sparkradar.merge;

import space.sparkradar.alerts.Alert;
import space.sparkradar.alerts.AlertNormalizer;
import space.sparkradar.condition.Condition;
import space.sparkradar.condition.ConditionClassifier;
import space.sparkradar.diagnostics.Diagnostics;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.source.NwsDocument;
import space.sparkradar.source.OwmDocument;
import space.sparkradar.spc.MesoscaleDiscussion;
import space.sparkradar.spc.MesoscaleFilter;
import space.sparkradar.spc.RiskRecord;
import space.sparkradar.spc.RiskResolver;
import space.sparkradar.units.IsoTime;
import space.sparkradar.units.Units;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Builds a {@link NormalizedForecast} from the OpenWeatherMap model document,
 * the NWS MapClick document, the NWS alert feed and the SPC feeds.
 *
 * <p>
 * NWS is the primary source wherever it has a value; the model fills in field
 * by field. The daily forecast follows the model's calendar days and overlays
 * NWS day/night segments through {@link DailySegmentCursor}.
 * </p>
 *
 * <p>
 * Pure apart from the injected clock (risk dates and mesoscale expiry). Each
 * section is isolated: a failure is reported to {@link Diagnostics} and that
 * section comes back empty.
 * </p>
 */
public final class ForecastMerger {
    static final String DEFAULT_RADAR = "international";

    private final Clock clock;
    private final Diagnostics diagnostics;

    public ForecastMerger(Clock clock, Diagnostics diagnostics) {
        this.clock = clock;
        this.diagnostics = diagnostics;
    }

    public NormalizedForecast merge(GeoPoint point, UpstreamDocuments docs) {
        OwmDocument owm = OwmDocument.of(docs.owm());
        NwsDocument nws = NwsDocument.of(docs.nws());

        List<RiskRecord> spc = section("spc",
                () -> RiskResolver.resolve(docs.outlooks(), point, LocalDate.now(clock)), List.of());
        List<MesoscaleDiscussion> mcds = section(MesoscaleFilter.SECTION,
                () -> MesoscaleFilter.filter(docs.mesoscale(), point, clock.instant(), diagnostics), List.of());
        List<Alert> alerts = section("alerts", () -> AlertNormalizer.normalize(docs.alerts(), diagnostics),
                List.of());
        List<NormalizedForecast.Minutely> minutely = section("minutely", () -> minutely(owm), List.of());
        List<NormalizedForecast.Hourly> hourly = section("hourly", () -> hourly(owm), List.of());
        List<NormalizedForecast.Daily> daily = section("daily", () -> daily(owm, nws), List.of());
        NormalizedForecast.Location location = section("location", () -> location(owm, nws), null);
        NormalizedForecast.Current current = section("current", () -> current(owm, nws), null);

        return new NormalizedForecast(
                location,
                current,
                alerts,
                mcds,
                new NormalizedForecast.Forecasts(spc, minutely, hourly, daily));
    }

    private <T> T section(String name, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            diagnostics.sectionFailed(name, e);
            return fallback;
        }
    }

    // ----------------------------
    // location + current
    // ----------------------------
    static NormalizedForecast.Location location(OwmDocument owm, NwsDocument nws) {
        OwmDocument.Current c = owm.current();
        String radar = nws.radar();
        return new NormalizedForecast.Location(
                nws.wfo(),
                radar != null ? radar : DEFAULT_RADAR,
                IsoTime.epochSecondsNonZero(c.sunrise()),
                IsoTime.epochSecondsNonZero(c.sunset()));
    }

    static NormalizedForecast.Current current(OwmDocument owm, NwsDocument nws) {
        OwmDocument.Current model = owm.current();
        NwsDocument.Observation obs = nws.observation();

        Double temperature = firstNonNull(
                Units.round(Units.fahrenheitToKelvin(obs.tempF()), 2),
                Units.validKelvin(model.temp()));
        Double dewPoint = firstNonNull(
                Units.round(Units.fahrenheitToKelvin(obs.dewPointF()), 2),
                Units.validKelvin(model.dewPoint()));
        Double windSpeed = firstNonNull(
                Units.mphToMetersPerSecond(obs.windMph()),
                Units.finite(model.windSpeed()));
        Double windGust = firstNonNull(
                Units.mphToMetersPerSecond(obs.gustMph()),
                Units.finite(model.windGust()));
        Integer windDirection = firstNonNull(obs.windDeg(), model.windDeg());
        Double modelVisibilityKm = model.visibilityMeters() == null ? null : model.visibilityMeters() / 1000.0;
        Double visibility = firstNonNull(
                Units.milesToKilometers(obs.visibilityMi()),
                Units.validNonZero(modelVisibilityKm));
        Double pressure = firstNonNull(
                Units.round(Units.inHgToHectopascal(obs.seaLevelPressureInHg()), 2),
                Units.validNonZero(model.pressureHpa()));

        return new NormalizedForecast.Current(
                temperature,
                dewPoint,
                model.humidity(),
                windSpeed,
                windGust,
                windDirection,
                ConditionClassifier.classifyOrUnknown(obs.weather(), model.description()),
                model.clouds(),
                visibility,
                pressure);
    }

    // ----------------------------
    // minutely + hourly
    // ----------------------------
    static List<NormalizedForecast.Minutely> minutely(OwmDocument owm) {
        List<NormalizedForecast.Minutely> out = new ArrayList<>();
        for (OwmDocument.Minute m : owm.minutely()) {
            Double precip = m.precipitation();
            out.add(new NormalizedForecast.Minutely(
                    IsoTime.epochSeconds(m.dt()),
                    precip == null ? 0.0 : precip));
        }
        return out;
    }

    static List<NormalizedForecast.Hourly> hourly(OwmDocument owm) {
        List<NormalizedForecast.Hourly> out = new ArrayList<>();
        for (OwmDocument.Hour h : owm.hourly()) {
            String desc = h.description();
            Condition condition = ConditionClassifier.classify(desc);
            Double pop = h.pop();
            out.add(new NormalizedForecast.Hourly(
                    IsoTime.epochSeconds(h.dt()),
                    Units.finite(h.temp()),
                    Units.finite(h.feelsLike()),
                    h.humidity(),
                    Units.finite(h.windSpeed()),
                    h.windDeg(),
                    condition != null ? condition : Condition.unknown(desc),
                    h.clouds(),
                    pop == null ? 0 : (int) Math.round(pop * 100.0)));
        }
        return out;
    }

    // ----------------------------
    // daily
    // ----------------------------
    List<NormalizedForecast.Daily> daily(OwmDocument owm, NwsDocument nws) {
        List<NormalizedForecast.Daily> out = new ArrayList<>();
        DailySegmentCursor cursor = new DailySegmentCursor(nws);
        int dayNumber = 0;
        for (OwmDocument.Day day : owm.daily()) {
            DailySegmentCursor.Segment segment = cursor.next();
            try {
                out.add(day(day, nws, segment));
            } catch (RuntimeException e) {
                diagnostics.itemSkipped("daily", "day " + dayNumber, e);
            }
            dayNumber++;
        }
        return out;
    }

    static NormalizedForecast.Daily day(OwmDocument.Day day, NwsDocument nws, DailySegmentCursor.Segment seg) {
        String modelDesc = day.description();
        Double modelHigh = Units.validKelvin(day.tempMax());
        Double modelLow = Units.validKelvin(day.tempMin());

        Condition dayCondition;
        Double high;
        Integer dayPop = null;
        if (seg.hasDay()) {
            Condition fromNws = ConditionClassifier.classify(nws.weather(seg.dayIndex()));
            dayCondition = fromNws != null ? fromNws : modelCondition(modelDesc);
            high = firstNonNull(Units.fahrenheitToKelvin(nws.temperatureF(seg.dayIndex())), modelHigh);
            dayPop = nws.pop(seg.dayIndex());
        } else {
            dayCondition = modelCondition(modelDesc);
            high = modelHigh;
        }

        Condition nightCondition;
        Double low;
        Integer nightPop = null;
        if (seg.hasNight()) {
            String nightText = nws.weather(seg.nightIndex());
            Condition fromNws = ConditionClassifier.classify(nightText);
            nightCondition = fromNws != null ? fromNws : Condition.unknown(nightText);
            low = firstNonNull(Units.fahrenheitToKelvin(nws.temperatureF(seg.nightIndex())), modelLow);
            nightPop = nws.pop(seg.nightIndex());
        } else {
            nightCondition = Condition.unknown(null);
            low = modelLow;
        }

        String description = null;
        if (seg.hasDay())
            description = nws.text(seg.dayIndex());
        else if (seg.hasNight())
            description = nws.text(seg.nightIndex());

        return new NormalizedForecast.Daily(
                IsoTime.utcDate(day.dt()),
                dayCondition,
                IsoTime.epochSeconds(day.sunrise()),
                IsoTime.epochSeconds(day.sunset()),
                high,
                low,
                dayPop,
                Units.finite(day.windSpeed()),
                day.windDeg(),
                description,
                new NormalizedForecast.Night(nightCondition, nightPop));
    }

    private static Condition modelCondition(String modelDesc) {
        Condition c = ConditionClassifier.classify(modelDesc);
        return c != null ? c : Condition.unknown(modelDesc);
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
