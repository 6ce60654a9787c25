package space.sparkradar.merge;

import space.sparkradar.source.NwsDocument;

/**
 * Walks the NWS flat forecast series alongside the model's calendar days.
 *
 * <p>
 * The NWS series is time-ordered half-day segments labelled "High" (daytime)
 * or "Low" (night), so it does not line up one-to-one with calendar days: a
 * series fetched in the evening starts with a lone "Low". Each call to
 * {@link #next()} consumes the slots belonging to one calendar day.
 * </p>
 */
final class DailySegmentCursor {

    enum State {
        /** Current slot is a daytime "High"; the next slot is its night. */
        AWAITING_DAY,
        /** Current slot is a lone night "Low". */
        AWAITING_NIGHT,
        /** No usable label at the current slot. */
        EXHAUSTED
    }

    /**
     * Slots for one calendar day; -1 where that half comes from the model.
     */
    record Segment(State state, int dayIndex, int nightIndex) {
        boolean hasDay() {
            return dayIndex >= 0;
        }

        boolean hasNight() {
            return nightIndex >= 0;
        }
    }

    private final NwsDocument nws;
    private int index;

    DailySegmentCursor(NwsDocument nws) {
        this.nws = nws;
    }

    State state() {
        String label = nws.tempLabel(index);
        if (NwsDocument.LABEL_HIGH.equals(label))
            return State.AWAITING_DAY;
        if (NwsDocument.LABEL_LOW.equals(label))
            return State.AWAITING_NIGHT;
        return State.EXHAUSTED;
    }

    int index() {
        return index;
    }

    /**
     * Returns the current day's slots and advances: by 2 for a day/night pair,
     * by 1 otherwise.
     */
    Segment next() {
        State state = state();
        int at = index;
        if (state == State.AWAITING_DAY) {
            index += 2;
            return new Segment(state, at, at + 1);
        }
        index += 1;
        if (state == State.AWAITING_NIGHT)
            return new Segment(state, -1, at);
        return new Segment(state, -1, -1);
    }
}
