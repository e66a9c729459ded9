package ou.capstone.geopoints.solar;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Sunrise and sunset for one location and date. Either event is absent when
 * the sun does not cross the zenith that day.
 */
public final class SunEvents {
    private final LocalTime rise;
    private final LocalTime set;

    public SunEvents(final LocalTime rise, final LocalTime set) {
        this.rise = rise;
        this.set = set;
    }

    public Optional<LocalTime> rise() {
        return Optional.ofNullable(rise);
    }

    public Optional<LocalTime> set() {
        return Optional.ofNullable(set);
    }

    @Override
    public String toString() {
        return "SunEvents{rise=" + rise + ", set=" + set + "}";
    }
}
