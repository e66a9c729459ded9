package ou.capstone.geopoints.solar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Sunrise and sunset times using the algorithm from the Almanac for
 * Computers, 1990 (Nautical Almanac Office, United States Naval Observatory).
 *
 * Times are accurate to within a couple of minutes for latitudes between the
 * polar circles, and are truncated to the minute.
 */
public final class SolarEvents {
    private static final Logger logger = LoggerFactory.getLogger(SolarEvents.class);

    private SolarEvents() {
        // Prevent instantiation
    }

    /**
     * Time of a rise or set event.
     *
     * @param latitude latitude in degrees
     * @param longitude longitude in degrees
     * @param date date of the event
     * @param mode rise or set
     * @param timezone offset from UTC in minutes for the returned time
     * @param zenith event definition; null selects {@link Zenith#OFFICIAL}
     * @return the event time, or empty if the sun does not reach the zenith
     *         on that date
     * @throws GeoValueException if {@code mode} is null
     */
    public static Optional<LocalTime> sunRiseSet(final double latitude, final double longitude,
                                                 final LocalDate date, final SunMode mode,
                                                 final int timezone, final Zenith zenith) {
        Objects.requireNonNull(date, "date");
        if (mode == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_MODE, "Unknown mode value null");
        }
        final double zenithDegrees = (zenith == null ? Zenith.OFFICIAL : zenith).degrees();

        final int n = date.getDayOfYear();

        // Longitude as an hour value, and approximate event time
        final double lngHour = longitude / 15;
        double t = n + (((mode == SunMode.RISE ? 6 : 18) - lngHour) / 24);

        // Sun's mean anomaly and true longitude
        final double m = (0.9856 * t) - 3.289;
        double l = m
                + 1.916 * Math.sin(Math.toRadians(m))
                + 0.020 * Math.sin(2 * Math.toRadians(m))
                + 282.634;
        l = Math.abs(l) % 360;

        // Right ascension, moved into the same quadrant as L, in hours
        double ra = Math.toDegrees(Math.atan(0.91764 * Math.tan(Math.toRadians(l))));
        final double lQuadrant = Math.floor(l / 90) * 90;
        final double raQuadrant = Math.floor(ra / 90) * 90;
        ra = (ra + (lQuadrant - raQuadrant)) / 15;

        // Declination
        final double sinDec = 0.39782 * Math.sin(Math.toRadians(l));
        final double cosDec = Math.cos(Math.asin(sinDec));

        // Local hour angle
        final double cosH = (Math.toRadians(zenithDegrees) - (sinDec * Math.sin(Math.toRadians(latitude))))
                / (cosDec * Math.cos(Math.toRadians(latitude)));
        if (cosH > 1 || cosH < -1) {
            logger.debug("Sun does not {} at ({}, {}) on {} (cosH={})",
                    mode == SunMode.RISE ? "rise" : "set", latitude, longitude, date, cosH);
            return Optional.empty();
        }

        double h = mode == SunMode.RISE
                ? 360 - Math.toDegrees(Math.acos(cosH))
                : Math.toDegrees(Math.acos(cosH));
        h = h / 15;

        // Local mean time of the event, then UTC, then the requested offset
        t = h + ra - (0.06571 * t) - 6.622;
        final double utc = t - lngHour;
        double local = utc + timezone / 60.0;
        if (local < 0) {
            local += 24;
        } else if (local > 23) {
            local -= 24;
        }

        final int hour = (int) local;
        int minute = hour == 0 ? (int) (60 * local) : (int) (60 * (local % hour));
        if (minute < 0) {
            minute += 60;
        }
        return Optional.of(LocalTime.of(hour, minute));
    }

    /** Both events for one date. */
    public static SunEvents sunEvents(final double latitude, final double longitude, final LocalDate date,
                                      final int timezone, final Zenith zenith) {
        return new SunEvents(
                sunRiseSet(latitude, longitude, date, SunMode.RISE, timezone, zenith).orElse(null),
                sunRiseSet(latitude, longitude, date, SunMode.SET, timezone, zenith).orElse(null));
    }
}
