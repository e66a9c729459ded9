package ou.capstone.geopoints.route;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Unit for flight plan elapsed times. Speeds are always distance per hour.
 */
public enum ElapsedTimeUnit {
    HOURS("h", 1),
    MINUTES("m", 60),
    SECONDS("s", 3600);

    private final String token;
    private final int perHour;

    ElapsedTimeUnit(final String token, final int perHour) {
        this.token = token;
        this.perHour = perHour;
    }

    public String token() {
        return token;
    }

    /** Converts a duration in hours to this unit. */
    public double fromHours(final double hours) {
        return hours * perHour;
    }

    public static ElapsedTimeUnit fromString(final String token) {
        for (final ElapsedTimeUnit unit : values()) {
            if (unit.token.equals(token)) {
                return unit;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_TIME_UNIT, "Unknown time unit " + token);
    }
}
