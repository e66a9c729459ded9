package ou.capstone.geopoints.point;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Unit in which a point reports, and accepts, distances.
 */
public enum DistanceUnit {
    METRIC("metric", "km", 1.0, "kilometres"),
    IMPERIAL("imperial", "sm", DistanceUnit.STATUTE_MILE_KM, "miles"),
    NAUTICAL("nautical", "nm", DistanceUnit.NAUTICAL_MILE_KM, "nautical miles");

    /** Kilometres per statute mile. */
    public static final double STATUTE_MILE_KM = 1.609;
    /** Kilometres per nautical mile. */
    public static final double NAUTICAL_MILE_KM = 1.852;

    private final String token;
    private final String abbreviation;
    private final double kilometres;
    private final String displayName;

    DistanceUnit(final String token, final String abbreviation, final double kilometres,
                 final String displayName) {
        this.token = token;
        this.abbreviation = abbreviation;
        this.kilometres = kilometres;
        this.displayName = displayName;
    }

    /** @return the canonical lowercase name, e.g. "metric" */
    public String token() {
        return token;
    }

    /** @return short form used on the command line, e.g. "nm" */
    public String abbreviation() {
        return abbreviation;
    }

    /** @return plural unit name used in reports, e.g. "nautical miles" */
    public String displayName() {
        return displayName;
    }

    public double toKilometres(final double distance) {
        return this == METRIC ? distance : distance * kilometres;
    }

    public double fromKilometres(final double kilometres) {
        return this == METRIC ? kilometres : kilometres / this.kilometres;
    }

    /**
     * Resolves a unit name or one of its aliases: {@code km}, {@code sm},
     * {@code US customary} and {@code nm}.
     */
    public static DistanceUnit fromString(final String token) {
        if (token != null) {
            switch (token) {
                case "metric":
                case "km":
                    return METRIC;
                case "imperial":
                case "sm":
                case "US customary":
                    return IMPERIAL;
                case "nautical":
                case "nm":
                    return NAUTICAL;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_UNIT, "Unknown units type " + token);
    }
}
