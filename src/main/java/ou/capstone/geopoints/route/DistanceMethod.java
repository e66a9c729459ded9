package ou.capstone.geopoints.route;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Great-circle distance formula.
 */
public enum DistanceMethod {
    /** Haversine formula, stable for short distances. */
    HAVERSINE,
    /** Spherical law of cosines, kept for cross-checking haversine results. */
    SLOC;

    public static DistanceMethod fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "haversine":
                    return HAVERSINE;
                case "sloc":
                    return SLOC;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_METHOD, "Unknown method type " + token);
    }
}
