package ou.capstone.geopoints.point;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Unit of the latitude/longitude values handed to a {@link Point} constructor.
 */
public enum AngleMode {
    DEGREES,
    RADIANS;

    public static AngleMode fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "degrees":
                    return DEGREES;
                case "radians":
                    return RADIANS;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.INVALID_ANGLE_MODE, "Unknown angle type " + token);
    }
}
