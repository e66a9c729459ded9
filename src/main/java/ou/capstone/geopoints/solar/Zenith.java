package ou.capstone.geopoints.solar;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Solar altitude, in degrees, that defines a rise or set event.
 */
public enum Zenith {
    /** Upper limb on the horizon: 34′ refraction plus 16′ semi-diameter. */
    OFFICIAL(-50 / 60.0),
    CIVIL(-6),
    NAUTICAL(-12),
    ASTRONOMICAL(-18);

    private final double degrees;

    Zenith(final double degrees) {
        this.degrees = degrees;
    }

    public double degrees() {
        return degrees;
    }

    /**
     * @param token zenith name; null or empty selects {@link #OFFICIAL}
     */
    public static Zenith fromString(final String token) {
        if (token == null || token.isEmpty()) {
            return OFFICIAL;
        }
        switch (token.toLowerCase(Locale.ROOT)) {
            case "official":
                return OFFICIAL;
            case "civil":
                return CIVIL;
            case "nautical":
                return NAUTICAL;
            case "astronomical":
                return ASTRONOMICAL;
            default:
                throw new GeoValueException(ErrorCode.UNKNOWN_ZENITH, "Unknown zenith value " + token);
        }
    }
}
