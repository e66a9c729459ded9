package ou.capstone.geopoints.solar;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

public enum SunMode {
    RISE,
    SET;

    public static SunMode fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "rise":
                    return RISE;
                case "set":
                    return SET;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_MODE, "Unknown mode value " + token);
    }
}
