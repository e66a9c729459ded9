package ou.capstone.geopoints.angle;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Sexagesimal split: degrees + fractional minutes, or degrees + minutes + seconds.
 */
public enum DmsStyle {
    DM,
    DMS;

    public static DmsStyle fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "dm":
                    return DM;
                case "dms":
                    return DMS;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_STYLE, "Unknown style type " + token);
    }
}
