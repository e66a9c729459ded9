package ou.capstone.geopoints.iso6709;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Angle layout in an ISO 6709 string.
 */
public enum Iso6709Style {
    /** Whole degrees, {@code +48+002}. */
    D,
    /** Decimal degrees, {@code +48.8667+002.3333}. */
    DD,
    /** Degrees and whole minutes, {@code +4852+00220}. */
    DM,
    /** Degrees, minutes and whole seconds, {@code +485200+0022000}. */
    DMS;

    public static Iso6709Style fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "d":
                    return D;
                case "dd":
                    return DD;
                case "dm":
                    return DM;
                case "dms":
                    return DMS;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format type " + token);
    }
}
