package ou.capstone.geopoints.locator;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Number of Maidenhead locator pairs to produce: 4, 6 or 8 characters.
 */
public enum LocatorPrecision {
    SQUARE(4),
    SUBSQUARE(6),
    EXTSQUARE(8);

    private final int length;

    LocatorPrecision(final int length) {
        this.length = length;
    }

    /** @return number of characters in a locator of this precision */
    public int length() {
        return length;
    }

    public static LocatorPrecision fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "square":
                    return SQUARE;
                case "subsquare":
                    return SUBSQUARE;
                case "extsquare":
                    return EXTSQUARE;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_PRECISION, "Unsupported precision value " + token);
    }
}
