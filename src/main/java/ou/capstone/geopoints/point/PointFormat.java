package ou.capstone.geopoints.point;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Human readable renderings of a {@link Point}.
 */
public enum PointFormat {
    /** N52.015°; W000.221° */
    DD,
    /** 52°00.90′N, 000°13.26′W */
    DM,
    /** 52°00′54″N, 000°13′16″W */
    DMS,
    /** IO92 */
    LOCATOR;

    public static PointFormat fromString(final String token) {
        if (token == null || token.isEmpty()) {
            return DD;
        }
        switch (token.toLowerCase(Locale.ROOT)) {
            case "dd":
                return DD;
            case "dm":
                return DM;
            case "dms":
                return DMS;
            case "locator":
                return LOCATOR;
            default:
                throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format_spec " + token);
        }
    }
}
