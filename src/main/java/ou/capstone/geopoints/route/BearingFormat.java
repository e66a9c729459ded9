package ou.capstone.geopoints.route;

import java.util.Locale;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * How a bearing is rendered as text: whole degrees ("294°") or a compass name
 * ("North-west").
 */
public enum BearingFormat {
    NUMERIC,
    STRING;

    public static BearingFormat fromString(final String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "numeric":
                    return NUMERIC;
                case "string":
                    return STRING;
                default:
                    break;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format type " + token);
    }
}
