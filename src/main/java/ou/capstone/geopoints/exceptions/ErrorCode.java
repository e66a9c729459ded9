package ou.capstone.geopoints.exceptions;

/**
 * Kinds of value error raised by the geometry, codec and solar code.
 */
public enum ErrorCode {
    INVALID_ANGLE_MODE,
    INVALID_LATITUDE,
    INVALID_LONGITUDE,
    UNKNOWN_UNIT,
    UNKNOWN_METHOD,
    UNKNOWN_FORMAT,
    UNSUPPORTED_SEGMENT_COUNT,
    UNKNOWN_PRECISION,
    INVALID_LOCATOR_LENGTH,
    INVALID_LOCATOR_VALUE,
    MALFORMED_INPUT,
    MALFORMED_COMPONENT,
    UNKNOWN_STYLE,
    UNKNOWN_MODE,
    UNKNOWN_ZENITH,
    UNKNOWN_ELLIPSOID,
    UNKNOWN_TIME_UNIT
}
