package ou.capstone.geopoints.locator;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;
import ou.capstone.geopoints.point.LatLon;

/**
 * Maidenhead locator codec.
 *
 * A locator is built from pairs of characters, longitude first:
 * <ul>
 *   <li>field, 20° x 10°, 'A' to 'R'</li>
 *   <li>square, 2° x 1°, '0' to '9'</li>
 *   <li>subsquare, 1/24 of a square, 'a' to 'x'</li>
 *   <li>extended square, 1/10 of a subsquare, '0' to '9'</li>
 * </ul>
 */
public final class GridLocator {
    private static final Logger logger = LoggerFactory.getLogger(GridLocator.class);

    static final double LONGITUDE_FIELD = 20;
    static final double LATITUDE_FIELD = 10;
    static final double LONGITUDE_SQUARE = LONGITUDE_FIELD / 10;
    static final double LATITUDE_SQUARE = LATITUDE_FIELD / 10;
    static final double LONGITUDE_SUBSQUARE = LONGITUDE_SQUARE / 24;
    static final double LATITUDE_SUBSQUARE = LATITUDE_SQUARE / 24;
    static final double LONGITUDE_EXTSQUARE = LONGITUDE_SUBSQUARE / 10;
    static final double LATITUDE_EXTSQUARE = LATITUDE_SUBSQUARE / 10;

    private GridLocator() {
        // Prevent instantiation
    }

    /**
     * Decodes a locator to a point inside its finest cell.
     *
     * Shorter locators are padded with five extended-square widths. That is
     * the centre of a six character subsquare, but only 1/48° by 1/24° in from
     * the south-west corner of a four character square.
     *
     * @param locator 4, 6 or 8 character locator; the subsquare pair may be
     *        either case, fields must be uppercase
     * @throws GeoValueException on a bad length or an out-of-range character
     */
    public static LatLon decode(final String locator) {
        if (locator == null || (locator.length() != 4 && locator.length() != 6 && locator.length() != 8)) {
            throw new GeoValueException(ErrorCode.INVALID_LOCATOR_LENGTH,
                    "Locator must be 4, 6 or 8 characters long " + locator);
        }

        final int lonField = locator.charAt(0) - 'A';
        final int latField = locator.charAt(1) - 'A';
        final int lonSquare = Character.digit(locator.charAt(2), 10);
        final int latSquare = Character.digit(locator.charAt(3), 10);
        checkRange(locator, lonField, 17);
        checkRange(locator, latField, 17);
        checkRange(locator, lonSquare, 9);
        checkRange(locator, latSquare, 9);

        double longitude = LONGITUDE_FIELD * lonField + LONGITUDE_SQUARE * lonSquare;
        double latitude = LATITUDE_FIELD * latField + LATITUDE_SQUARE * latSquare;

        if (locator.length() >= 6) {
            final String subsquare = locator.substring(4, 6).toLowerCase(Locale.ROOT);
            final int lonSubsquare = subsquare.charAt(0) - 'a';
            final int latSubsquare = subsquare.charAt(1) - 'a';
            checkRange(locator, lonSubsquare, 23);
            checkRange(locator, latSubsquare, 23);
            longitude += LONGITUDE_SUBSQUARE * lonSubsquare;
            latitude += LATITUDE_SUBSQUARE * latSubsquare;
        }

        if (locator.length() == 8) {
            final int lonExtsquare = Character.digit(locator.charAt(6), 10);
            final int latExtsquare = Character.digit(locator.charAt(7), 10);
            checkRange(locator, lonExtsquare, 9);
            checkRange(locator, latExtsquare, 9);
            longitude += LONGITUDE_EXTSQUARE * lonExtsquare + LONGITUDE_EXTSQUARE / 2;
            latitude += LATITUDE_EXTSQUARE * latExtsquare + LATITUDE_EXTSQUARE / 2;
        } else {
            longitude += LONGITUDE_EXTSQUARE * 5;
            latitude += LATITUDE_EXTSQUARE * 5;
        }

        final LatLon result = new LatLon(latitude - 90, longitude - 180);
        logger.debug("Decoded locator {} to {}", locator, result);
        return result;
    }

    private static void checkRange(final String locator, final int value, final int max) {
        if (value < 0 || value > max) {
            throw new GeoValueException(ErrorCode.INVALID_LOCATOR_VALUE, "Invalid values in locator " + locator);
        }
    }

    /**
     * Encodes a position as a locator.
     *
     * @throws GeoValueException if the precision is missing or either
     *         coordinate is out of range
     */
    public static String encode(final double latitude, final double longitude, final LocatorPrecision precision) {
        if (precision == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_PRECISION, "Unsupported precision value null");
        }
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new GeoValueException(ErrorCode.INVALID_LATITUDE, "Invalid latitude value " + latitude);
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new GeoValueException(ErrorCode.INVALID_LONGITUDE, "Invalid longitude value " + longitude);
        }

        double lat = latitude + 90.0;
        double lon = longitude + 180.0;
        final StringBuilder sb = new StringBuilder(precision.length());

        // Clamped so that latitude 90 and longitude 180 stay in the last cell
        int field = index(lon, LONGITUDE_FIELD, 17);
        sb.append((char) ('A' + field));
        lon -= field * LONGITUDE_FIELD;

        field = index(lat, LATITUDE_FIELD, 17);
        sb.append((char) ('A' + field));
        lat -= field * LATITUDE_FIELD;

        int square = index(lon, LONGITUDE_SQUARE, 9);
        sb.append(square);
        lon -= square * LONGITUDE_SQUARE;

        square = index(lat, LATITUDE_SQUARE, 9);
        sb.append(square);
        lat -= square * LATITUDE_SQUARE;

        if (precision != LocatorPrecision.SQUARE) {
            int subsquare = index(lon, LONGITUDE_SUBSQUARE, 23);
            sb.append((char) ('a' + subsquare));
            lon -= subsquare * LONGITUDE_SUBSQUARE;

            subsquare = index(lat, LATITUDE_SUBSQUARE, 23);
            sb.append((char) ('a' + subsquare));
            lat -= subsquare * LATITUDE_SUBSQUARE;
        }

        if (precision == LocatorPrecision.EXTSQUARE) {
            sb.append(index(lon, LONGITUDE_EXTSQUARE, 9));
            sb.append(index(lat, LATITUDE_EXTSQUARE, 9));
        }

        return sb.toString();
    }

    private static int index(final double offset, final double width, final int max) {
        return Math.min((int) (offset / width), max);
    }
}
