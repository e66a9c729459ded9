package ou.capstone.geopoints.iso6709;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.angle.DmsStyle;
import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Codec for the common subset of ISO 6709 point strings, e.g.
 * {@code +352139+1384339+3776/} for Mount Fuji.
 *
 * Latitude and longitude each carry an explicit sign and may be whole or
 * fractional degrees, degrees and minutes, or degrees, minutes and seconds.
 * The optional third component is altitude in metres. Every string ends in
 * {@code /}.
 */
public final class Iso6709 {
    private static final Logger logger = LoggerFactory.getLogger(Iso6709.class);

    private static final Pattern ISO6709_PATTERN =
            Pattern.compile("^([-+][\\d.]+)([-+][\\d.]+)([+-][\\d.]+)?/$");

    public static final int DEFAULT_PRECISION = 4;

    private Iso6709() {
        // Prevent instantiation
    }

    /**
     * @throws GeoValueException {@code MALFORMED_INPUT} if the string is not
     *         shaped like ISO 6709, {@code MALFORMED_COMPONENT} if latitude or
     *         longitude has an unsupported number of integer digits
     */
    public static Iso6709Position parse(final String text) {
        if (text == null) {
            throw new GeoValueException(ErrorCode.MALFORMED_INPUT, "Incorrect format for string null");
        }
        final Matcher matcher = ISO6709_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new GeoValueException(ErrorCode.MALFORMED_INPUT, "Incorrect format for string " + text);
        }

        final double latitude = parseComponent(matcher.group(1), 2, "latitude");
        final double longitude = parseComponent(matcher.group(2), 3, "longitude");
        final String altitudeText = matcher.group(3);
        final Double altitude = altitudeText == null ? null : parseNumber(altitudeText, "altitude");

        logger.debug("Parsed ISO 6709 string {} to ({}, {}, {})", text, latitude, longitude, altitude);
        return new Iso6709Position(latitude, longitude, altitude);
    }

    /**
     * @param component signed component, e.g. {@code +4852}
     * @param degreeDigits integer digits used for whole degrees: 2 for
     *        latitude, 3 for longitude
     */
    private static double parseComponent(final String component, final int degreeDigits, final String name) {
        final double sign = component.charAt(0) == '+' ? 1.0 : -1.0;
        final int dot = component.indexOf('.');
        final int head = dot < 0 ? component.length() : dot;
        final int degreesEnd = degreeDigits + 1;

        if (head == degreesEnd) {
            return parseNumber(component, name);
        }
        if (head == degreesEnd + 2) {
            return parseNumber(component.substring(0, degreesEnd), name)
                    + sign * (parseNumber(component.substring(degreesEnd), name) / 60);
        }
        if (head == degreesEnd + 4) {
            return parseNumber(component.substring(0, degreesEnd), name)
                    + sign * (parseNumber(component.substring(degreesEnd, degreesEnd + 2), name) / 60)
                    + sign * (parseNumber(component.substring(degreesEnd + 2), name) / 3600);
        }
        throw new GeoValueException(ErrorCode.MALFORMED_COMPONENT,
                "Incorrect format for " + name + " " + component);
    }

    private static double parseNumber(final String value, final String name) {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new GeoValueException(ErrorCode.MALFORMED_COMPONENT,
                    "Incorrect format for " + name + " " + value, e);
        }
    }

    public static String format(final double latitude, final double longitude) {
        return format(latitude, longitude, null, Iso6709Style.DD, DEFAULT_PRECISION);
    }

    public static String format(final double latitude, final double longitude, final Double altitude) {
        return format(latitude, longitude, altitude, Iso6709Style.DD, DEFAULT_PRECISION);
    }

    /**
     * Produces an ISO 6709 string.
     *
     * DM and DMS styles round to the whole minute or second, carrying into
     * the higher fields, so a parsed canonical string formats back unchanged.
     * Altitude is written as a signed integer when whole, with three decimals
     * otherwise, and left out when null or zero.
     *
     * @param precision decimal places for {@link Iso6709Style#DD}
     * @throws GeoValueException if {@code style} is null
     */
    public static String format(final double latitude, final double longitude, final Double altitude,
                                final Iso6709Style style, final int precision) {
        if (style == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format type null");
        }
        final StringBuilder sb = new StringBuilder();
        switch (style) {
            case D:
                sb.append(String.format(Locale.US, "%+03d%+04d", (int) latitude, (int) longitude));
                break;
            case DD:
                sb.append(String.format(Locale.US, "%+0" + (precision + 4) + "." + precision + "f", latitude));
                sb.append(String.format(Locale.US, "%+0" + (precision + 5) + "." + precision + "f", longitude));
                break;
            case DM:
            case DMS:
            default:
                final DmsStyle dmsStyle = style == Iso6709Style.DM ? DmsStyle.DM : DmsStyle.DMS;
                appendSexagesimal(sb, latitude, dmsStyle, 2);
                appendSexagesimal(sb, longitude, dmsStyle, 3);
                break;
        }

        if (altitude != null && altitude != 0) {
            if (altitude == Math.floor(altitude) && !Double.isInfinite(altitude)) {
                sb.append(String.format(Locale.US, "%+d", altitude.longValue()));
            } else {
                sb.append(String.format(Locale.US, "%+.3f", altitude));
            }
        }
        sb.append('/');
        return sb.toString();
    }

    private static void appendSexagesimal(final StringBuilder sb, final double angle, final DmsStyle style,
                                          final int degreeDigits) {
        // Sign from the bit so that a parsed -000000 keeps its minus
        sb.append(Math.copySign(1.0, angle) < 0 ? '-' : '+');
        if (style == DmsStyle.DMS) {
            final long seconds = Math.round(Math.abs(angle) * 3600);
            sb.append(String.format(Locale.US, "%0" + degreeDigits + "d%02d%02d",
                    seconds / 3600, seconds / 60 % 60, seconds % 60));
        } else {
            final long minutes = Math.round(Math.abs(angle) * 60);
            sb.append(String.format(Locale.US, "%0" + degreeDigits + "d%02d", minutes / 60, minutes % 60));
        }
    }
}
