package ou.capstone.geopoints.point;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.geopoints.angle.Angles;
import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Parses free-form location strings typed on a command line.
 *
 * Accepted shapes, tried with the separators {@code ;}, {@code ,} and space
 * in that order:
 * <ul>
 *   <li>{@code 52.015;-0.221} or {@code 52.015N 0.221W}</li>
 *   <li>{@code 52.015 N 0.221 W}</li>
 *   <li>{@code 52d00m54s N 0d13m15s W}, also with {@code '"} or {@code ′″}</li>
 * </ul>
 */
public final class LocationParser {

    private static final String[] SEPARATORS = { ";", ",", " " };

    private LocationParser() {
        // Prevent instantiation
    }

    /**
     * @return the position, or empty if the string has none of the accepted
     *         shapes
     * @throws GeoValueException {@code MALFORMED_INPUT} if a shape matches but
     *         a number does not parse
     */
    public static Optional<LatLon> parse(final String location) {
        if (location == null) {
            return Optional.empty();
        }
        for (final String separator : SEPARATORS) {
            final String[] chunks = StringUtils.splitByWholeSeparatorPreserveAllTokens(location, separator);
            if (chunks.length == 2) {
                return Optional.of(new LatLon(
                        hemisphereSuffixed(chunks[0], 'N', 'S'),
                        hemisphereSuffixed(chunks[1], 'E', 'W')));
            }
            if (chunks.length == 4) {
                return Optional.of(new LatLon(
                        hemisphereSeparated(chunks[0], chunks[1], "S"),
                        hemisphereSeparated(chunks[2], chunks[3], "W")));
            }
        }
        return Optional.empty();
    }

    private static double hemisphereSuffixed(final String chunk, final char positive, final char negative) {
        if (chunk.endsWith(String.valueOf(positive))) {
            return number(chunk.substring(0, chunk.length() - 1));
        }
        if (chunk.endsWith(String.valueOf(negative))) {
            return -number(chunk.substring(0, chunk.length() - 1));
        }
        return number(chunk);
    }

    private static double hemisphereSeparated(final String value, final String hemisphere, final String negative) {
        if (StringUtils.endsWithAny(value, "s", "\"", "″")) {
            return splitDms(value, hemisphere);
        }
        final double angle = number(value);
        return negative.equals(hemisphere) ? -angle : angle;
    }

    /**
     * Reads the three digit runs of a {@code DdMmSs} value; every run must be
     * terminated by a non-digit marker.
     */
    private static double splitDms(final String text, final String hemisphere) {
        final List<String> sections = new ArrayList<>(3);
        final StringBuilder section = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isDigit(c)) {
                section.append(c);
            } else {
                sections.add(section.toString());
                section.setLength(0);
            }
        }
        if (sections.size() != 3) {
            throw new GeoValueException(ErrorCode.MALFORMED_INPUT, "Invalid sexagesimal value " + text);
        }
        double degrees = number(sections.get(0));
        double minutes = number(sections.get(1));
        double seconds = number(sections.get(2));
        if ("S".equals(hemisphere) || "W".equals(hemisphere)) {
            degrees = -degrees;
            minutes = -minutes;
            seconds = -seconds;
        }
        return Angles.toDd(degrees, minutes, seconds);
    }

    private static double number(final String text) {
        // Double.parseDouble also accepts Java type suffixes such as "1d"
        if (text.isEmpty() || StringUtils.endsWithAny(text, "d", "D", "f", "F")) {
            throw new GeoValueException(ErrorCode.MALFORMED_INPUT, "Invalid number '" + text + "'");
        }
        try {
            return Double.parseDouble(text);
        } catch (final NumberFormatException e) {
            throw new GeoValueException(ErrorCode.MALFORMED_INPUT, "Invalid number '" + text + "'", e);
        }
    }
}
