package ou.capstone.geopoints.angle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Names compass directions for bearings.
 *
 * The sixteen point windrose is generated from the four cardinal names, one
 * quadrant at a time, so the 4, 8 and 16 segment names always agree with each
 * other: every 8 segment name is an even entry of the 16 segment table, and
 * every 4 segment name an even entry of the 8 segment one.
 */
public final class CompassRose {

    private static final String[] CARDINALS = { "north", "east", "south", "west", "north" };

    private static final List<String> NAMES = buildNames(false);
    private static final List<String> ABBREVIATIONS = buildNames(true);

    private CompassRose() {
        // Prevent instantiation
    }

    /**
     * Direction name for a bearing using an 8 segment compass.
     *
     * @param angle bearing in degrees
     * @return e.g. "North-east"
     */
    public static String angleToName(final double angle) {
        return angleToName(angle, 8, false);
    }

    /**
     * Direction name for a bearing.
     *
     * @param angle bearing in degrees, any value; it is reduced modulo 360
     * @param segments 4, 8 or 16
     * @param abbreviated letter codes ("NNE") instead of phrases ("North-north-east")
     * @return the direction name
     * @throws GeoValueException for any other segment count
     */
    public static String angleToName(final double angle, final int segments, final boolean abbreviated) {
        final int index;
        switch (segments) {
            case 4:
                index = Math.floorMod((int) ((angle + 45) / 90), 4) * 4;
                break;
            case 8:
                index = Math.floorMod((int) ((angle + 22.5) / 45), 8) * 2;
                break;
            case 16:
                index = Math.floorMod((int) ((angle + 11.25) / 22.5), 16);
                break;
            default:
                throw new GeoValueException(ErrorCode.UNSUPPORTED_SEGMENT_COUNT,
                        "Segments parameter must be 4, 8 or 16 not " + segments);
        }
        return abbreviated ? ABBREVIATIONS.get(index) : NAMES.get(index);
    }

    /** @return the sixteen names, clockwise from north */
    public static List<String> names(final boolean abbreviated) {
        return abbreviated ? ABBREVIATIONS : NAMES;
    }

    private static List<String> buildNames(final boolean abbreviated) {
        final List<String> names = new ArrayList<>(16);
        for (int quadrant = 0; quadrant < 4; quadrant++) {
            names.addAll(quadrant(quadrant, abbreviated));
        }
        return List.copyOf(names);
    }

    /**
     * The four names of one quadrant, starting at its cardinal point.
     * Intermediate names always lead with north or south ("South-east", never
     * "East-south").
     */
    private static List<String> quadrant(final int quadrant, final boolean abbreviated) {
        final String here = primitive(quadrant, abbreviated);
        final String next = primitive(quadrant + 1, abbreviated);
        final String separator = abbreviated ? "" : "-";

        if (quadrant % 2 == 0) {
            return List.of(
                    StringUtils.capitalize(here),
                    String.join(separator, StringUtils.capitalize(here), here, next),
                    String.join(separator, StringUtils.capitalize(here), next),
                    String.join(separator, StringUtils.capitalize(next), here, next));
        }
        return List.of(
                StringUtils.capitalize(here),
                String.join(separator, StringUtils.capitalize(here), next, here),
                String.join(separator, StringUtils.capitalize(next), here),
                String.join(separator, StringUtils.capitalize(next), next, here));
    }

    private static String primitive(final int index, final boolean abbreviated) {
        final String name = CARDINALS[index];
        return abbreviated ? name.substring(0, 1).toUpperCase(Locale.ROOT) : name;
    }
}
