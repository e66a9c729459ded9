package ou.capstone.geopoints.angle;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Conversions between decimal degrees and sexagesimal components.
 */
public final class Angles {

    private Angles() {
        // Prevent instantiation
    }

    /**
     * Splits a decimal angle into degrees, minutes and (for {@link DmsStyle#DMS})
     * seconds. The sign of the angle is applied to every component.
     *
     * @param angle angle in decimal degrees
     * @param style DM for fractional minutes, DMS for whole minutes and seconds
     * @return the sign-carrying components
     * @throws GeoValueException if {@code style} is null
     */
    public static Dms toDms(final double angle, final DmsStyle style) {
        if (style == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_STYLE, "Unknown style type null");
        }
        final double sign = angle >= 0 ? 1.0 : -1.0;
        final double[] minutesSeconds = divmod(Math.abs(angle) * 3600, 60);
        final double[] degreesMinutes = divmod(minutesSeconds[0], 60);

        final double degrees = (int) degreesMinutes[0];
        final double seconds = minutesSeconds[1];
        if (style == DmsStyle.DMS) {
            final double minutes = (int) degreesMinutes[1];
            return new Dms(sign * degrees, sign * minutes, sign * seconds);
        }
        return new Dms(sign * degrees, sign * (degreesMinutes[1] + seconds / 60));
    }

    public static Dms toDms(final double angle) {
        return toDms(angle, DmsStyle.DMS);
    }

    /**
     * Joins degrees, minutes and seconds into a decimal angle. The result is
     * negative when any component is negative.
     */
    public static double toDd(final double degrees, final double minutes, final double seconds) {
        final double sign = (degrees < 0 || minutes < 0 || seconds < 0) ? -1.0 : 1.0;
        return sign * (Math.abs(degrees) + Math.abs(minutes) / 60 + Math.abs(seconds) / 3600);
    }

    public static double toDd(final double degrees, final double minutes) {
        return toDd(degrees, minutes, 0.0);
    }

    /**
     * Floored division returning quotient and remainder, with the remainder
     * taken from {@code %} so that components add back up exactly.
     */
    static double[] divmod(final double value, final double divisor) {
        double mod = value % divisor;
        double div = (value - mod) / divisor;
        if (mod != 0.0 && (divisor < 0) != (mod < 0)) {
            mod += divisor;
            div -= 1.0;
        }
        double floorDiv = Math.floor(div);
        if (div - floorDiv > 0.5) {
            floorDiv += 1.0;
        }
        return new double[] { floorDiv, mod };
    }
}
