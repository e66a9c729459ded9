package ou.capstone.geopoints.iso6709;

import ou.capstone.geopoints.point.DistanceUnit;
import ou.capstone.geopoints.point.Point;

/**
 * Decoded ISO 6709 location. Altitude is in metres and may be null.
 */
public record Iso6709Position(double latitude, double longitude, Double altitude) {

    public Iso6709Position(final double latitude, final double longitude) {
        this(latitude, longitude, null);
    }

    public Point toPoint(final DistanceUnit units) {
        return new Point(latitude, longitude, units);
    }

    /** Re-encodes with the default style and precision. */
    public String toIso6709() {
        return Iso6709.format(latitude, longitude, altitude);
    }
}
