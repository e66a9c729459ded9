package ou.capstone.geopoints.point;

import java.util.Locale;

/**
 * Unvalidated latitude/longitude pair in degrees, as produced by the codecs.
 */
public record LatLon(double latitude, double longitude) {

    /**
     * @throws ou.capstone.geopoints.exceptions.GeoValueException if either value is out of range
     */
    public Point toPoint(final DistanceUnit units) {
        return new Point(latitude, longitude, units);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", latitude, longitude);
    }
}
