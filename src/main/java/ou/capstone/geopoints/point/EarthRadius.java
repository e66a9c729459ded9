package ou.capstone.geopoints.point;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Approximate Earth radius at a given latitude on a reference ellipsoid.
 */
public final class EarthRadius {

    private EarthRadius() {
        // Prevent instantiation
    }

    public static double calcRadius(final double latitude) {
        return calcRadius(latitude, Ellipsoid.WGS84);
    }

    /**
     * Meridional radius of curvature, {@code a(1-e)/(1-e sin²φ)^1.5} with
     * {@code e = 1 - b²/a²}.
     *
     * @param latitude latitude in degrees
     * @return radius in kilometres
     */
    public static double calcRadius(final double latitude, final Ellipsoid ellipsoid) {
        if (ellipsoid == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_ELLIPSOID, "Unknown ellipsoid null");
        }
        final double major = ellipsoid.major();
        final double minor = ellipsoid.minor();
        final double eccentricity = 1 - (minor * minor) / (major * major);

        final double sl = Math.sin(Math.toRadians(latitude));
        return (major * (1 - eccentricity)) / Math.pow(1 - eccentricity * sl * sl, 1.5);
    }
}
