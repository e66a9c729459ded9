package ou.capstone.geopoints.route;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.angle.CompassRose;
import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;
import ou.capstone.geopoints.point.AngleMode;
import ou.capstone.geopoints.point.DistanceUnit;
import ou.capstone.geopoints.point.Point;

/**
 * GreatCircle
 *
 * - Distance, initial/final bearing, midpoint and destination on a sphere
 * - Distances are reported in, and accepted in, the start point's unit
 *
 * Projected longitudes are wrapped across the antimeridian.
 * Longitude is undefined at the poles and bearings from a pole or between
 * antipodal points depend on rounding in {@code atan2}; those inputs are not
 * special-cased.
 */
public final class GreatCircle {
    private static final Logger logger = LoggerFactory.getLogger(GreatCircle.class);

    /** Mean Earth radius used for every calculation, in kilometres. */
    public static final double BODY_RADIUS_KM = 6367.0;

    private GreatCircle() {
        // Prevent instantiation
    }

    // ---------- Distance ----------

    /**
     * Great-circle distance from {@code from} to {@code to}.
     *
     * @return distance in {@code from}'s unit
     * @throws GeoValueException if {@code method} is null
     */
    public static double distance(final Point from, final Point to, final DistanceMethod method) {
        if (method == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_METHOD, "Unknown method type null");
        }
        final double dLat = to.radLatitude - from.radLatitude;
        final double dLon = to.radLongitude - from.radLongitude;

        final double km;
        if (method == DistanceMethod.HAVERSINE) {
            final double sinLat = Math.sin(dLat / 2);
            final double sinLon = Math.sin(dLon / 2);
            double a = sinLat * sinLat
                    + Math.cos(from.radLatitude) * Math.cos(to.radLatitude) * sinLon * sinLon;
            // Clamp to avoid NaN from rounding near antipodes
            a = Math.min(1.0, a);
            km = 2 * BODY_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        } else {
            double cosAngle = Math.sin(from.radLatitude) * Math.sin(to.radLatitude)
                    + Math.cos(from.radLatitude) * Math.cos(to.radLatitude) * Math.cos(dLon);
            // Clamp to avoid NaN from rounding when the points coincide
            cosAngle = Math.max(-1.0, Math.min(1.0, cosAngle));
            km = Math.acos(cosAngle) * BODY_RADIUS_KM;
        }
        final double distance = from.getUnits().fromKilometres(km);
        logger.debug("{} distance from {} to {} is {} {}", method, from, to, distance,
                from.getUnits().displayName());
        return distance;
    }

    // ---------- Bearings ----------

    /**
     * Initial bearing from {@code from} to {@code to}, clockwise from true north.
     * On a sphere this is generally not the reverse bearing plus 180°.
     *
     * @return bearing in [0, 360)
     */
    public static double bearing(final Point from, final Point to) {
        final double dLon = to.radLongitude - from.radLongitude;

        final double y = Math.sin(dLon) * Math.cos(to.radLatitude);
        final double x = Math.cos(from.radLatitude) * Math.sin(to.radLatitude)
                - Math.sin(from.radLatitude) * Math.cos(to.radLatitude) * Math.cos(dLon);
        final double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360) % 360;
    }

    /**
     * Bearing on arrival at {@code to}, derived from the reverse initial bearing.
     */
    public static double finalBearing(final Point from, final Point to) {
        return (bearing(to, from) + 180) % 360;
    }

    /**
     * @return whole degrees such as "294°", or an 8 segment compass name
     * @throws GeoValueException if {@code format} is null
     */
    public static String formatBearing(final double bearing, final BearingFormat format) {
        if (format == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format type null");
        }
        if (format == BearingFormat.STRING) {
            return CompassRose.angleToName(bearing);
        }
        return (int) bearing + "°";
    }

    // ---------- Projection ----------

    /**
     * Point halfway along the great circle between two points.
     * Unit and timezone come from {@code from}.
     */
    public static Point midpoint(final Point from, final Point to) {
        final double dLon = to.radLongitude - from.radLongitude;
        final double y = Math.sin(dLon) * Math.cos(to.radLatitude);
        final double x = Math.cos(to.radLatitude) * Math.cos(dLon);

        final double cosFromX = Math.cos(from.radLatitude) + x;
        final double latitude = Math.atan2(
                Math.sin(from.radLatitude) + Math.sin(to.radLatitude),
                Math.sqrt(cosFromX * cosFromX + y * y));
        final double longitude = normalizeLongitude(from.radLongitude + Math.atan2(y, cosFromX));

        return new Point(latitude, longitude, from.getUnits(), AngleMode.RADIANS, from.getTimezone());
    }

    /**
     * Forward geodesic: the point reached after travelling {@code distance}
     * along initial {@code bearing}.
     *
     * @param bearing direction of travel in degrees
     * @param distance distance in {@code from}'s unit
     */
    public static Point destination(final Point from, final double bearing, final double distance) {
        final double theta = Math.toRadians(bearing);
        final double angularDistance = from.getUnits().toKilometres(distance) / BODY_RADIUS_KM;

        final double latitude = Math.asin(
                Math.sin(from.radLatitude) * Math.cos(angularDistance)
                        + Math.cos(from.radLatitude) * Math.sin(angularDistance) * Math.cos(theta));
        final double longitude = normalizeLongitude(from.radLongitude + Math.atan2(
                Math.sin(theta) * Math.sin(angularDistance) * Math.cos(from.radLatitude),
                Math.cos(angularDistance) - Math.sin(from.radLatitude) * Math.sin(latitude)));

        logger.debug("Destination from {} on {}° after {} {}", from, bearing, distance,
                from.getUnits().displayName());
        return new Point(latitude, longitude, from.getUnits(), AngleMode.RADIANS, from.getTimezone());
    }

    /**
     * Wraps a longitude that crossed the antimeridian back into [-π, π).
     *
     * @param longitude radians, within one turn of the valid range
     */
    static double normalizeLongitude(final double longitude) {
        return (longitude + 3 * Math.PI) % (2 * Math.PI) - Math.PI;
    }

    /** Inverse geodesic: initial bearing and haversine distance. */
    public static Inverse inverse(final Point from, final Point to) {
        return new Inverse(bearing(from, to), distance(from, to, DistanceMethod.HAVERSINE));
    }

    // ---------- Angle/distance conversion ----------

    /**
     * Length of the great-circle arc subtending {@code angle}.
     *
     * @param angle angle in degrees
     * @return distance in {@code units}
     */
    public static double angleToDistance(final double angle, final DistanceUnit units) {
        if (units == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_UNIT, "Unknown units type null");
        }
        return units.fromKilometres(Math.toRadians(angle) * BODY_RADIUS_KM);
    }

    /**
     * Angle subtended by a great-circle arc of length {@code distance}.
     *
     * @return angle in degrees
     */
    public static double distanceToAngle(final double distance, final DistanceUnit units) {
        if (units == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_UNIT, "Unknown units type null");
        }
        return Math.toDegrees(units.toKilometres(distance) / BODY_RADIUS_KM);
    }
}
