package ou.capstone.geopoints.point;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Optional;

import ou.capstone.geopoints.angle.Dms;
import ou.capstone.geopoints.angle.DmsStyle;
import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;
import ou.capstone.geopoints.locator.GridLocator;
import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.route.BearingFormat;
import ou.capstone.geopoints.route.DistanceMethod;
import ou.capstone.geopoints.route.GreatCircle;
import ou.capstone.geopoints.route.Inverse;
import ou.capstone.geopoints.solar.SolarEvents;
import ou.capstone.geopoints.solar.SunEvents;
import ou.capstone.geopoints.solar.SunMode;
import ou.capstone.geopoints.solar.Zenith;

/**
 * Immutable location on the Earth's surface.
 *
 * Latitude and longitude are held both in degrees and in radians; both forms
 * are derived together in the constructor and never change afterwards.
 * The distance unit scales every distance a point reports or accepts, and the
 * timezone offset (minutes east of UTC) is used only for sunrise and sunset.
 */
public final class Point {

    public final double latitude;
    public final double longitude;
    public final double radLatitude;
    public final double radLongitude;
    private final DistanceUnit units;
    private final int timezone;

    public Point(final double latitude, final double longitude) {
        this(latitude, longitude, DistanceUnit.METRIC, AngleMode.DEGREES, 0);
    }

    public Point(final double latitude, final double longitude, final DistanceUnit units) {
        this(latitude, longitude, units, AngleMode.DEGREES, 0);
    }

    /**
     * Constructs a Point with validation.
     *
     * @param latitude latitude, in degrees or radians depending on {@code angle}
     * @param longitude longitude, in degrees or radians depending on {@code angle}
     * @param units unit for distances
     * @param angle unit of {@code latitude} and {@code longitude}
     * @param timezone offset from UTC in minutes
     * @throws GeoValueException if the angle mode or unit is missing, or either
     *         coordinate is out of range
     */
    public Point(final double latitude, final double longitude, final DistanceUnit units,
                 final AngleMode angle, final int timezone) {
        if (angle == null) {
            throw new GeoValueException(ErrorCode.INVALID_ANGLE_MODE, "Unknown angle type null");
        }
        if (angle == AngleMode.DEGREES) {
            this.latitude = latitude;
            this.longitude = longitude;
            this.radLatitude = Math.toRadians(latitude);
            this.radLongitude = Math.toRadians(longitude);
        } else {
            this.radLatitude = latitude;
            this.radLongitude = longitude;
            this.latitude = Math.toDegrees(latitude);
            this.longitude = Math.toDegrees(longitude);
        }
        checkLatitude(this.latitude);
        checkLongitude(this.longitude);
        if (units == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_UNIT, "Unknown units type null");
        }
        this.units = units;
        this.timezone = timezone;
    }

    /**
     * Constructs a Point from sexagesimal components, e.g.
     * {@code new Point(new Dms(50, 20, 10), new Dms(-1, -3, -12), DistanceUnit.METRIC, 0)}.
     */
    public Point(final Dms latitude, final Dms longitude, final DistanceUnit units, final int timezone) {
        this(latitude.toDecimal(), longitude.toDecimal(), units, AngleMode.DEGREES, timezone);
    }

    public Point(final Dms latitude, final Dms longitude) {
        this(latitude, longitude, DistanceUnit.METRIC, 0);
    }

    /**
     * Point at the centre of a Maidenhead locator's finest cell.
     */
    public static Point fromGridLocator(final String locator, final DistanceUnit units) {
        return GridLocator.decode(locator).toPoint(units);
    }

    static void checkLatitude(final double latitude) {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new GeoValueException(ErrorCode.INVALID_LATITUDE, "Invalid latitude value " + latitude);
        }
    }

    static void checkLongitude(final double longitude) {
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new GeoValueException(ErrorCode.INVALID_LONGITUDE, "Invalid longitude value " + longitude);
        }
    }

    /** @return latitude in degrees */
    public double getLatitude() {
        return latitude;
    }

    /** @return longitude in degrees */
    public double getLongitude() {
        return longitude;
    }

    public DistanceUnit getUnits() {
        return units;
    }

    /** @return offset from UTC in minutes */
    public int getTimezone() {
        return timezone;
    }

    /**
     * Moves the location, keeping unit and timezone. Both coordinates are
     * revalidated and both angle forms recomputed.
     *
     * @return a new Point at the given location
     */
    public Point relocate(final double latitude, final double longitude) {
        return new Point(latitude, longitude, units, AngleMode.DEGREES, timezone);
    }

    /** Moves the location to the centre of a Maidenhead locator. */
    public Point relocateToGridLocator(final String locator) {
        final LatLon centre = GridLocator.decode(locator);
        return relocate(centre.latitude(), centre.longitude());
    }

    public Point withUnits(final DistanceUnit units) {
        return new Point(latitude, longitude, units, AngleMode.DEGREES, timezone);
    }

    public Point withTimezone(final int timezone) {
        return new Point(latitude, longitude, units, AngleMode.DEGREES, timezone);
    }

    // ---------- Formatting ----------

    public String format(final PointFormat format) {
        if (format == null) {
            throw new GeoValueException(ErrorCode.UNKNOWN_FORMAT, "Unknown format_spec null");
        }
        switch (format) {
            case DM:
                return formatSexagesimal(DmsStyle.DM);
            case DMS:
                return formatSexagesimal(DmsStyle.DMS);
            case LOCATOR:
                return toGridLocator();
            case DD:
            default:
                return (latitude < 0 ? "S" : "N")
                        + String.format(Locale.US, "%06.3f°; ", Math.abs(latitude))
                        + (longitude < 0 ? "W" : "E")
                        + String.format(Locale.US, "%07.3f°", Math.abs(longitude));
        }
    }

    private String formatSexagesimal(final DmsStyle style) {
        return sexagesimal(latitude, style, 2) + (latitude < 0 ? 'S' : 'N')
                + ", " + sexagesimal(longitude, style, 3) + (longitude < 0 ? 'W' : 'E');
    }

    /**
     * Unsigned degrees with whole seconds or hundredths of a minute. Rounding
     * happens before the split so the lower fields never reach 60.
     */
    private static String sexagesimal(final double angle, final DmsStyle style, final int degreeDigits) {
        if (style == DmsStyle.DMS) {
            final long seconds = Math.round(Math.abs(angle) * 3600);
            return String.format(Locale.US, "%0" + degreeDigits + "d°%02d′%02d″",
                    seconds / 3600, seconds / 60 % 60, seconds % 60);
        }
        final long hundredths = Math.round(Math.abs(angle) * 6000);
        return String.format(Locale.US, "%0" + degreeDigits + "d°%05.2f′",
                hundredths / 6000, (hundredths % 6000) / 100.0);
    }

    // ---------- Geometry ----------

    public double distance(final Point other) {
        return GreatCircle.distance(this, other, DistanceMethod.HAVERSINE);
    }

    public double distance(final Point other, final DistanceMethod method) {
        return GreatCircle.distance(this, other, method);
    }

    public double bearing(final Point other) {
        return GreatCircle.bearing(this, other);
    }

    public String bearing(final Point other, final BearingFormat format) {
        return GreatCircle.formatBearing(bearing(other), format);
    }

    public double finalBearing(final Point other) {
        return GreatCircle.finalBearing(this, other);
    }

    public String finalBearing(final Point other, final BearingFormat format) {
        return GreatCircle.formatBearing(finalBearing(other), format);
    }

    /** @return initial bearing as an 8 segment compass name, e.g. "North-west" */
    public String bearingName(final Point other) {
        return bearing(other, BearingFormat.STRING);
    }

    public String finalBearingName(final Point other) {
        return finalBearing(other, BearingFormat.STRING);
    }

    public Point midpoint(final Point other) {
        return GreatCircle.midpoint(this, other);
    }

    /**
     * @param bearing direction of travel in degrees
     * @param distance distance in this point's unit
     */
    public Point destination(final double bearing, final double distance) {
        return GreatCircle.destination(this, bearing, distance);
    }

    /** Forward geodesic, same as {@link #destination(double, double)}. */
    public Point forward(final double bearing, final double distance) {
        return destination(bearing, distance);
    }

    public Inverse inverse(final Point other) {
        return GreatCircle.inverse(this, other);
    }

    /**
     * @param accuracy distance in this point's unit
     * @return true if {@code other} is closer than {@code accuracy}
     */
    public boolean isWithin(final Point other, final double accuracy) {
        return distance(other) < accuracy;
    }

    public String toGridLocator() {
        return toGridLocator(LocatorPrecision.SQUARE);
    }

    public String toGridLocator(final LocatorPrecision precision) {
        return GridLocator.encode(latitude, longitude, precision);
    }

    // ---------- Solar events ----------

    public Optional<LocalTime> sunrise(final LocalDate date) {
        return sunrise(date, Zenith.OFFICIAL);
    }

    public Optional<LocalTime> sunrise(final LocalDate date, final Zenith zenith) {
        return SolarEvents.sunRiseSet(latitude, longitude, date, SunMode.RISE, timezone, zenith);
    }

    public Optional<LocalTime> sunset(final LocalDate date) {
        return sunset(date, Zenith.OFFICIAL);
    }

    public Optional<LocalTime> sunset(final LocalDate date, final Zenith zenith) {
        return SolarEvents.sunRiseSet(latitude, longitude, date, SunMode.SET, timezone, zenith);
    }

    public SunEvents sunEvents(final LocalDate date) {
        return sunEvents(date, Zenith.OFFICIAL);
    }

    public SunEvents sunEvents(final LocalDate date, final Zenith zenith) {
        return SolarEvents.sunEvents(latitude, longitude, date, timezone, zenith);
    }

    // ---------- Identity ----------

    /**
     * @return e.g. {@code Point(52.015, -0.221, 'metric', 0)}
     */
    public String toCanonicalString() {
        return "Point(" + latitude + ", " + longitude + ", '" + units.token() + "', " + timezone + ")";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        return toCanonicalString().equals(((Point) o).toCanonicalString());
    }

    @Override
    public int hashCode() {
        return toCanonicalString().hashCode();
    }

    @Override
    public String toString() {
        return format(PointFormat.DD);
    }
}
