package ou.capstone.geopoints.angle;

/**
 * Degrees, minutes and seconds of an angle. Each component carries the sign of
 * the whole angle; in {@link DmsStyle#DM} form the minutes are fractional and
 * seconds are zero.
 */
public record Dms(double degrees, double minutes, double seconds) {

    public Dms(final double degrees, final double minutes) {
        this(degrees, minutes, 0.0);
    }

    /** @return the angle in decimal degrees */
    public double toDecimal() {
        return Angles.toDd(degrees, minutes, seconds);
    }
}
