package ou.capstone.geopoints.point;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Reference ellipsoids, as equatorial and polar radius in kilometres.
 */
public enum Ellipsoid {
    /** Ordnance Survey default. */
    AIRY_1830("Airy (1830)", 6377.563, 6356.257),
    BESSEL("Bessel", 6377.397, 6356.079),
    CLARKE_1880("Clarke (1880)", 6378.249145, 6356.51486955),
    FAI_SPHERE("FAI sphere", 6371, 6371),
    GRS_67("GRS-67", 6378.160, 6356.775),
    INTERNATIONAL("International", 6378.388, 6356.912),
    KRASOVSKY("Krasovsky", 6378.245, 6356.863),
    NAD27("NAD27", 6378.206, 6356.584),
    WGS66("WGS66", 6378.145, 6356.758),
    WGS72("WGS72", 6378.135, 6356.751),
    /** GPS default. */
    WGS84("WGS84", 6378.137, 6356.752);

    private final String displayName;
    private final double major;
    private final double minor;

    Ellipsoid(final String displayName, final double major, final double minor) {
        this.displayName = displayName;
        this.major = major;
        this.minor = minor;
    }

    public String displayName() {
        return displayName;
    }

    /** @return equatorial radius in kilometres */
    public double major() {
        return major;
    }

    /** @return polar radius in kilometres */
    public double minor() {
        return minor;
    }

    /**
     * Resolves a model by its display name, e.g. "Airy (1830)", or its
     * constant name, e.g. "AIRY_1830".
     */
    public static Ellipsoid fromString(final String token) {
        for (final Ellipsoid ellipsoid : values()) {
            if (ellipsoid.displayName.equals(token) || ellipsoid.name().equals(token)) {
                return ellipsoid;
            }
        }
        throw new GeoValueException(ErrorCode.UNKNOWN_ELLIPSOID, "Unknown ellipsoid " + token);
    }
}
