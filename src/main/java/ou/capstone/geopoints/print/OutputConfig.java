package ou.capstone.geopoints.print;

import ou.capstone.geopoints.point.DistanceUnit;
import ou.capstone.geopoints.point.PointFormat;

/**
 * Configuration for command line output.
 */
public record OutputConfig(
    /**
     * How locations are written when no locator precision is requested.
     */
    PointFormat format,

    /**
     * Unit for distances, also used when reading locations.
     */
    DistanceUnit units,

    /**
     * Whether to write full sentences ("Location 1 to 2 is 24 kilometres")
     * instead of bare values.
     */
    boolean verbose
) {
    /**
     * Creates a default OutputConfig: DMS locations, kilometres, bare values.
     */
    public static OutputConfig defaults() {
        return new OutputConfig(PointFormat.DMS, DistanceUnit.METRIC, false);
    }
}
