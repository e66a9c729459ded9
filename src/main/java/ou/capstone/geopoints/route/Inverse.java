package ou.capstone.geopoints.route;

/**
 * Result of the inverse geodesic problem: initial bearing in degrees and
 * distance in the start point's unit.
 */
public record Inverse(double bearing, double distance) {
}
