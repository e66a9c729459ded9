package ou.capstone.geopoints.point;

/**
 * Point labelled with its configured name or its position on the command line.
 */
public record NamedPoint(String name, Point point) {
}
