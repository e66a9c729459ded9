package ou.capstone.geopoints.point;

import java.time.Instant;

/**
 * Point with the instant it was visited, e.g. a GPS track fix.
 */
public record TimedPoint(Point point, Instant time) {
}
