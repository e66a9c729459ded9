package ou.capstone.geopoints.point;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered track of timed points.
 */
public final class TimedPoints {

    private final List<TimedPoint> points;

    public TimedPoints(final List<TimedPoint> points) {
        this.points = List.copyOf(points);
    }

    public List<TimedPoint> asList() {
        return points;
    }

    /** Positions without their timestamps. */
    public Points toPoints() {
        return new Points(points.stream().map(TimedPoint::point).collect(Collectors.toList()));
    }

    /**
     * Average speed over each leg, in the leg start point's unit per hour.
     *
     * @throws IllegalStateException if there are fewer than two points
     * @throws IllegalArgumentException if a leg takes no time
     */
    public List<Double> speeds() {
        final List<Double> distances = toPoints().distances();
        final List<Double> speeds = new ArrayList<>(distances.size());
        for (int i = 0; i < distances.size(); i++) {
            final Duration elapsed = Duration.between(points.get(i).time(), points.get(i + 1).time());
            if (elapsed.isZero()) {
                throw new IllegalArgumentException("No time elapsed between points " + i + " and " + (i + 1));
            }
            final double hours = elapsed.toNanos() / 3_600_000_000_000.0;
            speeds.add(distances.get(i) / hours);
        }
        return speeds;
    }
}
