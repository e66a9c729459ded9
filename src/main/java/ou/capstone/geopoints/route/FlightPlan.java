package ou.capstone.geopoints.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.point.Point;

/**
 * FlightPlan
 *
 * - Splits an ordered list of waypoints into great-circle legs
 * - Estimates elapsed time per leg from a ground speed
 * - Summarises the overall route against the direct route
 *
 * Distances and speed use the first waypoint's unit; speed is per hour.
 */
public final class FlightPlan {
    private static final Logger logger = LoggerFactory.getLogger(FlightPlan.class);

    /** One leg of the plan, ending at {@code to}. */
    public record Leg(Point from, Point to, double bearing, double distance, OptionalDouble elapsed) {
    }

    private final List<Point> waypoints;
    private final List<Leg> legs;
    private final double speed;
    private final ElapsedTimeUnit timeUnit;

    private FlightPlan(final List<Point> waypoints, final List<Leg> legs,
                       final double speed, final ElapsedTimeUnit timeUnit) {
        this.waypoints = waypoints;
        this.legs = legs;
        this.speed = speed;
        this.timeUnit = timeUnit;
    }

    /**
     * Builds the plan.
     *
     * @param waypoints route, in order of travel
     * @param speed ground speed per hour; 0 means elapsed times are not estimated
     * @param timeUnit unit for elapsed times
     * @throws IllegalStateException if fewer than two waypoints are given
     * @throws IllegalArgumentException if speed is negative
     */
    public static FlightPlan plan(final List<Point> waypoints, final double speed,
                                  final ElapsedTimeUnit timeUnit) {
        if (waypoints == null || waypoints.size() < 2) {
            throw new IllegalStateException("More than one location is required");
        }
        if (speed < 0) {
            logger.error("Invalid speed value: {}. Speed must not be negative.", speed);
            throw new IllegalArgumentException("Speed must not be negative, got: " + speed);
        }
        if (timeUnit == null) {
            throw new IllegalArgumentException("Time unit is required");
        }

        final List<Leg> legs = new ArrayList<>(waypoints.size() - 1);
        for (int i = 1; i < waypoints.size(); i++) {
            final Point from = waypoints.get(i - 1);
            final Point to = waypoints.get(i);
            final Inverse inverse = GreatCircle.inverse(from, to);
            legs.add(new Leg(from, to, inverse.bearing(), inverse.distance(),
                    elapsed(inverse.distance(), speed, timeUnit)));
        }
        logger.debug("Planned {} legs at speed {}", legs.size(), speed);
        return new FlightPlan(List.copyOf(waypoints), Collections.unmodifiableList(legs), speed, timeUnit);
    }

    private static OptionalDouble elapsed(final double distance, final double speed,
                                          final ElapsedTimeUnit timeUnit) {
        if (speed == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(timeUnit.fromHours(distance / speed));
    }

    public List<Point> getWaypoints() {
        return waypoints;
    }

    public List<Leg> getLegs() {
        return legs;
    }

    public double getSpeed() {
        return speed;
    }

    public ElapsedTimeUnit getTimeUnit() {
        return timeUnit;
    }

    /** @return true if elapsed times are estimated */
    public boolean hasSpeed() {
        return speed != 0;
    }

    /** Sum of all leg distances. */
    public double overallDistance() {
        double total = 0;
        for (final Leg leg : legs) {
            total += leg.distance();
        }
        return total;
    }

    public OptionalDouble overallElapsed() {
        return elapsed(overallDistance(), speed, timeUnit);
    }

    /** Bearing and distance straight from the first waypoint to the last. */
    public Inverse direct() {
        return GreatCircle.inverse(waypoints.get(0), waypoints.get(waypoints.size() - 1));
    }

    public OptionalDouble directElapsed() {
        return elapsed(direct().distance(), speed, timeUnit);
    }
}
