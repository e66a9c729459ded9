package ou.capstone.geopoints.point;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import ou.capstone.geopoints.locator.GridLocator;
import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.route.DistanceMethod;
import ou.capstone.geopoints.route.Inverse;
import ou.capstone.geopoints.solar.SunEvents;
import ou.capstone.geopoints.solar.Zenith;

/**
 * Ordered series of points, e.g. the waypoints of a route.
 *
 * Pairwise operations work on consecutive points and return one result per
 * leg; they need at least two points. Per-point operations return one result
 * per point.
 */
public final class Points implements Iterable<Point> {

    private final List<Point> points;

    public Points(final List<Point> points) {
        this.points = List.copyOf(points);
    }

    /**
     * Parses location strings, falling back to a Maidenhead locator when a
     * string has none of the {@link LocationParser} shapes.
     *
     * @throws ou.capstone.geopoints.exceptions.GeoValueException if a string
     *         is neither
     */
    public static Points parse(final List<String> locations, final DistanceUnit units) {
        final List<Point> parsed = new ArrayList<>(locations.size());
        for (final String location : locations) {
            final LatLon latLon = LocationParser.parse(location).orElseGet(() -> GridLocator.decode(location));
            parsed.add(latLon.toPoint(units));
        }
        return new Points(parsed);
    }

    public List<Point> asList() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public Point get(final int index) {
        return points.get(index);
    }

    @Override
    public Iterator<Point> iterator() {
        return points.iterator();
    }

    // ---------- Pairwise ----------

    private <T> List<T> pairwise(final BiFunction<Point, Point, T> operation) {
        if (points.size() < 2) {
            throw new IllegalStateException("More than one location is required");
        }
        final List<T> results = new ArrayList<>(points.size() - 1);
        for (int i = 0; i < points.size() - 1; i++) {
            results.add(operation.apply(points.get(i), points.get(i + 1)));
        }
        return results;
    }

    public List<Double> distances() {
        return distances(DistanceMethod.HAVERSINE);
    }

    public List<Double> distances(final DistanceMethod method) {
        return pairwise((a, b) -> a.distance(b, method));
    }

    public List<Double> bearings() {
        return pairwise(Point::bearing);
    }

    public List<Double> finalBearings() {
        return pairwise(Point::finalBearing);
    }

    public List<Inverse> inverses() {
        return pairwise(Point::inverse);
    }

    public List<Point> midpoints() {
        return pairwise(Point::midpoint);
    }

    // ---------- Per point ----------

    /**
     * @param distance range in {@code location}'s unit
     * @return points closer to {@code location} than {@code distance}
     */
    public List<Point> within(final Point location, final double distance) {
        return points.stream()
                .filter(p -> location.isWithin(p, distance))
                .collect(Collectors.toList());
    }

    public List<Point> destinations(final double bearing, final double distance) {
        return points.stream()
                .map(p -> p.destination(bearing, distance))
                .collect(Collectors.toList());
    }

    public List<Optional<LocalTime>> sunrises(final LocalDate date, final Zenith zenith) {
        return points.stream()
                .map(p -> p.sunrise(date, zenith))
                .collect(Collectors.toList());
    }

    public List<Optional<LocalTime>> sunsets(final LocalDate date, final Zenith zenith) {
        return points.stream()
                .map(p -> p.sunset(date, zenith))
                .collect(Collectors.toList());
    }

    public List<SunEvents> sunEvents(final LocalDate date, final Zenith zenith) {
        return points.stream()
                .map(p -> p.sunEvents(date, zenith))
                .collect(Collectors.toList());
    }

    public List<String> gridLocators(final LocatorPrecision precision) {
        return points.stream()
                .map(p -> p.toGridLocator(precision))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return points.stream().map(Point::toCanonicalString).collect(Collectors.joining(", ", "Points([", "])"));
    }
}
