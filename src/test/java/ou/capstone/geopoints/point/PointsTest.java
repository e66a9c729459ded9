package ou.capstone.geopoints.point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import ou.capstone.geopoints.exceptions.GeoValueException;
import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.route.DistanceMethod;
import ou.capstone.geopoints.route.Inverse;
import ou.capstone.geopoints.solar.SunEvents;
import ou.capstone.geopoints.solar.Zenith;

/**
 * Unit tests for Points
 */
class PointsTest {

    private static final double TOLERANCE = 0.001;

    private static final Point HOME = new Point(52.015, -0.221);
    private static final Point TARGET = new Point(52.6333, -2.5);
    private static final Point CAMBRIDGE = new Point(52.168, 0.040);

    private final Points route = new Points(List.of(HOME, CAMBRIDGE, TARGET));

    @Test
    void testParse_CoordinatesAndLocators() {
        Points parsed = Points.parse(List.of("52.015;-0.221", "IO92va", "52.6333 N 2.5 W"), DistanceUnit.NAUTICAL);

        assertEquals(3, parsed.size());
        assertEquals(HOME.withUnits(DistanceUnit.NAUTICAL), parsed.get(0));
        assertEquals(52.020833, parsed.get(1).getLatitude(), 1e-6);
        assertEquals(-2.5, parsed.get(2).getLongitude(), 0.0);
    }

    @Test
    void testParse_Garbage() {
        assertThrows(GeoValueException.class, () -> Points.parse(List.of("home"), DistanceUnit.METRIC));
    }

    @Test
    void testDistances() {
        List<Double> distances = route.distances();
        assertEquals(2, distances.size());
        assertEquals(24.630, distances.get(0), TOLERANCE);
        assertEquals(distances, route.distances(DistanceMethod.HAVERSINE));
        assertEquals(distances.get(1), route.distances(DistanceMethod.SLOC).get(1), 1e-6);
    }

    @Test
    void testBearingsAndMidpoints() {
        assertEquals(46.242, route.bearings().get(0), TOLERANCE);
        assertEquals(2, route.finalBearings().size());

        List<Inverse> inverses = route.inverses();
        assertEquals(route.bearings().get(1), inverses.get(1).bearing(), 0.0);
        assertEquals(route.distances().get(1), inverses.get(1).distance(), 0.0);

        Point midpoint = new Points(List.of(HOME, TARGET)).midpoints().get(0);
        assertEquals(52.329631405407014, midpoint.getLatitude(), 1e-9);
    }

    @Test
    void testPairwise_NeedsTwoPoints() {
        Points single = new Points(List.of(HOME));
        IllegalStateException e = assertThrows(IllegalStateException.class, single::distances);
        assertEquals("More than one location is required", e.getMessage());
        assertThrows(IllegalStateException.class, single::bearings);
        assertThrows(IllegalStateException.class, new Points(List.of())::midpoints);
    }

    @Test
    void testWithin() {
        List<Point> near = route.within(HOME, 30);
        assertEquals(List.of(HOME, CAMBRIDGE), near);
        assertTrue(route.within(HOME, 0).isEmpty());
    }

    @Test
    void testWithin_RangeInLocationUnit() {
        // Cambridge is 24.6 km, 13.3 nautical miles, from home
        Point nauticalHome = HOME.withUnits(DistanceUnit.NAUTICAL);
        assertEquals(List.of(HOME, CAMBRIDGE), route.within(nauticalHome, 14));
        assertEquals(List.of(HOME), route.within(nauticalHome, 13));
    }

    @Test
    void testDestinations() {
        List<Point> destinations = route.destinations(240, 42);
        assertEquals(3, destinations.size());
        assertEquals(51.82483, destinations.get(0).getLatitude(), 1e-5);
        assertEquals(-0.75058, destinations.get(0).getLongitude(), 1e-5);
        assertEquals(51.97783, destinations.get(1).getLatitude(), 1e-5);
    }

    @Test
    void testSunEvents() {
        LocalDate date = LocalDate.of(2007, 6, 15);
        List<Optional<LocalTime>> sunrises = route.sunrises(date, Zenith.OFFICIAL);
        assertEquals(Optional.of(LocalTime.of(3, 40)), sunrises.get(0));
        assertEquals(Optional.of(LocalTime.of(20, 22)), route.sunsets(date, null).get(0));

        List<SunEvents> astronomical = route.sunEvents(date, Zenith.ASTRONOMICAL);
        assertTrue(astronomical.get(0).rise().isEmpty());
    }

    @Test
    void testGridLocators() {
        assertEquals(List.of("IO92", "JO02", "IO82"), route.gridLocators(LocatorPrecision.SQUARE));
    }

    @Test
    void testToString() {
        assertEquals("Points([Point(52.015, -0.221, 'metric', 0), Point(52.168, 0.04, 'metric', 0)])",
                new Points(List.of(HOME, CAMBRIDGE)).toString());
    }
}
