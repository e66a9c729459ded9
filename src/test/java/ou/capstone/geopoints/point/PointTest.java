package ou.capstone.geopoints.point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ou.capstone.geopoints.angle.Dms;
import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;
import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.route.BearingFormat;
import ou.capstone.geopoints.route.Inverse;
import ou.capstone.geopoints.solar.SunEvents;
import ou.capstone.geopoints.solar.Zenith;

/**
 * Unit tests for Point
 */
class PointTest {

    private static final double TOLERANCE = 1e-9;

    private static final Point HOME = new Point(52.015, -0.221);
    private static final Point TARGET = new Point(52.6333, -2.5);

    @Test
    void testConstructor_DegreesAndRadiansAgree() {
        Point radians = new Point(Math.toRadians(52.015), Math.toRadians(-0.221),
                DistanceUnit.METRIC, AngleMode.RADIANS, 0);

        assertEquals(52.015, radians.getLatitude(), TOLERANCE);
        assertEquals(-0.221, radians.getLongitude(), TOLERANCE);
        assertEquals(HOME.radLatitude, radians.radLatitude, TOLERANCE);
        assertEquals(Math.toRadians(-0.221), HOME.radLongitude, 0.0);
    }

    @Test
    void testConstructor_FromSexagesimal() {
        Point point = new Point(new Dms(50, 20, 10), new Dms(-1, -3, -12));
        assertEquals(50.336111111111116, point.getLatitude(), TOLERANCE);
        assertEquals(-1.0533333333333335, point.getLongitude(), TOLERANCE);
    }

    @ParameterizedTest
    @CsvSource({
            "91, 0, INVALID_LATITUDE",
            "-90.0001, 0, INVALID_LATITUDE",
            "NaN, 0, INVALID_LATITUDE",
            "0, 180.5, INVALID_LONGITUDE",
            "0, -181, INVALID_LONGITUDE"
    })
    void testConstructor_OutOfRange(double latitude, double longitude, ErrorCode code) {
        GeoValueException e = assertThrows(GeoValueException.class, () -> new Point(latitude, longitude));
        assertEquals(code, e.getCode());
    }

    @Test
    void testConstructor_RangeLimitsAccepted() {
        Point corner = new Point(-90, 180);
        assertEquals(-90.0, corner.getLatitude(), 0.0);
        assertEquals(180.0, corner.getLongitude(), 0.0);
    }

    @Test
    void testConstructor_MissingModeOrUnit() {
        assertEquals(ErrorCode.INVALID_ANGLE_MODE, assertThrows(GeoValueException.class,
                () -> new Point(0, 0, DistanceUnit.METRIC, null, 0)).getCode());
        assertEquals(ErrorCode.UNKNOWN_UNIT, assertThrows(GeoValueException.class,
                () -> new Point(0, 0, null)).getCode());
        assertEquals(ErrorCode.INVALID_ANGLE_MODE, assertThrows(GeoValueException.class,
                () -> AngleMode.fromString("gradians")).getCode());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "52.015 | -0.221 | DD | N52.015°; W000.221°",
            "52.015 | -0.221 | DM | 52°00.90′N, 000°13.26′W",
            "52.015 | -0.221 | DMS | 52°00′54″N, 000°13′16″W",
            "52.015 | -0.221 | LOCATOR | IO92",
            "-33.8688 | 151.2093 | DD | S33.869°; E151.209°",
            "-33.8688 | 151.2093 | DM | 33°52.13′S, 151°12.56′E",
            "-33.8688 | 151.2093 | DMS | 33°52′08″S, 151°12′33″E",
            "0 | 0 | DMS | 00°00′00″N, 000°00′00″E"
    })
    void testFormat(double latitude, double longitude, PointFormat format, String expected) {
        assertEquals(expected, new Point(latitude, longitude).format(format));
    }

    @Test
    void testFormat_RoundingCarriesIntoDegrees() {
        Point point = new Point(52 + 59.996 / 60, -(0.5 + 59.6 / 3600));
        assertEquals("53°00.00′N, 000°30.99′W", point.format(PointFormat.DM));
        assertEquals("53°00′00″N, 000°31′00″W", point.format(PointFormat.DMS));
    }

    @Test
    void testFormat_ToStringIsDecimal() {
        assertEquals("N52.015°; W000.221°", HOME.toString());
        assertEquals(ErrorCode.UNKNOWN_FORMAT,
                assertThrows(GeoValueException.class, () -> HOME.format(null)).getCode());
        assertEquals(PointFormat.DD, PointFormat.fromString(""));
        assertEquals(ErrorCode.UNKNOWN_FORMAT,
                assertThrows(GeoValueException.class, () -> PointFormat.fromString("utm")).getCode());
    }

    @Test
    void testEquality_IncludesUnitsAndTimezone() {
        assertEquals(new Point(52.015, -0.221), HOME);
        assertEquals(HOME.hashCode(), new Point(52.015, -0.221).hashCode());
        assertNotEquals(HOME, HOME.withUnits(DistanceUnit.NAUTICAL));
        assertNotEquals(HOME, HOME.withTimezone(60));
        assertNotEquals(HOME, TARGET);
        assertEquals("Point(52.015, -0.221, 'metric', 0)", HOME.toCanonicalString());
        assertEquals("Point(52.015, -0.221, 'nautical', 60)",
                HOME.withUnits(DistanceUnit.NAUTICAL).withTimezone(60).toCanonicalString());
    }

    @Test
    void testRelocate_KeepsUnitsAndRevalidates() {
        Point nautical = HOME.withUnits(DistanceUnit.NAUTICAL);
        Point moved = nautical.relocate(52.6333, -2.5);

        assertEquals(DistanceUnit.NAUTICAL, moved.getUnits());
        assertEquals(Math.toRadians(52.6333), moved.radLatitude, 0.0);
        assertThrows(GeoValueException.class, () -> nautical.relocate(95, 0));

        Point fromLocator = HOME.relocateToGridLocator("IO92va");
        assertEquals(52.020833333333333, fromLocator.getLatitude(), TOLERANCE);
        assertEquals(-0.208333333333343, fromLocator.getLongitude(), TOLERANCE);
        assertEquals(fromLocator, Point.fromGridLocator("IO92va", DistanceUnit.METRIC));
    }

    @Test
    void testGeometryDelegates() {
        assertEquals(169.3416655665351, HOME.distance(TARGET), TOLERANCE);
        assertEquals("294°", HOME.bearing(TARGET, BearingFormat.NUMERIC));
        assertEquals("North-west", HOME.bearingName(TARGET));
        assertEquals("North-west", HOME.finalBearingName(TARGET));
        assertEquals("West", TARGET.bearingName(new Point(52.6, -5.0)));

        Inverse inverse = HOME.inverse(TARGET);
        Point forward = HOME.forward(inverse.bearing(), inverse.distance());
        assertEquals(TARGET.getLatitude(), forward.getLatitude(), 1e-6);
        assertEquals(TARGET.getLongitude(), forward.getLongitude(), 1e-6);
    }

    @Test
    void testIsWithin() {
        assertTrue(HOME.isWithin(TARGET, 170));
        assertFalse(HOME.isWithin(TARGET, 169));
        assertFalse(HOME.isWithin(HOME, 0), "Range is exclusive");
        assertTrue(HOME.withUnits(DistanceUnit.NAUTICAL).isWithin(TARGET, 92));
    }

    @Test
    void testGridLocator() {
        assertEquals("IO92", HOME.toGridLocator());
        assertEquals("IO92va33", HOME.toGridLocator(LocatorPrecision.EXTSQUARE));
    }

    @Test
    void testSunEvents_UseTimezone() {
        LocalDate date = LocalDate.of(2007, 6, 15);
        assertEquals(Optional.of(LocalTime.of(3, 40)), HOME.sunrise(date));
        assertEquals(Optional.of(LocalTime.of(21, 22)), HOME.withTimezone(60).sunset(date));
        assertEquals(Optional.of(LocalTime.of(2, 51)), HOME.sunrise(date, Zenith.CIVIL));

        SunEvents events = HOME.sunEvents(date, Zenith.ASTRONOMICAL);
        assertTrue(events.rise().isEmpty());
        assertTrue(events.set().isEmpty());
    }
}
