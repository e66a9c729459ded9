package ou.capstone.geopoints.solar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

/**
 * Unit tests for SolarEvents
 */
class SolarEventsTest {

    private static final double HOME_LAT = 52.015;
    private static final double HOME_LON = -0.221;
    private static final LocalDate MIDSUMMER_2007 = LocalDate.of(2007, 6, 15);

    private static LocalTime time(String text) {
        return LocalTime.parse(text);
    }

    @ParameterizedTest
    @CsvSource({
            "2007-06-15, 03:40",
            "1993-12-11, 07:58",
            "2007-02-21, 07:04",
            "2007-01-21, 07:56"
    })
    void testSunrise(LocalDate date, String expected) {
        assertEquals(Optional.of(time(expected)),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, date, SunMode.RISE, 0, Zenith.OFFICIAL));
    }

    @ParameterizedTest
    @CsvSource({
            "2007-06-15, 20:22",
            "1993-12-11, 15:49"
    })
    void testSunset(LocalDate date, String expected) {
        assertEquals(Optional.of(time(expected)),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, date, SunMode.SET, 0, Zenith.OFFICIAL));
    }

    /** Other ports of the almanac routine give 20:22 for this sunset. */
    @Test
    void testSunEvents_LateJune() {
        SunEvents events = SolarEvents.sunEvents(HOME_LAT, HOME_LON, LocalDate.of(2007, 6, 28), 0, Zenith.OFFICIAL);
        assertEquals(Optional.of(time("03:42")), events.rise());
        assertEquals(Optional.of(time("20:24")), events.set());
    }

    @Test
    void testTimezoneOffset() {
        assertEquals(Optional.of(time("04:40")),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, SunMode.RISE, 60, Zenith.OFFICIAL));
        assertEquals(Optional.of(time("21:22")),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, SunMode.SET, 60, Zenith.OFFICIAL));
    }

    @Test
    void testTimezoneOffset_LateEvening() {
        assertEquals(Optional.of(time("23:22")),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, SunMode.SET, 180, Zenith.OFFICIAL));
        assertEquals(Optional.of(time("23:40")),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, SunMode.RISE, -240, Zenith.OFFICIAL));
    }

    /**
     * Local times between 23:00 and 24:00 are wrapped back a day and come out
     * as roughly an hour later, past midnight. Pinned so a change to the
     * wraparound is deliberate.
     */
    @Test
    void testTimezoneOffset_WraparoundQuirkBetween23And24() {
        assertEquals(Optional.of(time("22:23")),
                SolarEvents.sunRiseSet(40.638611, -73.762222, MIDSUMMER_2007, SunMode.RISE, 780, Zenith.OFFICIAL));
        assertEquals(Optional.of(time("00:24")),
                SolarEvents.sunRiseSet(40.638611, -73.762222, MIDSUMMER_2007, SunMode.RISE, 840, Zenith.OFFICIAL));
        assertEquals(Optional.of(time("00:23")),
                SolarEvents.sunRiseSet(40.638611, -73.762222, MIDSUMMER_2007, SunMode.RISE, 900, Zenith.OFFICIAL));
    }

    @Test
    void testNullZenithIsOfficial() {
        assertEquals(Optional.of(time("03:40")),
                SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, SunMode.RISE, 0, null));
    }

    @Test
    void testEventsWrapAroundMidnight() {
        SunEvents jfk = SolarEvents.sunEvents(40.638611, -73.762222, MIDSUMMER_2007, 0, Zenith.OFFICIAL);
        assertEquals(Optional.of(time("09:23")), jfk.rise());
        assertEquals(Optional.of(time("00:27")), jfk.set());

        SunEvents tokyo = SolarEvents.sunEvents(35.549999, 139.78333333, MIDSUMMER_2007, 0, Zenith.OFFICIAL);
        assertEquals(Optional.of(time("19:24")), tokyo.rise());
        assertEquals(Optional.of(time("09:57")), tokyo.set());
    }

    @ParameterizedTest
    @CsvSource({
            "CIVIL, 52.015, -0.221, 02:51, 21:11",
            "CIVIL, 40.638611, -73.762222, 08:50, 01:00",
            "CIVIL, 49.016666, -2.5333333, 03:22, 20:58",
            "CIVIL, 35.549999, 139.78333333, 18:54, 10:27",
            "NAUTICAL, 52.015, -0.221, 01:32, 22:30",
            "NAUTICAL, 40.638611, -73.762222, 08:07, 01:44",
            "NAUTICAL, 49.016666, -2.5333333, 02:20, 22:00",
            "NAUTICAL, 35.549999, 139.78333333, 18:17, 11:05",
            "ASTRONOMICAL, 40.638611, -73.762222, 07:14, 02:36",
            "ASTRONOMICAL, 35.549999, 139.78333333, 17:34, 11:48"
    })
    void testTwilight(Zenith zenith, double latitude, double longitude, String rise, String set) {
        SunEvents events = SolarEvents.sunEvents(latitude, longitude, MIDSUMMER_2007, 0, zenith);
        assertEquals(Optional.of(time(rise)), events.rise());
        assertEquals(Optional.of(time(set)), events.set());
    }

    @Test
    void testNoAstronomicalNightInSummer() {
        SunEvents home = SolarEvents.sunEvents(HOME_LAT, HOME_LON, MIDSUMMER_2007, 0, Zenith.ASTRONOMICAL);
        assertFalse(home.rise().isPresent());
        assertFalse(home.set().isPresent());

        SunEvents paris = SolarEvents.sunEvents(49.016666, -2.5333333, MIDSUMMER_2007, 0, Zenith.ASTRONOMICAL);
        assertTrue(paris.rise().isEmpty());
    }

    @Test
    void testPolarNightAndDay() {
        assertTrue(SolarEvents.sunRiseSet(89, 0, LocalDate.of(2007, 12, 21), SunMode.RISE, 0, Zenith.OFFICIAL)
                .isEmpty(), "Sun does not rise in polar night");
        assertTrue(SolarEvents.sunRiseSet(89, 0, LocalDate.of(2007, 6, 21), SunMode.SET, 0, Zenith.OFFICIAL)
                .isEmpty(), "Sun does not set in polar day");
    }

    @Test
    void testInvalidArguments() {
        GeoValueException e = assertThrows(GeoValueException.class,
                () -> SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, MIDSUMMER_2007, null, 0, Zenith.OFFICIAL));
        assertEquals(ErrorCode.UNKNOWN_MODE, e.getCode());

        assertThrows(NullPointerException.class,
                () -> SolarEvents.sunRiseSet(HOME_LAT, HOME_LON, null, SunMode.RISE, 0, Zenith.OFFICIAL));
    }

    @Test
    void testZenithAndModeFromString() {
        assertEquals(Zenith.OFFICIAL, Zenith.fromString(null));
        assertEquals(Zenith.OFFICIAL, Zenith.fromString(""));
        assertEquals(Zenith.NAUTICAL, Zenith.fromString("nautical"));
        assertEquals(-50 / 60.0, Zenith.OFFICIAL.degrees(), 0.0);
        assertEquals(ErrorCode.UNKNOWN_ZENITH,
                assertThrows(GeoValueException.class, () -> Zenith.fromString("golden")).getCode());

        assertEquals(SunMode.SET, SunMode.fromString("set"));
        assertEquals(ErrorCode.UNKNOWN_MODE,
                assertThrows(GeoValueException.class, () -> SunMode.fromString("noon")).getCode());
    }
}
