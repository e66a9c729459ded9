package ou.capstone.geopoints.angle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

class CompassRoseTest {

    @Test
    void testNames_SixteenPointRose() {
        assertEquals(List.of("North", "North-north-east", "North-east", "East-north-east",
                "East", "East-south-east", "South-east", "South-south-east",
                "South", "South-south-west", "South-west", "West-south-west",
                "West", "West-north-west", "North-west", "North-north-west"),
                CompassRose.names(false));
    }

    @Test
    void testNames_Abbreviated() {
        assertEquals(List.of("N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
                "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"),
                CompassRose.names(true));
    }

    @ParameterizedTest
    @CsvSource({
            "0, North",
            "360, North",
            "45, North-east",
            "292, West",
            "293, North-west",
            "359, North",
            "-10, North",
    })
    void testAngleToName_DefaultEightSegments(double angle, String expected) {
        assertEquals(expected, CompassRose.angleToName(angle));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 4, false, North",
            "360, 16, false, North",
            "45, 4, true, E",
            "44, 4, true, N",
            "292, 16, true, WNW",
            "180, 16, true, S",
            "100, 16, false, East",
            "90, 4, false, East",
            "135, 4, false, South",
            "270, 4, true, W",
    })
    void testAngleToName(double angle, int segments, boolean abbreviated, String expected) {
        assertEquals(expected, CompassRose.angleToName(angle, segments, abbreviated));
    }

    @Test
    void testAngleToName_UnsupportedSegments() {
        GeoValueException e = assertThrows(GeoValueException.class,
                () -> CompassRose.angleToName(10, 12, false));
        assertEquals(ErrorCode.UNSUPPORTED_SEGMENT_COUNT, e.getCode());
    }
}
