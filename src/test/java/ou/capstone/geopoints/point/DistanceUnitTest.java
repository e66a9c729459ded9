package ou.capstone.geopoints.point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ou.capstone.geopoints.exceptions.ErrorCode;
import ou.capstone.geopoints.exceptions.GeoValueException;

class DistanceUnitTest {

    @ParameterizedTest
    @CsvSource({
            "metric, METRIC",
            "km, METRIC",
            "imperial, IMPERIAL",
            "sm, IMPERIAL",
            "US customary, IMPERIAL",
            "nautical, NAUTICAL",
            "nm, NAUTICAL"
    })
    void testFromString(String token, DistanceUnit expected) {
        assertEquals(expected, DistanceUnit.fromString(token));
    }

    @Test
    void testFromString_Unknown() {
        GeoValueException e = assertThrows(GeoValueException.class, () -> DistanceUnit.fromString("furlongs"));
        assertEquals(ErrorCode.UNKNOWN_UNIT, e.getCode());
        assertEquals("Unknown units type furlongs", e.getMessage());
    }

    @Test
    void testConversions() {
        assertEquals(10.0, DistanceUnit.METRIC.fromKilometres(10.0), 0.0);
        assertEquals(10.0, DistanceUnit.NAUTICAL.fromKilometres(18.52), 1e-12);
        assertEquals(16.09, DistanceUnit.IMPERIAL.toKilometres(10.0), 1e-12);
        assertEquals("nautical miles", DistanceUnit.NAUTICAL.displayName());
        assertEquals("sm", DistanceUnit.IMPERIAL.abbreviation());
    }
}
