package in.optionsnap.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "OPTIONSNAP_ENV_TEST";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testFallsBackToSystemProperty() {
        System.setProperty(KEY, "value");

        assertEquals("value", Env.get(KEY, "default"));
    }

    @Test
    void testDefaultsWhenAbsentOrInvalid() {
        assertEquals(42, Env.getInt(KEY, 42));

        System.setProperty(KEY, "forty-two");
        assertEquals(42, Env.getInt(KEY, 42), "Unparseable number falls back");
        assertEquals(Duration.ofSeconds(61), Env.getSeconds(KEY, 61));
        assertEquals(LocalTime.of(2, 0), Env.getTime(KEY, LocalTime.of(2, 0)));
    }

    @Test
    void testTypedValues() {
        System.setProperty(KEY, "1500");
        assertEquals(Duration.ofMillis(1500), Env.getMillis(KEY, 1000));
        assertEquals(Duration.ofSeconds(1500), Env.getSeconds(KEY, 30));

        System.setProperty(KEY, "true");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "03:30");
        assertEquals(LocalTime.of(3, 30), Env.getTime(KEY, LocalTime.of(2, 0)));
    }
}
