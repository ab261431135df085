package gcra.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class QuotaTest {

    @Test
    void testEmissionInterval_isPeriodOverBurst() {
        Quota quota = new Quota(10, Duration.ofSeconds(20));

        assertEquals(Duration.ofSeconds(2), quota.emissionInterval());
        assertEquals(2_000_000_000L, quota.emissionIntervalNanos());
        assertEquals(20_000_000_000L, quota.burstToleranceNanos());
        assertEquals(6_000_000_000L, quota.incrementIntervalNanos(3));
    }

    @Test
    void testEmissionInterval_floorsToWholeNanos() {
        Quota quota = new Quota(3, Duration.ofSeconds(1));

        assertEquals(333_333_333L, quota.emissionIntervalNanos());
        assertEquals(999_999_999L, quota.burstToleranceNanos());
        assertEquals(Duration.ofSeconds(1), quota.period());
        assertEquals(1_000_000_000L, quota.periodNanos());
    }

    @Test
    void testInvalidBurst_throws() {
        assertThrows(InvalidQuotaException.class, () -> new Quota(0, Duration.ofSeconds(1)));
        assertThrows(InvalidQuotaException.class, () -> new Quota(-5, Duration.ofSeconds(1)));
    }

    @Test
    void testInvalidPeriod_throws() {
        assertThrows(InvalidQuotaException.class, () -> new Quota(1, Duration.ZERO));
        assertThrows(InvalidQuotaException.class, () -> new Quota(1, Duration.ofMillis(-1)));
        assertThrows(InvalidQuotaException.class, () -> new Quota(1, null));
    }

    @Test
    void testPeriodTooShortForBurst_throws() {
        InvalidQuotaException e = assertThrows(
            InvalidQuotaException.class, () -> new Quota(5, Duration.ofNanos(4)));
        assertTrue(e.getMessage().contains("maxBurst 5"));

        assertDoesNotThrow(() -> new Quota(5, Duration.ofNanos(5)));
    }

    @Test
    void testPeriodOverflow_throws() {
        InvalidQuotaException e = assertThrows(
            InvalidQuotaException.class, () -> new Quota(1, Duration.ofDays(365L * 1_000)));
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void testInvalidQuota_isIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new Quota(0, Duration.ofSeconds(1)));
    }

    @Test
    void testFactories() {
        assertEquals(new Quota(100, Duration.ofSeconds(1)), Quota.perSecond(100));
        assertEquals(new Quota(60, Duration.ofMinutes(1)), Quota.perMinute(60));
        assertEquals(Duration.ofMinutes(1), Quota.perHour(60).emissionInterval());
    }

    @Test
    void testValueSemantics() {
        Quota a = new Quota(4, Duration.ofSeconds(4));
        Quota b = new Quota(4, Duration.ofMillis(4_000));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Quota(4, Duration.ofSeconds(8)));
        assertNotEquals(a, new Quota(2, Duration.ofSeconds(4)));
        assertTrue(a.toString().contains("maxBurst=4"));
    }
}
