package io.mural.server.replication;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaults_double_from_200ms_up_to_5s() {
        var p = RetryPolicy.defaults();

        assertEquals(Duration.ofMillis(200), p.delayAfter(1));
        assertEquals(Duration.ofMillis(400), p.delayAfter(2));
        assertEquals(Duration.ofMillis(800), p.delayAfter(3));
        assertEquals(Duration.ofMillis(3200), p.delayAfter(5));
        assertEquals(Duration.ofSeconds(5), p.delayAfter(6));
        assertEquals(Duration.ofSeconds(5), p.delayAfter(1000), "no overflow for large attempt numbers");
        assertEquals(5, p.maxAttempts());
    }

    @Test
    void attempts_left_counts_the_first_attempt() {
        var p = new RetryPolicy(Duration.ofMillis(1), Duration.ofMillis(2), 3);

        assertTrue(p.hasAttemptsLeft(1));
        assertTrue(p.hasAttemptsLeft(2));
        assertFalse(p.hasAttemptsLeft(3));
    }

    @Test
    void rejects_nonsense() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ZERO, Duration.ofSeconds(1), 3));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 3));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ofMillis(1), Duration.ofSeconds(1), 0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().delayAfter(0));
    }
}
