package ai.pipestream.regulatory.contentsync;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    private final RetryBackoff backoff = new RetryBackoff(Duration.ofSeconds(30), Duration.ofMinutes(30));

    @Test
    void testDoublesPerAttempt() {
        assertEquals(Duration.ofSeconds(30), backoff.delayFor(1));
        assertEquals(Duration.ofSeconds(60), backoff.delayFor(2));
        assertEquals(Duration.ofSeconds(120), backoff.delayFor(3));
        assertEquals(Duration.ofSeconds(240), backoff.delayFor(4));
    }

    @Test
    void testCappedAtMax() {
        assertEquals(Duration.ofMinutes(30), backoff.delayFor(8));
        assertEquals(Duration.ofMinutes(30), backoff.delayFor(1000));
    }

    @Test
    void testInitialAboveMax() {
        RetryBackoff inverted = new RetryBackoff(Duration.ofMinutes(5), Duration.ofMinutes(1));

        assertEquals(Duration.ofMinutes(1), inverted.delayFor(1));
        assertEquals(Duration.ofMinutes(1), inverted.delayFor(3));
    }
}
