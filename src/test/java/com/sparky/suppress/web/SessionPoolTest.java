package com.sparky.suppress.web;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionPoolTest {

    @Test
    void testSessions_distinctPerSlot() {
        SessionPool pool = new SessionPool(3, Duration.ofSeconds(1));

        assertEquals(3, pool.size());
        assertNotSame(pool.session(0), pool.session(1));
        assertSame(pool.session(2), pool.session(2));
        assertEquals(Duration.ofSeconds(1), pool.session(0).connectTimeout().orElseThrow());
    }

    @Test
    void testConstructor_rejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new SessionPool(0, Duration.ofSeconds(1)));
    }
}
