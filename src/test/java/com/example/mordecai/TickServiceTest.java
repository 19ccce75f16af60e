package com.example.mordecai;

import com.example.mordecai.util.TickService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TickService Tests")
public class TickServiceTest {

    private TickService ticks;

    @BeforeEach
    void setUp() {
        ticks = new TickService(1);
    }

    @AfterEach
    void tearDown() {
        ticks.shutdown();
    }

    @Test
    void testScheduleAndCancel() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(3);
        ticks.scheduleAtFixedRate("counter", ran::countDown, 0, 10);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(ticks.isScheduled("counter"));
        assertTrue(ticks.cancel("counter"));
        assertFalse(ticks.isScheduled("counter"));
        assertFalse(ticks.cancel("counter"));
    }

    @Test
    @DisplayName("A throwing task keeps its schedule")
    void testFailingTaskKeepsRunning() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch ran = new CountDownLatch(3);
        ticks.scheduleAtFixedRate("flaky", () -> {
            calls.incrementAndGet();
            ran.countDown();
            throw new IllegalStateException("boom");
        }, 0, 10);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(calls.get() >= 3);
    }
}
