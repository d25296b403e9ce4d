package com.tickerbot.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TickerBotApplicationTest {

    @Test
    void run_shouldReturnUsageCodesWithoutTouchingDatabase() {
        TickerBotApplication app = new TickerBotApplication();

        assertEquals(TickerBotApplication.EXIT_OK, app.run(new String[]{"--help"}));
        assertEquals(TickerBotApplication.EXIT_USAGE, app.run(new String[]{}));
        assertEquals(TickerBotApplication.EXIT_USAGE, app.run(new String[]{"--run"}));
        assertEquals(TickerBotApplication.EXIT_USAGE, app.run(new String[]{"--unknown-flag"}));
    }

    @Test
    void cancelOnShutdown_shouldHoldUntilRunFinishes() throws InterruptedException {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        TickerBotApplication.CancelOnShutdown hook =
                new TickerBotApplication.CancelOnShutdown(() -> cancelled.set(true), Duration.ofSeconds(10));
        Thread shutdown = new Thread(hook, "test-shutdown");

        shutdown.start();
        shutdown.join(200L);

        assertTrue(cancelled.get());
        assertTrue(shutdown.isAlive(), "hook must wait for the run to record itself");

        hook.finished();
        shutdown.join(2_000L);
        assertFalse(shutdown.isAlive());
    }

    @Test
    void cancelOnShutdown_shouldGiveUpAfterGracePeriod() throws InterruptedException {
        TickerBotApplication.CancelOnShutdown hook =
                new TickerBotApplication.CancelOnShutdown(() -> { }, Duration.ofMillis(100));
        Thread shutdown = new Thread(hook, "test-shutdown");

        shutdown.start();
        shutdown.join(2_000L);

        assertFalse(shutdown.isAlive());
    }

    @Test
    void cancelOnShutdown_shouldSkipCancelWhenRunAlreadyFinished() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        TickerBotApplication.CancelOnShutdown hook =
                new TickerBotApplication.CancelOnShutdown(() -> cancelled.set(true), Duration.ofSeconds(10));

        hook.finished();
        hook.run();

        assertFalse(cancelled.get());
    }
}
