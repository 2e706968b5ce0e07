package net.spookly.proxygroup.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

class ProbeContextTest {
    @Test
    void timeoutFinishesContext() throws InterruptedException {
        ProbeContext context = ProbeContext.withTimeout(Duration.ofMillis(50));
        CountDownLatch done = new CountDownLatch(1);
        context.whenDone(cause -> done.countDown());

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(context.isDone());
        assertInstanceOf(TimeoutException.class, context.cause());
        assertEquals(Duration.ZERO, context.remaining(Duration.ofSeconds(10)));
    }

    @Test
    void cancelKeepsFirstCause() {
        ProbeContext context = ProbeContext.background();
        assertFalse(context.isDone());
        assertNull(context.cause());
        assertEquals(Duration.ofSeconds(3), context.remaining(Duration.ofSeconds(3)));

        context.cancel();
        context.cancel();

        assertInstanceOf(CancellationException.class, context.cause());
    }

    @Test
    void callbackRegisteredAfterDoneRunsImmediately() {
        ProbeContext context = ProbeContext.background();
        context.cancel();
        AtomicReference<Throwable> seen = new AtomicReference<>();

        context.whenDone(seen::set);

        assertInstanceOf(CancellationException.class, seen.get());
    }

    @Test
    void detachedCallbackIsNotRun() {
        ProbeContext context = ProbeContext.background();
        AtomicReference<Throwable> seen = new AtomicReference<>();
        Runnable detach = context.whenDone(seen::set);
        assertEquals(1, context.pendingCallbacks());

        detach.run();
        context.cancel();

        assertNull(seen.get());
        assertEquals(0, context.pendingCallbacks());
    }
}
