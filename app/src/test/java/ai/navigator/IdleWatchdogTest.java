package ai.navigator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IdleWatchdogTest {

    @Test
    void testFiresOnceAfterTimeout() throws Exception {
        var fired = new AtomicInteger();
        var latch = new CountDownLatch(1);
        long lastActivity = System.currentTimeMillis();
        try (var watchdog = new IdleWatchdog(100, () -> lastActivity, () -> {
            fired.incrementAndGet();
            latch.countDown();
        })) {
            watchdog.start();
            assertTrue(latch.await(5, TimeUnit.SECONDS));
            Thread.sleep(300);
            assertEquals(1, fired.get());
        }
    }

    @Test
    void testActivityPostponesShutdown() throws Exception {
        var fired = new AtomicInteger();
        try (var watchdog = new IdleWatchdog(500, System::currentTimeMillis, fired::incrementAndGet)) {
            watchdog.start();
            Thread.sleep(800);
            assertEquals(0, fired.get());
        }
    }
}
