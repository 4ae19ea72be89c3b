package in.tradepulse.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * JVM shutdown hook that stops the engine and ends the process with the
 * engine's own exit code.
 *
 * Without it a SIGTERM reports 143 even though the engine shut down cleanly:
 * the main thread's {@code System.exit} blocks while hooks are running.
 */
final class ShutdownHook implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

    private final Runnable stopEngine;
    private final IntConsumer halt;
    private final Duration grace;
    private final AtomicInteger exitCode = new AtomicInteger(SignalEngine.EXIT_OK);
    private final CountDownLatch mainDone = new CountDownLatch(1);

    ShutdownHook(Runnable stopEngine, IntConsumer halt, Duration grace) {
        this.stopEngine = stopEngine;
        this.halt = halt;
        this.grace = grace;
    }

    /**
     * Called by the main thread once the engine has reported how it ended.
     */
    void mainFinished(int code) {
        exitCode.set(code);
        mainDone.countDown();
    }

    @Override
    public void run() {
        stopEngine.run();
        try {
            if (!mainDone.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[ENGINE] Main thread did not finish within {}ms", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        halt.accept(exitCode.get());
    }
}
