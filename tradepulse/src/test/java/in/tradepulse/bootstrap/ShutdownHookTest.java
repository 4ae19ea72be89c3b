package in.tradepulse.bootstrap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ShutdownHookTest {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Test
    void sigtermStopsEngineAndExitsZero() throws Exception {
        CompletableFuture<Void> engineStopped = new CompletableFuture<>();
        ShutdownHook hook = new ShutdownHook(() -> {
            events.add("stop");
            engineStopped.complete(null);
        }, code -> events.add("halt " + code), Duration.ofSeconds(5));

        // Main thread blocked in awaitExitCode until the engine stops
        Thread main = new Thread(() -> {
            engineStopped.join();
            events.add("main done");
            hook.mainFinished(SignalEngine.EXIT_OK);
        });
        main.start();

        hook.run();
        main.join();

        assertEquals(List.of("stop", "main done", "halt 0"), events);
    }

    @Test
    void exitCodeFromMainIsKept() {
        ShutdownHook hook = new ShutdownHook(() -> events.add("stop"),
            code -> events.add("halt " + code), Duration.ofSeconds(5));

        hook.mainFinished(SignalEngine.EXIT_RECONNECT_EXHAUSTED);
        hook.run();

        assertEquals(List.of("stop", "halt 2"), events);
    }

    @Test
    void haltsAfterGraceWhenMainNeverReports() {
        ShutdownHook hook = new ShutdownHook(() -> events.add("stop"),
            code -> events.add("halt " + code), Duration.ofMillis(50));

        hook.run();

        assertEquals(List.of("stop", "halt 0"), events);
    }
}
