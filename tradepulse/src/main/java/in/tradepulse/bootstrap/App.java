package in.tradepulse.bootstrap;

import in.tradepulse.config.BotConfig;
import in.tradepulse.config.ConfigurationException;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Process entry point.
 *
 * Exit codes: 0 graceful shutdown, 1 configuration failure, 2 reconnect attempts exhausted.
 * SIGTERM counts as a graceful shutdown: the shutdown hook stops the engine and
 * ends the process with the engine's exit code.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration HOOK_GRACE = Duration.ofSeconds(5);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TradePulse Signal Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        BotConfig config;
        try {
            config = BotConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (ConfigurationException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(SignalEngine.EXIT_CONFIG);
            return;
        }

        SignalEngine engine = new SignalEngine(config, Clock.systemUTC(), CollectorRegistry.defaultRegistry);
        ShutdownHook hook = new ShutdownHook(engine::shutdown, Runtime.getRuntime()::halt, HOOK_GRACE);
        Runtime.getRuntime().addShutdownHook(new Thread(hook, "shutdown-hook"));

        engine.start();
        int exitCode = engine.awaitExitCode();

        log.info("=== TradePulse exiting with code {} ===", exitCode);
        hook.mainFinished(exitCode);
        System.exit(exitCode);
    }

    private App() {}
}
