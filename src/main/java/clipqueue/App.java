package clipqueue;

import clipqueue.coordinator.config.Dependencies;
import clipqueue.coordinator.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code App [config.ini]}. Without an INI file, settings come from
 * {@code CLIPQUEUE_*} environment variables.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException, InterruptedException {
        QueueConfig config = args.length > 0
                ? QueueConfig.fromIni(new File(args[0]))
                : QueueConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            stopped.countDown();
        }, "shutdown"));

        try {
            deps.start();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            System.exit(1);
        }
        log.info("Coordinator ready, backend at {}", config.backendBaseUrl());
        stopped.await();
    }
}
