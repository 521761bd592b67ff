package com.example.mediacache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar media-cache.jar <config.json>");
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        MediaCacheConfig config = new ConfigLoader().load(configPath);
        MediaService service = new MediaService(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            service.close();
            stopped.countDown();
        }, "media-cache-shutdown"));
        service.start();
        stopped.await();
    }
}
