package com.nasexporter.service.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class LoggingSetup {
    static final String CONFIG_RESOURCE = "/nas-exporter-logging.properties";

    private LoggingSetup() {
    }

    /**
     * Loads the bundled handler configuration unless one was given with
     * {@code -Djava.util.logging.config.file}, then applies {@code level} to the root logger.
     */
    public static void configure(Level level) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed loading logging configuration " + CONFIG_RESOURCE, e);
            }
        }

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
