package com.largomodo.pathsanitizer.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Stock warning sinks for {@link SanitizationPolicy}.
 */
public final class WarningSinks {

    private static final Logger log = LoggerFactory.getLogger(WarningSinks.class);

    private static final Consumer<String> LOGGING = log::warn;
    private static final Consumer<String> SILENT = message -> {
    };

    private WarningSinks() {
        // Static utility class - prevent instantiation
    }

    /**
     * Sink that logs each message at WARN.
     */
    public static Consumer<String> logging() {
        return LOGGING;
    }

    /**
     * Sink that discards every message.
     */
    public static Consumer<String> silent() {
        return SILENT;
    }
}
