package com.sendanywhere.config;

import com.sendanywhere.chunk.TransferMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Tunables for chunking, parallelism, retries, storage retention, pairing codes
 * and network timeouts.
 * <p>
 * Precedence, lowest first: built-in defaults, classpath
 * {@code send-anywhere.properties}, the file named by
 * {@code -Dsendanywhere.config}, then {@code -Dsendanywhere.<key>} system
 * properties.
 */
public final class SendAnywhereConfig {

    private static final Logger log = LoggerFactory.getLogger(SendAnywhereConfig.class);

    public static final String RESOURCE = "send-anywhere.properties";
    public static final String CONFIG_FILE_PROPERTY = "sendanywhere.config";
    public static final String SYSTEM_PREFIX = "sendanywhere.";

    private final Properties props;

    private SendAnywhereConfig(Properties props) {
        this.props = props;
    }

    public static SendAnywhereConfig load() {
        return load(System.getProperties());
    }

    /**
     * Load using {@code overrides} in place of the JVM system properties.
     */
    public static SendAnywhereConfig load(Properties overrides) {
        Properties merged = new Properties();

        try (InputStream in = SendAnywhereConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath " + RESOURCE, e);
        }

        String external = overrides.getProperty(CONFIG_FILE_PROPERTY);
        if (external != null && !external.isBlank()) {
            Path path = Paths.get(external.trim());
            try (InputStream in = Files.newInputStream(path)) {
                merged.load(in);
                log.info("Loaded configuration from {}", path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read configuration file " + path, e);
            }
        }

        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX) && !name.equals(CONFIG_FILE_PROPERTY)) {
                merged.setProperty(name.substring(SYSTEM_PREFIX.length()), overrides.getProperty(name));
            }
        }
        return new SendAnywhereConfig(merged);
    }

    public static SendAnywhereConfig defaults() {
        return load(new Properties());
    }

    // --- chunking ---

    public int chunkSize(TransferMode mode) {
        return switch (mode) {
            case LAN -> intValue("chunk.size.lan", mode.defaultChunkSize());
            case WEBRTC -> intValue("chunk.size.webrtc", mode.defaultChunkSize());
            case RELAY -> intValue("chunk.size.relay", mode.defaultChunkSize());
        };
    }

    // --- transfer engine ---

    public int maxParallelChunks() { return intValue("transfer.parallel.max", 5); }
    public int minParallelChunks() { return intValue("transfer.parallel.min", 1); }
    public int maxRetryAttempts() { return intValue("transfer.retry.max-attempts", 3); }
    public Duration retryDelay() { return Duration.ofMillis(longValue("transfer.retry.delay-ms", 2000)); }

    // --- relay ---

    public String relayHost() { return stringValue("relay.host", "0.0.0.0"); }
    public int relayPort() { return intValue("relay.port", 8000); }
    public Path relayStorageDir() { return Paths.get(stringValue("relay.storage-dir", "uploads")); }
    public Duration relayRetention() { return Duration.ofHours(longValue("relay.cleanup-after-hours", 24)); }
    public Duration relaySweepInterval() { return Duration.ofMinutes(longValue("relay.sweep-interval-minutes", 60)); }

    // --- signaling ---

    public String signalingHost() { return stringValue("signaling.host", "0.0.0.0"); }
    public int signalingPort() { return intValue("signaling.port", 3000); }
    public int pairCodeLength() { return intValue("pair-code.length", 6); }
    public Duration pairCodeTtl() { return Duration.ofSeconds(longValue("pair-code.ttl-seconds", 3600)); }

    // --- network ---

    public int lanPort() { return intValue("lan.port", 9000); }
    public Duration connectTimeout() { return Duration.ofSeconds(longValue("timeout.connect-seconds", 30)); }
    public Duration chunkTimeout() { return Duration.ofSeconds(longValue("timeout.chunk-seconds", 60)); }

    public String stringValue(String key, String defaultValue) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? defaultValue : v.trim();
    }

    public int intValue(String key, int defaultValue) {
        return (int) longValue(key, defaultValue);
    }

    public long longValue(String key, long defaultValue) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' is not a number: " + v, e);
        }
    }
}
