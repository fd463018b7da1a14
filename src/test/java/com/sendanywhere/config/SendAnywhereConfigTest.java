package com.sendanywhere.config;

import com.sendanywhere.chunk.TransferMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SendAnywhereConfigTest {

    @Test
    void defaultsMatchBundledProperties() {
        SendAnywhereConfig config = SendAnywhereConfig.defaults();
        assertEquals(2 * 1024 * 1024, config.chunkSize(TransferMode.LAN));
        assertEquals(512 * 1024, config.chunkSize(TransferMode.WEBRTC));
        assertEquals(1024 * 1024, config.chunkSize(TransferMode.RELAY));
        assertEquals(5, config.maxParallelChunks());
        assertEquals(3, config.maxRetryAttempts());
        assertEquals(Duration.ofSeconds(2), config.retryDelay());
        assertEquals(Duration.ofHours(24), config.relayRetention());
        assertEquals(6, config.pairCodeLength());
        assertEquals(Duration.ofHours(1), config.pairCodeTtl());
        assertEquals(8000, config.relayPort());
        assertEquals(3000, config.signalingPort());
    }

    @Test
    void prefixedOverridesWin() {
        Properties overrides = new Properties();
        overrides.setProperty("sendanywhere.relay.port", "18000");
        overrides.setProperty("sendanywhere.pair-code.ttl-seconds", "60");
        overrides.setProperty("relay.port", "1");

        SendAnywhereConfig config = SendAnywhereConfig.load(overrides);
        assertEquals(18000, config.relayPort());
        assertEquals(Duration.ofSeconds(60), config.pairCodeTtl());
    }

    @Test
    void externalFileSitsBetweenClasspathAndOverrides(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "signaling.port=4000\nlan.port=9100\n");

        Properties overrides = new Properties();
        overrides.setProperty(SendAnywhereConfig.CONFIG_FILE_PROPERTY, file.toString());
        overrides.setProperty("sendanywhere.lan.port", "9200");

        SendAnywhereConfig config = SendAnywhereConfig.load(overrides);
        assertEquals(4000, config.signalingPort());
        assertEquals(9200, config.lanPort());
    }

    @Test
    void missingExternalFileFails(@TempDir Path tempDir) {
        Properties overrides = new Properties();
        overrides.setProperty(SendAnywhereConfig.CONFIG_FILE_PROPERTY, tempDir.resolve("nope.properties").toString());
        assertThrows(UncheckedIOException.class, () -> SendAnywhereConfig.load(overrides));
    }

    @Test
    void nonNumericValueIsRejected() {
        Properties overrides = new Properties();
        overrides.setProperty("sendanywhere.transfer.parallel.max", "many");
        SendAnywhereConfig config = SendAnywhereConfig.load(overrides);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::maxParallelChunks);
        assertTrue(e.getMessage().contains("transfer.parallel.max"));
    }
}
