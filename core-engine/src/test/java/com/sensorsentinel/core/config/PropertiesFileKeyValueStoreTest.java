package com.sensorsentinel.core.config;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.model.ThresholdMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PropertiesFileKeyValueStore}.
 */
class PropertiesFileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should return empty for a file that does not exist yet")
    void shouldStartEmpty() {
        PropertiesFileKeyValueStore store = new PropertiesFileKeyValueStore(tempDir.resolve("settings.properties"));

        assertThat(store.getString("thresholdMode")).isEmpty();
    }

    @Test
    @DisplayName("Should write through and read back from a new instance")
    void shouldPersistAcrossInstances() {
        Path file = tempDir.resolve("nested").resolve("settings.properties");
        new PropertiesFileKeyValueStore(file).setString("thresholdMode", "restricted");

        assertThat(Files.exists(file)).isTrue();
        assertThat(new PropertiesFileKeyValueStore(file).getString("thresholdMode")).contains("restricted");
    }

    @Test
    @DisplayName("Threshold store state should survive a restart")
    void shouldBackThresholdStore() {
        Path file = tempDir.resolve("settings.properties");
        ThresholdConfigurationStore store = new ThresholdConfigurationStore(new PropertiesFileKeyValueStore(file));
        store.selectMode(ThresholdMode.CUSTOM);
        store.updateCustomThreshold(DetectorKind.EWMA, "1.8");

        ThresholdConfigurationStore restarted = new ThresholdConfigurationStore(new PropertiesFileKeyValueStore(file));

        assertThat(restarted.getMode()).isEqualTo(ThresholdMode.CUSTOM);
        assertThat(restarted.activeThresholds().getEwma()).isEqualTo(1.8);
    }

    @Test
    @DisplayName("A failed write should leave the previous value visible")
    void failedWriteKeepsPreviousValue() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        PropertiesFileKeyValueStore store = new PropertiesFileKeyValueStore(blocker.resolve("settings.properties"));

        assertThatThrownBy(() -> store.setString("thresholdMode", "restricted"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to write");

        assertThat(store.getString("thresholdMode")).isEmpty();
    }

    @Test
    @DisplayName("Threshold store and its file should agree after a failed write")
    void failedWriteKeepsThresholdStoreConsistent() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        PropertiesFileKeyValueStore persistence =
                new PropertiesFileKeyValueStore(blocker.resolve("settings.properties"));
        ThresholdConfigurationStore store = new ThresholdConfigurationStore(persistence);

        assertThatThrownBy(() -> store.selectMode(ThresholdMode.RESTRICTED))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.getMode()).isEqualTo(ThresholdMode.NORMAL);
        assertThat(new ThresholdConfigurationStore(persistence).getMode()).isEqualTo(ThresholdMode.NORMAL);
    }
}
