package org.fielddispatch.engine.geo;

import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ZoneTable")
class ZoneTableTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Bundled table contains the Tashkent districts")
    void loadsBundledTable() {
        ZoneTable table = ZoneTable.loadDefault();

        assertThat(table.size()).isEqualTo(10);
        assertThat(table.contains("chilanzar")).isTrue();
        assertThat(table.find("  Yunusabad ")).map(Zone::getName).contains("yunusabad");
        assertThat(table.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Custom table is read from a JSON file")
    void loadsFromFile() throws IOException {
        Path file = tempDir.resolve("zones.json");
        Files.write(file, ("[{\"name\":\"depot\",\"lat\":1.5,\"lon\":2.5,\"note\":\"ignored\"},"
                + "{\"name\":\"site\",\"lat\":-3,\"lon\":4}]").getBytes(StandardCharsets.UTF_8));

        ZoneTable table = ZoneTable.load(file);

        assertThat(table.size()).isEqualTo(2);
        Zone depot = table.find("DEPOT").orElseThrow();
        assertThat(depot.getLatitude()).isEqualTo(1.5);
        assertThat(depot.getLongitude()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Duplicate names are rejected")
    void rejectsDuplicates() {
        assertThatThrownBy(() -> ZoneTable.of(Arrays.asList(new Zone("a", 0, 0), new Zone("A", 1, 1))))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Nameless and out-of-range entries are rejected")
    void rejectsInvalidEntries() throws IOException {
        Path nameless = tempDir.resolve("nameless.json");
        Files.write(nameless, "[{\"lat\":1,\"lon\":2}]".getBytes(StandardCharsets.UTF_8));
        Path outOfRange = tempDir.resolve("range.json");
        Files.write(outOfRange, "[{\"name\":\"x\",\"lat\":91,\"lon\":0}]".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> ZoneTable.load(nameless)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> ZoneTable.load(outOfRange)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> ZoneTable.load(tempDir.resolve("missing.json")))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
