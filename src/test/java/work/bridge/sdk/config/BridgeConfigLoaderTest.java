package work.bridge.sdk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.bridge.sdk.shared.ConfigurationException;

class BridgeConfigLoaderTest {
    private static final Path SOURCE = Path.of("bridge.toml");

    @Test
    void readsUnitList() {
        BridgeConfig config = BridgeConfigLoader.parse(SOURCE, "[bridge]\nunits = [\"a.B\", \" c.D \"]\n");

        assertEquals(List.of("a.B", "c.D"), config.units());
        assertEquals(SOURCE, config.source());
    }

    @Test
    void emptyUnitListIsAllowed() {
        assertTrue(BridgeConfigLoader.parse(SOURCE, "[bridge]\nunits = []\n").units().isEmpty());
    }

    @Test
    void rejectsMalformedConfiguration() {
        assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[bridge\nunits = 1"));
        assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[other]\nunits = []\n"));
        assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[bridge]\nname = \"x\"\n"));
        assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[bridge]\nunits = \"a.B\"\n"));
        assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[bridge]\nunits = [1, 2]\n"));
    }

    @Test
    void missingSectionHintIsPlainText() {
        var error = assertThrows(ConfigurationException.class, () -> BridgeConfigLoader.parse(SOURCE, "[other]\nunits = []\n"));

        assertTrue(error.getMessage().contains("Add a [bridge] table with units = [\"com.example.Steps\"]"));
        assertFalse(error.getMessage().contains("\\n"));
    }

    @Test
    void findsConfigInDirectory(@TempDir Path dir) throws Exception {
        assertTrue(BridgeConfigLoader.find(dir).isEmpty());

        Files.writeString(dir.resolve(BridgeConfig.FILE_NAME), "[bridge]\nunits = [\"a.B\"]\n");

        BridgeConfig config = BridgeConfigLoader.find(dir).orElseThrow();
        assertEquals(List.of("a.B"), config.units());
    }
}
