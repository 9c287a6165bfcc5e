package work.bridge.sdk.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.bridge.sdk.shared.ConfigurationException;

/**
 * Reads {@code bridge.toml}:
 * <pre>
 * [bridge]
 * units = ["com.example.steps.OrderSteps"]
 * </pre>
 */
public final class BridgeConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(BridgeConfigLoader.class);

    private BridgeConfigLoader() {}

    /**
     * Loads {@code bridge.toml} from {@code directory} when present.
     */
    public static Optional<BridgeConfig> find(Path directory) {
        Path candidate = directory.resolve(BridgeConfig.FILE_NAME);
        if (!Files.isRegularFile(candidate)) {
            log.debug("No {} in {}", BridgeConfig.FILE_NAME, directory.toAbsolutePath());
            return Optional.empty();
        }
        return Optional.of(load(candidate));
    }

    public static BridgeConfig load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
        return parse(path, text);
    }

    static BridgeConfig parse(Path source, String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigurationException(source + " is not valid TOML: " + errors);
        }
        TomlTable bridge = result.getTable("bridge");
        if (bridge == null) {
            throw new ConfigurationException(
                "[bridge] section missing from " + source + ". Add a [bridge] table with units = [\"com.example.Steps\"]"
            );
        }
        if (!bridge.contains("units")) {
            throw new ConfigurationException("[bridge] units is missing in " + source);
        }
        if (!bridge.isArray("units")) {
            throw new ConfigurationException("[bridge] units should be an array of class names in " + source);
        }
        TomlArray array = bridge.getArrayOrEmpty("units");
        List<String> units = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String unit) || unit.isBlank()) {
                throw new ConfigurationException("[bridge] units[" + i + "] must be a non-empty string in " + source);
            }
            units.add(unit.trim());
        }
        return new BridgeConfig(source, units);
    }
}
