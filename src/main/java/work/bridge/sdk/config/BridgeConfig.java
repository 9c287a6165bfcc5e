package work.bridge.sdk.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Project settings read from {@code bridge.toml}.
 *
 * @param source file the settings were read from
 * @param units  fully-qualified class names of the discovery units, in declaration order
 */
public record BridgeConfig(Path source, List<String> units) {
    public static final String FILE_NAME = "bridge.toml";

    public BridgeConfig {
        units = units == null ? List.of() : List.copyOf(units);
    }
}
