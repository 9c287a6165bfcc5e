package work.bridge.sdk.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.bridge.sdk.config.BridgeConfig;
import work.bridge.sdk.config.BridgeConfigLoader;
import work.bridge.sdk.shared.ConfigurationException;

/**
 * Unit selection shared by commands that discover steps. Falls back to {@code bridge.toml}.
 */
final class UnitOptions {
    @CommandLine.Option(
        names = "--units",
        arity = "1..*",
        paramLabel = "CLASS",
        description = "Discovery unit classes (default: [bridge] units from bridge.toml)."
    )
    private List<String> units = new ArrayList<>();

    @CommandLine.Option(
        names = "--project-dir",
        paramLabel = "DIR",
        description = "Directory holding bridge.toml.",
        defaultValue = "."
    )
    private Path projectDir;

    List<String> resolve() {
        if (units != null && !units.isEmpty()) {
            return List.copyOf(units);
        }
        List<String> configured = BridgeConfigLoader.find(projectDir)
            .map(BridgeConfig::units)
            .orElse(List.of());
        if (configured.isEmpty()) {
            throw new ConfigurationException("No units specified. Use --units or configure [bridge] units in bridge.toml");
        }
        return configured;
    }
}
