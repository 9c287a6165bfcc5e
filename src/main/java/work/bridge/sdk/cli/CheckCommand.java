package work.bridge.sdk.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.bridge.sdk.config.BridgeConfig;
import work.bridge.sdk.config.BridgeConfigLoader;
import work.bridge.sdk.pipeline.PipelineRegistry;
import work.bridge.sdk.pipeline.StepDiscovery;
import work.bridge.sdk.shared.BridgeException;
import work.bridge.sdk.step.StepRegistry;

@CommandLine.Command(
    name = "check",
    description = "Validate the project's bridge.toml and the units it lists.",
    mixinStandardHelpOptions = true
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--project-dir",
        paramLabel = "DIR",
        description = "Directory holding bridge.toml.",
        defaultValue = "."
    )
    private Path projectDir;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Checking Bridge SDK project setup...");
        out.println();

        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        Path configPath = projectDir.resolve(BridgeConfig.FILE_NAME);

        if (!Files.isRegularFile(configPath)) {
            errors.add(BridgeConfig.FILE_NAME + " not found in " + projectDir.toAbsolutePath().normalize());
            out.println("[FAIL] " + BridgeConfig.FILE_NAME + " exists");
        } else {
            out.println("[OK]   " + BridgeConfig.FILE_NAME + " exists");
            checkConfig(configPath, out, errors, warnings);
        }

        out.println();
        out.println("-".repeat(50));
        if (!errors.isEmpty()) {
            printNumbered(out, "Found " + errors.size() + " error(s):", errors);
            return 1;
        }
        if (!warnings.isEmpty()) {
            printNumbered(out, "Setup OK with " + warnings.size() + " warning(s):", warnings);
            return 0;
        }
        out.println();
        out.println("All checks passed! Your project is ready for Bridge SDK.");
        return 0;
    }

    private static void checkConfig(Path configPath, PrintWriter out, List<String> errors, List<String> warnings) {
        BridgeConfig config;
        try {
            config = BridgeConfigLoader.load(configPath);
        } catch (BridgeException ex) {
            errors.add(ex.summary());
            out.println("[FAIL] [bridge] units configured");
            return;
        }
        if (config.units().isEmpty()) {
            errors.add("[bridge] units is empty. Add your step units: units = [\"com.example.Steps\"]");
            out.println("[FAIL] [bridge] units configured");
            return;
        }
        out.println("[OK]   [bridge] units configured: " + config.units());

        out.println();
        out.println("Checking unit loading...");
        var steps = new StepRegistry();
        var discovery = new StepDiscovery(steps, new PipelineRegistry());
        for (String unit : config.units()) {
            try {
                discovery.discover(unit);
                out.println("[OK]   Can load '" + unit + "'");
            } catch (BridgeException ex) {
                errors.add("Cannot load unit '" + unit + "': " + ex.summary());
                out.println("[FAIL] Can load '" + unit + "'");
            }
        }

        out.println();
        if (steps.size() == 0) {
            warnings.add("No steps found. Make sure your units register steps.");
            out.println("[WARN] No steps found in configured units");
            return;
        }
        out.println("[OK]   Found " + steps.size() + " step(s):");
        for (String name : steps.snapshot().keySet()) {
            out.println("       - " + name);
        }
    }

    private static void printNumbered(PrintWriter out, String title, List<String> items) {
        out.println();
        out.println(title);
        out.println();
        for (int i = 0; i < items.size(); i++) {
            out.println("  " + (i + 1) + ". " + items.get(i));
            out.println();
        }
    }
}
