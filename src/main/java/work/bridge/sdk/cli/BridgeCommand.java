package work.bridge.sdk.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "bridge",
    description = "Discover, describe and run Bridge steps.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { CheckCommand.class, ConfigCommand.class, RunStepCommand.class }
)
final class BridgeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 1;
    }
}
