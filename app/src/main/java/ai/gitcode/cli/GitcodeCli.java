package ai.gitcode.cli;

import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // spec is injected by picocli before call()
@CommandLine.Command(
        name = "gitcode",
        mixinStandardHelpOptions = true,
        version = "gitcode 1.0.0",
        description = "Turns file changes and schedules into commit-ready signals.",
        subcommands = {WatchCommand.class, CheckCommand.class})
public final class GitcodeCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(GitcodeCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        logger.debug("Starting gitcode CLI");
        int exitCode = new CommandLine(new GitcodeCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
