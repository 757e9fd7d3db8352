package com.warden.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Set;

/**
 * Runs the picocli command tree inside the Spring context and reports its exit code.
 * <p>
 * {@code serve} is not executed here: the embedded web server keeps the JVM alive, and
 * {@link com.warden.WardenApplication#main} uses {@link #isServeInvocation} to decide
 * whether to start one.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final String SERVE = "serve";
    static final int EXIT_FAILURE = 1;

    private static final Set<String> HELP_FLAGS = Set.of("-h", "--help", "-V", "--version");

    private final WardenCommand wardenCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WardenCommand wardenCommand, IFactory factory) {
        this.wardenCommand = wardenCommand;
        this.factory = factory;
    }

    /**
     * True when {@code serve} is the subcommand (the first non-option argument) and no
     * help or version flag is present. {@code warden status serve} is a status query.
     */
    public static boolean isServeInvocation(String... args) {
        int first = 0;
        while (first < args.length && args[first].startsWith("-")) {
            first++;
        }
        if (first == args.length || !SERVE.equals(args[first])) {
            return false;
        }
        for (String arg : args) {
            if (HELP_FLAGS.contains(arg)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void run(String... args) {
        if (isServeInvocation(args)) {
            log.debug("Serve mode: leaving the command line to the web server lifecycle");
            return;
        }
        CommandLine commandLine = new CommandLine(wardenCommand, factory);
        commandLine.setExecutionExceptionHandler((ex, command, parseResult) -> {
            log.error("warden {} failed", command.getCommandName(), ex);
            ConsoleOutput.error(command.getCommandName() + " failed: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
