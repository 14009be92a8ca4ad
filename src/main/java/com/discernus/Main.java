package com.discernus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

import com.discernus.cli.RunCommand;
import com.discernus.cli.TraceCommand;
import com.discernus.cli.VerifyCommand;
import com.discernus.dispatch.ModelClient;
import com.discernus.runtime.AppConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "discernus",
        mixinStandardHelpOptions = true,
        version = "discernus 0.1.0",
        description = "Runs cached, provenance-tracked LLM analysis pipelines.",
        subcommands = {
                RunCommand.class,
                TraceCommand.class,
                VerifyCommand.class,
                CommandLine.HelpCommand.class
        })
public class Main implements Callable<Integer> {
    public static final int EXIT_USAGE = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml",
            scope = CommandLine.ScopeType.INHERIT)
    Path configPath;

    private final ModelClient modelClient;
    private final UnaryOperator<String> environment;

    public Main() {
        this(null, System::getenv);
    }

    /** For embedding and tests: a fixed model client and environment lookup. */
    public Main(ModelClient modelClient, UnaryOperator<String> environment) {
        this.modelClient = modelClient;
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return EXIT_USAGE;
    }

    public AppConfig loadConfig() throws IOException {
        if (!Files.exists(configPath)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(configPath.toFile(), AppConfig.class);
    }

    public Path configDir() {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? Path.of(".") : parent;
    }

    public ModelClient modelClient() {
        return modelClient;
    }

    public UnaryOperator<String> environment() {
        return environment;
    }
}
