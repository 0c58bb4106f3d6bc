package com.codeprism.cli;

import com.codeprism.core.config.AnalyzerConfig;
import com.codeprism.core.config.ConfigLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to write a default {@code codeprism.yaml}.
 *
 * <p>An existing file is left alone unless {@code --force} is given.
 */
@Command(
    name = "init",
    description = "Write a default codeprism.yaml",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "Target directory (default: current directory)",
        defaultValue = ".")
    private Path directory;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing configuration file")
    private boolean force;

    @Override
    public Integer call() {
        Path configFile = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(configFile) && !force) {
            System.err.println("✗ " + configFile + " already exists (use --force to overwrite)");
            return 1;
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(configFile, ConfigLoader.toYaml(AnalyzerConfig.defaults()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", configFile, e);
            System.err.println("✗ Failed to write " + configFile + ": " + e.getMessage());
            return 1;
        }

        log.info("Wrote default configuration to {}", configFile);
        System.out.println("✓ Created " + configFile);
        return 0;
    }
}
