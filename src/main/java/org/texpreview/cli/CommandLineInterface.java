package org.texpreview.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.texpreview.cli.commands.CompileCommand;
import org.texpreview.cli.commands.WatchCommand;
import org.texpreview.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "texpreview",
    mixinStandardHelpOptions = true,
    version = "texpreview 1.0",
    description = "texpreview - fast HTML previews of multi-file LaTeX projects",
    subcommands = {
        CompileCommand.class,
        WatchCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "texpreview.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: texpreview.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("texpreview");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new ConfigException.IO(ConfigFactory.empty().origin(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            this.config = load(this.configFile);
        } else {
            // 2) Next: standard Typesafe Config system property -Dconfig.file
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                if (!systemConfigFile.exists()) {
                    throw new ConfigException.IO(ConfigFactory.empty().origin(),
                            "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
                }
                logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                this.config = load(systemConfigFile);
            } else {
                // 3) Then: texpreview.conf in the current working directory
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    this.config = load(cwdConfigFile);
                } else {
                    // 4) Finally: classpath defaults only
                    logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    this.config = ConfigFactory.systemProperties()
                            .withFallback(ConfigFactory.systemEnvironment())
                            .withFallback(ConfigFactory.load())
                            .resolve();
                }
            }
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config load(final File file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * Loads the configuration on first use.
     * @return The resolved application configuration.
     * @throws ConfigException if a configuration file is missing or cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
