package org.reportforge.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.reportforge.cli.commands.CompileCommand;
import org.reportforge.cli.commands.IrCommand;
import org.reportforge.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "reportforge",
    mixinStandardHelpOptions = true,
    version = "ReportForge 1.0",
    description = "ReportForge - compiles declarative report layouts to Typst markup",
    subcommands = {
        CompileCommand.class,
        IrCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "reportforge.conf";
    static final String LOGGING_FORMAT_PROPERTY = "reportforge.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: reportforge.conf)"
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
        commandLine.setCommandName("reportforge");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new IllegalStateException("Configuration file specified via --config was not found: "
                            + this.configFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = layered(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new IllegalStateException("Configuration file specified via -Dconfig.file was not found: "
                                + systemConfigFile.getAbsolutePath());
                    }
                    logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                    this.config = layered(systemConfigFile);
                } else {
                    // 3) Then: reportforge.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = layered(cwdConfigFile);
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
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        // Logging setup
        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config layered(final File file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
