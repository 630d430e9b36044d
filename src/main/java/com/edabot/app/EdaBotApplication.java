package com.edabot.app;

import com.edabot.config.ConfigLoader;
import com.edabot.config.EdaConfig;
import com.edabot.core.PipelineException;
import com.edabot.runner.EdaRunner;
import com.edabot.runner.RunOutcome;
import com.edabot.utils.StepTimer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Command-line entry point: {@code edabot [--config <path>] [--help]}.
 * Exit codes are 0 on success, 1 when a pipeline stage fails and 2 on a
 * usage error.
 */
public final class EdaBotApplication {
    private static final Logger log = LogManager.getLogger(EdaBotApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final Path workingDir;

    public EdaBotApplication() {
        this(Path.of(".").toAbsolutePath().normalize());
    }

    EdaBotApplication(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static void main(String[] args) {
        int exit = new EdaBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("edabot", options);
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("edabot", options);
            return EXIT_OK;
        }
        if (!cmd.getArgList().isEmpty()) {
            new HelpFormatter().printHelp("edabot", options);
            log.error("Unexpected arguments: {}", cmd.getArgList());
            return EXIT_USAGE;
        }

        Path configPath = cmd.hasOption("config")
                ? workingDir.resolve(cmd.getOptionValue("config")).normalize()
                : workingDir.resolve(ConfigLoader.DEFAULT_CONFIG_PATH);

        StepTimer timer = new StepTimer();
        try {
            log.info("Starting financial time series EDA...");
            timer.start(StepTimer.CONFIG);
            EdaConfig config = ConfigLoader.load(configPath, workingDir);
            timer.end(StepTimer.CONFIG);

            RunOutcome outcome = new EdaRunner().run(config, timer);
            log.info("Analyzed {} series over {} return observations; report at {}",
                    outcome.columns.size(), outcome.returnRows, outcome.reportPath);
            return EXIT_OK;
        } catch (PipelineException e) {
            log.error("FATAL [{}]: {}", e.stage(), e.getMessage());
            log.debug("Pipeline failure detail", e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("FATAL [unexpected]: {}", e.toString(), e);
            return EXIT_FAILURE;
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path")
                .desc("path to the YAML run configuration (default " + ConfigLoader.DEFAULT_CONFIG_PATH + ")").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
