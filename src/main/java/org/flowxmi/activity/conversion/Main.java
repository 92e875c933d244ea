package org.flowxmi.activity.conversion;

import org.flowxmi.activity.conversion.config.ConfigHelper;
import org.flowxmi.activity.conversion.config.models.ConverterConfig;
import org.flowxmi.activity.conversion.input.ActivityInputHelper;
import org.flowxmi.activity.conversion.input.ParseInputException;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.flowxmi.activity.conversion.report.DiagnosticsReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Command line entry point: {@code Main <input.json> [output.xmi] [config.json]}.
 * Without an output path the XMI is written next to the input with the extension replaced.
 * The diagnostics report goes next to the XMI as {@code <name>.report.txt}.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INVALID_INPUT = 3;
    static final int EXIT_FAILURE = 1;

    int run(String[] args) {
        if (args.length < 1 || args.length > 3) {
            log.error("Usage: Main <input.json> [output.xmi] [config.json]");
            return EXIT_USAGE;
        }
        String inputPath = args[0];
        Path outputPath = args.length > 1 ? Paths.get(args[1]) : defaultOutputPath(inputPath);
        ConverterConfig config;
        try {
            config = args.length > 2
                    ? ConfigHelper.loadConfigFile(args[2])
                    : ConfigHelper.loadDefaultConfig();
        } catch (RuntimeException e) {
            log.error("{}: {}", e.getMessage(), e.getCause() != null ? e.getCause().getMessage() : "no details");
            return EXIT_FAILURE;
        }

        ActivityInput input;
        try {
            input = ActivityInputHelper.loadInputFile(inputPath);
        } catch (ParseInputException e) {
            log.error("Input {} rejected: {}", inputPath, e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        ActivityConversionPipeline pipeline = new ActivityConversionPipeline(config, null, timestamp);
        ConversionResult result;
        try {
            result = pipeline.convert(input);
        } catch (ParseInputException e) {
            log.error("Input {} rejected: {}", inputPath, e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        String report = new DiagnosticsReportRenderer().render(result.graph().name(), result);
        Path reportPath = withExtension(outputPath, ".report.txt");
        try {
            Files.writeString(outputPath, result.xmi(), StandardCharsets.UTF_8);
            Files.writeString(reportPath, report, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", outputPath, e);
            return EXIT_FAILURE;
        }

        log.info("Wrote {} ({} warnings, {} errors)", outputPath.toAbsolutePath(), result.warningCount(), result.errorCount());
        return EXIT_OK;
    }

    static Path defaultOutputPath(String inputPath) {
        return withExtension(Paths.get(inputPath), ".xmi");
    }

    static Path withExtension(Path path, String extension) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(base + extension);
    }

    public static void main(String[] args) {
        System.exit(new Main().run(args));
    }
}
