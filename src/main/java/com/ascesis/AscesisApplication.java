package com.ascesis;

import com.ascesis.api.CompilationResult;
import com.ascesis.core.compiler.AscesisCompiler;
import com.ascesis.core.compiler.CompilationException;
import com.ascesis.core.compiler.CompilerConfig;
import com.ascesis.core.export.ContentExporter;
import com.ascesis.infrastructure.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point:
 * {@code AscesisApplication <file.json> [output.json]}.
 *
 * Compiles the definitions file and writes the root content as JSON, to
 * the output file if one is given and to standard output otherwise.
 */
public class AscesisApplication {
    private static final Logger logger = Logger.getLogger(AscesisApplication.class.getName());

    public static void main(String[] args) {
        configureLogging();
        if (args.length < 1 || args.length > 2) {
            logger.severe("Usage: AscesisApplication <file.json> [output.json]");
            System.exit(1);
        }
        try {
            run(Paths.get(args[0]), args.length == 2 ? Paths.get(args[1]) : null);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Compilation failed: " + e.getMessage(), e);
            System.exit(1);
        } finally {
            TracingService.getInstance().shutdown();
        }
    }

    static void run(Path input, Path output) throws IOException, CompilationException {
        CompilerConfig config = CompilerConfig.fromEnvironment();
        logger.info("Compiling " + input + " with " + config);

        TracingService tracingService = TracingService.getInstance();
        AscesisCompiler compiler = new AscesisCompiler(tracingService.getTracer(), config);
        CompilationResult result = compiler.compile(input);

        ContentExporter exporter = new ContentExporter(config.isPrettyOutput());
        if (output == null) {
            System.out.println(exporter.toJson(result.rootName(), result.rootContent(), result.context()));
        } else {
            exporter.write(result.rootName(), result.rootContent(), result.context(), output);
            logger.info("Wrote content of '" + result.rootName() + "' to " + output);
        }
    }

    private static void configureLogging() {
        try (InputStream config = AscesisApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging configuration", e);
        }
    }
}
