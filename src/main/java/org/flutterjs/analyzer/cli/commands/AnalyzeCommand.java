package org.flutterjs.analyzer.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.flutterjs.analyzer.ProjectAnalyzer;
import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.AnalysisResult;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.flutterjs.analyzer.config.ConfigLoader;
import org.flutterjs.analyzer.config.LoggingConfigurator;
import org.flutterjs.analyzer.diagnostics.Diagnostic;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "analyze",
    description = "Analyzes a Flutter project and reports its components and structural problems."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_FATAL = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, defaultValue = ".", description = "Project root directory (default: ${DEFAULT-VALUE})")
    private Path project;

    @Option(names = "--json", description = "Print the result as JSON.")
    private boolean json;

    @Option(names = "--cache", negatable = true, description = "Read and write the incremental cache.")
    private Boolean cache;

    @Option(names = "--parallel", negatable = true, description = "Analyze independent files concurrently.")
    private Boolean parallel;

    @Option(names = "--max-parallelism", description = "Maximum number of files analyzed at once.")
    private Integer maxParallelism;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: analyzer.conf)")
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log per-file details.")
    private boolean verbose;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final AnalyzerOptions options;
        try {
            options = options();
        } catch (ConfigException | IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FATAL;
        }

        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(project, options)) {
            final AnalysisResult result = analyzer.analyze();
            if (json) {
                out.println(toJson(result));
            } else {
                printReport(out, result);
            }
            out.flush();
            return result.successful() ? EXIT_OK : EXIT_INVALID;
        } catch (AnalysisException e) {
            LOGGER.error("{}", e.getMessage());
            return EXIT_FATAL;
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to render the result: {}", e.getMessage());
            return EXIT_FATAL;
        }
    }

    private AnalyzerOptions options() {
        if (configFile != null && !configFile.isFile()) {
            throw new IllegalArgumentException("configuration file not found: " + configFile.getAbsolutePath());
        }
        final Config config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        LoggingConfigurator.configure(config);

        AnalyzerOptions options = AnalyzerOptions.fromConfig(config);
        if (cache != null) options = options.withCacheEnabled(cache);
        if (parallel != null) options = options.withParallel(parallel);
        if (maxParallelism != null) options = options.withMaxParallelism(maxParallelism);
        if (verbose || options.verbose()) LoggingConfigurator.enableVerbose();
        return options;
    }

    private static void printReport(PrintWriter out, AnalysisResult result) {
        out.println("Statistics: " + result.statistics());
        out.println();
        out.print(result.validation());
        out.println();
        out.println("Components (" + result.application().components().size() + "):");
        for (ComponentDeclaration component : result.application().components()) {
            String binding = component.stateful()
                    ? " -> " + (component.stateHolderName() == null ? "?" : component.stateHolderName())
                    : "";
            out.printf("  %s [%s]%s  %s%n", component.name(), component.kind(), binding, component.file().fileName());
        }
        if (!result.diagnostics().isEmpty()) {
            out.println();
            out.println("Diagnostics:");
            result.diagnostics().values().forEach(list -> list.forEach(d -> out.println("  " + d)));
        }
    }

    static String toJson(AnalysisResult result) throws JsonProcessingException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("successful", result.successful());
        summary.put("statistics", result.statistics());
        summary.put("validation", result.validation());

        List<Map<String, Object>> components = new ArrayList<>();
        for (ComponentDeclaration component : result.application().components()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", component.name());
            entry.put("kind", component.kind());
            entry.put("file", component.file());
            entry.put("stateHolder", component.stateHolderName());
            components.add(entry);
        }
        summary.put("components", components);
        summary.put("stateHolders", result.application().stateHolders().size());
        summary.put("observableStates", result.application().observableStates().size());
        summary.put("edges", result.application().componentGraph().edges().size());

        Map<String, List<Diagnostic>> diagnostics = new LinkedHashMap<>();
        for (Map.Entry<FileIdentity, List<Diagnostic>> entry : result.diagnostics().entrySet()) {
            diagnostics.put(entry.getKey().path(), entry.getValue());
        }
        summary.put("diagnostics", diagnostics);

        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(summary);
    }
}
