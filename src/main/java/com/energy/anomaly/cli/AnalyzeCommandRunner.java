package com.energy.anomaly.cli;

import com.energy.anomaly.service.AnomalyAnalysisService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * Command-line entry point.
 *
 * Usage:  java -jar power-anomaly-detection.jar readings.csv
 *
 * Prints the JSON result (array of anomalies or error object) to stdout. Spring
 * option arguments ({@code --name=value}) are skipped when looking for the path.
 */
@Component
public class AnalyzeCommandRunner implements CommandLineRunner {

    static final String NO_INPUT_MESSAGE = "No CSV file provided";

    private final AnomalyAnalysisService analysisService;
    private final PrintStream out;

    public AnalyzeCommandRunner(AnomalyAnalysisService analysisService) {
        this.analysisService = analysisService;
        this.out = System.out;
    }

    @Override
    public void run(String... args) {
        String csvPath = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .orElse(null);

        if (csvPath == null) {
            out.println(analysisService.renderError(NO_INPUT_MESSAGE));
            return;
        }
        out.println(analysisService.analyzeToJson(csvPath));
    }
}
