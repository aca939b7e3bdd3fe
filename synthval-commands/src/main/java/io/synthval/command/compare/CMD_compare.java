package io.synthval.command.compare;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import io.synthval.stats.ValidationEngine;
import io.synthval.stats.config.TierThresholds;
import io.synthval.stats.config.ValidationConfig;
import io.synthval.stats.model.ValidationReport;
import io.synthval.stats.report.ReportJson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Compare synthetic survey responses against real ones.
///
/// ## Usage
///
/// ```bash
/// synthval compare --input responses.json
/// synthval compare --input responses.json --format json --output report.json
/// synthval compare --input responses.json --config validation.json --tier1 0.9
/// ```
///
/// ## Exit Codes
///
/// - 0: a report with an overall tier was produced
/// - 1: the report is flagged as insufficient data
/// - 2: the input or configuration could not be read
@CommandLine.Command(
    name = "compare",
    header = "Compare synthetic survey responses against real responses",
    description = "Runs the statistical test battery over the responses in a JSON file and reports "
        + "per-test, per-question and overall match scores and tiers.",
    exitCodeList = {
        "0: Report produced",
        "1: Insufficient data for an overall tier",
        "2: Error reading input or configuration"
    }
)
public class CMD_compare implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_compare.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INSUFFICIENT_DATA = 1;
    public static final int EXIT_INPUT_ERROR = 2;

    /// Report output formats.
    public enum Format {
        text, json
    }

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "JSON file with the synthetic and real responses",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--format", "-f"},
        description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private Format format = Format.text;

    @CommandLine.Option(
        names = {"--output", "-o"},
        description = "Write the report to this file instead of standard output"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--config", "-c"},
        description = "JSON file with validation settings (tier thresholds, score scales)"
    )
    private Path configPath;

    @CommandLine.Option(names = "--tier1", description = "Match score above which a result is TIER_1")
    private Double tier1;

    @CommandLine.Option(names = "--tier2", description = "Match score above which a result is TIER_2")
    private Double tier2;

    @CommandLine.Option(names = "--tier3", description = "Match score above which a result is TIER_3")
    private Double tier3;

    @Override
    public Integer call() {
        ValidationReport report;
        try {
            ValidationConfig config = loadConfig();
            if (!Files.exists(inputPath)) {
                System.err.println("Error: Input file not found: " + inputPath);
                return EXIT_INPUT_ERROR;
            }
            ComparisonInput input = ComparisonInput.read(inputPath);
            report = input.evaluate(new ValidationEngine(config));
        } catch (IOException | IllegalArgumentException | JsonParseException e) {
            logger.error("Cannot read input: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        String rendered = format == Format.json
            ? ReportJson.toJson(report) + System.lineSeparator()
            : TextReportFormatter.format(report);

        if (outputPath != null) {
            try {
                Files.writeString(outputPath, rendered, StandardCharsets.UTF_8);
                logger.info("Report written to {}", outputPath);
            } catch (IOException e) {
                logger.error("Cannot write report to {}: {}", outputPath, e.getMessage());
                System.err.println("Error: cannot write " + outputPath + ": " + e.getMessage());
                return EXIT_INPUT_ERROR;
            }
        } else {
            System.out.print(rendered);
            System.out.flush();
        }
        return report.insufficientData() ? EXIT_INSUFFICIENT_DATA : EXIT_OK;
    }

    private ValidationConfig loadConfig() throws IOException {
        ValidationConfig config = configPath == null ? ValidationConfig.defaults() : ValidationConfig.load(configPath);
        if (tier1 != null || tier2 != null || tier3 != null) {
            TierThresholds current = config.tierThresholds();
            TierThresholds overridden = new TierThresholds(
                tier1 != null ? tier1 : current.tier1(),
                tier2 != null ? tier2 : current.tier2(),
                tier3 != null ? tier3 : current.tier3());
            config = config.withTierThresholds(overridden);
        }
        return config;
    }
}
