/*
 * Copyright 2026 Velora Contributors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.velora.ensemble.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.AnomalyEnsemble;
import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.dataset.DatasetReader;
import com.velora.ensemble.exception.AnomalyEnsembleException;
import com.velora.ensemble.output.CsvTableWriter;
import com.velora.ensemble.output.ITableWriter;
import com.velora.ensemble.output.JsonTableWriter;
import com.velora.ensemble.returntypes.EnsembleResult;

/**
 * Reads a table, scores its most recent records with the anomaly ensemble and
 * writes the augmented test records.
 */
@Slf4j
public class AnomalyEnsembleRunner {

    /**
     * how many of the records above the alert threshold are logged individually
     */
    static final int LOGGED_ALERTS = 10;

    protected final ArgumentParser argumentParser;

    public AnomalyEnsembleRunner() {
        this(new ArgumentParser(AnomalyEnsembleRunner.class.getName(),
                "Score the most recent records of a time-ordered table with an ensemble of anomaly detectors and "
                        + "append the scores to the output rows."));
    }

    public AnomalyEnsembleRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        AnomalyEnsembleRunner runner = new AnomalyEnsembleRunner();
        runner.parse(args);
        ArgumentParser parser = runner.argumentParser;
        try (BufferedReader in = openInput(parser.getInput()); PrintWriter out = openOutput(parser.getOutput())) {
            runner.run(in, out);
        } catch (AnomalyEnsembleException | IllegalArgumentException e) {
            log.error("Scoring failed: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        Dataset dataset = new DatasetReader(argumentParser.getDelimiter()).read(in);
        AnomalyEnsemble ensemble = argumentParser.toBuilder().build();
        EnsembleResult result = ensemble.score(dataset);
        createWriter().write(result.getTable(), out);
        out.flush();
        summarize(result);
    }

    protected ITableWriter createWriter() {
        if ("json".equals(argumentParser.getOutputFormat())) {
            return new JsonTableWriter();
        }
        return new CsvTableWriter(argumentParser.getDelimiter());
    }

    protected void summarize(EnsembleResult result) {
        double threshold = argumentParser.getAlertThreshold();
        List<Integer> alerts = result.getRecordsAbove(threshold);
        log.info("Scored {} records; {} above alert threshold {}", result.getTestSize(), alerts.size(), threshold);
        String timestampColumn = argumentParser.getTimestampColumn();
        for (int i = 0; i < Math.min(LOGGED_ALERTS, alerts.size()); i++) {
            int record = alerts.get(i);
            log.info("  {} = {}: composite score {}", timestampColumn,
                    result.getTable().get(record, timestampColumn), result.getCompositeScore(record));
        }
    }

    static BufferedReader openInput(String name) throws IOException {
        if ("-".equals(name)) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return Files.newBufferedReader(Paths.get(name), StandardCharsets.UTF_8);
    }

    static PrintWriter openOutput(String name) throws IOException {
        if ("-".equals(name)) {
            return new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        }
        return new PrintWriter(Files.newBufferedWriter(Paths.get(name), StandardCharsets.UTF_8));
    }
}
