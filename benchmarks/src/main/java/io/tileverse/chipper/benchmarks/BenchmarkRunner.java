/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chipper.benchmarks;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.openjdk.jmh.infra.BenchmarkParams;
import org.openjdk.jmh.profile.GCProfiler;
import org.openjdk.jmh.results.Result;
import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;
import org.openjdk.jmh.runner.options.WarmupMode;

/**
 * Command line runner for the chipper benchmarks.
 * <p>
 * Runs the read and/or write benchmarks, optionally overriding their {@code @Param} values, and writes a report
 * comparing the MAPPED and MANUAL backends for each window shape.
 */
public class BenchmarkRunner {

    /**
     * Available benchmark types.
     */
    public enum BenchmarkType {
        READ(ChipperReadBenchmark.class),
        WRITE(ChipperWriteBenchmark.class),
        ALL(ChipperReadBenchmark.class, ChipperWriteBenchmark.class);

        private final List<Class<?>> benchmarkClasses;

        BenchmarkType(Class<?>... classes) {
            this.benchmarkClasses = List.of(classes);
        }
    }

    /**
     * Command line options overriding a benchmark {@code @Param}, mapped to the parameter name.
     */
    private static final Map<String, String> PARAM_OPTIONS = Map.of(
            "--backend", "backend",
            "--raster-size", "rasterSize",
            "--raw-type", "rawType",
            "--window-size", "windowSize",
            "--access-pattern", "accessPattern",
            "--number-of-windows", "numberOfWindows");

    public static void main(String[] args) throws RunnerException, IOException {
        BenchmarkConfig config = parseArgs(args);
        Collection<RunResult> results = runBenchmarks(config);
        if (results.isEmpty()) {
            System.out.println("No benchmark produced results");
            return;
        }
        generateReport(results, config);
    }

    private static BenchmarkConfig parseArgs(String[] args) {
        BenchmarkConfig config = new BenchmarkConfig();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                switch (arg) {
                    case "--type" -> config.type = BenchmarkType.valueOf(value(args, ++i, arg).toUpperCase());
                    case "--forks" -> config.forks = Integer.parseInt(value(args, ++i, arg));
                    case "--warmup-iterations" -> config.warmupIterations = Integer.parseInt(value(args, ++i, arg));
                    case "--measurement-iterations" ->
                        config.measurementIterations = Integer.parseInt(value(args, ++i, arg));
                    case "--warmup-time" -> config.warmupTime = Integer.parseInt(value(args, ++i, arg));
                    case "--measurement-time" -> config.measurementTime = Integer.parseInt(value(args, ++i, arg));
                    case "--output-format" ->
                        config.resultFormat = ResultFormatType.valueOf(value(args, ++i, arg).toUpperCase());
                    case "--output-file" -> config.outputFile = value(args, ++i, arg);
                    case "--report" -> config.reportFile = value(args, ++i, arg);
                    case "--profiler" -> config.enableProfiler = true;
                    case "--help" -> {
                        printUsage();
                        System.exit(0);
                    }
                    default -> {
                        String param = PARAM_OPTIONS.get(arg);
                        if (param == null) {
                            System.err.println("Unknown option: " + arg);
                            printUsage();
                            System.exit(1);
                        }
                        config.params.put(param, value(args, ++i, arg));
                    }
                }
            } catch (IllegalArgumentException e) {
                System.err.println("Error parsing argument '" + arg + "': " + e.getMessage());
                printUsage();
                System.exit(1);
            }
        }
        return config;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println("""
                Usage: java -cp <benchmarks-jar> io.tileverse.chipper.benchmarks.BenchmarkRunner [options]

                  --type <READ|WRITE|ALL>           Benchmarks to run. Default: ALL
                  --forks <n>                       Default: 1
                  --warmup-iterations <n>           Default: 3
                  --measurement-iterations <n>      Default: 5
                  --warmup-time <seconds>           Default: 10
                  --measurement-time <seconds>      Default: 10
                  --output-format <CSV|JSON|TEXT>   JMH result format, used with --output-file
                  --output-file <file>              JMH result file
                  --report <file>                   Backend comparison report. Default: backend-comparison.txt
                  --profiler                        Enable the JMH GC profiler

                  --backend <MAPPED|MANUAL|AUTO>    Overrides of the benchmark parameters, comma separated
                  --raster-size <n>
                  --raw-type <type>
                  --window-size <n>
                  --access-pattern <SEQUENTIAL|RANDOM>
                  --number-of-windows <n>
                """);
    }

    private static Collection<RunResult> runBenchmarks(BenchmarkConfig config) throws RunnerException {
        String include = config.type.benchmarkClasses.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining("|"));

        ChainedOptionsBuilder optionsBuilder = new OptionsBuilder()
                .include(include)
                .warmupMode(WarmupMode.BULK)
                .warmupIterations(config.warmupIterations)
                .warmupTime(TimeValue.seconds(config.warmupTime))
                .measurementIterations(config.measurementIterations)
                .measurementTime(TimeValue.seconds(config.measurementTime))
                .forks(config.forks)
                .shouldFailOnError(true)
                .shouldDoGC(true);

        if (config.enableProfiler) {
            optionsBuilder.addProfiler(GCProfiler.class);
        }
        if (config.outputFile != null) {
            optionsBuilder.resultFormat(config.resultFormat);
            optionsBuilder.result(config.outputFile);
        }
        config.params.forEach((name, value) -> optionsBuilder.param(name, value.split(",")));

        return new Runner(optionsBuilder.build()).run();
    }

    /**
     * Writes one line per benchmark and parameter combination, pairing the MAPPED and MANUAL scores and the ratio
     * between them.
     */
    private static void generateReport(Collection<RunResult> results, BenchmarkConfig config) throws IOException {
        Map<String, Map<String, Result<?>>> byCase = new TreeMap<>();
        for (RunResult result : results) {
            BenchmarkParams params = result.getParams();
            String key = params.getBenchmark().substring(params.getBenchmark().lastIndexOf('.') + 1)
                    + params.getParamsKeys().stream()
                            .filter(name -> !"backend".equals(name))
                            .map(name -> " " + name + "=" + params.getParam(name))
                            .collect(Collectors.joining());
            byCase.computeIfAbsent(key, k -> new TreeMap<>())
                    .put(params.getParam("backend"), result.getPrimaryResult());
        }

        Path report = Path.of(config.reportFile);
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(report))) {
            writer.printf("Chipper backend comparison, %s%n%n", LocalDateTime.now());
            byCase.forEach((key, scores) -> {
                Result<?> mapped = scores.get("MAPPED");
                Result<?> manual = scores.get("MANUAL");
                writer.printf("%s%n  MAPPED %s  MANUAL %s", key, format(mapped), format(manual));
                if (mapped != null && manual != null && manual.getScore() > 0) {
                    writer.printf("  mapped/manual %.2f", mapped.getScore() / manual.getScore());
                }
                writer.println();
            });
        }
        System.out.println("Backend comparison written to: " + report.toAbsolutePath());
    }

    private static String format(Result<?> result) {
        return result == null
                ? "-"
                : "%.2f +/- %.2f %s".formatted(result.getScore(), result.getScoreError(), result.getScoreUnit());
    }

    /**
     * Configuration for the benchmark run.
     */
    static class BenchmarkConfig {
        BenchmarkType type = BenchmarkType.ALL;
        int forks = 1;
        int warmupIterations = 3;
        int measurementIterations = 5;
        int warmupTime = 10; // seconds
        int measurementTime = 10; // seconds
        ResultFormatType resultFormat = ResultFormatType.TEXT;
        String outputFile = null;
        String reportFile = "backend-comparison.txt";
        boolean enableProfiler = false;
        Map<String, String> params = new LinkedHashMap<>();
    }
}
