/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.creatorstats;

import io.creatorstats.etl.CreatorStatsPipeline;
import io.creatorstats.etl.PipelineResult;
import io.creatorstats.etl.RunConfig;
import io.creatorstats.qa.DataQualityException;
import io.creatorstats.qa.QaConfig;
import io.creatorstats.qa.QaConfigLoader;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Command line entry point.
 *
 * <pre>
 * creator-stats --creators data/creators.csv --videos data/videos.csv \
 *     --output data/out [--rules rules.yaml] [--date 2025-01-31]
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 on a validation, input or write failure,
 * 2 on invalid arguments.
 */
public final class CreatorStatsMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(CreatorStatsMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private final Clock clock;

  CreatorStatsMain(Clock clock) {
    this.clock = clock;
  }

  public static void main(String[] args) {
    System.exit(new CreatorStatsMain(Clock.systemDefaultZone()).run(args));
  }

  static Options options() {
    Options options = new Options();
    options.addOption(Option.builder()
        .longOpt("creators")
        .argName("file")
        .required(true)
        .hasArg()
        .desc("creators CSV file")
        .build());
    options.addOption(Option.builder()
        .longOpt("videos")
        .argName("file")
        .required(true)
        .hasArg()
        .desc("videos CSV file")
        .build());
    options.addOption(Option.builder()
        .longOpt("output")
        .argName("dir")
        .required(true)
        .hasArg()
        .desc("output root directory")
        .build());
    options.addOption(Option.builder()
        .longOpt("rules")
        .argName("file")
        .hasArg()
        .desc("QA rule file (defaults to the bundled rules)")
        .build());
    options.addOption(Option.builder()
        .longOpt("date")
        .argName("yyyy-MM-dd")
        .hasArg()
        .desc("run date (defaults to today)")
        .build());
    return options;
  }

  /**
   * Runs the pipeline for the given arguments.
   *
   * @return Process exit code
   */
  int run(String[] args) {
    Options options = options();
    CommandLine commandLine;
    RunConfig runConfig;
    try {
      CommandLineParser parser = new DefaultParser();
      commandLine = parser.parse(options, args);
      RunConfig.Builder builder = RunConfig.builder()
          .outputRoot(commandLine.getOptionValue("output"))
          .clock(clock);
      if (commandLine.hasOption("date")) {
        builder.runDate(RunConfig.parseDate(commandLine.getOptionValue("date")));
      }
      runConfig = builder.build();
    } catch (ParseException | IllegalArgumentException e) {
      LOGGER.error("Invalid arguments: {}", e.getMessage());
      printUsage(options);
      return EXIT_USAGE;
    }

    Path creators = Paths.get(commandLine.getOptionValue("creators"));
    Path videos = Paths.get(commandLine.getOptionValue("videos"));
    try {
      QaConfig rules = commandLine.hasOption("rules")
          ? QaConfigLoader.fromFile(Paths.get(commandLine.getOptionValue("rules")))
          : QaConfigLoader.fromResource(QaConfigLoader.BUNDLED_RULES);
      PipelineResult result = new CreatorStatsPipeline(rules, runConfig)
          .execute(creators, videos);
      LOGGER.info("Wrote {} file(s) with {} warning(s)", result.getFiles().size(),
          result.getWarnings().size());
      return EXIT_OK;
    } catch (DataQualityException e) {
      LOGGER.error("Data quality check failed: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException e) {
      LOGGER.error("Creator stats run failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  private static void printUsage(Options options) {
    PrintWriter writer = new PrintWriter(
        new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);
    new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "creator-stats",
        null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null,
        true);
    writer.flush();
  }
}
