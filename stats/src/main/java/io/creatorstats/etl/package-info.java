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

/**
 * Creator statistics run orchestration.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.creatorstats.etl.CreatorStatsPipeline} - Validates both inputs, computes
 *       per-creator statistics and writes the output tables</li>
 *   <li>{@link io.creatorstats.etl.RunConfig} - Output root, run date and keyword limits</li>
 *   <li>{@link io.creatorstats.etl.PipelineResult} - Files written, row counts and
 *       validation warnings of one run</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QaConfig rules = QaConfigLoader.fromResource(QaConfigLoader.BUNDLED_RULES);
 * RunConfig run = RunConfig.builder()
 *     .outputRoot("/data/out")
 *     .runDate(LocalDate.of(2025, 1, 31))
 *     .build();
 *
 * PipelineResult result = new CreatorStatsPipeline(rules, run)
 *     .execute(Paths.get("creators.csv"), Paths.get("videos.csv"));
 * }</pre>
 */
package io.creatorstats.etl;
