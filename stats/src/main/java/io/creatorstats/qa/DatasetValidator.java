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
package io.creatorstats.qa;

import io.creatorstats.dataset.Dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Applies the creators pipeline and the videos pipeline of a {@link QaConfig}.
 *
 * <p>Creators are validated first. If they fail, videos are not validated
 * at all and the creators failure propagates.
 */
public class DatasetValidator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetValidator.class);

  private final QaConfig config;
  private final RuleEvaluator evaluator;

  public DatasetValidator(QaConfig config) {
    this(config, new RuleEvaluator());
  }

  public DatasetValidator(QaConfig config, RuleEvaluator evaluator) {
    this.config = requireNonNull(config, "config");
    this.evaluator = requireNonNull(evaluator, "evaluator");
  }

  /**
   * Validates both datasets.
   *
   * @param creators Raw creators dataset
   * @param videos Raw videos dataset
   * @return Validated datasets and their warnings
   * @throws DataQualityException The first fatal failure, creators before videos
   */
  public ValidationOutcome validate(Dataset creators, Dataset videos)
      throws DataQualityException {
    LOGGER.info("Validating {} ({} rows)", creators.getName(), creators.size());
    ValidatedDataset validCreators = evaluator.evaluate(creators, config.getCreators());

    LOGGER.info("Validating {} ({} rows)", videos.getName(), videos.size());
    ValidatedDataset validVideos = evaluator.evaluate(videos, config.getVideos());

    ValidationOutcome outcome = new ValidationOutcome(validCreators, validVideos);
    LOGGER.info("Validation complete with {} warning(s)", outcome.getWarnings().size());
    return outcome;
  }

  public QaConfig getConfig() {
    return config;
  }
}
