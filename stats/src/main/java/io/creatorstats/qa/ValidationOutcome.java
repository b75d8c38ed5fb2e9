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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validated creators and videos, plus every warning raised while validating them.
 */
public final class ValidationOutcome {

  private final ValidatedDataset creators;
  private final ValidatedDataset videos;

  public ValidationOutcome(ValidatedDataset creators, ValidatedDataset videos) {
    this.creators = creators;
    this.videos = videos;
  }

  public ValidatedDataset getCreators() {
    return creators;
  }

  public ValidatedDataset getVideos() {
    return videos;
  }

  /**
   * Returns creators warnings followed by videos warnings.
   */
  public List<ValidationWarning> getWarnings() {
    List<ValidationWarning> all = new ArrayList<ValidationWarning>(creators.getWarnings());
    all.addAll(videos.getWarnings());
    return Collections.unmodifiableList(all);
  }
}
