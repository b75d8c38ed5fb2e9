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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dataset that passed its QA pipeline, with the warnings raised on the way.
 */
public final class ValidatedDataset {

  private final Dataset dataset;
  private final List<ValidationWarning> warnings;

  public ValidatedDataset(Dataset dataset, List<ValidationWarning> warnings) {
    this.dataset = dataset;
    this.warnings = Collections.unmodifiableList(new ArrayList<ValidationWarning>(warnings));
  }

  /**
   * Returns the coerced, filled copy of the input dataset.
   */
  public Dataset getDataset() {
    return dataset;
  }

  public List<ValidationWarning> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
