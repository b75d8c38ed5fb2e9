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

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one {@link QaPipeline} against a dataset.
 *
 * <p>For each rule, in order:
 * <ol>
 *   <li>The column must exist, otherwise {@link SchemaException}</li>
 *   <li>Every value is converted to the rule's {@link ColumnType}; missing
 *       entries take the fill value if one is configured. Unconvertible values,
 *       and nulls in a non-nullable column without a fill value, raise
 *       {@link TypeMismatchException}</li>
 *   <li>Each assertion runs in order. A fatal violation raises
 *       {@link ValidationException}; any other violation is recorded as a
 *       {@link ValidationWarning} and evaluation continues</li>
 * </ol>
 *
 * <p>The input dataset is never modified; the result holds a converted copy.
 * An empty dataset passes every assertion.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RuleEvaluator evaluator = new RuleEvaluator();
 * ValidatedDataset result = evaluator.evaluate(creators, config.getCreators());
 * for (ValidationWarning warning : result.getWarnings()) {
 *   LOGGER.warn("{}", warning);
 * }
 * }</pre>
 */
public class RuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleEvaluator.class);

  /**
   * Evaluates a pipeline.
   *
   * @param dataset Dataset to validate
   * @param pipeline Rules to apply
   * @return Validated copy of the dataset with collected warnings
   * @throws SchemaException If a column is missing or cannot be converted
   * @throws ValidationException If a fatal assertion is violated
   */
  public ValidatedDataset evaluate(Dataset dataset, QaPipeline pipeline)
      throws SchemaException, ValidationException {
    String name = dataset.getName();
    LOGGER.debug("Evaluating {} rule(s) of pipeline '{}' against {} ({} rows)",
        pipeline.getRules().size(), pipeline.getName(), name, dataset.size());

    Dataset current = dataset;
    List<ValidationWarning> warnings = new ArrayList<ValidationWarning>();

    for (QaRule rule : pipeline.getRules()) {
      String column = rule.getColumn();
      if (!current.hasColumn(column)) {
        LOGGER.error("{} - Column '{}' not found", name, column);
        throw SchemaException.missingColumn(name, column);
      }

      List<Object> values = coerceColumn(name, rule, current.column(column));
      current = current.withColumnValues(column, values);

      for (Assertion assertion : rule.getAssertions()) {
        long violations = assertion.getCheck().countViolations(values, assertion);
        if (violations == 0) {
          continue;
        }
        if (assertion.isShouldFail()) {
          LOGGER.error("{} - {} ({} row(s))", name, assertion.getMessage(), violations);
          throw new ValidationException(name, column, assertion, violations);
        }
        ValidationWarning warning = new ValidationWarning(name, column,
            assertion.getCheck(), assertion.getMessage(), violations);
        LOGGER.warn("{}", warning);
        warnings.add(warning);
      }
    }

    return new ValidatedDataset(current, warnings);
  }

  /**
   * Converts a column's values, applying the rule's fill value to missing entries.
   */
  private List<Object> coerceColumn(String dataset, QaRule rule, List<Object> raw)
      throws TypeMismatchException {
    List<Object> converted = new ArrayList<Object>(raw.size());
    long missing = 0;
    long malformed = 0;
    Object malformedSample = null;

    for (Object value : raw) {
      CoercionResult result = rule.getType().coerce(value);
      switch (result.getStatus()) {
        case OK:
          converted.add(result.getValue());
          break;
        case MISSING:
          if (rule.hasFillValue()) {
            converted.add(rule.getFillValue());
          } else {
            if (!rule.isNullable()) {
              missing++;
            }
            converted.add(null);
          }
          break;
        case MALFORMED:
        default:
          if (malformed == 0) {
            malformedSample = result.getRawValue();
          }
          malformed++;
          converted.add(null);
          break;
      }
    }

    if (malformed > 0) {
      LOGGER.error("{} - Column '{}' has {} value(s) that are not {}", dataset,
          rule.getColumn(), malformed, rule.getType().getConfigName());
      throw new TypeMismatchException(dataset, rule.getColumn(), rule.getType(),
          CoercionResult.Status.MALFORMED, malformed, malformedSample);
    }
    if (missing > 0) {
      LOGGER.error("{} - Column '{}' contains null values.", dataset, rule.getColumn());
      throw new TypeMismatchException(dataset, rule.getColumn(), rule.getType(),
          CoercionResult.Status.MISSING, missing, null);
    }
    return converted;
  }
}
