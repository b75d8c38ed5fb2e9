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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered list of QA rules applied to one dataset.
 *
 * <p>Rules run in declaration order; the first fatal violation stops the
 * pipeline.
 */
public class QaPipeline {

  private final String name;
  private final List<QaRule> rules;

  private QaPipeline(String name, List<QaRule> rules) {
    this.name = name;
    this.rules = Collections.unmodifiableList(new ArrayList<QaRule>(rules));
  }

  /**
   * Creates a pipeline.
   *
   * @param name Pipeline name, usually the dataset it validates
   * @param rules Rules in evaluation order
   * @return QaPipeline instance
   * @throws IllegalArgumentException If two rules target the same column
   */
  public static QaPipeline of(String name, List<QaRule> rules) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Pipeline name is required");
    }
    Set<String> columns = new HashSet<String>();
    for (QaRule rule : rules) {
      if (!columns.add(rule.getColumn())) {
        throw new IllegalArgumentException("Pipeline '" + name
            + "' declares column '" + rule.getColumn() + "' more than once");
      }
    }
    return new QaPipeline(name, rules);
  }

  /**
   * Creates a pipeline from a YAML/JSON list of rule maps.
   */
  @SuppressWarnings("unchecked")
  public static QaPipeline fromList(String name, List<?> list) {
    List<QaRule> rules = new ArrayList<QaRule>();
    if (list != null) {
      for (Object item : list) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Rule in pipeline '" + name
              + "' must be a map, got: " + item);
        }
        rules.add(QaRule.fromMap((Map<String, Object>) item));
      }
    }
    return of(name, rules);
  }

  public String getName() {
    return name;
  }

  public List<QaRule> getRules() {
    return rules;
  }

  /**
   * Returns the rule for a column, or null if the pipeline does not declare it.
   */
  public @Nullable QaRule getRule(String column) {
    for (QaRule rule : rules) {
      if (rule.getColumn().equals(column)) {
        return rule;
      }
    }
    return null;
  }

  /**
   * Returns the declared column names in rule order.
   */
  public List<String> getColumns() {
    List<String> columns = new ArrayList<String>(rules.size());
    for (QaRule rule : rules) {
      columns.add(rule.getColumn());
    }
    return columns;
  }

  @Override public String toString() {
    return "QaPipeline{name='" + name + "', rules=" + rules.size() + "}";
  }
}
