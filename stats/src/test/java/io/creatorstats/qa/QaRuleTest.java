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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for rule configuration: {@link Assertion}, {@link QaRule} and {@link QaPipeline}.
 */
@Tag("unit")
public class QaRuleTest {

  @Test void testAssertionFromMap() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("check", "in-range");
    map.put("should_fail", true);
    map.put("min", 0);
    map.put("max", 100);
    map.put("message", "Out of range");

    Assertion assertion = Assertion.fromMap(map);

    assertEquals(CheckType.IN_RANGE, assertion.getCheck());
    assertTrue(assertion.isShouldFail());
    assertEquals(0.0, assertion.getMin());
    assertEquals(100.0, assertion.getMax());
    assertEquals("Out of range", assertion.getMessage());
  }

  @Test void testAssertionDefaults() {
    Assertion assertion = Assertion.builder(CheckType.UNIQUE).min(3).build();
    assertFalse(assertion.isShouldFail());
    assertNull(assertion.getMin());
    assertTrue(assertion.getMessage().contains("unique"));
  }

  @Test void testAssertionParameterValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> Assertion.builder(CheckType.IN_RANGE).build());
    assertThrows(IllegalArgumentException.class,
        () -> Assertion.builder(CheckType.IN_RANGE).min(5).max(1).build());
    assertThrows(IllegalArgumentException.class,
        () -> Assertion.builder(CheckType.MATCHES).build());
    assertThrows(IllegalArgumentException.class,
        () -> Assertion.builder(CheckType.MATCHES).pattern("(unclosed"));
    assertThrows(IllegalArgumentException.class, () -> CheckType.fromName("positive"));
  }

  @Test void testRuleFromMapCoercesFillValue() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("column", "follower_count");
    map.put("expected_type", "int64");
    map.put("fill_na", 0);
    Map<String, Object> check = new HashMap<String, Object>();
    check.put("check", "non_negative");
    check.put("should_fail", true);
    map.put("assertions", Arrays.<Object>asList(check));

    QaRule rule = QaRule.fromMap(map);

    assertEquals("follower_count", rule.getColumn());
    assertEquals(ColumnType.INT64, rule.getType());
    assertTrue(rule.hasFillValue());
    assertEquals(0L, rule.getFillValue());
    assertFalse(rule.isNullable());
    assertEquals(1, rule.getAssertions().size());
  }

  @Test void testRuleRejectsUnconvertibleFillValue() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> QaRule.builder().column("views").type(ColumnType.INT64).fillValue("none").build());
    assertTrue(e.getMessage().contains("views"));
  }

  @Test void testRuleRequiresColumnAndType() {
    assertThrows(IllegalArgumentException.class,
        () -> QaRule.builder().type(ColumnType.STRING).build());
    assertThrows(IllegalArgumentException.class,
        () -> QaRule.builder().column("bio").build());
  }

  @Test void testPipelineRejectsDuplicateColumns() {
    QaRule rule = QaRule.builder().column("bio").type(ColumnType.STRING).build();
    assertThrows(IllegalArgumentException.class,
        () -> QaPipeline.of("creators", Arrays.asList(rule, rule)));
  }

  @Test void testPipelineLookup() {
    QaPipeline pipeline = QaPipeline.of("creators", Arrays.asList(
        QaRule.builder().column("creator_id").type(ColumnType.INT64).build(),
        QaRule.builder().column("bio").type(ColumnType.STRING).build()));
    assertEquals(Arrays.asList("creator_id", "bio"), pipeline.getColumns());
    assertEquals(ColumnType.STRING, pipeline.getRule("bio").getType());
    assertNull(pipeline.getRule("missing"));
  }
}
