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
package io.creatorstats.text;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TfIdfKeywordExtractor}.
 */
@Tag("unit")
public class TfIdfKeywordExtractorTest {

  private TfIdfKeywordExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = TfIdfKeywordExtractor.english();
  }

  @Test void testTrendingKeywordsRankedBySummedWeight() {
    List<String> captions = Arrays.asList(
        "viral viral trend",
        "viral trend cool",
        "viral something else");

    assertEquals(Arrays.asList("viral", "trend"), extractor.topKeywords(captions, 2));
    assertEquals(Arrays.asList("viral", "trend", "cool"), extractor.topKeywords(captions, 5));
  }

  @Test void testEmptyCaptionContributesNothing() {
    List<String> captions = Arrays.asList("great tech tips", "");
    assertEquals(Arrays.asList("great", "tech", "tips"), extractor.topKeywords(captions, 3));
  }

  @Test void testTiesBrokenAlphabetically() {
    assertEquals(Arrays.asList("alpha", "beta"),
        extractor.topKeywords(Collections.singletonList("gamma beta alpha"), 2));
  }

  @Test void testBlankAndStopWordOnlyInputYieldsNothing() {
    assertTrue(extractor.topKeywords(Collections.<String>emptyList(), 3).isEmpty());
    assertTrue(extractor.topKeywords(Arrays.asList("", "   ", null), 3).isEmpty());
    assertTrue(extractor.topKeywords(Collections.singletonList("the and of a"), 3).isEmpty());
  }

  @Test void testTokenizationLowercasesAndDropsShortTokens() {
    assertEquals(Arrays.asList("python", "data", "python", "x1"),
        extractor.tokenize("Python, DATA & python! a x1 I"));
  }

  @Test void testPerDocumentKeywords() {
    List<List<String>> keywords = extractor.topKeywordsPerDocument(Arrays.asList(
        "python data python data arbitrary text",
        "",
        "cooking pasta"), 2);

    assertEquals(3, keywords.size());
    assertEquals(Arrays.asList("data", "python"), keywords.get(0));
    assertTrue(keywords.get(1).isEmpty());
    assertEquals(Arrays.asList("cooking", "pasta"), keywords.get(2));
  }

  @Test void testDeterministic() {
    List<String> captions = Arrays.asList("one two three", "two three four", "three four five");
    List<String> first = extractor.topKeywords(captions, 3);
    for (int i = 0; i < 5; i++) {
      assertEquals(first, extractor.topKeywords(captions, 3));
    }
  }

  @Test void testCustomStopWords() {
    TfIdfKeywordExtractor custom =
        new TfIdfKeywordExtractor(Collections.singleton("viral"));
    assertEquals(Collections.singletonList("trend"),
        custom.topKeywords(Collections.singletonList("viral trend"), 3));
  }
}
