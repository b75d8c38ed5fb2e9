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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF keyword extractor.
 *
 * <p>Weighting:
 * <ul>
 *   <li>Tokens are runs of two or more word characters, lower-cased</li>
 *   <li>English stop words are removed</li>
 *   <li>Term frequency is the raw count within a document</li>
 *   <li>Inverse document frequency is smoothed: {@code ln((1 + n) / (1 + df)) + 1}</li>
 *   <li>Each document vector is L2-normalized</li>
 * </ul>
 *
 * <p>For {@link #topKeywords} the normalized vectors are summed across documents.
 * Terms with equal weight are ordered alphabetically.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * KeywordExtractor extractor = TfIdfKeywordExtractor.english();
 * List<String> keywords = extractor.topKeywords(captions, 3);
 * }</pre>
 */
public class TfIdfKeywordExtractor implements KeywordExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(TfIdfKeywordExtractor.class);

  private static final Pattern TOKEN =
      Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  static final String ENGLISH_STOP_WORDS = "/stopwords/english.txt";

  private static TfIdfKeywordExtractor english;

  private final Set<String> stopWords;

  public TfIdfKeywordExtractor(Set<String> stopWords) {
    this.stopWords = ImmutableSet.copyOf(stopWords);
  }

  /**
   * Returns a shared extractor using the bundled English stop word list.
   */
  public static synchronized TfIdfKeywordExtractor english() {
    if (english == null) {
      english = new TfIdfKeywordExtractor(loadStopWords(ENGLISH_STOP_WORDS));
    }
    return english;
  }

  /**
   * Loads a stop word list from the classpath, one word per line. Blank lines
   * and lines starting with {@code #} are skipped.
   */
  static Set<String> loadStopWords(String resourcePath) {
    InputStream in = TfIdfKeywordExtractor.class.getResourceAsStream(resourcePath);
    if (in == null) {
      throw new IllegalStateException("Stop word list not found: " + resourcePath);
    }
    ImmutableSet.Builder<String> words = ImmutableSet.builder();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        String word = line.trim();
        if (!word.isEmpty() && !word.startsWith("#")) {
          words.add(word.toLowerCase(Locale.ROOT));
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read stop word list " + resourcePath, e);
    }
    Set<String> result = words.build();
    LOGGER.debug("Loaded {} stop words from {}", result.size(), resourcePath);
    return result;
  }

  @Override public List<String> topKeywords(List<String> documents, int limit) {
    List<Map<String, Double>> vectors = weigh(documents);
    Map<String, Double> totals = new TreeMap<String, Double>();
    for (Map<String, Double> vector : vectors) {
      for (Map.Entry<String, Double> entry : vector.entrySet()) {
        totals.merge(entry.getKey(), entry.getValue(), Double::sum);
      }
    }
    return rank(totals, limit);
  }

  @Override public List<List<String>> topKeywordsPerDocument(List<String> documents,
      int limit) {
    List<Map<String, Double>> vectors = weigh(documents);
    List<List<String>> result = new ArrayList<List<String>>(vectors.size());
    for (Map<String, Double> vector : vectors) {
      result.add(rank(vector, limit));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Tokenizes a document, dropping stop words.
   */
  List<String> tokenize(String document) {
    List<String> tokens = new ArrayList<String>();
    if (document == null) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (!stopWords.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /**
   * Computes one normalized TF-IDF vector per document. Vectors are keyed by
   * term in alphabetical order.
   */
  private List<Map<String, Double>> weigh(List<String> documents) {
    List<Map<String, Integer>> counts = new ArrayList<Map<String, Integer>>(documents.size());
    Map<String, Integer> documentFrequency = new HashMap<String, Integer>();
    for (String document : documents) {
      Map<String, Integer> termCounts = new TreeMap<String, Integer>();
      for (String token : tokenize(document)) {
        termCounts.merge(token, 1, Integer::sum);
      }
      for (String term : termCounts.keySet()) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
      counts.add(termCounts);
    }

    int n = documents.size();
    List<Map<String, Double>> vectors = new ArrayList<Map<String, Double>>(n);
    for (Map<String, Integer> termCounts : counts) {
      Map<String, Double> vector = new TreeMap<String, Double>();
      double sumOfSquares = 0.0;
      for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
        int df = documentFrequency.get(entry.getKey());
        double idf = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        double weight = entry.getValue() * idf;
        vector.put(entry.getKey(), weight);
        sumOfSquares += weight * weight;
      }
      if (sumOfSquares > 0.0) {
        double norm = Math.sqrt(sumOfSquares);
        for (Map.Entry<String, Double> entry : vector.entrySet()) {
          entry.setValue(entry.getValue() / norm);
        }
      }
      vectors.add(vector);
    }
    return vectors;
  }

  private static List<String> rank(Map<String, Double> weights, int limit) {
    if (limit <= 0 || weights.isEmpty()) {
      return ImmutableList.of();
    }
    List<Map.Entry<String, Double>> entries =
        new ArrayList<Map.Entry<String, Double>>(weights.entrySet());
    entries.sort(
        Comparator.comparing((Map.Entry<String, Double> e) -> e.getValue()).reversed()
            .thenComparing(Map.Entry::getKey));
    ImmutableList.Builder<String> terms = ImmutableList.builder();
    for (int i = 0; i < Math.min(limit, entries.size()); i++) {
      terms.add(entries.get(i).getKey());
    }
    return terms.build();
  }
}
