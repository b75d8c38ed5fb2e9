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

import java.util.List;

/**
 * Ranks the terms of a set of caption documents.
 *
 * <p>Implementations must be deterministic: identical input always yields the
 * same ordering, with ties broken by a fixed rule. Empty or blank input yields
 * an empty result rather than an error.
 */
public interface KeywordExtractor {

  /**
   * Returns the highest-weighted terms over all documents, best first.
   *
   * @param documents Caption texts; null entries are treated as empty
   * @param limit Maximum number of terms to return
   * @return At most {@code limit} terms
   */
  List<String> topKeywords(List<String> documents, int limit);

  /**
   * Returns the highest-weighted terms of each document, weighted against
   * the whole set.
   *
   * @param documents Caption texts; null entries are treated as empty
   * @param limit Maximum number of terms per document
   * @return One list per input document, in input order
   */
  List<List<String>> topKeywordsPerDocument(List<String> documents, int limit);
}
