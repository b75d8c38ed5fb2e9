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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads a {@link QaConfig} from a YAML (or JSON) rule file.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * QaConfig config = QaConfigLoader.fromResource("/creator-stats-rules.yaml");
 * DatasetValidator validator = new DatasetValidator(config);
 * }</pre>
 */
public final class QaConfigLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(QaConfigLoader.class);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  /** Rule file bundled with the application. */
  public static final String BUNDLED_RULES = "/creator-stats-rules.yaml";

  private QaConfigLoader() {
  }

  /**
   * Loads rules from a file on disk.
   *
   * @param path Rule file path
   * @return Parsed configuration
   * @throws IOException If the file cannot be read or parsed
   */
  public static QaConfig fromFile(Path path) throws IOException {
    LOGGER.info("Loading QA rules from file: {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, path.toString());
    }
  }

  /**
   * Loads rules from a classpath resource.
   *
   * @param resourcePath Absolute resource path, e.g. {@code /creator-stats-rules.yaml}
   * @return Parsed configuration
   * @throws IOException If the resource is missing or cannot be parsed
   */
  public static QaConfig fromResource(String resourcePath) throws IOException {
    LOGGER.info("Loading QA rules from resource: {}", resourcePath);
    InputStream in = QaConfigLoader.class.getResourceAsStream(resourcePath);
    if (in == null) {
      throw new IOException("Resource not found: " + resourcePath);
    }
    try (InputStream stream = in) {
      return parse(stream, resourcePath);
    }
  }

  /**
   * Parses rules from YAML text.
   */
  public static QaConfig fromString(String yaml) throws IOException {
    try {
      @SuppressWarnings("unchecked")
      Map<String, Object> document = YAML_MAPPER.readValue(yaml, Map.class);
      return build(document, "<string>");
    } catch (JsonProcessingException e) {
      throw new IOException("Invalid QA rule document: " + e.getOriginalMessage(), e);
    }
  }

  private static QaConfig parse(InputStream in, String source) throws IOException {
    Map<String, Object> document;
    try {
      @SuppressWarnings("unchecked")
      Map<String, Object> parsed = YAML_MAPPER.readValue(in, Map.class);
      document = parsed;
    } catch (JsonProcessingException e) {
      throw new IOException("Invalid QA rule file " + source + ": " + e.getOriginalMessage(), e);
    }
    return build(document, source);
  }

  private static QaConfig build(Map<String, Object> document, String source)
      throws IOException {
    try {
      QaConfig config = QaConfig.fromMap(document);
      LOGGER.debug("Loaded {} creator rule(s) and {} video rule(s) from {}",
          config.getCreators().getRules().size(), config.getVideos().getRules().size(), source);
      return config;
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid QA rule file " + source + ": " + e.getMessage(), e);
    }
  }
}
