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
package io.creatorstats.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage provider backed by the local filesystem.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public String resolvePath(String basePath, String relativePath) {
    return Paths.get(basePath).resolve(relativePath).toString();
  }

  @Override public boolean exists(String path) throws IOException {
    return Files.exists(Paths.get(path));
  }

  @Override public void createDirectories(String path) throws IOException {
    Files.createDirectories(Paths.get(path));
  }

  @Override public OutputStream openOutputStream(String path) throws IOException {
    return Files.newOutputStream(Paths.get(path));
  }

  @Override public void move(String source, String target) throws IOException {
    Path from = Paths.get(source);
    Path to = Paths.get(target);
    try {
      // Atomic rename (on most filesystems)
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.warn("Atomic move not supported for {}, falling back to replace", target);
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  @Override public boolean delete(String path) throws IOException {
    Path root = Paths.get(path);
    if (!Files.exists(root)) {
      return false;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(root)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    }
    for (Path p : paths) {
      Files.deleteIfExists(p);
    }
    return true;
  }

  @Override public List<String> listFiles(String path) throws IOException {
    Path root = Paths.get(path);
    List<String> files = new ArrayList<String>();
    if (!Files.isDirectory(root)) {
      return files;
    }
    try (Stream<Path> walk = Files.walk(root)) {
      walk.filter(Files::isRegularFile)
          .sorted()
          .forEach(p -> files.add(p.toString()));
    }
    return files;
  }
}
