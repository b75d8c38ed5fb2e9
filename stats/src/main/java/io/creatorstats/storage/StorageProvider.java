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

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Storage provider interface for abstracting where output files are written.
 *
 * <p>Paths are plain strings so that implementations other than the local
 * filesystem can map them onto their own key space.
 */
public interface StorageProvider {

  /**
   * Resolves a relative path against a base path.
   *
   * @param basePath The base path
   * @param relativePath The relative path, using {@code /} as separator
   * @return The resolved path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Creates directories for the given path, including parents.
   *
   * @param path The directory path to create
   * @throws IOException If an I/O error occurs
   */
  void createDirectories(String path) throws IOException;

  /**
   * Opens a stream that creates or truncates a file. Parent directories must exist.
   *
   * @param path The file path
   * @return Output stream for the file
   * @throws IOException If an I/O error occurs
   */
  OutputStream openOutputStream(String path) throws IOException;

  /**
   * Moves a file, replacing any existing target. Readers of the target see
   * either the old file or the new one, never a partial file.
   *
   * @param source The source file path
   * @param target The target file path
   * @throws IOException If an I/O error occurs
   */
  void move(String source, String target) throws IOException;

  /**
   * Deletes a file, or a directory and everything under it.
   *
   * @param path The path to delete
   * @return true if something was deleted, false if the path didn't exist
   * @throws IOException If an I/O error occurs
   */
  boolean delete(String path) throws IOException;

  /**
   * Lists regular files under a directory, recursively, in path order.
   *
   * @param path The directory path
   * @return File paths; empty if the directory does not exist
   * @throws IOException If an I/O error occurs
   */
  List<String> listFiles(String path) throws IOException;
}
