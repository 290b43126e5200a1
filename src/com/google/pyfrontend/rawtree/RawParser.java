/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyfrontend.rawtree;

/**
 * The upstream parser that turns a whole source file into a raw tree rooted at a {@link
 * Token#MODULE} node. Implementations live outside this library.
 */
@FunctionalInterface
public interface RawParser {

  /**
   * Parses a module.
   *
   * @param source the file contents
   * @param fileName the file name, used in error messages only
   * @param featureVersion the Python 3 minor version whose grammar to accept
   * @throws RawSyntaxException if the source is not grammatical
   */
  RawNode parseModule(String source, String fileName, int featureVersion);
}
