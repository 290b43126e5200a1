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

package com.google.pyfrontend.convert;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown after a conversion run that had no diagnostics sink and produced blocking errors.
 * Carries every blocking diagnostic of the run.
 */
public class ParseFailedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<PyError> errors;

  public ParseFailedException(List<PyError> errors) {
    super(describe(errors));
    this.errors = ImmutableList.copyOf(errors);
  }

  public ImmutableList<PyError> getErrors() {
    return errors;
  }

  private static String describe(List<PyError> errors) {
    StringBuilder sb = new StringBuilder();
    for (PyError error : errors) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(error.format());
    }
    return sb.toString();
  }
}
