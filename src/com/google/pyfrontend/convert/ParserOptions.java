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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Options that control a conversion run. */
public class ParserOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The minor version of Python 3 whose grammar stub files are parsed with. */
  public static final int DEFAULT_PYTHON3_MINOR_VERSION = 6;

  private int pythonMajorVersion = 3;
  private int pythonMinorVersion = DEFAULT_PYTHON3_MINOR_VERSION;

  /** Whether a None default leaves the declared type of its argument as written. */
  private boolean noImplicitOptional = false;

  /** A module to treat as an alias of {@code typing}. */
  private @Nullable String customTypingModule = null;

  private ImmutableMap<String, String> moduleTranslations = ImmutableMap.of();

  public ParserOptions() {}

  public int getPythonMajorVersion() {
    return pythonMajorVersion;
  }

  public int getPythonMinorVersion() {
    return pythonMinorVersion;
  }

  public void setPythonVersion(int major, int minor) {
    checkArgument(major == 2 || major == 3, "unsupported Python version %s.%s", major, minor);
    checkArgument(minor >= 0, "bad minor version %s", minor);
    this.pythonMajorVersion = major;
    this.pythonMinorVersion = minor;
  }

  public boolean isNoImplicitOptional() {
    return noImplicitOptional;
  }

  public void setNoImplicitOptional(boolean noImplicitOptional) {
    this.noImplicitOptional = noImplicitOptional;
  }

  public @Nullable String getCustomTypingModule() {
    return customTypingModule;
  }

  public void setCustomTypingModule(@Nullable String customTypingModule) {
    this.customTypingModule = customTypingModule;
  }

  /** Rewrites applied to imported module names, keyed by the name as written. */
  public ImmutableMap<String, String> getModuleTranslations() {
    return moduleTranslations;
  }

  public void setModuleTranslations(Map<String, String> moduleTranslations) {
    this.moduleTranslations = ImmutableMap.copyOf(checkNotNull(moduleTranslations));
  }

  /** Translates a module name as written in an import to the one the analysis should use. */
  String translateModuleId(String id) {
    if (id.equals(customTypingModule)) {
      return "typing";
    }
    if (id.equals("__builtin__") && pythonMajorVersion == 2) {
      // HACK: to get 2.x and 3.x modules resolved the same way
      return "builtins";
    }
    return moduleTranslations.getOrDefault(id, id);
  }
}
