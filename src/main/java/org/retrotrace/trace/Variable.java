/*
 * Copyright 2025 The Retrospect Authors
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

package org.retrotrace.trace;

import com.google.common.base.Preconditions;

/**
 * A Variable identifies one program variable slot. Variables are created (and classified) by the
 * front end before optimization starts; the optimizer never creates them.
 *
 * <p>Each Variable owns the version counter used by all of its traces. Versions are allocated
 * sequentially starting from one; version zero is reserved for the variable's entry state.
 *
 * <p>Variables use identity equality, so two Variables with the same name in different scopes are
 * distinct.
 */
public class Variable {

  /** The static classification of a variable, which determines its entry state. */
  public enum Kind {
    /** A function parameter, bound when the function is entered. */
    PARAMETER(Trace.Kind.INIT),
    /** A local variable of a function. */
    LOCAL(Trace.Kind.UNINIT),
    /**
     * A name whose resolution is deferred because the scope also contains dynamic-name operations;
     * it may turn out to be a local or a module variable.
     */
    MAYBE_LOCAL(Trace.Kind.UNKNOWN),
    /** A module-level variable, which may be rebound by code outside the current flow. */
    MODULE(Trace.Kind.UNKNOWN),
    /** A compiler-generated temporary. */
    TEMPORARY(Trace.Kind.UNINIT);

    /** The kind of the version-zero trace of variables of this kind. */
    public final Trace.Kind entryState;

    Kind(Trace.Kind entryState) {
      this.entryState = entryState;
    }
  }

  public final String name;
  public final Kind kind;

  /**
   * True if this variable is also referenced from a nested closure, which lets code outside the
   * current flow observe or rebind it.
   */
  private final boolean sharedWithClosure;

  /** The most recently allocated version; zero if none have been allocated. */
  private int lastVersion;

  public Variable(String name, Kind kind) {
    this(name, kind, false);
  }

  public Variable(String name, Kind kind, boolean sharedWithClosure) {
    Preconditions.checkArgument(!name.isEmpty());
    Preconditions.checkArgument(
        !sharedWithClosure || kind != Kind.MODULE, "module variables cannot be closure-shared");
    this.name = name;
    this.kind = kind;
    this.sharedWithClosure = sharedWithClosure;
  }

  public boolean isParameter() {
    return kind == Kind.PARAMETER;
  }

  public boolean isModuleVariable() {
    return kind == Kind.MODULE;
  }

  public boolean isMaybeLocal() {
    return kind == Kind.MAYBE_LOCAL;
  }

  public boolean isTemporary() {
    return kind == Kind.TEMPORARY;
  }

  public boolean isSharedWithClosure() {
    return sharedWithClosure;
  }

  /** Returns a new version number, greater than any previously returned for this variable. */
  public int allocateNextVersion() {
    return ++lastVersion;
  }

  /** Returns the most recently allocated version, or zero if none has been allocated. */
  public int lastVersion() {
    return lastVersion;
  }

  @Override
  public String toString() {
    return name;
  }
}
