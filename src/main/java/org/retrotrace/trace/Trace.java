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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.retrotrace.tree.AssignVariable;

/**
 * A Trace records one fact about a variable: "variable V at version N has property P". The
 * identifying fields of a Trace never change after it is created; the only mutable state is a set
 * of append-only annotations (how often it was read, whether it was explicitly released, whether
 * its value escaped) that later passes use for dead-store and redundant-delete elimination.
 *
 * <p>There is one concrete subclass per {@link Kind}.
 */
public abstract class Trace {

  /** Identifies the concrete subclass of a Trace. */
  public enum Kind {
    /** The variable is not bound. */
    UNINIT,
    /** The variable was bound implicitly when its scope was entered (e.g. a parameter). */
    INIT,
    /** Nothing is known about the variable's binding. */
    UNKNOWN,
    /** The variable was bound by a specific assignment. */
    ASSIGN,
    /** The variable's state is the union of two or more states at a control-flow join. */
    MERGE
  }

  public final Variable variable;
  public final int version;

  private int usageCount;
  private boolean released;
  private boolean escaped;

  private Trace(Variable variable, int version) {
    Preconditions.checkArgument(version >= 0);
    this.variable = variable;
    this.version = version;
  }

  public abstract Kind kind();

  /**
   * Returns the trace that was current for this variable immediately before this one, or null if
   * there is no single predecessor (entry states and merges).
   */
  public @Nullable Trace previous() {
    return null;
  }

  /** Returns true if the variable is certainly bound in this state. */
  public abstract boolean mustHaveValue();

  /** Returns true if the variable is certainly unbound in this state. */
  public abstract boolean mustNotHaveValue();

  public final boolean isUninit() {
    return kind() == Kind.UNINIT;
  }

  public final boolean isInit() {
    return kind() == Kind.INIT;
  }

  public final boolean isUnknown() {
    return kind() == Kind.UNKNOWN;
  }

  public final boolean isAssign() {
    return kind() == Kind.ASSIGN;
  }

  public final boolean isMerge() {
    return kind() == Kind.MERGE;
  }

  /** Records that a variable reference reading this version was kept in the tree. */
  public void addUsage() {
    usageCount++;
  }

  /** Records that this version was explicitly released (e.g. deleted at scope exit). */
  public void addRelease() {
    released = true;
  }

  /** Records that this version's value was passed somewhere it could be retained. */
  public void markEscaped() {
    escaped = true;
  }

  public int usageCount() {
    return usageCount;
  }

  public boolean isReleased() {
    return released;
  }

  public boolean hasEscaped() {
    return escaped;
  }

  /** Returns {@code name#version}, the notation used when one trace refers to another. */
  public String key() {
    return variable.name + "#" + version;
  }

  /** Returns a one-line description including the annotations, for trace dumps. */
  public String dump() {
    StringBuilder sb = new StringBuilder(toString());
    if (usageCount != 0) {
      sb.append(" usages=").append(usageCount);
    }
    if (released) {
      sb.append(" released");
    }
    if (escaped) {
      sb.append(" escaped");
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    Trace prev = previous();
    String result = key() + " " + kind().name().toLowerCase();
    return (prev == null) ? result : result + " (after " + prev.key() + ")";
  }

  /** The state of a variable that has not been bound, or that was deleted. */
  public static class Uninit extends Trace {
    private final @Nullable Trace previous;

    public Uninit(Variable variable, int version, @Nullable Trace previous) {
      super(variable, version);
      this.previous = previous;
    }

    @Override
    public Kind kind() {
      return Kind.UNINIT;
    }

    @Override
    public @Nullable Trace previous() {
      return previous;
    }

    @Override
    public boolean mustHaveValue() {
      return false;
    }

    @Override
    public boolean mustNotHaveValue() {
      return true;
    }
  }

  /** The entry state of a variable that is bound implicitly, e.g. a parameter. */
  public static class Init extends Trace {
    public Init(Variable variable, int version) {
      super(variable, version);
    }

    @Override
    public Kind kind() {
      return Kind.INIT;
    }

    @Override
    public boolean mustHaveValue() {
      return true;
    }

    @Override
    public boolean mustNotHaveValue() {
      return false;
    }
  }

  /** A state about which nothing is trusted. */
  public static class Unknown extends Trace {
    private final @Nullable Trace previous;

    public Unknown(Variable variable, int version, @Nullable Trace previous) {
      super(variable, version);
      this.previous = previous;
    }

    @Override
    public Kind kind() {
      return Kind.UNKNOWN;
    }

    @Override
    public @Nullable Trace previous() {
      return previous;
    }

    @Override
    public boolean mustHaveValue() {
      return false;
    }

    @Override
    public boolean mustNotHaveValue() {
      return false;
    }
  }

  /** The state established by one assignment statement. */
  public static class Assign extends Trace {
    private final AssignVariable assignNode;
    private final Trace previous;

    public Assign(Variable variable, int version, AssignVariable assignNode, Trace previous) {
      super(variable, version);
      Preconditions.checkArgument(previous.variable == variable);
      this.assignNode = assignNode;
      this.previous = previous;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    public AssignVariable assignNode() {
      return assignNode;
    }

    @Override
    public Trace previous() {
      return previous;
    }

    @Override
    public boolean mustHaveValue() {
      return true;
    }

    @Override
    public boolean mustNotHaveValue() {
      return false;
    }
  }

  /**
   * The state of a variable after a control-flow join at which it had different versions on
   * different incoming paths. The predecessors are an unordered set; two merges of the same traces
   * are indistinguishable regardless of the order in which the paths were visited.
   */
  public static class Merge extends Trace {
    private final ImmutableSet<Trace> predecessors;

    public Merge(Variable variable, int version, ImmutableSet<Trace> predecessors) {
      super(variable, version);
      Preconditions.checkArgument(predecessors.size() >= 2, "merge of fewer than two traces");
      Preconditions.checkArgument(predecessors.stream().allMatch(t -> t.variable == variable));
      this.predecessors = predecessors;
    }

    @Override
    public Kind kind() {
      return Kind.MERGE;
    }

    /** Returns the traces reconciled by this merge. */
    public ImmutableSet<Trace> predecessors() {
      return predecessors;
    }

    /** Returns the versions of {@link #predecessors}. */
    public ImmutableSet<Integer> predecessorVersions() {
      return predecessors.stream().map(t -> t.version).collect(ImmutableSet.toImmutableSet());
    }

    @Override
    public boolean mustHaveValue() {
      return predecessors.stream().allMatch(Trace::mustHaveValue);
    }

    @Override
    public boolean mustNotHaveValue() {
      return predecessors.stream().allMatch(Trace::mustNotHaveValue);
    }

    @Override
    public String toString() {
      return predecessors.stream()
          .sorted(Comparator.comparingInt(t -> t.version))
          .map(Trace::key)
          .collect(Collectors.joining(", ", key() + " merge of {", "}"));
    }
  }
}
