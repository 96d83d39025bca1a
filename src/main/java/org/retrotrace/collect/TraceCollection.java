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

package org.retrotrace.collect;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.retrotrace.Logging;
import org.retrotrace.OptimizationError;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;
import org.retrotrace.tree.AssignVariable;
import org.retrotrace.tree.ChangeTag;
import org.retrotrace.tree.ComputeResult;
import org.retrotrace.tree.DelVariable;
import org.retrotrace.tree.Expression;
import org.retrotrace.tree.SourcePosition;
import org.retrotrace.tree.Statement;
import org.retrotrace.tree.StatementSequence;
import org.retrotrace.tree.VariableRef;
import org.retrotrace.tree.VariableWrites;

/**
 * A TraceCollection tracks, for one point in the walk over a module or function body, which version
 * of each variable is active. Nodes are optimized by passing them to {@link #onStatement} or {@link
 * #onExpression} along with the collection for their position in the control flow.
 *
 * <p>There are two flavors:
 *
 * <ul>
 *   <li>A root collection ({@link #forModule}, {@link #forFunction}) is created once per module or
 *       function body per pass, along with the {@link AnalysisState} it shares with all of its
 *       branches.
 *   <li>A branch collection ({@link #branch}) starts with a copy of another collection's active
 *       versions and is used for one path of a control-flow split (a conditional arm, a loop body,
 *       or the state at a break, continue, or return). Once a branch has been merged into another
 *       collection it is consumed and may not be used again.
 * </ul>
 *
 * All collections forked from the same root share its AnalysisState, so traces created by any of
 * them are visible to all of them.
 */
public class TraceCollection {
  private static final Logger logger = Logging.getLogger();

  private final String name;
  private final AnalysisState state;
  private final boolean isRoot;

  /** The active version of each variable seen so far; null once this collection is consumed. */
  private @Nullable Map<Variable, Integer> activeVersions;

  /** Set by {@link #removeAllKnowledge}. */
  private boolean removesKnowledge;

  private TraceCollection(
      String name, AnalysisState state, boolean isRoot, Map<Variable, Integer> activeVersions) {
    this.name = name;
    this.state = state;
    this.isRoot = isRoot;
    this.activeVersions = activeVersions;
  }

  /** Creates the root collection for a module body. */
  public static TraceCollection forModule(AnalysisState state) {
    return new TraceCollection("module", state, true, new LinkedHashMap<>());
  }

  /** Creates the root collection for a function body. */
  public static TraceCollection forFunction(String functionName, AnalysisState state) {
    return new TraceCollection("function " + functionName, state, true, new LinkedHashMap<>());
  }

  /** Returns a new branch collection starting with this collection's active versions. */
  public TraceCollection branch(String name) {
    return new TraceCollection(name, state, false, new LinkedHashMap<>(activeMap()));
  }

  public String name() {
    return name;
  }

  public AnalysisState state() {
    return state;
  }

  public boolean isRoot() {
    return isRoot;
  }

  /** Returns true if this collection has been merged into another and may no longer be used. */
  public boolean isConsumed() {
    return activeVersions == null;
  }

  Map<Variable, Integer> activeMap() {
    Preconditions.checkState(activeVersions != null, "%s was already merged", this);
    return activeVersions;
  }

  void consume() {
    activeMap();
    activeVersions = null;
  }

  void replaceActiveMap(Map<Variable, Integer> newActiveVersions) {
    activeMap();
    activeVersions = newActiveVersions;
  }

  /** Returns a snapshot of the active version of each variable seen so far. */
  public ImmutableMap<Variable, Integer> activeVersions() {
    return ImmutableMap.copyOf(activeMap());
  }

  /** Returns the variables that have an active version in this collection. */
  public ImmutableList<Variable> activeVariables() {
    return ImmutableList.copyOf(activeMap().keySet());
  }

  /**
   * Returns the active version of {@code variable}. If this is the first time the variable has been
   * seen, makes its entry state (version zero) active, creating the entry trace if no collection of
   * this scope has created it yet.
   */
  public int currentVersion(Variable variable) {
    Map<Variable, Integer> actives = activeMap();
    Integer version = actives.get(variable);
    if (version != null) {
      return version;
    }
    if (!state.hasTrace(variable, 0)) {
      state.addTrace(entryTrace(variable));
    }
    actives.put(variable, 0);
    return 0;
  }

  private static Trace entryTrace(Variable variable) {
    return switch (variable.kind.entryState) {
      case UNINIT -> new Trace.Uninit(variable, 0, null);
      case INIT -> new Trace.Init(variable, 0);
      case UNKNOWN -> new Trace.Unknown(variable, 0, null);
      case ASSIGN, MERGE -> throw new AssertionError(variable.kind);
    };
  }

  /**
   * Returns the trace of the active version of {@code variable}.
   *
   * @throws IllegalStateException if the active version has no trace, which can only be the result
   *     of an optimizer defect
   */
  public Trace currentTrace(Variable variable) {
    return state.getTrace(variable, currentVersion(variable));
  }

  private void markCurrentVersion(Variable variable, int version) {
    activeMap().put(variable, version);
  }

  /**
   * Allocates a new version of {@code variable} recording that it was bound by {@code assignNode},
   * and makes it active.
   */
  @CanIgnoreReturnValue
  public Trace.Assign newAssignTrace(Variable variable, AssignVariable assignNode) {
    Trace previous = currentTrace(variable);
    Trace.Assign trace =
        new Trace.Assign(variable, variable.allocateNextVersion(), assignNode, previous);
    state.addTrace(trace);
    markCurrentVersion(variable, trace.version);
    return trace;
  }

  /**
   * Allocates a new, uninitialized version of {@code variable} and makes it active. Returns the
   * trace that was active before, i.e. the value that was deleted.
   */
  @CanIgnoreReturnValue
  public Trace newDeleteTrace(Variable variable) {
    Trace previous = currentTrace(variable);
    Trace trace = new Trace.Uninit(variable, variable.allocateNextVersion(), previous);
    state.addTrace(trace);
    markCurrentVersion(variable, trace.version);
    return previous;
  }

  /** Records the write performed by {@code assignNode}; returns the new trace for it to keep. */
  @CanIgnoreReturnValue
  public Trace.Assign onVariableAssigned(AssignVariable assignNode) {
    return newAssignTrace(assignNode.target(), assignNode);
  }

  /**
   * Records the delete performed by {@code delNode}. Returns the trace that was active before the
   * delete; if that trace {@link Trace#mustNotHaveValue}, the delete is certain to find the
   * variable unbound.
   */
  @CanIgnoreReturnValue
  public Trace onVariableDeleted(DelVariable delNode) {
    return newDeleteTrace(delNode.target());
  }

  /** Marks the active trace of {@code variable} as released, and returns it. */
  @CanIgnoreReturnValue
  public Trace onVariableReleased(Variable variable) {
    Trace current = currentTrace(variable);
    current.addRelease();
    return current;
  }

  /** Records that the current value of {@code variable} was passed somewhere it may be retained. */
  public void onVariableContentEscapes(Variable variable) {
    currentTrace(variable).markEscaped();
  }

  /**
   * Makes a new {@link Trace.Unknown} version of {@code variable} active. The previously active
   * trace is left in the table unchanged.
   */
  public void markActiveVariableAsUnknown(Variable variable) {
    Trace current = currentTrace(variable);
    Trace trace = new Trace.Unknown(variable, variable.allocateNextVersion(), current);
    state.addTrace(trace);
    markCurrentVersion(variable, trace.version);
  }

  /** Calls {@link #markActiveVariableAsUnknown} for every active variable. */
  public void markActiveVariablesAsUnknown() {
    activeVariables().forEach(this::markActiveVariableAsUnknown);
  }

  /**
   * Called when control passes through code that may observe or rebind variables outside of the
   * tracked flow (e.g. a call). Makes module variables unknown, and either all other variables (if
   * {@link org.retrotrace.OptimizerOptions#escapeAllLocals} is set) or just those shared with a
   * nested closure.
   */
  public void escapeAllActiveVariables() {
    boolean escapeAll = state.options.escapeAllLocals;
    for (Variable variable : activeVariables()) {
      if (variable.isModuleVariable() || escapeAll || variable.isSharedWithClosure()) {
        markActiveVariableAsUnknown(variable);
      }
    }
  }

  /** Makes every active variable unknown and disables later trace-based optimization here. */
  public void removeAllKnowledge() {
    removesKnowledge = true;
    markActiveVariablesAsUnknown();
  }

  public boolean removesKnowledge() {
    return removesKnowledge;
  }

  /** Records that the scope contains dynamic-name operations. */
  public void assumeUnclearLocals() {
    state.assumeUnclearLocals();
  }

  public boolean hasUnclearLocals() {
    return state.hasUnclearLocals();
  }

  /**
   * Makes every variable that may be written anywhere in {@code statements} unknown. Used before
   * optimizing a loop body, since a later iteration may see values written by an earlier one.
   */
  public void degradePartiallyFromCode(StatementSequence statements) {
    VariableWrites.of(statements).forEach(this::markActiveVariableAsUnknown);
  }

  /**
   * Returns true if {@code a} and {@code b} certainly refer to the same value, which is only known
   * when both are references to the same variable.
   */
  public static boolean mustAlias(Expression a, Expression b) {
    return a instanceof VariableRef refA
        && b instanceof VariableRef refB
        && refA.variable() == refB.variable();
  }

  /** Returns true if {@code a} and {@code b} certainly refer to different values; never known. */
  public static boolean mustNotAlias(Expression a, Expression b) {
    return false;
  }

  /**
   * Optimizes {@code expression} and returns the expression that should replace it (possibly
   * itself). If the result is a variable reference, it is counted as a use of the active trace.
   */
  public Expression onExpression(Expression expression) {
    ComputeResult<Expression> result = expression.computeExpression(this);
    Expression newExpression = result.node();
    Preconditions.checkState(newExpression != null, "%s computed to null", expression.kind());
    if (result.tag() != null) {
      signalChange(result.tag(), expression.position, result.message());
    }
    // Only count references that survived optimization.
    if (newExpression instanceof VariableRef ref) {
      currentTrace(ref.variable()).addUsage();
    }
    return newExpression;
  }

  /**
   * Optimizes {@code statement} and returns the statement that should replace it, possibly itself,
   * or null if it should be removed.
   *
   * @throws OptimizationError if anything goes wrong; this indicates an optimizer defect
   */
  public @Nullable Statement onStatement(Statement statement) {
    try {
      ComputeResult<Statement> result = statement.computeStatement(this);
      Statement newStatement = result.node();
      if (newStatement != statement) {
        Preconditions.checkState(
            result.tag() != null, "%s was replaced without notification", statement.kind());
        signalChange(result.tag(), statement.position, result.message());
      }
      return newStatement;
    } catch (RuntimeException e) {
      logger.error("Problem with statement at " + statement.position);
      throw (e instanceof OptimizationError) ? e : new OptimizationError(e, statement.position);
    }
  }

  /** Optimizes a branch of a conditional using this (branch) collection. */
  public @Nullable StatementSequence computeBranch(StatementSequence branch) {
    return branch.computeStatementsSequence(this);
  }

  /**
   * Optimizes the body of a module or function with this root collection and then makes the state
   * at exit from the body active: the merge of the state at each return and, if the body can fall
   * off its end, the state at its end.
   */
  public @Nullable StatementSequence computeFunctionBody(StatementSequence body) {
    Preconditions.checkState(isRoot, "%s is not a root collection", this);
    StatementSequence result;
    List<TraceCollection> exits;
    try (AbortTracking tracking = withAbortTracking(false, false, true)) {
      result = body.computeStatementsSequence(this);
      exits = new ArrayList<>(tracking.collections(ExitKind.RETURN));
    }
    if (result == null || !result.isAborting()) {
      exits.add(this);
    }
    if (!exits.isEmpty()) {
      mergeNBranches(exits);
    }
    return result;
  }

  /**
   * Merges the states of two alternative paths into this collection. Either may be null, meaning
   * that path doesn't reach the join (or doesn't exist); if exactly one is null the other is merged
   * with this collection's current state, which represents the path that made no changes.
   */
  public void mergeTwoBranches(
      @Nullable TraceCollection yesCollection, @Nullable TraceCollection noCollection) {
    if (yesCollection == null && noCollection == null) {
      return;
    } else if (yesCollection == null || noCollection == null) {
      mergeNBranches(
          ImmutableList.of(this, (yesCollection != null) ? yesCollection : noCollection));
    } else {
      mergeNBranches(ImmutableList.of(yesCollection, noCollection));
    }
  }

  /**
   * Replaces this collection's active versions with the merge of the given collections' active
   * versions; see {@link BranchMerger}. The given collections (other than this one, if it is
   * included) are consumed.
   */
  public void mergeNBranches(List<TraceCollection> collections) {
    Preconditions.checkArgument(!collections.isEmpty(), "nothing to merge");
    if (collections.size() == 1) {
      TraceCollection only = collections.get(0);
      if (only != this) {
        activeMap().putAll(only.activeMap());
        only.consume();
      }
      return;
    }
    BranchMerger merger = new BranchMerger();
    merger.start(this);
    collections.forEach(merger::add);
    merger.finish();
  }

  /**
   * Opens a scope that collects the requested kinds of exits into fresh registries, saving any
   * registries that were previously active; closing the scope restores them.
   */
  public AbortTracking withAbortTracking(
      boolean catchBreaks, boolean catchContinues, boolean catchReturns) {
    EnumSet<ExitKind> kinds = EnumSet.noneOf(ExitKind.class);
    if (catchBreaks) {
      kinds.add(ExitKind.BREAK);
    }
    if (catchContinues) {
      kinds.add(ExitKind.CONTINUE);
    }
    if (catchReturns) {
      kinds.add(ExitKind.RETURN);
    }
    return new AbortTracking(state, kinds);
  }

  /** Records that the innermost loop is exited from the current state of this collection. */
  public void onBreak() {
    addExit(ExitKind.BREAK, true);
  }

  /** Records that the innermost loop is continued from the current state of this collection. */
  public void onContinue() {
    addExit(ExitKind.CONTINUE, true);
  }

  /**
   * Records that the function returns from the current state of this collection. Ignored if no
   * return registry is active (e.g. at module level).
   */
  public void onReturn() {
    addExit(ExitKind.RETURN, false);
  }

  private void addExit(ExitKind kind, boolean required) {
    List<TraceCollection> registry = state.exitCollections(kind);
    if (registry == null) {
      Preconditions.checkState(!required, "%s outside of an enclosing loop", kind.collectionName);
      return;
    }
    registry.add(branch(kind.collectionName));
  }

  /** Forwards a rewrite notification to this scope's {@link org.retrotrace.tree.ChangeNotifier}. */
  public void signalChange(ChangeTag tag, SourcePosition position, String message) {
    state.signalChange(tag, position, message);
  }

  /** Returns a listing of every trace created in this scope so far. */
  public String dumpTraces() {
    return "Trace collection state: " + this + "\n" + state.dumpTraces();
  }

  /** Returns a listing of the active trace of each variable in this collection. */
  public String dumpActiveTraces() {
    return activeVariables().stream()
        .map(variable -> currentTrace(variable).dump())
        .collect(Collectors.joining("\n", "Active in " + this + ":\n", ""));
  }

  @Override
  public String toString() {
    return "<" + name + ">";
  }
}
