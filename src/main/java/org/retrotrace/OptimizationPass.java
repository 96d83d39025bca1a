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

package org.retrotrace;

import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.AnalysisState;
import org.retrotrace.collect.TraceCollection;
import org.retrotrace.tree.ChangeNotifier;
import org.retrotrace.tree.ChangeTag;
import org.retrotrace.tree.SourcePosition;
import org.retrotrace.tree.StatementSequence;

/**
 * Runs one optimization pass over a module or function body. Each pass starts with an empty trace
 * table; a driver that wants a fixed point calls {@link #run} again with the returned body until
 * {@link Result#changeCount} is zero.
 */
public class OptimizationPass {
  private static final Logger logger = Logging.getLogger();

  private final OptimizerOptions options;

  public OptimizationPass(OptimizerOptions options) {
    this.options = options;
  }

  public OptimizationPass() {
    this(OptimizerOptions.defaults());
  }

  /** The outcome of a pass. */
  public static class Result {
    private final @Nullable StatementSequence body;
    private final int changeCount;
    private final TraceCollection collection;

    Result(@Nullable StatementSequence body, int changeCount, TraceCollection collection) {
      this.body = body;
      this.changeCount = changeCount;
      this.collection = collection;
    }

    /** The rewritten body, or null if every statement was removed. */
    public @Nullable StatementSequence body() {
      return body;
    }

    /** The number of change notifications signalled during the pass. */
    public int changeCount() {
      return changeCount;
    }

    /** The root collection, holding the state at exit from the body. */
    public TraceCollection collection() {
      return collection;
    }
  }

  /** Optimizes a module body. */
  public Result run(StatementSequence body) {
    CountingNotifier notifier = new CountingNotifier();
    TraceCollection root = TraceCollection.forModule(new AnalysisState(options, notifier));
    logger.debug("Starting pass over " + root);
    StatementSequence result = body.computeStatementsSequence(root);
    return finish(root, result, notifier);
  }

  /** Optimizes the body of the named function, leaving the function exit state active. */
  public Result runFunction(String functionName, StatementSequence body) {
    CountingNotifier notifier = new CountingNotifier();
    TraceCollection root =
        TraceCollection.forFunction(functionName, new AnalysisState(options, notifier));
    logger.debug("Starting pass over " + root);
    StatementSequence result = root.computeFunctionBody(body);
    return finish(root, result, notifier);
  }

  private Result finish(
      TraceCollection root, @Nullable StatementSequence result, CountingNotifier notifier) {
    if (options.logTraceDumps && logger.isTraceEnabled()) {
      logger.trace(root.dumpTraces());
      logger.trace(root.dumpActiveTraces());
    }
    logger.debug("Finished pass over " + root + " with " + notifier.count + " change(s)");
    return new Result(result, notifier.count, root);
  }

  /** Logs and counts each change. */
  private static class CountingNotifier implements ChangeNotifier {
    int count;

    @Override
    public void signalChange(ChangeTag tag, SourcePosition position, String message) {
      count++;
      if (logger.isDebugEnabled()) {
        logger.debug(tag.tagName + " " + position + ": " + message);
      }
    }
  }
}
