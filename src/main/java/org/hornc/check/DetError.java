/*
 * Copyright 2026 The Hornc Authors
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

package org.hornc.check;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.hornc.hlds.Context;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.ProcId;
import org.jspecify.annotations.Nullable;

/** A problem found by determinism analysis. */
public final class DetError extends Diagnostic {

  public enum Kind {
    /** The inferred determinism of a procedure is looser than its declaration. */
    DECLARATION_VIOLATED,
    /** The condition of an if-then-else can succeed more than once. */
    NONDET_CONDITION,
    /** A goal follows one that can never succeed. */
    UNREACHABLE_CODE,
    /** A call to a committed choice procedure occurs where all solutions are needed. */
    CC_CALL_IN_ALL_SOLUTIONS
  }

  /** A subgoal that contributes to the problem. */
  public static final class Culprit {
    public final GoalId goal;
    public final Context context;
    public final String goalText;
    public final Determinism determinism;

    public Culprit(GoalId goal, Context context, String goalText, Determinism determinism) {
      this.goal = goal;
      this.context = context;
      this.goalText = goalText;
      this.determinism = determinism;
    }

    @Override
    public String toString() {
      return context + ": `" + goalText + "' (" + determinism + ")";
    }
  }

  public final Kind kind;

  /** For DECLARATION_VIOLATED, the declared determinism. */
  public final @Nullable Determinism declared;

  /**
   * The inferred determinism of the procedure (or of the condition, for NONDET_CONDITION, or of
   * the callee, for CC_CALL_IN_ALL_SOLUTIONS).
   */
  public final Determinism inferred;

  /** For DECLARATION_VIOLATED, the subgoals that can fail where failure was not allowed. */
  public final ImmutableList<Culprit> failingGoals;

  /**
   * The subgoals that can succeed more than once where at most one solution was allowed (or, for
   * UNREACHABLE_CODE, the goal that cannot succeed, and for CC_CALL_IN_ALL_SOLUTIONS, the call).
   */
  public final ImmutableList<Culprit> multiSolutionGoals;

  public DetError(
      Severity severity,
      ProcId proc,
      @Nullable GoalId goal,
      Context context,
      Kind kind,
      @Nullable Determinism declared,
      Determinism inferred,
      List<Culprit> failingGoals,
      List<Culprit> multiSolutionGoals) {
    super(severity, proc.pred, proc, goal, context);
    this.kind = kind;
    this.declared = declared;
    this.inferred = inferred;
    this.failingGoals = ImmutableList.copyOf(failingGoals);
    this.multiSolutionGoals = ImmutableList.copyOf(multiSolutionGoals);
  }

  @Override
  public String message() {
    StringBuilder sb = new StringBuilder();
    switch (kind) {
      case DECLARATION_VIOLATED -> {
        sb.append("determinism declaration not satisfied: declared ")
            .append(declared)
            .append(", inferred ")
            .append(inferred)
            .append('.');
        for (Culprit c : failingGoals) {
          sb.append("\n  ").append(c).append(" can fail.");
        }
        for (Culprit c : multiSolutionGoals) {
          sb.append("\n  ").append(c).append(" can succeed more than once.");
        }
      }
      case NONDET_CONDITION ->
          sb.append("the condition of an if-then-else can succeed more than once (")
              .append(inferred)
              .append(')');
      case UNREACHABLE_CODE -> {
        sb.append("this goal is unreachable");
        for (Culprit c : multiSolutionGoals) {
          sb.append("\n  ").append(c).append(" cannot succeed.");
        }
      }
      case CC_CALL_IN_ALL_SOLUTIONS ->
          sb.append("call to `")
              .append(multiSolutionGoals.get(0).goalText)
              .append("' with determinism ")
              .append(inferred)
              .append(" occurs in a context which requires all solutions");
    }
    return sb.toString();
  }
}
