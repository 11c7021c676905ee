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
import java.util.stream.Collectors;
import org.hornc.hlds.Context;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.Inst;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;
import org.jspecify.annotations.Nullable;

/** An error found by mode analysis. */
public final class ModeError extends Diagnostic {

  public enum Kind {
    /** No mode of the called procedure (or closure) accepts the arguments' insts. */
    NO_MATCHING_MODE,
    /** More than one mode of the called procedure accepts the arguments' insts. */
    AMBIGUOUS_MODE,
    /** A unification of two variables, neither of which is bound. */
    FREE_UNIFICATION,
    /** A construction with an argument that is not bound. */
    FREE_ARG_IN_CONSTRUCTION,
    /** A variable that is bound on some paths but not others is used. */
    PARTIALLY_INSTANTIATED,
    /** A head variable does not have the inst required by the procedure's mode at exit. */
    FINAL_INST_MISMATCH,
    /** A negated goal (or the condition of an if-then-else) binds a variable used outside it. */
    NEGATION_BINDS_NONLOCAL,
    /** A variable is used after its value was destructively updated. */
    CLOBBERED_USE,
    /** A variable that is called is not known to be a closure. */
    NOT_CALLABLE,
    /** A closure is built from a procedure whose determinism has not been declared. */
    CLOSURE_NEEDS_DETERMINISM
  }

  /** One variable whose inst was not what was required. */
  public static final class Mismatch {
    /** The argument position (from 1), or 0 if the variable is not an argument. */
    public final int argNum;

    public final Var var;
    public final Inst expected;
    public final Inst actual;

    public Mismatch(int argNum, Var var, Inst expected, Inst actual) {
      this.argNum = argNum;
      this.var = var;
      this.expected = expected;
      this.actual = actual;
    }

    @Override
    public String toString() {
      String prefix = (argNum == 0) ? "" : "argument " + argNum + " ";
      return prefix + "(" + var + ") has inst " + actual + ", expected " + expected;
    }
  }

  public final Kind kind;

  /** The goal in which the error was found, rendered as source text. */
  public final String goalText;

  public final ImmutableList<Mismatch> mismatches;

  /** For AMBIGUOUS_MODE, the procedures that matched. */
  public final ImmutableList<ProcId> candidates;

  public ModeError(
      ProcId proc,
      @Nullable GoalId goal,
      Context context,
      Kind kind,
      String goalText,
      List<Mismatch> mismatches,
      List<ProcId> candidates) {
    super(Severity.ERROR, proc.pred, proc, goal, context);
    this.kind = kind;
    this.goalText = goalText;
    this.mismatches = ImmutableList.copyOf(mismatches);
    this.candidates = ImmutableList.copyOf(candidates);
  }

  /** Returns the variables that are the subject of this error. */
  public ImmutableList<Var> vars() {
    return mismatches.stream().map(m -> m.var).collect(ImmutableList.toImmutableList());
  }

  private String mismatchText() {
    return mismatches.stream().map(Mismatch::toString).collect(Collectors.joining("; "));
  }

  @Override
  public String message() {
    return switch (kind) {
      case NO_MATCHING_MODE ->
          "mode error in `" + goalText + "': no mode matches: " + mismatchText();
      case AMBIGUOUS_MODE ->
          "ambiguous mode for `"
              + goalText
              + "': modes "
              + candidates.stream()
                  .map(p -> String.valueOf(p.modeNum))
                  .collect(Collectors.joining(", "))
              + " all match";
      case FREE_UNIFICATION -> "unification of two free variables in `" + goalText + "'";
      case FREE_ARG_IN_CONSTRUCTION ->
          "mode error in `" + goalText + "': constructor argument is free: " + mismatchText();
      case PARTIALLY_INSTANTIATED ->
          "variable bound on only some paths is used in `" + goalText + "': " + mismatchText();
      case FINAL_INST_MISMATCH -> "final inst of head variable is wrong: " + mismatchText();
      case NEGATION_BINDS_NONLOCAL ->
          "`" + goalText + "' binds variables that are visible outside it: " + mismatchText();
      case CLOBBERED_USE ->
          "use of variable after destructive update in `" + goalText + "': " + mismatchText();
      case NOT_CALLABLE ->
          "variable called in `" + goalText + "' is not a closure: " + mismatchText();
      case CLOSURE_NEEDS_DETERMINISM ->
          "closure in `"
              + goalText
              + "' refers to "
              + candidates.get(0)
              + ", which has no declared determinism";
    };
  }
}
