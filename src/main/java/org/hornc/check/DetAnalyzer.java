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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hornc.check.DetError.Culprit;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Determinism.MaxSolutions;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Goal.Unify;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.Inst;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.ProcInfo;
import org.hornc.hlds.Purity;
import org.hornc.hlds.Var;

/**
 * Infers the determinism of each goal in a mode-annotated procedure body, bottom-up, and checks
 * the result against the procedure's declared determinism (if any).
 *
 * <p>Each goal is analyzed in a <i>solution context</i>: in a first-solution context (the body of
 * a committed-choice procedure, a negated goal, or the goal of a commit scope) only the first
 * solution of the goal will be used, so disjunctions that could have many solutions are treated as
 * committed-choice.
 *
 * <p>A pure conjunct that can succeed more than once but binds no variables is wrapped in a commit
 * scope, since its additional solutions would be indistinguishable from the first.
 *
 * <p>Disjunctions that test the same bound variable against distinct constructors are analyzed as
 * switches: at most one of their branches can succeed.
 */
public final class DetAnalyzer {

  /** The output of determinism analysis for one procedure. */
  public static final class Result {
    /** The body with every goal's determinism filled in. */
    public final Goal goal;

    /** The determinism of the body. */
    public final Determinism inferred;

    /** Errors and warnings. */
    public final ImmutableList<DetError> errors;

    Result(Goal goal, Determinism inferred, List<DetError> errors) {
      this.goal = goal;
      this.inferred = inferred;
      this.errors = ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
      return errors.stream().anyMatch(Diagnostic::isError);
    }
  }

  private enum SolutionContext {
    ALL,
    FIRST
  }

  private final ModuleTable table;
  private final ProcId procId;
  private final GoalBuilder builder;
  private final List<DetError> errors = new ArrayList<>();

  private DetAnalyzer(ModuleTable table, ProcId procId, GoalBuilder builder) {
    this.table = table;
    this.procId = procId;
    this.builder = builder;
  }

  /**
   * Analyzes the given body (the result of mode analysis) of a procedure. The determinisms of
   * called procedures are taken from {@code table}.
   */
  public static Result analyze(ModuleTable table, ProcId procId, Goal body) {
    PredInfo pred = table.pred(procId.pred);
    ProcInfo proc = table.proc(procId);
    DetAnalyzer analyzer =
        new DetAnalyzer(table, procId, GoalBuilder.forRewriting(body, pred.headVars));
    boolean committed =
        proc.declared != null && proc.declared.maxSolutions == MaxSolutions.MANY_CC;
    SolutionContext context = committed ? SolutionContext.FIRST : SolutionContext.ALL;
    Goal result = analyzer.infer(body, context, false);
    Determinism inferred = result.determinism();
    if (committed) {
      inferred = inferred.firstSolution();
    }
    if (proc.declared != null && !inferred.isAtLeastAsTightAs(proc.declared)) {
      analyzer.reportViolation(result, proc.declared, inferred);
    }
    return new Result(result, inferred, analyzer.errors);
  }

  /**
   * Returns the goal annotated with its determinism. If {@code mayPrune} is true and the goal binds
   * no variables but may succeed more than once, it is wrapped in a commit scope.
   */
  private Goal infer(Goal goal, SolutionContext context, boolean mayPrune) {
    Goal result = inferUnpruned(goal, context);
    Determinism det = result.determinism();
    if (mayPrune
        && det.maxSolutions == MaxSolutions.MANY
        && !bindsVariables(result)
        && !isImpure(result)) {
      Goal.Scope scope =
          new Goal.Scope(
              result.info.withId(new GoalId(builder.nextGoalId())),
              Goal.Scope.Kind.COMMIT,
              result);
      return scope.withInfo(scope.info.withDeterminism(det.commit()));
    }
    return result;
  }

  private Goal inferUnpruned(Goal goal, SolutionContext context) {
    if (goal.info.before != null && !goal.info.before.isReachable()) {
      // Mode analysis determined that this goal can't be reached.
      Goal result = goal.mapChildren(c -> inferUnpruned(c, context));
      return withDet(result, Determinism.ERRONEOUS);
    } else if (goal instanceof Unify unify) {
      return withDet(unify, unifyDeterminism(unify));
    } else if (goal instanceof Goal.Call call) {
      Determinism det =
          (call.proc == null) ? Determinism.ERRONEOUS : table.determinism(call.proc);
      return withDet(call, callDeterminism(call, det, context));
    } else if (goal instanceof Goal.HigherOrderCall call) {
      Determinism det =
          (call.higherOrder == null) ? Determinism.ERRONEOUS : call.higherOrder.determinism;
      return withDet(call, callDeterminism(call, det, context));
    } else if (goal instanceof Goal.Conj conj) {
      return conj(conj, context);
    } else if (goal instanceof Goal.Disj disj) {
      return disj(disj, context);
    } else if (goal instanceof Goal.Not not) {
      Goal inner = infer(not.goal, SolutionContext.FIRST, false);
      return withDet(not.withChildren(ImmutableList.of(inner)), inner.determinism().negation());
    } else if (goal instanceof Goal.IfThenElse ite) {
      return ifThenElse(ite, context);
    } else if (goal instanceof Goal.Scope scope) {
      if (scope.kind == Goal.Scope.Kind.COMMIT) {
        Goal inner = infer(scope.goal, SolutionContext.FIRST, false);
        return withDet(scope.withChildren(ImmutableList.of(inner)), inner.determinism().commit());
      }
      Goal inner = infer(scope.goal, context, false);
      return withDet(scope.withChildren(ImmutableList.of(inner)), inner.determinism());
    } else if (goal instanceof Goal.Switch sw) {
      List<Goal> arms = new ArrayList<>();
      for (Goal.Case c : sw.cases) {
        arms.add(infer(c.goal, context, false));
      }
      return withDet(sw.withChildren(arms), switchDeterminism(arms, sw.isExhaustive()));
    }
    throw new AssertionError(goal);
  }

  /**
   * Returns the determinism of a call to a procedure with determinism {@code det}. A committed
   * choice callee only returns its first solution, so calling it where all solutions are needed
   * is an error; the call is then treated as having all of its solutions.
   */
  private Determinism callDeterminism(Goal call, Determinism det, SolutionContext context) {
    if (context == SolutionContext.FIRST || det.maxSolutions != MaxSolutions.MANY_CC) {
      return det;
    }
    errors.add(
        new DetError(
            Severity.ERROR,
            procId,
            call.id(),
            call.info.context,
            DetError.Kind.CC_CALL_IN_ALL_SOLUTIONS,
            null,
            det,
            ImmutableList.of(),
            ImmutableList.of(new Culprit(call.id(), call.info.context, call.toString(), det))));
    return Determinism.of(det.canFail, MaxSolutions.MANY);
  }

  private static Goal withDet(Goal goal, Determinism det) {
    return goal.withInfo(goal.info.withDeterminism(det));
  }

  /** Returns the determinism of a switch with the given (analyzed) arms. */
  static Determinism switchDeterminism(List<Goal> arms, boolean exhaustive) {
    Determinism det = Determinism.emptySwitch();
    for (Goal arm : arms) {
      det = det.switchJoin(arm.determinism());
    }
    return exhaustive ? det : det.withCanFail();
  }

  /**
   * Returns the determinism of a conjunction of goals with the given determinisms. A conjunct
   * that cannot succeed makes the rest of the conjunction irrelevant.
   */
  static Determinism conjDeterminism(List<Determinism> dets) {
    Determinism det = Determinism.DET;
    for (int i = dets.size() - 1; i >= 0; i--) {
      det = dets.get(i).conjunction(det);
    }
    return det;
  }

  static Determinism unifyDeterminism(Unify unify) {
    if (unify.info.isUnreachableAfter()) {
      return Determinism.FAILURE;
    }
    return unify.canFail ? Determinism.SEMIDET : Determinism.DET;
  }

  private Goal conj(Goal.Conj conj, SolutionContext context) {
    int n = conj.goals.size();
    Goal[] analyzed = new Goal[n];
    Determinism tail = Determinism.DET;
    // Work backwards, since whether a conjunct is in a first-solution context depends on whether
    // the conjuncts after it can fail.
    for (int i = n - 1; i >= 0; i--) {
      SolutionContext headContext =
          (context == SolutionContext.FIRST && !tail.canFail)
              ? SolutionContext.FIRST
              : SolutionContext.ALL;
      analyzed[i] = infer(conj.goals.get(i), headContext, true);
      tail = analyzed[i].determinism().conjunction(tail);
    }
    for (int i = 0; i < n - 1; i++) {
      Goal g = analyzed[i];
      if (!g.determinism().canSucceed()) {
        Goal next = analyzed[i + 1];
        errors.add(
            new DetError(
                Severity.WARNING,
                procId,
                next.id(),
                next.info.context,
                DetError.Kind.UNREACHABLE_CODE,
                null,
                g.determinism(),
                ImmutableList.of(),
                ImmutableList.of(culprit(g))));
        break;
      }
    }
    return withDet(conj.withChildren(ImmutableList.copyOf(analyzed)), tail);
  }

  private Goal disj(Goal.Disj disj, SolutionContext context) {
    SwitchCandidate candidate = SwitchCandidate.find(disj);
    List<Goal> branches = new ArrayList<>();
    for (Goal branch : disj.goals) {
      branches.add(infer(branch, context, false));
    }
    Determinism det;
    if (candidate != null) {
      // At most one branch can be entered, and the leading test only selects the branch.
      det = Determinism.emptySwitch();
      for (Goal branch : branches) {
        det = det.switchJoin(armDeterminism(branch));
      }
      if (!candidate.isExhaustive()) {
        det = det.withCanFail();
      }
    } else {
      det = Determinism.FAILURE;
      for (Goal branch : branches) {
        det = det.disjunction(branch.determinism());
      }
      if (context == SolutionContext.FIRST) {
        det = det.firstSolution();
      }
    }
    return withDet(disj.withChildren(branches), det);
  }

  /**
   * Returns the determinism of an analyzed switch-candidate branch once its leading constructor
   * test has been made redundant by the switch.
   */
  static Determinism armDeterminism(Goal branch) {
    ImmutableList<Goal> conjuncts = branch.conjuncts();
    List<Determinism> dets = new ArrayList<>();
    dets.add(residualTestDeterminism((Unify) conjuncts.get(0)));
    for (int i = 1; i < conjuncts.size(); i++) {
      dets.add(conjuncts.get(i).determinism());
    }
    return conjDeterminism(dets);
  }

  /**
   * Returns the determinism of a deconstruction after its constructor test is done by a switch:
   * it can still fail if it compares any of the arguments.
   */
  static Determinism residualTestDeterminism(Unify test) {
    return test.argModes.contains(Unify.ArgMode.TEST) ? Determinism.SEMIDET : Determinism.DET;
  }

  private Goal ifThenElse(Goal.IfThenElse ite, SolutionContext context) {
    Goal cond = infer(ite.cond, SolutionContext.ALL, true);
    Goal thenGoal = infer(ite.thenGoal, context, false);
    Goal elseGoal = infer(ite.elseGoal, context, false);
    Determinism c = cond.determinism();
    Determinism t = thenGoal.determinism();
    Determinism e = elseGoal.determinism();
    if (c.canSucceedMoreThanOnce()) {
      errors.add(
          new DetError(
              Severity.ERROR,
              procId,
              cond.id(),
              cond.info.context,
              DetError.Kind.NONDET_CONDITION,
              null,
              c,
              ImmutableList.of(),
              multiSolutionCulprits(cond)));
    }
    Determinism det;
    if (!c.canFail) {
      // The else part is unreachable.
      det = c.conjunction(t);
    } else if (!c.canSucceed()) {
      // The then part is unreachable.
      det = e;
    } else {
      Determinism condThen = c.conjunction(t);
      det = Determinism.of(t.canFail || e.canFail, condThen.switchJoin(e).maxSolutions);
    }
    return withDet(ite.withChildren(ImmutableList.of(cond, thenGoal, elseGoal)), det);
  }

  /** Returns true if {@code goal} binds any variable that was free before it. */
  private static boolean bindsVariables(Goal goal) {
    if (goal.info.before == null) {
      return true;
    }
    for (Map.Entry<Var, Inst> entry : goal.info.delta().entrySet()) {
      if (goal.info.before.get(entry.getKey()).isFree() && !entry.getValue().isFree()) {
        return true;
      }
    }
    return false;
  }

  private boolean isImpure(Goal goal) {
    if (goal instanceof Goal.Call call) {
      return table.pred(call.pred).purity == Purity.IMPURE;
    }
    return goal.children().stream().anyMatch(this::isImpure);
  }

  private void reportViolation(Goal body, Determinism declared, Determinism inferred) {
    List<Culprit> failing =
        (inferred.canFail && !declared.canFail) ? failingCulprits(body) : ImmutableList.of();
    List<Culprit> multi =
        inferred.maxSolutions.compareTo(declared.maxSolutions) > 0
            ? multiSolutionCulprits(body)
            : ImmutableList.of();
    errors.add(
        new DetError(
            Severity.ERROR,
            procId,
            body.id(),
            body.info.context,
            DetError.Kind.DECLARATION_VIOLATED,
            declared,
            inferred,
            failing,
            multi));
  }

  private static Culprit culprit(Goal goal) {
    return new Culprit(goal.id(), goal.info.context, goal.toString(), goal.determinism());
  }

  /** Returns the innermost subgoals of {@code goal} that make it able to fail. */
  static ImmutableList<Culprit> failingCulprits(Goal goal) {
    ImmutableList.Builder<Culprit> result = ImmutableList.builder();
    addFailingCulprits(goal, result);
    return result.build();
  }

  private static void addFailingCulprits(Goal goal, ImmutableList.Builder<Culprit> result) {
    if (!goal.determinism().canFail) {
      return;
    }
    if (goal instanceof Goal.Conj || goal instanceof Goal.Scope) {
      goal.children().forEach(c -> addFailingCulprits(c, result));
    } else if (goal instanceof Goal.Disj disj && !disj.goals.isEmpty()) {
      disj.goals.forEach(c -> addFailingCulprits(c, result));
    } else if (goal instanceof Goal.IfThenElse ite) {
      addFailingCulprits(ite.thenGoal, result);
      addFailingCulprits(ite.elseGoal, result);
    } else if (goal instanceof Goal.Switch sw) {
      if (!sw.isExhaustive()) {
        result.add(culprit(goal));
      }
      sw.cases.forEach(c -> addFailingCulprits(c.goal, result));
    } else {
      // A unification, call, negation, or fail.
      result.add(culprit(goal));
    }
  }

  /** Returns the innermost subgoals of {@code goal} that give it multiple solutions. */
  static ImmutableList<Culprit> multiSolutionCulprits(Goal goal) {
    ImmutableList.Builder<Culprit> result = ImmutableList.builder();
    addMultiSolutionCulprits(goal, result);
    return result.build();
  }

  private static void addMultiSolutionCulprits(Goal goal, ImmutableList.Builder<Culprit> result) {
    if (!goal.determinism().canSucceedMoreThanOnce()) {
      return;
    }
    if (goal instanceof Goal.Disj disj) {
      if (SwitchCandidate.find(disj) != null) {
        disj.goals.forEach(c -> addMultiSolutionCulprits(c, result));
      } else {
        result.add(culprit(goal));
      }
    } else if (goal instanceof Goal.Call || goal instanceof Goal.HigherOrderCall) {
      result.add(culprit(goal));
    } else {
      goal.children().forEach(c -> addMultiSolutionCulprits(c, result));
    }
  }
}
