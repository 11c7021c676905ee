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
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Goal.Unify;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.GoalInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;

/**
 * Rewrites disjunctions whose branches each start by testing the same bound variable against a
 * different constructor into {@link Goal.Switch}es, and if-then-elses whose condition is such a
 * test of a variable with a known set of possible constructors into two-armed switches.
 *
 * <p>This runs after determinism analysis, and never changes the determinism of a goal; if it
 * would, that's an internal error. Running it on its own output returns the same tree.
 */
public final class SwitchDetector {

  /** The output of switch detection for one procedure. */
  public static final class Result {
    public final Goal goal;

    /** One warning for each switch that doesn't cover every possible constructor. */
    public final ImmutableList<SwitchWarning> warnings;

    Result(Goal goal, List<SwitchWarning> warnings) {
      this.goal = goal;
      this.warnings = ImmutableList.copyOf(warnings);
    }
  }

  private final ProcId procId;

  /** Supplies ids for the goals this creates. */
  private final GoalBuilder builder;

  private final List<SwitchWarning> warnings = new ArrayList<>();

  private SwitchDetector(ProcId procId, GoalBuilder builder) {
    this.procId = procId;
    this.builder = builder;
  }

  /** Detects switches in a body that has been through determinism analysis. */
  public static Result detect(ProcId procId, Goal body) {
    SwitchDetector detector =
        new SwitchDetector(procId, GoalBuilder.forRewriting(body, ImmutableList.of()));
    Goal result = detector.rewrite(body);
    return new Result(result, detector.warnings);
  }

  private Goal rewrite(Goal goal) {
    Goal result = goal.mapChildren(this::rewrite);
    if (result instanceof Goal.Disj disj) {
      SwitchCandidate candidate = SwitchCandidate.find(disj);
      if (candidate != null) {
        return fromDisj(disj, candidate);
      }
    } else if (result instanceof Goal.IfThenElse ite) {
      Goal.Switch sw = fromIfThenElse(ite);
      if (sw != null) {
        return sw;
      }
    }
    return result;
  }

  private Goal.Switch fromDisj(Goal.Disj disj, SwitchCandidate candidate) {
    List<Goal.Case> cases = new ArrayList<>();
    for (int i = 0; i < disj.goals.size(); i++) {
      Goal branch = disj.goals.get(i);
      Unify test = candidate.tests.get(i);
      ImmutableList<Goal> rest = branch.conjuncts().subList(1, branch.conjuncts().size());
      cases.add(new Goal.Case(ImmutableList.of(test.functor), arm(branch.info, test, rest)));
    }
    return validated(
        disj, candidate.var, cases, candidate.closed, candidate.missing, disj.determinism());
  }

  /**
   * Returns the goal for a switch arm that was selected by {@code test}, followed by {@code rest}.
   * The test itself is kept only if it binds or compares any arguments.
   */
  private static Goal arm(GoalInfo info, Unify test, List<Goal> rest) {
    List<Goal> goals = new ArrayList<>();
    if (!test.args.isEmpty()) {
      Determinism det = DetAnalyzer.residualTestDeterminism(test);
      Goal residual = test.withKind(Unify.Kind.DECONSTRUCT, test.argModes, det.canFail);
      goals.add(residual.withInfo(residual.info.withDeterminism(det)));
    }
    goals.addAll(rest);
    if (goals.size() == 1) {
      return goals.get(0);
    }
    List<Determinism> dets = new ArrayList<>();
    goals.forEach(g -> dets.add(g.determinism()));
    Goal.Conj conj = new Goal.Conj(info, goals);
    return conj.withInfo(info.withDeterminism(DetAnalyzer.conjDeterminism(dets)));
  }

  /**
   * If {@code ite}'s condition just tests a variable with a known set of constructors against one
   * of them (without binding or comparing any arguments other than to extract them), returns an
   * equivalent switch; otherwise returns null.
   */
  private Goal.Switch fromIfThenElse(Goal.IfThenElse ite) {
    if (!(ite.cond instanceof Unify test)
        || test.functor == null
        || test.kind != Unify.Kind.DECONSTRUCT
        || test.argModes.contains(Unify.ArgMode.TEST)
        || !test.canFail
        || test.info.isUnreachableAfter()
        || ite.info.before == null) {
      return null;
    }
    Var var = test.lhs;
    ImmutableSortedSet<ConsId> possible =
        SwitchCandidate.possibleConstructors(var, ite.info.before.get(var));
    if (possible == null || !possible.contains(test.functor) || possible.size() < 2) {
      return null;
    }
    List<ConsId> others = new ArrayList<>(possible);
    others.remove(test.functor);
    Goal selected = ite.thenGoal;
    if (!test.args.isEmpty()) {
      GoalInfo info =
          ite.info
              .withId(new GoalId(builder.nextGoalId()))
              .withInsts(ite.info.before, ite.thenGoal.info.after);
      selected = arm(info, test, ite.thenGoal.conjuncts());
    }
    List<Goal.Case> cases = new ArrayList<>();
    cases.add(new Goal.Case(ImmutableList.of(test.functor), selected));
    cases.add(new Goal.Case(others, ite.elseGoal));
    return validated(ite, var, cases, true, ImmutableSortedSet.of(), ite.determinism());
  }

  /**
   * Returns a switch replacing {@code original}, after checking that its determinism is {@code
   * expected}.
   */
  private Goal.Switch validated(
      Goal original,
      Var var,
      List<Goal.Case> cases,
      boolean closed,
      ImmutableSortedSet<ConsId> missing,
      Determinism expected) {
    List<Goal> arms = new ArrayList<>();
    cases.forEach(c -> arms.add(c.goal));
    Determinism det = DetAnalyzer.switchDeterminism(arms, closed && missing.isEmpty());
    if (det != expected) {
      throw new InternalCompilerError(
          procId,
          "Switch on %s at %s has determinism %s, replacing goal with %s",
          var,
          original.id(),
          det,
          expected);
    }
    if (closed && !missing.isEmpty()) {
      warnings.add(new SwitchWarning(procId, original.id(), original.info.context, var, missing));
    }
    return new Goal.Switch(original.info, var, cases, closed, missing);
  }
}
