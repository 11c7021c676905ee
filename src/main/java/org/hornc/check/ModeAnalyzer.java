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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hornc.check.ModeError.Kind;
import org.hornc.check.ModeError.Mismatch;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Goal.Unify;
import org.hornc.hlds.HigherOrder;
import org.hornc.hlds.Inst;
import org.hornc.hlds.InstMap;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.ProcInfo;
import org.hornc.hlds.Purity;
import org.hornc.hlds.Uniqueness;
import org.hornc.hlds.Var;
import org.jspecify.annotations.Nullable;

/**
 * Checks that the body of a procedure is mode-correct, i.e. that every variable is bound before
 * it is consumed, and annotates each goal with the insts of its variables before and after it.
 *
 * <p>Conjunctions are reordered if necessary so that producers come before consumers. At each step
 * we schedule the first remaining conjunct (in source order) that can be analyzed without error,
 * so the result is the legal schedule closest to the source order. Impure goals are barriers: no
 * other goal may be moved across them.
 *
 * <p>Unifications are classified as assignments, tests, constructions or deconstructions, and each
 * call is matched against the modes of the called predicate.
 *
 * <p>Errors are collected and analysis continues. After an error the variables involved are
 * assumed to be ground (and are "poisoned", so that later errors that only involve them are not
 * reported).
 */
public final class ModeAnalyzer {
  private static final Logger logger = LogManager.getLogger(ModeAnalyzer.class);

  /** The output of mode analysis for one procedure. */
  public static final class Result {
    /** The annotated (and possibly reordered) body. */
    public final Goal goal;

    public final ImmutableList<ModeError> errors;

    Result(Goal goal, List<ModeError> errors) {
      this.goal = goal;
      this.errors = ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
      return !errors.isEmpty();
    }
  }

  /** An annotated goal together with the complete InstMap after it. */
  private static class Analyzed {
    final Goal goal;
    final InstMap after;

    Analyzed(Goal goal, InstMap after) {
      this.goal = goal;
      this.after = after;
    }
  }

  private final ModuleTable table;
  private final ProcId procId;
  private final List<ModeError> errors = new ArrayList<>();

  /**
   * The number of errors found so far, including any that were not added to {@link #errors}
   * because they only involved poisoned variables.
   */
  private int errorCount;

  private Set<Var> poisoned = new HashSet<>();

  private ModeAnalyzer(ModuleTable table, ProcId procId) {
    this.table = table;
    this.procId = procId;
  }

  /** Analyzes the body of the given procedure. */
  public static Result analyze(ModuleTable table, ProcId procId) {
    PredInfo pred = table.pred(procId.pred);
    Preconditions.checkArgument(pred.body != null, "%s has no body", pred);
    ProcInfo proc = table.proc(procId);
    InstMap initial = InstMap.EMPTY;
    for (int i = 0; i < pred.headVars.size(); i++) {
      initial = initial.set(pred.headVars.get(i), proc.argModes.get(i).before);
    }
    ModeAnalyzer analyzer = new ModeAnalyzer(table, procId);
    Analyzed body = analyzer.analyze(pred.body, initial, ImmutableSet.copyOf(pred.headVars));
    analyzer.checkFinalInsts(pred, proc, body);
    return new Result(body.goal, analyzer.errors);
  }

  private void checkFinalInsts(PredInfo pred, ProcInfo proc, Analyzed body) {
    if (!body.after.isReachable()) {
      return;
    }
    List<Mismatch> mismatches = new ArrayList<>();
    for (int i = 0; i < pred.headVars.size(); i++) {
      Var v = pred.headVars.get(i);
      Inst actual = body.after.get(v);
      Inst required = proc.argModes.get(i).after;
      if (!poisoned.contains(v) && !actual.satisfies(required)) {
        mismatches.add(new Mismatch(i + 1, v, required, actual));
      }
    }
    if (!mismatches.isEmpty()) {
      report(body.goal, Kind.FINAL_INST_MISMATCH, mismatches, ImmutableList.of());
    }
  }

  private void report(Goal goal, Kind kind, List<Mismatch> mismatches, List<ProcId> candidates) {
    ++errorCount;
    if (!mismatches.isEmpty() && mismatches.stream().allMatch(m -> poisoned.contains(m.var))) {
      return;
    }
    errors.add(
        new ModeError(
            procId, goal.id(), goal.info.context, kind, goal.toString(), mismatches, candidates));
  }

  /**
   * Analyzes {@code goal} as part of a trial schedule. If it can be analyzed without errors returns
   * the result; otherwise discards any errors and returns null.
   */
  private @Nullable Analyzed tryAnalyze(Goal goal, InstMap before, Set<Var> liveAfter) {
    int savedCount = errorCount;
    int savedSize = errors.size();
    Set<Var> savedPoisoned = new HashSet<>(poisoned);
    Analyzed result = analyze(goal, before, liveAfter);
    if (errorCount == savedCount) {
      return result;
    }
    errorCount = savedCount;
    errors.subList(savedSize, errors.size()).clear();
    poisoned = savedPoisoned;
    return null;
  }

  /**
   * Analyzes {@code goal} starting from the given insts. {@code liveAfter} contains the variables
   * that may be used after the goal completes.
   */
  private Analyzed analyze(Goal goal, InstMap before, Set<Var> liveAfter) {
    if (!before.isReachable()) {
      return new Analyzed(unreachable(goal), InstMap.UNREACHABLE);
    } else if (goal instanceof Unify unify) {
      return unify(unify, before, liveAfter);
    } else if (goal instanceof Goal.Call call) {
      return call(call, before, liveAfter);
    } else if (goal instanceof Goal.HigherOrderCall call) {
      return higherOrderCall(call, before, liveAfter);
    } else if (goal instanceof Goal.Conj conj) {
      return conj(conj, before, liveAfter);
    } else if (goal instanceof Goal.Disj disj) {
      InstMap after = InstMap.UNREACHABLE;
      List<Goal> branches = new ArrayList<>();
      for (Goal branch : disj.goals) {
        Analyzed a = analyze(branch, before, liveAfter);
        branches.add(a.goal);
        after = after.join(a.after);
      }
      return annotate(disj.withChildren(branches), before, after);
    } else if (goal instanceof Goal.Not not) {
      Analyzed inner = analyze(not.goal, before, liveAfter);
      checkNoNonLocalBindings(not, before, inner.after, liveAfter);
      return annotate(not.withChildren(ImmutableList.of(inner.goal)), before, before);
    } else if (goal instanceof Goal.IfThenElse ite) {
      Set<Var> condLive = union(liveAfter, ite.thenGoal.freeVars());
      Analyzed cond = analyze(ite.cond, before, condLive);
      Analyzed thenGoal = analyze(ite.thenGoal, cond.after, liveAfter);
      Analyzed elseGoal = analyze(ite.elseGoal, before, liveAfter);
      return annotate(
          ite.withChildren(ImmutableList.of(cond.goal, thenGoal.goal, elseGoal.goal)),
          before,
          thenGoal.after.join(elseGoal.after));
    } else if (goal instanceof Goal.Scope scope) {
      Analyzed inner = analyze(scope.goal, before, liveAfter);
      return annotate(scope.withChildren(ImmutableList.of(inner.goal)), before, inner.after);
    } else if (goal instanceof Goal.Switch sw) {
      InstMap after = InstMap.UNREACHABLE;
      List<Goal> arms = new ArrayList<>();
      Inst varInst = before.get(sw.var);
      for (Goal.Case c : sw.cases) {
        Inst narrowed = Inst.NOT_REACHED;
        for (ConsId consId : c.consIds) {
          narrowed = narrowed.join(varInst.narrow(consId));
        }
        Analyzed a = analyze(c.goal, before.set(sw.var, narrowed), liveAfter);
        arms.add(a.goal);
        after = after.join(a.after);
      }
      return annotate(sw.withChildren(arms), before, after);
    }
    throw new AssertionError(goal);
  }

  /** Annotates a goal that can't be reached; no errors are reported for it. */
  private static Goal unreachable(Goal goal) {
    Goal result = goal.mapChildren(ModeAnalyzer::unreachable);
    return result.withInfo(result.info.withInsts(InstMap.UNREACHABLE, InstMap.UNREACHABLE));
  }

  private static Analyzed annotate(Goal goal, InstMap before, InstMap after) {
    ImmutableSortedSet<Var> vars = goal.freeVars();
    return new Analyzed(
        goal.withInfo(goal.info.withInsts(before.restrict(vars), after.restrict(vars))), after);
  }

  /**
   * Returns the result of a leaf goal that had an error: any of its variables that aren't bound
   * are assumed to be ground from now on.
   */
  private Analyzed failed(Goal goal, InstMap before) {
    InstMap after = before;
    for (Var v : goal.freeVars()) {
      if (!before.get(v).isBound()) {
        after = after.set(v, Inst.GROUND);
        poisoned.add(v);
      }
    }
    return annotate(goal, before, after);
  }

  /**
   * Reports an error if any of the given variables may be free on some paths and bound on others.
   * Returns true if an error was reported.
   */
  private boolean checkMixed(Goal goal, List<Var> vars, InstMap m) {
    List<Mismatch> mismatches = new ArrayList<>();
    for (Var v : vars) {
      Inst inst = m.get(v);
      if (inst instanceof Inst.Mixed mixed && !alreadyListed(mismatches, v)) {
        mismatches.add(new Mismatch(0, v, mixed.boundPart, inst));
      }
    }
    if (mismatches.isEmpty()) {
      return false;
    }
    report(goal, Kind.PARTIALLY_INSTANTIATED, mismatches, ImmutableList.of());
    return true;
  }

  private static boolean alreadyListed(List<Mismatch> mismatches, Var v) {
    return mismatches.stream().anyMatch(m -> m.var.equals(v));
  }

  /** Reports an error if any of the given variables has been clobbered. */
  private boolean checkClobbered(Goal goal, List<Var> vars, InstMap m) {
    List<Mismatch> mismatches = new ArrayList<>();
    for (Var v : vars) {
      Inst inst = m.get(v);
      if (inst.isBound() && inst.uniqueness() == Uniqueness.CLOBBERED) {
        mismatches.add(new Mismatch(0, v, Inst.GROUND, inst));
      }
    }
    if (mismatches.isEmpty()) {
      return false;
    }
    report(goal, Kind.CLOBBERED_USE, mismatches, ImmutableList.of());
    return true;
  }

  private Analyzed unify(Unify unify, InstMap m, Set<Var> liveAfter) {
    if (checkMixed(unify, unify.freeVars().asList(), m)) {
      return failed(unify, m);
    } else if (unify.isVarVar()) {
      return unifyVars(unify, m, liveAfter);
    } else if (unify.isClosure()) {
      return unifyClosure(unify, m, liveAfter);
    }
    Inst lhs = m.get(unify.lhs);
    return lhs.isFree() ? construct(unify, m, liveAfter) : deconstruct(unify, m, liveAfter);
  }

  private Analyzed unifyVars(Unify unify, InstMap m, Set<Var> liveAfter) {
    Var x = unify.lhs;
    Var y = unify.rhsVar;
    Inst ix = m.get(x);
    Inst iy = m.get(y);
    if (ix.isFree() && iy.isFree()) {
      report(
          unify,
          Kind.FREE_UNIFICATION,
          ImmutableList.of(
              new Mismatch(0, x, Inst.GROUND, ix), new Mismatch(0, y, Inst.GROUND, iy)),
          ImmutableList.of());
      return failed(unify, m);
    } else if (ix.isFree()) {
      return assign(unify, m, liveAfter);
    } else if (iy.isFree()) {
      return assign(unify.swapped(), m, liveAfter);
    } else if (checkClobbered(unify, ImmutableList.of(x, y), m)) {
      return failed(unify, m);
    }
    List<Mismatch> partial = new ArrayList<>();
    if (!ix.isGround()) {
      partial.add(new Mismatch(0, x, Inst.GROUND, ix));
    }
    if (!iy.isGround()) {
      partial.add(new Mismatch(0, y, Inst.GROUND, iy));
    }
    if (!partial.isEmpty()) {
      report(unify, Kind.PARTIALLY_INSTANTIATED, partial, ImmutableList.of());
      return failed(unify, m);
    }
    // After a successful test both variables have the more precise of the two insts.
    InstMap after = m;
    ImmutableSortedSet<ConsId> fx = ix.functors();
    ImmutableSortedSet<ConsId> fy = iy.functors();
    if (fx != null && fy != null) {
      if (fx.stream().noneMatch(fy::contains)) {
        after = InstMap.UNREACHABLE;
      }
    } else if (fx != null) {
      after = after.set(y, ix.withUniqueness(iy.uniqueness()));
    } else if (fy != null) {
      after = after.set(x, iy.withUniqueness(ix.uniqueness()));
    }
    Unify result = unify.withKind(Unify.Kind.SIMPLE_TEST, ImmutableList.of(), true);
    return annotate(result, m, after);
  }

  /** {@code unify.lhs} is free and {@code unify.rhsVar} is bound. */
  private Analyzed assign(Unify unify, InstMap m, Set<Var> liveAfter) {
    Var target = unify.lhs;
    Var source = unify.rhsVar;
    if (checkClobbered(unify, ImmutableList.of(source), m)) {
      return failed(unify, m);
    }
    Inst inst = m.get(source);
    InstMap after = m;
    if (inst.uniqueness() == Uniqueness.UNIQUE && liveAfter.contains(source)) {
      // Both variables now refer to the same value.
      inst = inst.withUniqueness(Uniqueness.SHARED);
      after = after.set(source, inst);
    }
    after = after.set(target, inst);
    Unify result = unify.withKind(Unify.Kind.ASSIGN, ImmutableList.of(), false);
    return annotate(result, m, after);
  }

  /** {@code unify.lhs} is free. */
  private Analyzed construct(Unify unify, InstMap m, Set<Var> liveAfter) {
    List<Mismatch> free = new ArrayList<>();
    for (int i = 0; i < unify.args.size(); i++) {
      Var arg = unify.args.get(i);
      Inst inst = m.get(arg);
      if (!inst.isBound()) {
        free.add(new Mismatch(i + 1, arg, Inst.GROUND, inst));
      }
    }
    if (!free.isEmpty()) {
      report(unify, Kind.FREE_ARG_IN_CONSTRUCTION, free, ImmutableList.of());
      return failed(unify, m);
    } else if (checkClobbered(unify, unify.args, m)) {
      return failed(unify, m);
    }
    InstMap after = m;
    List<Inst> argInsts = new ArrayList<>();
    for (Var arg : unify.args) {
      Inst inst = m.get(arg);
      if (inst.uniqueness() == Uniqueness.UNIQUE && liveAfter.contains(arg)) {
        inst = inst.withUniqueness(Uniqueness.SHARED);
        after = after.set(arg, inst);
      }
      argInsts.add(inst);
    }
    after = after.set(unify.lhs, Inst.bound(Uniqueness.UNIQUE, unify.functor, argInsts));
    Unify result = unify.withKind(Unify.Kind.CONSTRUCT, ImmutableList.of(), false);
    return annotate(result, m, after);
  }

  /** {@code unify.lhs} is bound. */
  private Analyzed deconstruct(Unify unify, InstMap m, Set<Var> liveAfter) {
    Var x = unify.lhs;
    ConsId functor = unify.functor;
    if (checkClobbered(unify, ImmutableList.of(x), m)) {
      return failed(unify, m);
    }
    Inst ix = m.get(x);
    Inst narrowed = ix.narrow(functor);
    ImmutableSortedSet<ConsId> possible = ix.functors();
    boolean canFail;
    if (possible != null) {
      canFail = !(possible.size() == 1 && possible.contains(functor));
    } else {
      canFail = !(x.type != null && x.type.constructors.equals(ImmutableList.of(functor)));
    }
    ImmutableList.Builder<Unify.ArgMode> argModes = ImmutableList.builder();
    if (!narrowed.isReachable()) {
      unify.args.forEach(a -> argModes.add(Unify.ArgMode.OUTPUT));
      Unify result = unify.withKind(Unify.Kind.DECONSTRUCT, argModes.build(), true);
      return annotate(result, m, InstMap.UNREACHABLE);
    }
    ImmutableList<Inst> fields = narrowed.argInsts(functor);
    InstMap after = m.set(x, narrowed);
    List<Mismatch> partial = new ArrayList<>();
    for (int i = 0; i < unify.args.size(); i++) {
      Var arg = unify.args.get(i);
      Inst field = fields.get(i);
      Inst inst = m.get(arg);
      if (inst.isFree()) {
        argModes.add(Unify.ArgMode.OUTPUT);
        if (liveAfter.contains(x)) {
          field = field.withUniqueness(Uniqueness.SHARED);
        }
        after = after.set(arg, field);
      } else {
        argModes.add(Unify.ArgMode.TEST);
        canFail = true;
        if (!inst.isGround()) {
          partial.add(new Mismatch(i + 1, arg, Inst.GROUND, inst));
        }
      }
    }
    if (!partial.isEmpty()) {
      report(unify, Kind.PARTIALLY_INSTANTIATED, partial, ImmutableList.of());
      return failed(unify, m);
    } else if (checkClobbered(unify, unify.args, m)) {
      return failed(unify, m);
    }
    Unify result = unify.withKind(Unify.Kind.DECONSTRUCT, argModes.build(), canFail);
    return annotate(result, m, after);
  }

  private Analyzed unifyClosure(Unify unify, InstMap m, Set<Var> liveAfter) {
    Inst ix = m.get(unify.lhs);
    if (!ix.isFree()) {
      report(
          unify,
          Kind.NO_MATCHING_MODE,
          ImmutableList.of(new Mismatch(0, unify.lhs, Inst.FREE, ix)),
          ImmutableList.of());
      return failed(unify, m);
    }
    PredInfo pred = table.pred(unify.closurePred);
    int numCaptured = unify.args.size();
    ProcId chosen = selectProc(unify, pred, unify.args, m);
    if (chosen == null) {
      return failed(unify, m);
    }
    ProcInfo proc = pred.procs.get(chosen.modeNum);
    if (proc.declared == null) {
      report(unify, Kind.CLOSURE_NEEDS_DETERMINISM, ImmutableList.of(), ImmutableList.of(chosen));
      return failed(unify, m);
    }
    HigherOrder ho =
        new HigherOrder(proc.argModes.subList(numCaptured, proc.argModes.size()), proc.declared);
    InstMap after = m;
    for (Var arg : unify.args) {
      Inst inst = m.get(arg);
      if (inst.uniqueness() == Uniqueness.UNIQUE) {
        after = after.set(arg, inst.withUniqueness(Uniqueness.SHARED));
      }
    }
    after = after.set(unify.lhs, Inst.closure(ho));
    Unify result =
        unify.withKind(Unify.Kind.CONSTRUCT, ImmutableList.of(), false).withClosureProc(chosen);
    return annotate(result, m, after);
  }

  /**
   * Returns the unique mode of {@code pred} whose initial insts are satisfied by the insts of
   * {@code args} (which may be a prefix of the predicate's arguments, for a closure). If there is
   * no such mode, or more than one, reports an error and returns null.
   */
  private @Nullable ProcId selectProc(Goal goal, PredInfo pred, List<Var> args, InstMap m) {
    List<ProcId> matches = new ArrayList<>();
    List<Mismatch> closest = null;
    for (int j = 0; j < pred.procs.size(); j++) {
      List<Mode> modes = pred.procs.get(j).argModes;
      List<Mismatch> mismatches = mismatches(args, modes.subList(0, args.size()), m);
      if (args.size() < modes.size()) {
        // Captured arguments of a closure must be inputs.
        for (int i = 0; i < args.size(); i++) {
          if (!modes.get(i).isInput()) {
            mismatches.add(new Mismatch(i + 1, args.get(i), Inst.GROUND, Inst.FREE));
          }
        }
      }
      if (mismatches.isEmpty()) {
        matches.add(pred.procId(j));
      } else if (closest == null || mismatches.size() < closest.size()) {
        closest = mismatches;
      }
    }
    if (matches.size() == 1) {
      return matches.get(0);
    } else if (matches.isEmpty()) {
      boolean allClobbered =
          closest.stream()
              .allMatch(x -> x.actual.isBound() && x.actual.uniqueness() == Uniqueness.CLOBBERED);
      report(
          goal,
          allClobbered ? Kind.CLOBBERED_USE : Kind.NO_MATCHING_MODE,
          closest,
          ImmutableList.of());
    } else {
      report(goal, Kind.AMBIGUOUS_MODE, ImmutableList.of(), matches);
    }
    return null;
  }

  private static List<Mismatch> mismatches(List<Var> args, List<Mode> modes, InstMap m) {
    List<Mismatch> result = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      Inst actual = m.get(args.get(i));
      Inst required = modes.get(i).before;
      if (!actual.satisfies(required)) {
        result.add(new Mismatch(i + 1, args.get(i), required, actual));
      }
    }
    return result;
  }

  /** Returns the insts after a call in which {@code args} were passed with the given modes. */
  private static InstMap applyModes(List<Var> args, List<Mode> modes, InstMap m) {
    InstMap after = m;
    for (int i = 0; i < args.size(); i++) {
      Var arg = args.get(i);
      Mode mode = modes.get(i);
      Inst inst = m.get(arg);
      if (!mode.isInput()) {
        after = after.set(arg, mode.after);
      } else if (inst.isBound() && mode.after.uniqueness() != Uniqueness.CLOBBERED) {
        // An input keeps what we knew about its value, but may lose its uniqueness.
        Uniqueness u = inst.uniqueness().join(mode.after.uniqueness());
        after = after.set(arg, inst.withUniqueness(u));
      } else {
        after = after.set(arg, mode.after);
      }
    }
    return after;
  }

  private Analyzed call(Goal.Call call, InstMap m, Set<Var> liveAfter) {
    if (checkMixed(call, call.args, m)) {
      return failed(call, m);
    }
    PredInfo pred = table.pred(call.pred);
    ProcId chosen = selectProc(call, pred, call.args, m);
    if (chosen == null) {
      return failed(call, m);
    }
    InstMap after = applyModes(call.args, pred.procs.get(chosen.modeNum).argModes, m);
    return annotate(call.withProc(chosen), m, after);
  }

  private Analyzed higherOrderCall(Goal.HigherOrderCall call, InstMap m, Set<Var> liveAfter) {
    List<Var> vars = ImmutableList.<Var>builder().add(call.closure).addAll(call.args).build();
    if (checkMixed(call, vars, m) || checkClobbered(call, ImmutableList.of(call.closure), m)) {
      return failed(call, m);
    }
    Inst closure = m.get(call.closure);
    HigherOrder ho = (closure instanceof Inst.Ground g) ? g.higherOrder : null;
    if (ho == null) {
      report(
          call,
          Kind.NOT_CALLABLE,
          ImmutableList.of(new Mismatch(0, call.closure, Inst.GROUND, closure)),
          ImmutableList.of());
      return failed(call, m);
    } else if (ho.argModes.size() != call.args.size()) {
      report(
          call,
          Kind.NO_MATCHING_MODE,
          ImmutableList.of(new Mismatch(0, call.closure, Inst.closure(ho), closure)),
          ImmutableList.of());
      return failed(call, m);
    }
    List<Mismatch> mismatches = mismatches(call.args, ho.argModes, m);
    if (!mismatches.isEmpty()) {
      report(call, Kind.NO_MATCHING_MODE, mismatches, ImmutableList.of());
      return failed(call, m);
    }
    InstMap after = applyModes(call.args, ho.argModes, m);
    return annotate(call.withHigherOrder(ho), m, after);
  }

  private Analyzed conj(Goal.Conj conj, InstMap before, Set<Var> liveAfter) {
    List<Goal> remaining = new ArrayList<>(conj.goals);
    List<Goal> scheduled = new ArrayList<>();
    InstMap current = before;
    boolean reordered = false;
    while (!remaining.isEmpty()) {
      if (!current.isReachable()) {
        remaining.forEach(g -> scheduled.add(unreachable(g)));
        break;
      }
      Analyzed next = null;
      int chosen = 0;
      for (int i = 0; i < remaining.size(); i++) {
        Goal g = remaining.get(i);
        if (i > 0 && isImpure(g)) {
          break;
        }
        next = tryAnalyze(g, current, liveAfter(liveAfter, remaining, i));
        if (next != null) {
          chosen = i;
          break;
        } else if (isImpure(g)) {
          break;
        }
      }
      if (next == null) {
        // Nothing can be scheduled without error; report the errors of the first remaining goal.
        next = analyze(remaining.get(0), current, liveAfter(liveAfter, remaining, 0));
      }
      reordered |= (chosen != 0);
      scheduled.add(next.goal);
      current = next.after;
      remaining.remove(chosen);
    }
    if (reordered) {
      logger.debug("{}: reordered conjunction {} as {}", procId, conj.id(), scheduled);
    }
    return annotate(conj.withChildren(scheduled), before, current);
  }

  /** Returns the variables that may be used after {@code remaining.get(skip)}. */
  private static Set<Var> liveAfter(Set<Var> liveAfter, List<Goal> remaining, int skip) {
    Set<Var> result = new HashSet<>(liveAfter);
    for (int i = 0; i < remaining.size(); i++) {
      if (i != skip) {
        result.addAll(remaining.get(i).freeVars());
      }
    }
    return result;
  }

  private boolean isImpure(Goal goal) {
    if (goal instanceof Goal.Call call) {
      return table.pred(call.pred).purity == Purity.IMPURE;
    }
    return goal.children().stream().anyMatch(this::isImpure);
  }

  /**
   * Reports an error if {@code goal} (a negation) binds any variable that was free before it and
   * is used after it.
   */
  private void checkNoNonLocalBindings(
      Goal goal, InstMap before, InstMap innerAfter, Set<Var> liveAfter) {
    if (!innerAfter.isReachable()) {
      return;
    }
    List<Mismatch> bound = new ArrayList<>();
    for (Var v : goal.freeVars()) {
      if (before.get(v).isFree() && !innerAfter.get(v).isFree() && liveAfter.contains(v)) {
        bound.add(new Mismatch(0, v, Inst.FREE, innerAfter.get(v)));
      }
    }
    if (!bound.isEmpty()) {
      report(goal, Kind.NEGATION_BINDS_NONLOCAL, bound, ImmutableList.of());
    }
  }

  private static Set<Var> union(Set<Var> a, Set<Var> b) {
    Set<Var> result = new HashSet<>(a);
    result.addAll(b);
    return result;
  }
}
