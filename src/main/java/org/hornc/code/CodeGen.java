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

package org.hornc.code;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.CodeModel;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Goal;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.Inst;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.ProcInfo;
import org.hornc.hlds.Var;
import org.jspecify.annotations.Nullable;

/**
 * Generates the low-level code for one procedure from its analyzed body.
 *
 * <p>Code is first generated with each variable in its own {@link Lval.Local}; {@link
 * SlotAssigner} then maps those to frame slots, and {@link InstrOptimizer} cleans up the result.
 *
 * <p>Every goal is generated with a <i>failure target</i>: the label to jump to if the goal fails.
 * Goals whose code model is NON instead fail by backtracking into the most recent choice point,
 * and are given the special {@link FailTarget#backtrack} target, whose code is just {@link
 * Instr.Fail}. A goal that leaves choice points but appears where its caller expects DET or SEMI
 * code (because only its first solution is wanted) is wrapped in a commit: the choice stack height
 * is saved before it and cut back to afterwards.
 */
public final class CodeGen {
  private static final Logger logger = LogManager.getLogger(CodeGen.class);

  /** Where control goes when a goal fails. */
  private static final class FailTarget {
    final Label label;

    /** True if the code at {@link #label} just backtracks to the most recent choice point. */
    final boolean backtrack;

    /** The variables that are read after control reaches {@link #label}. */
    final ImmutableSortedSet<Var> live;

    FailTarget(Label label, boolean backtrack, ImmutableSortedSet<Var> live) {
      this.label = label;
      this.backtrack = backtrack;
      this.live = live;
    }
  }

  /**
   * The loop that self-recursive tail calls are turned into. The loop head follows the entry code
   * that loads the invariant inputs and evaluates the hoisted goals, so a tail call only reloads
   * the other inputs.
   */
  private static final class Loop {
    final Label head;

    /** The tail calls; compared by identity. */
    final Set<Goal> tailCalls = Collections.newSetFromMap(new IdentityHashMap<>());

    /** The positions of the inputs that tail calls must reload. */
    final List<Integer> reloaded = new ArrayList<>();

    /** The positions of the inputs that every tail call passes through unchanged. */
    final List<Integer> invariant = new ArrayList<>();

    /** Unifications that are evaluated once, before the loop head. */
    final List<Goal.Unify> hoisted = new ArrayList<>();

    /** The variables that are set before the loop head and so are live throughout the loop. */
    ImmutableSortedSet<Var> pinned = ImmutableSortedSet.of();

    Loop(Label head) {
      this.head = head;
    }
  }

  private final ModuleTable table;
  private final ProcId procId;
  private final PredInfo pred;
  private final ProcInfo proc;
  private final CodeModel model;
  private final OptTuple opt;
  private final Liveness liveness;

  private final List<Instr> code = new ArrayList<>();
  private final Map<Goal, Boolean> leavesChoicePoints = new IdentityHashMap<>();
  private int nextLabel;
  private int nextTemp;

  /** The goal that instructions are currently being generated for. */
  private @Nullable GoalId origin;

  /** The code at this label returns failure from a SEMI procedure, or aborts a DET one. */
  private @Nullable Label failExit;

  /** The code at this label is just {@link Instr.Fail}. */
  private @Nullable Label backtrack;

  private @Nullable Loop loop;

  private CodeGen(ModuleTable table, ProcId procId, Goal body, OptTuple opt) {
    this.table = table;
    this.procId = procId;
    this.pred = table.pred(procId.pred);
    this.proc = table.proc(procId);
    this.model = table.determinism(procId).codeModel();
    this.opt = opt;
    this.liveness = Liveness.compute(body, outputs(pred.headVars, proc.argModes));
  }

  /**
   * Generates, assigns slots for, and optimizes the code for a procedure. If {@code verify} is
   * true the result is checked with {@link LivenessChecker}.
   */
  public static ProcCode generate(
      ModuleTable table, ProcId procId, Goal body, OptTuple opt, boolean verify) {
    CodeGen gen = new CodeGen(table, procId, body, opt);
    ImmutableList<Instr> raw = gen.generate(body);
    if (verify) {
      LivenessChecker.checkChoicePoints(procId, raw);
    }
    SlotAssigner.Result assigned = SlotAssigner.assign(procId, raw, opt);
    ImmutableList<Instr> optimized = InstrOptimizer.optimize(procId, assigned.instrs, opt);
    ProcCode result = new ProcCode(procId, gen.model, assigned.frameSize, optimized);
    if (verify) {
      LivenessChecker.checkSlots(result);
    }
    logger.debug(
        "{}: {} instructions generated, {} after optimization, {} slots",
        procId,
        raw.size(),
        optimized.size(),
        assigned.frameSize);
    return result;
  }

  /**
   * Returns the code for a procedure implemented by foreign code, which is only called through
   * closures; direct calls use {@link Instr.ForeignCall}.
   */
  public static ProcCode foreignWrapper(ModuleTable table, ProcId procId) {
    PredInfo pred = table.pred(procId.pred);
    ImmutableList<Mode> modes = table.proc(procId).argModes;
    CodeModel model = table.determinism(procId).codeModel();
    if (model == CodeModel.NON) {
      throw new InternalCompilerError(procId, "Foreign procedure cannot be nondeterministic");
    }
    List<Rval> inputs = new ArrayList<>();
    List<Lval> outputs = new ArrayList<>();
    for (int i = 0; i < modes.size(); i++) {
      if (modes.get(i).isInput()) {
        inputs.add(new Lval.Reg(i + 1));
      } else if (modes.get(i).isOutput()) {
        outputs.add(new Lval.Reg(i + 1));
      }
    }
    return new ProcCode(
        procId,
        model,
        0,
        ImmutableList.of(
            new Instr.ForeignCall(null, pred.foreignName, inputs, outputs, model),
            new Instr.Return(null)));
  }

  private static List<Var> outputs(List<Var> headVars, List<Mode> modes) {
    List<Var> result = new ArrayList<>();
    for (int i = 0; i < modes.size(); i++) {
      if (modes.get(i).isOutput()) {
        result.add(headVars.get(i));
      }
    }
    return result;
  }

  private ImmutableList<Instr> generate(Goal body) {
    if (opt.enabled(OptTuple.Switch.TAIL_CALLS) && model != CodeModel.NON) {
      loop = findLoop(body);
    }
    FailTarget procFail =
        (model == CodeModel.NON)
            ? backtrackTarget()
            : new FailTarget(failExit(), false, ImmutableSortedSet.of());
    genEntry(body, procFail);
    gen(body, procFail);
    genExit();
    if (failExit != null) {
      emit(new Instr.Define(null, failExit));
      if (model == CodeModel.SEMI) {
        emit(new Instr.FreeFrame(null));
        emit(new Instr.SetSuccess(null, false));
        emit(new Instr.Return(null));
      } else {
        emit(new Instr.Abort(null, "det procedure " + procId + " failed"));
      }
    }
    if (backtrack != null) {
      emit(new Instr.Define(null, backtrack));
      emit(new Instr.Fail(null));
    }
    return ImmutableList.copyOf(code);
  }

  private void genEntry(Goal body, FailTarget procFail) {
    origin = null;
    // The size is filled in by SlotAssigner.
    emit(new Instr.AllocFrame(null, 0));
    ImmutableSortedSet<Var> used = liveness.liveBefore(body);
    List<Integer> loaded = new ArrayList<>();
    if (loop != null) {
      loadInputs(loop.invariant, used);
      for (Goal.Unify unify : loop.hoisted) {
        origin = unify.id();
        genUnify(unify, procFail);
      }
      origin = null;
      emit(new Instr.Define(null, loop.head));
      loaded.addAll(loop.reloaded);
    } else {
      for (int i = 0; i < proc.argModes.size(); i++) {
        if (proc.argModes.get(i).isInput()) {
          loaded.add(i);
        }
      }
    }
    loadInputs(loaded, used);
  }

  private void loadInputs(List<Integer> positions, Set<Var> used) {
    for (int i : positions) {
      Var v = pred.headVars.get(i);
      if (used.contains(v)) {
        emit(new Instr.Assign(null, local(v), new Lval.Reg(i + 1)));
      }
    }
  }

  private void genExit() {
    origin = null;
    for (int i = 0; i < proc.argModes.size(); i++) {
      if (proc.argModes.get(i).isOutput()) {
        emit(new Instr.Assign(null, new Lval.Reg(i + 1), local(pred.headVars.get(i))));
      }
    }
    emit(new Instr.FreeFrame(null));
    if (model == CodeModel.SEMI) {
      emit(new Instr.SetSuccess(null, true));
    }
    emit(new Instr.Return(null));
  }

  private void gen(Goal goal, FailTarget fail) {
    gen(goal, fail, false);
  }

  /**
   * Generates code for {@code goal}. If {@code prune} is true only the first solution is wanted,
   * so no choice points may be left behind even if the goal's code model is NON.
   */
  private void gen(Goal goal, FailTarget fail, boolean prune) {
    if (isUnreachable(goal) || (loop != null && loop.hoisted.contains(goal))) {
      return;
    }
    GoalId saved = origin;
    origin = goal.id();
    Determinism det = goal.determinism();
    boolean leaves = leavesChoicePoints(goal);
    if (leaves && (prune || det.codeModel() != CodeModel.NON)) {
      genCommitted(goal, fail);
    } else {
      if (leaves && !fail.backtrack) {
        throw new InternalCompilerError(
            procId, "Goal %s leaves choice points but has a failure label", goal.id());
      }
      genStructural(goal, fail);
    }
    if (!det.canSucceed()) {
      origin = goal.id();
      if (det.canFail) {
        emitFail(fail);
      } else {
        emit(new Instr.Abort(origin, "erroneous goal " + goal.id() + " succeeded"));
      }
    }
    origin = saved;
  }

  private void genStructural(Goal goal, FailTarget fail) {
    if (goal instanceof Goal.Unify unify) {
      genUnify(unify, fail);
    } else if (goal instanceof Goal.Call call) {
      genCall(call, fail);
    } else if (goal instanceof Goal.HigherOrderCall hoCall) {
      genHigherOrderCall(hoCall, fail);
    } else if (goal instanceof Goal.Conj conj) {
      for (Goal g : conj.goals) {
        gen(g, fail);
        if (!isUnreachable(g) && !g.determinism().canSucceed()) {
          break;
        }
      }
    } else if (goal instanceof Goal.Disj disj) {
      genDisj(disj, fail);
    } else if (goal instanceof Goal.Switch sw) {
      genSwitch(sw, fail);
    } else if (goal instanceof Goal.IfThenElse ite) {
      genIfThenElse(ite, fail);
    } else if (goal instanceof Goal.Not not) {
      genNot(not, fail);
    } else if (goal instanceof Goal.Scope scope) {
      gen(scope.goal, fail, scope.kind == Goal.Scope.Kind.COMMIT);
    } else {
      throw new InternalCompilerError(procId, "Unexpected goal %s", goal);
    }
  }

  /**
   * Generates code for a goal that leaves choice points, followed by code that removes them
   * again.
   */
  private void genCommitted(Goal goal, FailTarget fail) {
    Lval.Temp height = new Lval.Temp(nextTemp++);
    emit(new Instr.SaveChoiceHeight(origin, height));
    if (fail.backtrack) {
      // If the goal fails it backtracks past its own choice points to the one below them,
      // which is where our failure would go anyway.
      genStructural(goal, fail);
      emit(new Instr.CutTo(origin, height));
      return;
    }
    Label resume = newLabel();
    Label done = newLabel();
    emit(new Instr.PushChoice(origin, resume, ImmutableList.of(), fail.live));
    genStructural(goal, backtrackTarget());
    emit(new Instr.CutTo(origin, height));
    emit(new Instr.Goto(origin, done));
    emit(new Instr.Define(origin, resume));
    emit(new Instr.PopChoice(origin));
    emitFail(fail);
    emit(new Instr.Define(origin, done));
  }

  private void genUnify(Goal.Unify unify, FailTarget fail) {
    ImmutableSortedSet<Var> after = liveness.liveAfter(unify);
    switch (unify.kind) {
      case ASSIGN -> {
        if (after.contains(unify.lhs)) {
          emit(new Instr.Assign(origin, local(unify.lhs), local(unify.rhsVar)));
        }
      }
      case SIMPLE_TEST ->
          emit(
              new Instr.GotoIf(
                  origin, Cond.equal(local(unify.lhs), local(unify.rhsVar)).negate(), fail.label));
      case CONSTRUCT -> {
        if (after.contains(unify.lhs)) {
          List<Rval> args = new ArrayList<>();
          unify.args.forEach(v -> args.add(local(v)));
          emit(
              new Instr.Construct(
                  origin, local(unify.lhs), unify.functor, unify.closureProc, args));
        }
      }
      case DECONSTRUCT -> {
        Lval x = local(unify.lhs);
        if (unify.canFail) {
          Cond test = Cond.hasFunctor(x, ImmutableList.of(unify.functor));
          emit(new Instr.GotoIf(origin, test.negate(), fail.label));
        }
        for (int i = 0; i < unify.args.size(); i++) {
          Var arg = unify.args.get(i);
          Rval field = new Rval.Field(x, i);
          if (unify.argModes.get(i) == Goal.Unify.ArgMode.OUTPUT) {
            if (after.contains(arg)) {
              emit(new Instr.Assign(origin, local(arg), field));
            }
          } else {
            emit(new Instr.GotoIf(origin, Cond.equal(field, local(arg)).negate(), fail.label));
          }
        }
      }
      case UNKNOWN -> throw new InternalCompilerError(procId, "Unanalyzed unification %s", unify);
    }
  }

  private void genCall(Goal.Call call, FailTarget fail) {
    ProcId callee = call.proc;
    if (callee == null) {
      throw new InternalCompilerError(procId, "No mode selected for %s", call);
    }
    if (loop != null && loop.tailCalls.contains(call)) {
      for (int i : loop.reloaded) {
        emit(new Instr.Assign(origin, new Lval.Reg(i + 1), local(call.args.get(i))));
      }
      emit(new Instr.Goto(origin, loop.head));
      return;
    }
    ImmutableList<Mode> modes = table.proc(callee).argModes;
    CodeModel calleeModel = table.determinism(callee).codeModel();
    ImmutableSortedSet<Var> after = liveness.liveAfter(call);
    PredInfo calleePred = table.pred(call.pred);
    if (calleePred.isForeign()) {
      if (calleeModel == CodeModel.NON) {
        throw new InternalCompilerError(procId, "Nondeterministic foreign call %s", call);
      }
      List<Rval> inputs = new ArrayList<>();
      List<Lval> outputs = new ArrayList<>();
      for (int i = 0; i < modes.size(); i++) {
        Var arg = call.args.get(i);
        if (modes.get(i).isInput()) {
          inputs.add(local(arg));
        } else if (modes.get(i).isOutput()) {
          // Results that nobody reads go to a scratch register.
          outputs.add(after.contains(arg) ? local(arg) : new Lval.Reg(i + 1));
        }
      }
      emit(new Instr.ForeignCall(origin, calleePred.foreignName, inputs, outputs, calleeModel));
      checkSuccess(calleeModel, fail);
      return;
    }
    loadArgs(call.args, modes);
    emit(new Instr.Call(origin, callee, calleeModel));
    checkSuccess(calleeModel, fail);
    storeResults(call.args, modes, after);
  }

  private void genHigherOrderCall(Goal.HigherOrderCall call, FailTarget fail) {
    if (call.higherOrder == null) {
      throw new InternalCompilerError(procId, "No higher-order inst for %s", call);
    }
    ImmutableList<Mode> modes = call.higherOrder.argModes;
    CodeModel calleeModel = call.higherOrder.determinism.codeModel();
    loadArgs(call.args, modes);
    emit(new Instr.CallClosure(origin, local(call.closure), call.args.size(), calleeModel));
    checkSuccess(calleeModel, fail);
    storeResults(call.args, modes, liveness.liveAfter(call));
  }

  private void loadArgs(List<Var> args, List<Mode> modes) {
    for (int i = 0; i < modes.size(); i++) {
      if (modes.get(i).isInput()) {
        emit(new Instr.Assign(origin, new Lval.Reg(i + 1), local(args.get(i))));
      }
    }
  }

  private void storeResults(List<Var> args, List<Mode> modes, Set<Var> after) {
    for (int i = 0; i < modes.size(); i++) {
      if (modes.get(i).isOutput() && after.contains(args.get(i))) {
        emit(new Instr.Assign(origin, local(args.get(i)), new Lval.Reg(i + 1)));
      }
    }
  }

  private void checkSuccess(CodeModel calleeModel, FailTarget fail) {
    if (calleeModel == CodeModel.SEMI) {
      emit(new Instr.GotoIf(origin, Cond.SUCCEEDED.negate(), fail.label));
    }
  }

  /**
   * Each disjunct but the last runs with a choice point whose resume label leads to the next
   * disjunct; the last one pops the choice point and fails to the disjunction's own target.
   */
  private void genDisj(Goal.Disj disj, FailTarget fail) {
    ImmutableList<Goal> branches = disj.goals;
    if (branches.size() <= 1) {
      // The empty disjunction's failure is emitted by our caller.
      if (!branches.isEmpty()) {
        gen(branches.get(0), fail);
      }
      return;
    }
    GoalId disjId = origin;
    Label end = newLabel();
    List<Label> resumes = new ArrayList<>();
    for (int i = 1; i < branches.size(); i++) {
      resumes.add(newLabel());
    }
    emit(
        new Instr.PushChoice(
            disjId, resumes.get(0), resumes.subList(1, resumes.size()), resumeLive(disj, 1, fail)));
    for (int i = 0; i < branches.size(); i++) {
      boolean last = (i == branches.size() - 1);
      if (i > 0) {
        emit(new Instr.Define(disjId, resumes.get(i - 1)));
        if (last) {
          emit(new Instr.PopChoice(disjId));
        } else {
          emit(new Instr.SetResume(disjId, resumes.get(i), resumeLive(disj, i + 1, fail)));
        }
      }
      gen(branches.get(i), last ? fail : backtrackTarget());
      emit(new Instr.Goto(disjId, end));
    }
    emit(new Instr.Define(disjId, end));
  }

  /** Returns the variables that are live when resuming at the {@code first}-th disjunct. */
  private ImmutableSortedSet<Var> resumeLive(Goal.Disj disj, int first, FailTarget fail) {
    ImmutableSortedSet.Builder<Var> builder = ImmutableSortedSet.naturalOrder();
    for (int i = first; i < disj.goals.size(); i++) {
      builder.addAll(liveness.liveBefore(disj.goals.get(i)));
    }
    return builder.addAll(fail.live).addAll(pinned()).build();
  }

  private void genSwitch(Goal.Switch sw, FailTarget fail) {
    GoalId swId = origin;
    Lval x = local(sw.var);
    if (sw.isExhaustive()) {
      checkCoverage(sw);
    }
    Label end = newLabel();
    if (opt.enabled(OptTuple.Switch.DENSE_SWITCH)
        && sw.closed
        && sw.cases.size() >= opt.value(OptTuple.Switch.DENSE_SWITCH_SIZE)) {
      ImmutableSortedMap.Builder<ConsId, Label> targets = ImmutableSortedMap.naturalOrder();
      List<Label> armLabels = new ArrayList<>();
      for (Goal.Case c : sw.cases) {
        Label armLabel = newLabel();
        armLabels.add(armLabel);
        c.consIds.forEach(consId -> targets.put(consId, armLabel));
      }
      Label otherwise = sw.isExhaustive() ? newLabel() : fail.label;
      emit(new Instr.ComputedGoto(swId, x, targets.build(), otherwise));
      for (int i = 0; i < sw.cases.size(); i++) {
        emit(new Instr.Define(swId, armLabels.get(i)));
        gen(sw.cases.get(i).goal, fail);
        emit(new Instr.Goto(swId, end));
      }
      if (sw.isExhaustive()) {
        emit(new Instr.Define(swId, otherwise));
        emit(new Instr.Abort(swId, "no arm for value of " + sw.var));
      }
    } else {
      for (int i = 0; i < sw.cases.size(); i++) {
        Goal.Case c = sw.cases.get(i);
        if (i == sw.cases.size() - 1 && sw.isExhaustive()) {
          emit(new Instr.Comment(swId, sw.var + " has functor " + c.consIds));
          gen(c.goal, fail);
          break;
        }
        Label next = newLabel();
        emit(new Instr.GotoIf(swId, Cond.hasFunctor(x, c.consIds).negate(), next));
        gen(c.goal, fail);
        emit(new Instr.Goto(swId, end));
        emit(new Instr.Define(swId, next));
      }
      if (!sw.isExhaustive()) {
        emit(new Instr.Comment(swId, "no arm matches " + sw.var));
        emitFail(fail);
      }
    }
    emit(new Instr.Define(swId, end));
  }

  private void checkCoverage(Goal.Switch sw) {
    Inst inst = sw.info.before.get(sw.var);
    ImmutableSortedSet<ConsId> possible = inst.functors();
    if (possible == null && sw.var.type != null) {
      possible = sw.var.type.constructorSet();
    }
    Set<ConsId> covered = new HashSet<>();
    sw.cases.forEach(c -> covered.addAll(c.consIds));
    if (possible == null || !covered.containsAll(possible)) {
      throw new InternalCompilerError(
          procId, "Switch on %s at %s has an uncovered constructor", sw.var, sw.id());
    }
  }

  private void genIfThenElse(Goal.IfThenElse ite, FailTarget fail) {
    GoalId iteId = origin;
    Label elseLabel = newLabel();
    Label end = newLabel();
    ImmutableSortedSet<Var> elseLive = withPinned(liveness.resume(ite));
    gen(ite.cond, new FailTarget(elseLabel, false, elseLive), true);
    gen(ite.thenGoal, fail);
    emit(new Instr.Goto(iteId, end));
    emit(new Instr.Define(iteId, elseLabel));
    gen(ite.elseGoal, fail);
    emit(new Instr.Define(iteId, end));
  }

  private void genNot(Goal.Not not, FailTarget fail) {
    GoalId notId = origin;
    Label ok = newLabel();
    gen(not.goal, new FailTarget(ok, false, withPinned(liveness.resume(not))), true);
    emitFail(fail);
    emit(new Instr.Define(notId, ok));
  }

  private boolean isUnreachable(Goal goal) {
    return goal.info.before != null && !goal.info.before.isReachable();
  }

  /** True if the code for {@code goal} may succeed with more choice points than it started with. */
  private boolean leavesChoicePoints(Goal goal) {
    if (isUnreachable(goal)) {
      return false;
    }
    Boolean cached = leavesChoicePoints.get(goal);
    if (cached != null) {
      return cached;
    }
    boolean result;
    if (goal instanceof Goal.Call call) {
      result =
          call.proc != null
              && !table.pred(call.pred).isForeign()
              && table.determinism(call.proc).codeModel() == CodeModel.NON;
    } else if (goal instanceof Goal.HigherOrderCall hoCall) {
      result =
          hoCall.higherOrder != null
              && hoCall.higherOrder.determinism.codeModel() == CodeModel.NON;
    } else if (goal instanceof Goal.Disj disj) {
      result = disj.goals.size() > 1 || disj.goals.stream().anyMatch(this::leavesChoicePoints);
    } else if (goal instanceof Goal.Not
        || (goal instanceof Goal.Scope scope && scope.kind == Goal.Scope.Kind.COMMIT)) {
      result = false;
    } else if (goal instanceof Goal.IfThenElse ite) {
      result = leavesChoicePoints(ite.thenGoal) || leavesChoicePoints(ite.elseGoal);
    } else {
      result = goal.children().stream().anyMatch(this::leavesChoicePoints);
    }
    leavesChoicePoints.put(goal, result);
    return result;
  }

  /**
   * Returns the loop to turn tail calls into, or null if the body has no self-recursive tail
   * calls.
   */
  private @Nullable Loop findLoop(Goal body) {
    Set<Goal> tailCalls = Collections.newSetFromMap(new IdentityHashMap<>());
    collectTailCalls(body, tailCalls);
    if (tailCalls.isEmpty()) {
      return null;
    }
    Loop result = new Loop(newLabel());
    result.tailCalls.addAll(tailCalls);
    ImmutableList<Var> headVars = pred.headVars;
    Set<Var> pinned = new HashSet<>();
    for (int i = 0; i < proc.argModes.size(); i++) {
      if (!proc.argModes.get(i).isInput()) {
        continue;
      }
      int pos = i;
      boolean invariant =
          opt.enabled(OptTuple.Switch.LOOP_INVARIANTS)
              && result.tailCalls.stream()
                  .allMatch(g -> ((Goal.Call) g).args.get(pos).equals(headVars.get(pos)));
      if (invariant) {
        result.invariant.add(i);
        pinned.add(headVars.get(i));
      } else {
        result.reloaded.add(i);
      }
    }
    if (opt.enabled(OptTuple.Switch.LOOP_INVARIANTS)) {
      for (Goal g : body.conjuncts()) {
        if (g instanceof Goal.Unify unify && isHoistable(unify, pinned)) {
          result.hoisted.add(unify);
          pinned.addAll(unify.freeVars());
        } else {
          break;
        }
      }
    }
    result.pinned = ImmutableSortedSet.copyOf(pinned);
    return result;
  }

  /**
   * True if {@code unify} can't fail and only reads variables in {@code available}, so it can be
   * evaluated once before the loop.
   */
  private static boolean isHoistable(Goal.Unify unify, Set<Var> available) {
    if (unify.canFail
        || unify.kind == Goal.Unify.Kind.SIMPLE_TEST
        || unify.argModes.contains(Goal.Unify.ArgMode.TEST)
        || !unify.determinism().canSucceed()
        || unify.info.before == null) {
      return false;
    }
    for (Var v : unify.freeVars()) {
      if (!unify.info.before.get(v).isFree() && !available.contains(v)) {
        return false;
      }
    }
    return unify.kind != Goal.Unify.Kind.UNKNOWN;
  }

  /**
   * Adds the self-recursive calls in tail position of {@code goal} to {@code tailCalls}: those
   * that are followed only by the procedure's exit and that return their outputs directly in
   * the head variables.
   */
  private void collectTailCalls(Goal goal, Set<Goal> tailCalls) {
    if (isUnreachable(goal)
        || (goal.determinism().codeModel() != CodeModel.NON && leavesChoicePoints(goal))) {
      return;
    }
    if (goal instanceof Goal.Call call) {
      if (procId.equals(call.proc) && outputsAreHeadVars(call)) {
        tailCalls.add(call);
      }
    } else if (goal instanceof Goal.Conj conj) {
      if (!conj.goals.isEmpty()) {
        collectTailCalls(conj.goals.get(conj.goals.size() - 1), tailCalls);
      }
    } else if (goal instanceof Goal.Switch sw) {
      sw.cases.forEach(c -> collectTailCalls(c.goal, tailCalls));
    } else if (goal instanceof Goal.IfThenElse ite) {
      collectTailCalls(ite.thenGoal, tailCalls);
      collectTailCalls(ite.elseGoal, tailCalls);
    } else if (goal instanceof Goal.Scope scope && scope.kind == Goal.Scope.Kind.EXISTS) {
      collectTailCalls(scope.goal, tailCalls);
    }
  }

  private boolean outputsAreHeadVars(Goal.Call call) {
    for (int i = 0; i < proc.argModes.size(); i++) {
      if (proc.argModes.get(i).isOutput() && !call.args.get(i).equals(pred.headVars.get(i))) {
        return false;
      }
    }
    return true;
  }

  private ImmutableSortedSet<Var> pinned() {
    return (loop == null) ? ImmutableSortedSet.of() : loop.pinned;
  }

  private ImmutableSortedSet<Var> withPinned(Set<Var> live) {
    return ImmutableSortedSet.copyOf(Sets.union(live, pinned()));
  }

  private FailTarget backtrackTarget() {
    if (backtrack == null) {
      backtrack = newLabel();
    }
    return new FailTarget(backtrack, true, ImmutableSortedSet.of());
  }

  private Label failExit() {
    if (failExit == null) {
      failExit = newLabel();
    }
    return failExit;
  }

  private void emitFail(FailTarget fail) {
    emit(new Instr.Goto(origin, fail.label));
  }

  private Label newLabel() {
    return new Label(nextLabel++);
  }

  private static Lval.Local local(Var v) {
    return new Lval.OfVar(v);
  }

  private void emit(Instr instr) {
    code.add(instr);
  }
}
