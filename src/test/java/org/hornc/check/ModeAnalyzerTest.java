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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Goal.Unify;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.Inst;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredId;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;
import org.hornc.testing.TestModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModeAnalyzerTest {

  private static final ModuleTable STANDARD = TestModules.standard();

  private static ModeAnalyzer.Result analyze(ModuleTable table, PredId pred, int modeNum) {
    return ModeAnalyzer.analyze(table, new ProcId(pred, modeNum));
  }

  /** Analyzes a procedure that is expected to have exactly one error, and returns it. */
  private static ModeError onlyError(ModuleTable table, PredId pred) {
    ModeAnalyzer.Result result = analyze(table, pred, 0);
    assertThat(result.errors).hasSize(1);
    return result.errors.get(0);
  }

  @Test
  public void constructionWaitsForItsArguments() {
    ModeAnalyzer.Result result = analyze(STANDARD, TestModules.APPEND, 0);
    assertThat(result.errors).isEmpty();
    Goal.Disj body = (Goal.Disj) result.goal;
    // C = [H|T2] can't be built until the recursive call has bound T2.
    ImmutableList<Goal> second = body.goals.get(1).conjuncts();
    assertThat(((Unify) second.get(0)).kind).isEqualTo(Unify.Kind.DECONSTRUCT);
    assertThat(((Goal.Call) second.get(1)).proc).isEqualTo(new ProcId(TestModules.APPEND, 0));
    Unify construct = (Unify) second.get(2);
    assertThat(construct.lhs.name).isEqualTo("C");
    assertThat(construct.kind).isEqualTo(Unify.Kind.CONSTRUCT);
  }

  @Test
  public void backwardModeReordersConjunction() {
    ModeAnalyzer.Result result = analyze(STANDARD, TestModules.APPEND, 1);
    assertThat(result.errors).isEmpty();
    Goal.Disj body = (Goal.Disj) result.goal;
    // A = [], C = B: A is constructed, then B is assigned from C.
    ImmutableList<Goal> first = body.goals.get(0).conjuncts();
    assertThat(((Unify) first.get(0)).kind).isEqualTo(Unify.Kind.CONSTRUCT);
    assertThat(((Unify) first.get(1)).kind).isEqualTo(Unify.Kind.ASSIGN);
    // C must be taken apart before the recursive call, and A built after it.
    ImmutableList<Goal> second = body.goals.get(1).conjuncts();
    Unify deconstruct = (Unify) second.get(0);
    assertThat(deconstruct.lhs.name).isEqualTo("C");
    assertThat(deconstruct.kind).isEqualTo(Unify.Kind.DECONSTRUCT);
    assertThat(((Goal.Call) second.get(1)).proc).isEqualTo(new ProcId(TestModules.APPEND, 1));
    Unify construct = (Unify) second.get(2);
    assertThat(construct.lhs.name).isEqualTo("A");
    assertThat(construct.kind).isEqualTo(Unify.Kind.CONSTRUCT);
  }

  @Test
  public void goalsAreAnnotatedWithInsts() {
    ModeAnalyzer.Result result = analyze(STANDARD, TestModules.NEXT, 0);
    PredInfo next = STANDARD.pred(TestModules.NEXT);
    Var c = next.headVars.get(0);
    Var d = next.headVars.get(1);
    assertThat(result.goal.info.before.get(c)).isEqualTo(Inst.GROUND);
    assertThat(result.goal.info.before.get(d)).isEqualTo(Inst.FREE);
    assertThat(result.goal.info.after.get(d).isGround()).isTrue();
    // After the first branch, C is known to be red.
    Goal branch = ((Goal.Disj) result.goal).goals.get(0);
    assertThat(branch.info.after.get(c)).isEqualTo(Inst.constant(TestModules.RED));
  }

  @Test
  public void closuresCaptureInputs() {
    ModeAnalyzer.Result result = analyze(STANDARD, TestModules.PREFIX_ALL, 0);
    assertThat(result.errors).isEmpty();
    Unify closure = (Unify) result.goal.conjuncts().get(0);
    assertThat(closure.closureProc).isEqualTo(new ProcId(TestModules.APPEND, 0));
    assertThat(closure.info.after.get(closure.lhs))
        .isEqualTo(Inst.closure(TestModules.IN_OUT_DET));
    ModeAnalyzer.Result map = analyze(STANDARD, TestModules.MAP, 0);
    assertThat(map.errors).isEmpty();
  }

  @Test
  public void noMatchingMode() {
    // bad(X) :- append(X, Y, Z).
    GoalBuilder b = new GoalBuilder().at("bad.m", 3);
    Var x = b.var("X");
    Var y = b.var("Y");
    Var z = b.var("Z");
    PredInfo bad =
        PredInfo.builder("bad")
            .clause(ImmutableList.of(x), b.call(TestModules.APPEND, x, y, z))
            .mode(Determinism.DET, Mode.IN)
            .build();
    ModeError error = onlyError(TestModules.module(bad, TestModules.append()), bad.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.NO_MATCHING_MODE);
    assertThat(error.vars()).containsExactly(y);
    assertThat(error.context.toString()).isEqualTo("bad.m:3");
    assertThat(error.message())
        .isEqualTo(
            "mode error in `append(X, Y, Z)': no mode matches: "
                + "argument 2 (Y) has inst free, expected ground");
    assertThat(error.render()).startsWith("bad.m:3: In bad/1-0: error: mode error");
  }

  @Test
  public void ambiguousMode() {
    // amb :- X = red, check(X), with check having both an (in) and a (ui) mode.
    PredInfo check =
        PredInfo.builder("check")
            .foreign("check")
            .mode(Determinism.SEMIDET, Mode.IN)
            .mode(Determinism.SEMIDET, Mode.UI)
            .build();
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    PredInfo amb =
        PredInfo.builder("amb")
            .clause(
                ImmutableList.of(),
                b.conj(b.unify(x, TestModules.RED), b.call(check.id, x)))
            .mode(Determinism.SEMIDET)
            .build();
    ModeError error = onlyError(TestModules.module(amb, check), amb.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.AMBIGUOUS_MODE);
    assertThat(error.candidates).containsExactly(check.procId(0), check.procId(1)).inOrder();
    assertThat(error.message()).isEqualTo("ambiguous mode for `check(X)': modes 0, 1 all match");
  }

  @Test
  public void closureNeedsDeclaredDeterminism() {
    // c(L, P) :- P = last(L).
    GoalBuilder b = new GoalBuilder();
    Var l = b.var("L", TestModules.LIST);
    Var p = b.var("P");
    PredInfo c =
        PredInfo.builder("c")
            .clause(ImmutableList.of(l, p), b.closure(p, TestModules.LAST, l))
            .mode(Determinism.DET, Mode.IN, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(c, TestModules.last()), c.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.CLOSURE_NEEDS_DETERMINISM);
    assertThat(error.candidates).containsExactly(new ProcId(TestModules.LAST, 0));
  }

  @Test
  public void capturedArgumentsMustBeInputs() {
    // c(P) :- P = append(A), with A free.
    GoalBuilder b = new GoalBuilder();
    Var p = b.var("P");
    Var a = b.var("A", TestModules.LIST);
    PredInfo c =
        PredInfo.builder("c")
            .clause(ImmutableList.of(p), b.closure(p, TestModules.APPEND, a))
            .mode(Determinism.DET, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(c, TestModules.append()), c.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.NO_MATCHING_MODE);
    assertThat(error.vars()).containsExactly(a);
  }

  @Test
  public void freeUnification() {
    // f(X) :- Y = Z, X = Y.
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    Var y = b.var("Y");
    Var z = b.var("Z");
    PredInfo f =
        PredInfo.builder("f")
            .clause(ImmutableList.of(x), b.conj(b.unify(y, z), b.unify(x, y)))
            .mode(Determinism.DET, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(f), f.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.FREE_UNIFICATION);
    assertThat(error.vars()).containsExactly(y, z).inOrder();
  }

  @Test
  public void callingANonClosure() {
    // g(P, X) :- P(X).
    GoalBuilder b = new GoalBuilder();
    Var p = b.var("P");
    Var x = b.var("X");
    PredInfo g =
        PredInfo.builder("g")
            .clause(ImmutableList.of(p, x), b.callClosure(p, x))
            .mode(Determinism.DET, Mode.IN, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(g), g.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.NOT_CALLABLE);
    assertThat(error.vars()).containsExactly(p);
  }

  @Test
  public void outputNeverBound() {
    // h(X) :- true.
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    PredInfo h =
        PredInfo.builder("h")
            .clause(ImmutableList.of(x), b.trueGoal())
            .mode(Determinism.DET, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(h), h.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.FINAL_INST_MISMATCH);
    assertThat(error.mismatches.get(0).argNum).isEqualTo(1);
    assertThat(error.mismatches.get(0).actual).isEqualTo(Inst.FREE);
  }

  @Test
  public void errorsOnlyInvolvingPoisonedVariablesAreNotRepeated() {
    // p(X) :- Y = Z, q(Y), q(Z), X = a; where q is (in), so each use of Y or Z after the first
    // error would otherwise be reported again.
    ConsId a = ConsId.of("a", 0);
    PredInfo q = PredInfo.builder("q").foreign("q").mode(Determinism.DET, Mode.IN).build();
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    Var y = b.var("Y");
    Var z = b.var("Z");
    PredInfo p =
        PredInfo.builder("p")
            .clause(
                ImmutableList.of(x),
                b.conj(b.unify(y, z), b.call(q.id, y), b.call(q.id, z), b.unify(x, a)))
            .mode(Determinism.DET, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(p, q), p.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.FREE_UNIFICATION);
  }

  @Test
  public void noModeOfThreeMatches() {
    // three(X) :- combine(X, Y, Z), where no mode of combine/3 takes two free arguments.
    PredInfo combine =
        PredInfo.builder("combine")
            .foreign("combine")
            .mode(Determinism.SEMIDET, Mode.IN, Mode.IN, Mode.OUT)
            .mode(Determinism.SEMIDET, Mode.IN, Mode.OUT, Mode.IN)
            .mode(Determinism.SEMIDET, Mode.OUT, Mode.IN, Mode.IN)
            .build();
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    Var y = b.var("Y");
    Var z = b.var("Z");
    PredInfo three =
        PredInfo.builder("three")
            .clause(ImmutableList.of(x), b.call(combine.id, x, y, z))
            .mode(Determinism.SEMIDET, Mode.IN)
            .build();
    ModeError error = onlyError(TestModules.module(three, combine), three.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.NO_MATCHING_MODE);
    assertThat(error.candidates).isEmpty();
    // The first of the modes that come closest is the one described.
    assertThat(error.vars()).containsExactly(y);
    assertThat(error.mismatches.get(0).argNum).isEqualTo(2);
  }

  @Test
  public void negationLeavesInstsUnchanged() {
    // empty(L) :- not(member(X, L)).
    GoalBuilder b = new GoalBuilder();
    Var l = b.var("L", TestModules.LIST);
    Var x = b.var("X");
    PredInfo empty =
        PredInfo.builder("empty")
            .clause(ImmutableList.of(l), b.not(b.call(TestModules.MEMBER, x, l)))
            .mode(Determinism.SEMIDET, Mode.IN)
            .build();
    ModeAnalyzer.Result result =
        analyze(TestModules.module(empty, TestModules.member()), empty.id, 0);
    assertThat(result.errors).isEmpty();
    Goal.Not not = (Goal.Not) result.goal;
    assertThat(not.goal.info.after.get(x)).isEqualTo(Inst.GROUND);
    assertThat(not.info.after.get(x)).isEqualTo(Inst.FREE);
    assertThat(not.info.after).isEqualTo(not.info.before);
  }

  @Test
  public void negationBindsOutput() {
    // nb(X) :- not(X = a).
    ConsId a = ConsId.of("a", 0);
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    PredInfo nb =
        PredInfo.builder("nb")
            .clause(ImmutableList.of(x), b.not(b.unify(x, a)))
            .mode(Determinism.SEMIDET, Mode.OUT)
            .build();
    ModeAnalyzer.Result result = analyze(TestModules.module(nb), nb.id, 0);
    // X is still free after the negation, so the head is wrong too.
    assertThat(result.errors.stream().map(e -> e.kind).collect(toImmutableList()))
        .containsExactly(
            ModeError.Kind.NEGATION_BINDS_NONLOCAL, ModeError.Kind.FINAL_INST_MISMATCH)
        .inOrder();
    ModeError error = result.errors.get(0);
    assertThat(error.vars()).containsExactly(x);
    assertThat(error.message())
        .isEqualTo(
            "`not(X = a)' binds variables that are visible outside it: "
                + "(X) has inst unique_bound(a), expected free");
  }

  @Test
  public void variableBoundInOnlyOneDisjunct() {
    // pi(C) :- (C = red, D = yes ; C = green), q(D).
    PredInfo q = PredInfo.builder("q").foreign("q").mode(Determinism.DET, Mode.IN).build();
    GoalBuilder b = new GoalBuilder();
    Var c = b.var("C", TestModules.COLOUR);
    Var d = b.var("D", TestModules.BOOL);
    PredInfo pi =
        PredInfo.builder("pi")
            .clause(
                ImmutableList.of(c),
                b.conj(
                    b.disj(
                        b.conj(b.unify(c, TestModules.RED), b.unify(d, TestModules.YES)),
                        b.unify(c, TestModules.GREEN)),
                    b.call(q.id, d)))
            .mode(Determinism.SEMIDET, Mode.IN)
            .build();
    ModeError error = onlyError(TestModules.module(pi, q), pi.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.PARTIALLY_INSTANTIATED);
    assertThat(error.goalText).isEqualTo("q(D)");
    assertThat(error.vars()).containsExactly(d);
    assertThat(error.mismatches.get(0).actual).isInstanceOf(Inst.Mixed.class);
    assertThat(((Inst.Mixed) error.mismatches.get(0).actual).boundPart.functors())
        .containsExactly(TestModules.YES);
  }

  @Test
  public void useAfterDestructiveUpdate() {
    // cl(L, M) :- consume(L), M = L.
    PredInfo consume =
        PredInfo.builder("consume").foreign("consume").mode(Determinism.DET, Mode.DI).build();
    GoalBuilder b = new GoalBuilder();
    Var l = b.var("L", TestModules.LIST);
    Var m = b.var("M", TestModules.LIST);
    PredInfo cl =
        PredInfo.builder("cl")
            .clause(ImmutableList.of(l, m), b.conj(b.call(consume.id, l), b.unify(m, l)))
            .mode(Determinism.DET, Mode.DI, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(cl, consume), cl.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.CLOBBERED_USE);
    assertThat(error.vars()).containsExactly(l);
    assertThat(error.message())
        .isEqualTo(
            "use of variable after destructive update in `M = L': "
                + "(L) has inst clobbered, expected ground");
  }

  @Test
  public void constructionFromFreeVariable() {
    // fa(X) :- X = tag(Y).
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    Var y = b.var("Y");
    PredInfo fa =
        PredInfo.builder("fa")
            .clause(ImmutableList.of(x), b.unify(x, TestModules.TAG, y))
            .mode(Determinism.DET, Mode.OUT)
            .build();
    ModeError error = onlyError(TestModules.module(fa), fa.id);
    assertThat(error.kind).isEqualTo(ModeError.Kind.FREE_ARG_IN_CONSTRUCTION);
    assertThat(error.message())
        .isEqualTo(
            "mode error in `X = tag(Y)': constructor argument is free: "
                + "argument 1 (Y) has inst free, expected ground");
  }
}
