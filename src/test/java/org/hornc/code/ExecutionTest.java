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

import static com.google.common.truth.Truth.assertThat;
import static org.hornc.testing.TestModules.list;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.hornc.check.DetError;
import org.hornc.code.Machine.Term;
import org.hornc.compiler.CompilationResult;
import org.hornc.compiler.CompilerOptions;
import org.hornc.compiler.ModuleCompiler;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredId;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;
import org.hornc.testing.TestModules;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles {@link TestModules#standard}, and a smaller module of committed choice and negated
 * goals, at each optimization level and runs the results on a {@link Machine}, checking that every
 * level gets the same answers.
 */
@RunWith(TestParameterInjector.class)
public class ExecutionTest {

  private static final ModuleTable MODULE = TestModules.standard();

  private static final Map<OptTuple, CompilationResult> compiled = new ConcurrentHashMap<>();

  @TestParameter({"0", "1", "2", "3", "4", "5", "6"})
  private int level;

  private Machine machine;

  /** Compiles the standard module with the given options, verifying liveness as it goes. */
  static CompilationResult compile(OptTuple opt) {
    return compiled.computeIfAbsent(opt, k -> compile(MODULE, k));
  }

  private static CompilationResult compile(ModuleTable module, OptTuple opt) {
    return new ModuleCompiler(
            CompilerOptions.builder().opt(opt).threads(1).verifyLiveness(true).build())
        .compile(module);
  }

  /** Returns a Machine for the given code, with the foreign procedures the module uses. */
  static Machine newMachine(CompilationResult result) {
    assertThat(result.errors()).isEmpty();
    return new Machine(result.table, result.code)
        .foreign("less_than", in -> ((Integer) in.get(0) < (Integer) in.get(1)) ? List.of() : null)
        .foreign("plus", in -> List.of((Integer) in.get(0) + (Integer) in.get(1)));
  }

  @Before
  public void setup() {
    machine = newMachine(compile(OptTuple.forLevel(level)));
  }

  private static ProcId proc(PredId pred, int modeNum) {
    return new ProcId(pred, modeNum);
  }

  private List<ImmutableList<Object>> solve(PredId pred, Object... inputs) {
    return machine.solve(proc(pred, 0), inputs);
  }

  @Test
  public void appendForwards() {
    assertThat(solve(TestModules.APPEND, list(1, 2), list(3)))
        .containsExactly(ImmutableList.of(list(1, 2, 3)));
    assertThat(solve(TestModules.APPEND, list(), list()))
        .containsExactly(ImmutableList.of(list()));
  }

  @Test
  public void appendBackwardsEnumeratesEverySplit() {
    assertThat(machine.solve(proc(TestModules.APPEND, 1), list(1, 2)))
        .containsExactly(
            ImmutableList.of(list(), list(1, 2)),
            ImmutableList.of(list(1), list(2)),
            ImmutableList.of(list(1, 2), list()))
        .inOrder();
  }

  @Test
  public void member() {
    assertThat(solve(TestModules.MEMBER, list(1, 2, 3)))
        .containsExactly(ImmutableList.of(1), ImmutableList.of(2), ImmutableList.of(3))
        .inOrder();
    assertThat(solve(TestModules.MEMBER, list())).isEmpty();
  }

  @Test
  public void containsCommitsToFirstMatch() {
    assertThat(solve(TestModules.CONTAINS, 2, list(1, 2, 3, 2))).containsExactly(List.of());
    assertThat(solve(TestModules.CONTAINS, 4, list(1, 2, 3))).isEmpty();
  }

  @Test
  public void last() {
    assertThat(solve(TestModules.LAST, list(1, 2, 3))).containsExactly(ImmutableList.of(3));
    assertThat(solve(TestModules.LAST, list(7))).containsExactly(ImmutableList.of(7));
    assertThat(solve(TestModules.LAST, list())).isEmpty();
  }

  @Test
  public void denseOrChainedSwitch() {
    assertThat(solve(TestModules.NEXT, Term.of(TestModules.RED)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.GREEN)));
    assertThat(solve(TestModules.NEXT, Term.of(TestModules.YELLOW)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.RED)));
  }

  @Test
  public void incompleteSwitchFails() {
    assertThat(solve(TestModules.WARM, Term.of(TestModules.YELLOW))).hasSize(1);
    assertThat(solve(TestModules.WARM, Term.of(TestModules.BLUE))).isEmpty();
  }

  @Test
  public void ifThenElse() {
    assertThat(solve(TestModules.IS_RED, Term.of(TestModules.RED)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.YES)));
    assertThat(solve(TestModules.IS_RED, Term.of(TestModules.GREEN)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.NO)));
    assertThat(solve(TestModules.MAX, 3, 7)).containsExactly(ImmutableList.of(7));
    assertThat(solve(TestModules.MAX, 7, 3)).containsExactly(ImmutableList.of(7));
  }

  @Test
  public void callsThatMayBeInlined() {
    assertThat(solve(TestModules.MAX3, 4, 9, 2)).containsExactly(ImmutableList.of(9));
    assertThat(solve(TestModules.MAX3, 1, 2, 3)).containsExactly(ImmutableList.of(3));
  }

  @Test
  public void tailRecursion() {
    assertThat(solve(TestModules.SUM, list(1, 2, 3, 4), 0)).containsExactly(ImmutableList.of(10));
    assertThat(solve(TestModules.SUM, list(), 5)).containsExactly(ImmutableList.of(5));
  }

  @Test
  public void loopInvariant() {
    Term w = Term.of(TestModules.TAG, "k");
    assertThat(solve(TestModules.TAG_REVERSE, "k", list(1, 2), list()))
        .containsExactly(
            ImmutableList.of(
                list(Term.of(TestModules.PAIR, w, 2), Term.of(TestModules.PAIR, w, 1))));
  }

  @Test
  public void closures() {
    assertThat(solve(TestModules.PREFIX_ALL, list(0), list(list(1), list(2, 3))))
        .containsExactly(ImmutableList.of(list(list(0, 1), list(0, 2, 3))));
    assertThat(solve(TestModules.PREFIX_ALL, list(0), list()))
        .containsExactly(ImmutableList.of(list()));
  }

  @Test
  public void longListsRunInBoundedSteps() {
    Object[] elements = new Object[1000];
    for (int i = 0; i < elements.length; i++) {
      elements[i] = 1;
    }
    assertThat(solve(TestModules.SUM, list(elements), 0)).containsExactly(ImmutableList.of(1000));
    // A fixed number of instructions per element, however the loop is compiled.
    assertThat(machine.steps()).isLessThan(50 * elements.length);
  }

  /**
   * <pre>
   * pick_colour(C) :- (C = red ; C = green).            cc_multi
   * any_colour(Y) :- (Y = blue ; pick_colour(Y)).       multi
   * first_colour(Y) :- (Y = blue ; pick_colour(Y)).     cc_multi
   * empty(L) :- not(L = [_|_]).                         semidet
   * </pre>
   */
  private static ModuleTable committedChoiceModule() {
    GoalBuilder b = new GoalBuilder().at("colours.m", 1);
    Var c = b.var("C", TestModules.COLOUR);
    PredInfo pickColour =
        PredInfo.builder("pick_colour")
            .clause(
                ImmutableList.of(c),
                b.disj(b.unify(c, TestModules.RED), b.unify(c, TestModules.GREEN)))
            .mode(Determinism.CC_MULTI, Mode.OUT)
            .build();
    GoalBuilder eb = new GoalBuilder().at("colours.m", 9);
    Var l = eb.var("L", TestModules.LIST);
    Var h = eb.var("H");
    Var t = eb.var("T", TestModules.LIST);
    PredInfo empty =
        PredInfo.builder("empty")
            .clause(ImmutableList.of(l), eb.not(eb.unify(l, TestModules.CONS, h, t)))
            .mode(Determinism.SEMIDET, Mode.IN)
            .build();
    return TestModules.module(
        pickColour,
        blueOrPicked("any_colour", Determinism.MULTI, pickColour.id),
        blueOrPicked("first_colour", Determinism.CC_MULTI, pickColour.id),
        empty);
  }

  private static PredInfo blueOrPicked(String name, Determinism det, PredId pick) {
    GoalBuilder b = new GoalBuilder().at("colours.m", 5);
    Var y = b.var("Y", TestModules.COLOUR);
    return PredInfo.builder(name)
        .clause(ImmutableList.of(y), b.disj(b.unify(y, TestModules.BLUE), b.call(pick, y)))
        .mode(det, Mode.OUT)
        .build();
  }

  @Test
  public void committedChoiceCallNeedingAllSolutionsIsRejected() {
    CompilationResult result = compile(committedChoiceModule(), OptTuple.forLevel(level));
    ProcId anyColour = proc(PredId.of("any_colour", 1), 0);
    assertThat(result.errors()).hasSize(1);
    DetError error = (DetError) result.errors().get(0);
    assertThat(error.kind).isEqualTo(DetError.Kind.CC_CALL_IN_ALL_SOLUTIONS);
    assertThat(error.proc).isEqualTo(anyColour);
    assertThat(result.code(anyColour)).isNull();

    // The rest of the module still compiles and runs.
    Machine colours = new Machine(result.table, result.code);
    assertThat(colours.solve(proc(PredId.of("pick_colour", 1), 0)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.RED)));
    assertThat(colours.solve(proc(PredId.of("first_colour", 1), 0)))
        .containsExactly(ImmutableList.of(Term.of(TestModules.BLUE)));
  }

  @Test
  public void negation() {
    CompilationResult result = compile(committedChoiceModule(), OptTuple.forLevel(level));
    Machine colours = new Machine(result.table, result.code);
    ProcId empty = proc(PredId.of("empty", 1), 0);
    assertThat(colours.solve(empty, list())).containsExactly(List.of());
    assertThat(colours.solve(empty, list(1))).isEmpty();
    assertThat(colours.solve(empty, list(1, 2))).isEmpty();
  }
}
