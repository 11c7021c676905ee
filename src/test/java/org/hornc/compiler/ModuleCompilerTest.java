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

package org.hornc.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.hornc.check.DetError;
import org.hornc.check.Diagnostic;
import org.hornc.check.PragmaError;
import org.hornc.check.SwitchWarning;
import org.hornc.code.ProcCode;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;
import org.hornc.testing.TestModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModuleCompilerTest {

  private static CompilationResult compile(ModuleTable table, CompilerOptions.Builder options) {
    return new ModuleCompiler(options.build()).compile(table);
  }

  private static CompilationResult compile(ModuleTable table) {
    return compile(table, CompilerOptions.builder().threads(1).verifyLiveness(true));
  }

  /** {@code first(L, X) :- L = [X|_]}, wrongly declared det. */
  private static PredInfo first(String name) {
    GoalBuilder b = new GoalBuilder().at(name + ".m", 1);
    Var l = b.var("L", TestModules.LIST);
    Var x = b.var("X");
    Var t = b.var("T", TestModules.LIST);
    return PredInfo.builder(name)
        .clause(ImmutableList.of(l, x), b.unify(l, TestModules.CONS, x, t))
        .mode(Determinism.DET, Mode.IN, Mode.OUT)
        .build();
  }

  private static ModuleTable standardPlus(PredInfo... extra) {
    ModuleTable.Builder builder = ModuleTable.builder();
    TestModules.standard().preds().forEach(builder::add);
    for (PredInfo pred : extra) {
      builder.add(pred);
    }
    return builder.build();
  }

  @Test
  public void standardModuleCompilesCleanly() {
    CompilationResult result = compile(TestModules.standard());
    assertThat(result.hasErrors()).isFalse();
    // warm/1 deliberately leaves out two colours.
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0)).isInstanceOf(SwitchWarning.class);
    assertThat(result.code.keySet()).containsExactlyElementsIn(result.table.procIds());
  }

  @Test
  public void undeclaredDeterminismIsInferred() {
    CompilationResult result = compile(TestModules.standard());
    ProcId last = new ProcId(TestModules.LAST, 0);
    assertThat(result.table.proc(last).declared).isNull();
    assertThat(result.table.proc(last).inferred).isEqualTo(Determinism.SEMIDET);
    assertThat(result.table.determinism(last)).isEqualTo(Determinism.SEMIDET);
    // Declared procedures record what was inferred too.
    ProcId member = new ProcId(TestModules.MEMBER, 0);
    assertThat(result.table.proc(member).inferred).isEqualTo(Determinism.NONDET);
  }

  @Test
  public void analyzedBodiesAreStored() {
    CompilationResult result = compile(TestModules.standard());
    ProcId next = new ProcId(TestModules.NEXT, 0);
    assertThat(result.table.proc(next).body.toString()).startsWith("switch C (");
    assertThat(result.table.proc(new ProcId(TestModules.LESS_THAN, 0)).body).isNull();
  }

  @Test
  public void errorsOnlyAffectTheirOwnProcedure() {
    PredInfo bad = first("bad");
    CompilationResult result = compile(standardPlus(bad));
    assertThat(result.errors()).hasSize(1);
    DetError error = (DetError) result.errors().get(0);
    assertThat(error.kind).isEqualTo(DetError.Kind.DECLARATION_VIOLATED);
    assertThat(result.code(bad.procId(0))).isNull();
    assertThat(result.code(new ProcId(TestModules.APPEND, 0))).isNotNull();
  }

  @Test
  public void diagnosticsAreSortedByPredicate() {
    CompilationResult result = compile(TestModules.module(first("zed"), first("alpha")));
    assertThat(result.errors()).hasSize(2);
    assertThat(result.errors().get(0).pred.name).isEqualTo("alpha");
    assertThat(result.errors().get(1).pred.name).isEqualTo("zed");
  }

  @Test
  public void conflictingInlinePragmas() {
    GoalBuilder b = new GoalBuilder().at("both.m", 4);
    Var x = b.var("X");
    PredInfo both =
        PredInfo.builder("both")
            .clause(ImmutableList.of(x), b.unify(x, TestModules.RED))
            .inline()
            .noInline()
            .mode(Determinism.DET, Mode.OUT)
            .build();
    CompilationResult result = compile(TestModules.module(both));
    assertThat(result.errors()).hasSize(1);
    PragmaError error = (PragmaError) result.errors().get(0);
    assertThat(error.kind).isEqualTo(PragmaError.Kind.CONFLICTING_INLINE);
    assertThat(error.render())
        .isEqualTo(
            "both.m:4: In both/1: error: conflicting inline and no_inline pragmas for both/1");
    assertThat(result.code(both.procId(0))).isNull();
  }

  @Test
  public void foreignProceduresMustHaveAtMostOneSolution() {
    PredInfo gen =
        PredInfo.builder("gen").foreign("gen").mode(Determinism.NONDET, Mode.OUT).build();
    PredInfo guess = PredInfo.builder("guess").foreign("guess").mode(null, Mode.OUT).build();
    PredInfo ok =
        PredInfo.builder("ok").foreign("ok").mode(Determinism.SEMIDET, Mode.IN).build();
    CompilationResult result = compile(TestModules.module(gen, guess, ok));
    ImmutableList<Diagnostic> errors = result.errors();
    assertThat(errors).hasSize(2);
    assertThat(((PragmaError) errors.get(0)).kind).isEqualTo(PragmaError.Kind.NONDET_FOREIGN);
    assertThat(errors.get(0).render())
        .isEqualTo("(unknown): In gen/1: error: foreign procedure gen/1 must be det or semidet");
    assertThat(errors.get(1).pred).isEqualTo(guess.id);
    assertThat(result.code(gen.procId(0))).isNull();
    assertThat(result.code(ok.procId(0))).isNotNull();
  }

  @Test
  public void switchWarningsCanBeTurnedOff() {
    CompilationResult result =
        compile(
            TestModules.standard(),
            CompilerOptions.builder().threads(1).reportSwitchWarnings(false));
    assertThat(result.diagnostics).isEmpty();
    assertThat(result.code(new ProcId(TestModules.WARM, 0))).isNotNull();
  }

  @Test
  public void parallelCompilationMatchesSequential() {
    ModuleTable table = standardPlus(first("bad"));
    for (int level : new int[] {0, 3, 6}) {
      OptTuple opt = OptTuple.forLevel(level);
      CompilationResult sequential =
          compile(table, CompilerOptions.builder().opt(opt).threads(1));
      CompilationResult parallel =
          compile(table, CompilerOptions.builder().opt(opt).threads(4));
      assertThat(parallel.code.keySet()).containsExactlyElementsIn(sequential.code.keySet());
      for (ProcId id : sequential.code.keySet()) {
        assertThat(parallel.code(id).toString()).isEqualTo(sequential.code(id).toString());
      }
      assertThat(render(parallel.diagnostics)).isEqualTo(render(sequential.diagnostics));
    }
  }

  private static ImmutableList<String> render(ImmutableList<Diagnostic> diagnostics) {
    return diagnostics.stream().map(Diagnostic::render).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void monitorSeesEveryProcedure() {
    Set<ProcId> seen = ConcurrentHashMap.newKeySet();
    CompilationResult result =
        compile(
            TestModules.standard(),
            CompilerOptions.builder().threads(3).monitor(code -> seen.add(code.proc)));
    assertThat(seen).containsExactlyElementsIn(result.code.keySet());
  }

  @Test
  public void internalErrorsAbortCompilation() {
    ProcId victim = new ProcId(TestModules.SUM, 0);
    ModuleCompiler.Monitor monitor =
        (ProcCode code) -> {
          if (code.proc.equals(victim)) {
            throw new InternalCompilerError(code.proc, "Injected fault at %s", "test");
          }
        };
    for (int threads : new int[] {1, 4}) {
      InternalCompilerError e =
          assertThrows(
              InternalCompilerError.class,
              () ->
                  compile(
                      TestModules.standard(),
                      CompilerOptions.builder().threads(threads).monitor(monitor)));
      assertThat(e.proc).isEqualTo(victim);
      assertThat(e).hasMessageThat().isEqualTo("Injected fault at test (in sum/3-0)");
    }
  }

  @Test
  public void badThreadCount() {
    assertThrows(IllegalArgumentException.class, () -> CompilerOptions.builder().threads(0));
  }
}
