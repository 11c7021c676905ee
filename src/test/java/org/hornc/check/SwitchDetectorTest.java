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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Goal;
import org.hornc.hlds.GoalBuilder;
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
public class SwitchDetectorTest {

  private static final ModuleTable STANDARD = TestModules.standard();

  private static SwitchDetector.Result detect(ModuleTable table, PredId pred) {
    ProcId id = new ProcId(pred, 0);
    DetAnalyzer.Result dets = DetAnalyzerTest.analyze(table, id);
    assertThat(dets.hasErrors()).isFalse();
    SwitchDetector.Result result = SwitchDetector.detect(id, dets.goal);
    assertThat(result.goal.determinism()).isEqualTo(dets.goal.determinism());
    return result;
  }

  @Test
  public void exhaustiveSwitch() {
    SwitchDetector.Result result = detect(STANDARD, TestModules.NEXT);
    assertThat(result.warnings).isEmpty();
    Goal.Switch sw = (Goal.Switch) result.goal;
    assertThat(sw.var.name).isEqualTo("C");
    assertThat(sw.isExhaustive()).isTrue();
    assertThat(sw.cases).hasSize(4);
    assertThat(sw.cases.get(0).consIds).containsExactly(TestModules.RED);
    // The constructor test is done by the switch, so only the output is left in each arm.
    assertThat(sw.cases.get(0).goal.toString()).isEqualTo("D := green");
    assertThat(sw.determinism()).isEqualTo(Determinism.DET);
  }

  @Test
  public void incompleteSwitchIsReported() {
    SwitchDetector.Result result = detect(STANDARD, TestModules.WARM);
    Goal.Switch sw = (Goal.Switch) result.goal;
    assertThat(sw.closed).isTrue();
    assertThat(sw.missing).containsExactly(TestModules.BLUE, TestModules.GREEN).inOrder();
    assertThat(sw.determinism()).isEqualTo(Determinism.SEMIDET);
    assertThat(result.warnings).hasSize(1);
    SwitchWarning warning = result.warnings.get(0);
    assertThat(warning.isError()).isFalse();
    assertThat(warning.missing).isEqualTo(sw.missing);
    assertThat(warning.message()).isEqualTo("switch on C does not cover [blue/0, green/0]");
    assertThat(warning.render()).isEqualTo(
        "colour.m:10: In warm/1-0: warning: switch on C does not cover [blue/0, green/0]");
  }

  @Test
  public void ifThenElseOnConstructor() {
    SwitchDetector.Result result = detect(STANDARD, TestModules.IS_RED);
    Goal.Switch sw = (Goal.Switch) result.goal;
    assertThat(sw.isExhaustive()).isTrue();
    assertThat(sw.cases).hasSize(2);
    assertThat(sw.cases.get(0).consIds).containsExactly(TestModules.RED);
    assertThat(sw.cases.get(1).consIds)
        .containsExactly(TestModules.BLUE, TestModules.GREEN, TestModules.YELLOW)
        .inOrder();
    assertThat(sw.cases.get(1).goal.toString()).isEqualTo("B := no");
  }

  @Test
  public void ifThenElseOnOtherConditionIsKept() {
    SwitchDetector.Result result = detect(STANDARD, TestModules.MAX);
    assertThat(result.goal).isInstanceOf(Goal.IfThenElse.class);
  }

  @Test
  public void nestedSwitchKeepsArgumentExtraction() {
    SwitchDetector.Result result = detect(STANDARD, TestModules.LAST);
    ImmutableList<Goal> body = result.goal.conjuncts();
    assertThat(body).hasSize(2);
    Goal.Switch sw = (Goal.Switch) body.get(1);
    assertThat(sw.var.name).isEqualTo("T");
    assertThat(sw.isExhaustive()).isTrue();
    Goal.Case cons = sw.cases.get(1);
    assertThat(cons.consIds).containsExactly(TestModules.CONS);
    assertThat(cons.goal.conjuncts().get(0).toString()).isEqualTo("T = [|](H2, T2)");
    assertThat(cons.goal.conjuncts().get(0).determinism()).isEqualTo(Determinism.DET);
  }

  @Test
  public void switchOnUntypedVariableHasDefault() {
    // ab(X) :- (X = a ; X = b).
    GoalBuilder b = new GoalBuilder();
    Var x = b.var("X");
    PredInfo ab =
        PredInfo.builder("ab")
            .clause(
                ImmutableList.of(x),
                b.disj(b.unify(x, ConsId.of("a", 0)), b.unify(x, ConsId.of("b", 0))))
            .mode(Determinism.SEMIDET, Mode.IN)
            .build();
    SwitchDetector.Result result = detect(TestModules.module(ab), ab.id);
    Goal.Switch sw = (Goal.Switch) result.goal;
    assertThat(sw.closed).isFalse();
    assertThat(sw.isExhaustive()).isFalse();
    // Nothing is known about the other values X might have, so there is nothing to warn about.
    assertThat(result.warnings).isEmpty();
    assertThat(sw.toString()).endsWith("; default: fail)");
  }

  @Test
  public void detectingTwiceChangesNothing() {
    for (PredId pred : ImmutableList.of(TestModules.NEXT, TestModules.WARM, TestModules.LAST)) {
      SwitchDetector.Result once = detect(STANDARD, pred);
      SwitchDetector.Result twice = SwitchDetector.detect(new ProcId(pred, 0), once.goal);
      assertThat(twice.goal.toString()).isEqualTo(once.goal.toString());
      assertThat(twice.warnings).isEmpty();
    }
  }
}
