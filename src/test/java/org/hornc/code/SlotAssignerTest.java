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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.CodeModel;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.VarSet;
import org.hornc.testing.TestModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SlotAssignerTest {

  private static final ProcId PROC = new ProcId(TestModules.SUM, 0);

  private final VarSet varSet = new VarSet();
  private final Lval.OfVar x = new Lval.OfVar(varSet.newVar("X"));
  private final Lval.OfVar y = new Lval.OfVar(varSet.newVar("Y"));

  private static Instr copy(Lval dst, Rval src) {
    return new Instr.Assign(null, dst, src);
  }

  private static Lval reg(int n) {
    return new Lval.Reg(n);
  }

  private static SlotAssigner.Result assign(List<Instr> instrs, int level) {
    SlotAssigner.Result result = SlotAssigner.assign(PROC, instrs, OptTuple.forLevel(level));
    // Whatever we chose, it must hold up.
    LivenessChecker.checkSlots(new ProcCode(PROC, CodeModel.DET, result.frameSize, result.instrs));
    return result;
  }

  /** X and Y are never live at the same time. */
  private List<Instr> sequential() {
    return ImmutableList.of(
        new Instr.AllocFrame(null, 0),
        copy(x, reg(1)),
        copy(reg(2), x),
        copy(y, reg(3)),
        copy(reg(4), y),
        new Instr.FreeFrame(null),
        new Instr.Return(null));
  }

  @Test
  public void localsWithDisjointLifetimesShareASlot() {
    SlotAssigner.Result result = assign(sequential(), 1);
    assertThat(result.frameSize).isEqualTo(1);
    assertThat(result.instrs)
        .containsExactly(
            new Instr.AllocFrame(null, 1),
            copy(new Lval.Slot(0, x), reg(1)),
            copy(reg(2), new Lval.Slot(0, x)),
            copy(new Lval.Slot(0, y), reg(3)),
            copy(reg(4), new Lval.Slot(0, y)),
            new Instr.FreeFrame(null),
            new Instr.Return(null))
        .inOrder();
  }

  @Test
  public void slotReuseCanBeDisabled() {
    OptTuple opt = OptTuple.builder(1).set(OptTuple.Switch.SLOT_REUSE, false).build();
    SlotAssigner.Result result = SlotAssigner.assign(PROC, sequential(), opt);
    assertThat(result.frameSize).isEqualTo(2);
    assertThat(result.instrs.get(0)).isEqualTo(new Instr.AllocFrame(null, 2));
    assertThat(result.instrs.get(3)).isEqualTo(copy(new Lval.Slot(1, y), reg(3)));
  }

  @Test
  public void overlappingLocalsGetDifferentSlots() {
    List<Instr> code =
        ImmutableList.of(
            new Instr.AllocFrame(null, 0),
            copy(x, reg(1)),
            copy(y, reg(2)),
            copy(reg(3), x),
            copy(reg(4), y),
            new Instr.Return(null));
    SlotAssigner.Result result = assign(code, 1);
    assertThat(result.frameSize).isEqualTo(2);
    assertThat(result.instrs.get(2)).isEqualTo(copy(new Lval.Slot(1, y), reg(2)));
  }

  @Test
  public void assignmentBetweenAliasesIsDropped() {
    List<Instr> code =
        ImmutableList.of(
            new Instr.AllocFrame(null, 0),
            copy(x, reg(1)),
            copy(y, x),
            copy(reg(2), y),
            new Instr.Return(null));
    SlotAssigner.Result result = assign(code, 1);
    assertThat(result.frameSize).isEqualTo(1);
    // Y shares X's slot, so the slot is labelled with X throughout.
    assertThat(result.instrs)
        .containsExactly(
            new Instr.AllocFrame(null, 1),
            copy(new Lval.Slot(0, x), reg(1)),
            copy(reg(2), new Lval.Slot(0, x)),
            new Instr.Return(null))
        .inOrder();
  }

  @Test
  public void withoutExcessAssignTheCopyIsKept() {
    List<Instr> code =
        ImmutableList.of(
            new Instr.AllocFrame(null, 0),
            copy(x, reg(1)),
            copy(y, x),
            copy(reg(2), y),
            new Instr.Return(null));
    SlotAssigner.Result result = assign(code, 0);
    assertThat(result.frameSize).isEqualTo(2);
    assertThat(result.instrs).contains(copy(new Lval.Slot(1, y), new Lval.Slot(0, x)));
  }

  @Test
  public void temporariesGetSlotsToo() {
    Lval.Temp temp = new Lval.Temp(0);
    List<Instr> code =
        ImmutableList.of(
            new Instr.AllocFrame(null, 0),
            new Instr.SaveChoiceHeight(null, temp),
            new Instr.CutTo(null, temp),
            new Instr.Return(null));
    SlotAssigner.Result result = assign(code, 1);
    assertThat(result.frameSize).isEqualTo(1);
    assertThat(result.instrs.get(2)).isEqualTo(new Instr.CutTo(null, new Lval.Slot(0, temp)));
  }

  @Test
  public void danglingVariable() {
    List<Instr> code =
        ImmutableList.of(new Instr.AllocFrame(null, 0), copy(reg(1), x), new Instr.Return(null));
    InternalCompilerError e =
        assertThrows(
            InternalCompilerError.class,
            () -> SlotAssigner.assign(PROC, code, OptTuple.forLevel(1)));
    assertThat(e).hasMessageThat().contains("Dangling variable X is read before it is set");
  }
}
