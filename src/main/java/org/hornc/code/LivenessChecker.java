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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;

/**
 * Consistency checks on generated code, run when liveness verification is enabled.
 *
 * <ul>
 *   <li>Before slot assignment, {@link #checkChoicePoints} checks that every variable read after
 *       resuming at a choice point's resume label is in the live set the choice point was
 *       annotated with.
 *   <li>After slot assignment and optimization, {@link #checkSlots} checks that on every path to
 *       an instruction that reads a slot, the last write to that slot was of the variable being
 *       read. A violation means either that a variable is used before it is defined, or that two
 *       variables whose lifetimes overlap were given the same slot.
 * </ul>
 *
 * Any violation is reported as an {@link InternalCompilerError}.
 */
public final class LivenessChecker {

  /** The contents of a slot that holds different variables on different paths. */
  private static final Object CONFLICT = new Object();

  private LivenessChecker() {}

  public static void checkChoicePoints(ProcId procId, List<Instr> instrs) {
    FlowGraph graph = new FlowGraph(procId, instrs);
    for (Instr instr : instrs) {
      if (instr instanceof Instr.PushChoice push) {
        for (Label resume : push.labels()) {
          checkResume(graph, resume, push.live, push);
        }
      } else if (instr instanceof Instr.SetResume setResume) {
        checkResume(graph, setResume.resume, setResume.live, setResume);
      }
    }
  }

  private static void checkResume(
      FlowGraph graph, Label resume, Set<Var> annotated, Instr instr) {
    BitSet live = graph.liveIn(graph.position(resume));
    for (int i = live.nextSetBit(0); i >= 0; i = live.nextSetBit(i + 1)) {
      // Temps are only live across a choice point within a commit, which restores them.
      if (graph.locals.get(i) instanceof Lval.OfVar v && !annotated.contains(v.var)) {
        throw new InternalCompilerError(
            graph.procId,
            "%s is live at %s but is missing from the live set of '%s'",
            v.var,
            resume,
            instr);
      }
    }
  }

  public static void checkSlots(ProcCode code) {
    int n = code.instrs.size();
    Object[][] before = new Object[n][];
    Deque<Integer> work = new ArrayDeque<>();
    if (n != 0) {
      before[0] = new Object[code.frameSize];
      work.add(0);
    }
    // Find what each slot holds before each reachable instruction...
    while (!work.isEmpty()) {
      int i = work.remove();
      Instr instr = code.instrs.get(i);
      Object[] state = before[i].clone();
      instr.forEachDef(
          lv -> {
            if (lv instanceof Lval.Slot slot) {
              state[slot.index] = slot.owner;
            }
          });
      if (instr.fallsThrough() && i + 1 < n) {
        merge(before, i + 1, state, work);
      }
      for (Label target : instr.successors()) {
        merge(before, code.position(target), state, work);
      }
    }
    // ... and then check each read.
    for (int i = 0; i < n; i++) {
      if (before[i] == null) {
        continue;
      }
      Object[] state = before[i];
      Instr instr = code.instrs.get(i);
      instr.forEachUse(lv -> checkRead(code, lv, state, instr));
      instr.forEachDef(
          lv -> {
            if (lv instanceof Lval.Local) {
              throw new InternalCompilerError(code.proc, "No slot assigned to %s", lv);
            }
          });
    }
  }

  private static void checkRead(ProcCode code, Lval lv, Object[] state, Instr instr) {
    if (lv instanceof Lval.Local) {
      throw new InternalCompilerError(code.proc, "No slot assigned to %s", lv);
    } else if (lv instanceof Lval.Slot slot) {
      Object holder = state[slot.index];
      if (holder == null) {
        throw new InternalCompilerError(
            code.proc, "Use before definition: '%s' reads %s, which was never set", instr, slot);
      } else if (!slot.owner.equals(holder)) {
        throw new InternalCompilerError(
            code.proc,
            "Storage reuse conflict: '%s' reads %s, but the slot may hold %s on some path",
            instr,
            slot,
            holder == CONFLICT ? "another variable, or nothing," : holder);
      }
    }
  }

  private static void merge(Object[][] before, int target, Object[] state, Deque<Integer> work) {
    Object[] existing = before[target];
    if (existing == null) {
      before[target] = state.clone();
      work.add(target);
      return;
    }
    boolean changed = false;
    for (int s = 0; s < state.length; s++) {
      if (existing[s] != CONFLICT && !Objects.equals(existing[s], state[s])) {
        existing[s] = CONFLICT;
        changed = true;
      }
    }
    if (changed) {
      work.add(target);
    }
  }
}
