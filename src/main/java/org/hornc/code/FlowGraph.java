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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.hlds.ProcId;

/**
 * The control flow between the instructions of a procedure, and which of its {@link Lval.Local}s
 * are live before and after each instruction.
 *
 * <p>Execution continues from an instruction to the next one (if it {@link Instr#fallsThrough})
 * and to each of its {@link Instr#successors}. Since a failure restores the frames as they were
 * when the choice point was pushed, a {@link Instr.PushChoice} is treated as branching to each of
 * its resume labels.
 */
final class FlowGraph {
  final ProcId procId;
  final List<Instr> instrs;

  /** Each Local that appears in {@link #instrs}, in order of first appearance. */
  final List<Lval.Local> locals = new ArrayList<>();

  private final Map<Lval.Local, Integer> localIndex = new HashMap<>();
  private final Map<Label, Integer> labelPositions = new HashMap<>();
  private final int[][] successors;
  private final BitSet[] uses;
  private final BitSet[] defs;
  private final BitSet[] liveIn;
  private final BitSet[] liveOut;

  FlowGraph(ProcId procId, List<Instr> instrs) {
    this.procId = procId;
    this.instrs = instrs;
    int n = instrs.size();
    uses = new BitSet[n];
    defs = new BitSet[n];
    for (int i = 0; i < n; i++) {
      Instr instr = instrs.get(i);
      if (instr instanceof Instr.Define define) {
        labelPositions.put(define.label, i);
      }
      BitSet used = new BitSet();
      instr.forEachUse(lv -> addLocal(lv, used));
      uses[i] = used;
      BitSet defined = new BitSet();
      instr.forEachDef(lv -> addLocal(lv, defined));
      defs[i] = defined;
    }
    successors = new int[n][];
    for (int i = 0; i < n; i++) {
      Instr instr = instrs.get(i);
      List<Label> targets = instr.successors();
      boolean next = instr.fallsThrough() && i + 1 < n;
      int[] succ = new int[targets.size() + (next ? 1 : 0)];
      int j = 0;
      if (next) {
        succ[j++] = i + 1;
      }
      for (Label target : targets) {
        succ[j++] = position(target);
      }
      successors[i] = succ;
    }
    liveIn = new BitSet[n];
    liveOut = new BitSet[n];
    computeLiveness();
  }

  private void addLocal(Lval lv, BitSet set) {
    if (lv instanceof Lval.Local local) {
      Integer index = localIndex.get(local);
      if (index == null) {
        index = locals.size();
        locals.add(local);
        localIndex.put(local, index);
      }
      set.set(index);
    }
  }

  /** A straightforward backward dataflow; iterates until nothing changes. */
  private void computeLiveness() {
    int n = instrs.size();
    for (int i = 0; i < n; i++) {
      liveIn[i] = new BitSet();
      liveOut[i] = new BitSet();
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = n - 1; i >= 0; i--) {
        BitSet out = new BitSet();
        for (int s : successors[i]) {
          out.or(liveIn[s]);
        }
        BitSet in = (BitSet) out.clone();
        in.andNot(defs[i]);
        in.or(uses[i]);
        if (!in.equals(liveIn[i])) {
          liveIn[i] = in;
          changed = true;
        }
        liveOut[i] = out;
      }
    }
  }

  int size() {
    return instrs.size();
  }

  int position(Label label) {
    Integer result = labelPositions.get(label);
    if (result == null) {
      throw new InternalCompilerError(procId, "Unknown label %s", label);
    }
    return result;
  }

  int localIndex(Lval.Local local) {
    return localIndex.get(local);
  }

  int[] successors(int i) {
    return successors[i];
  }

  /** The Locals read by the i-th instruction; must not be modified. */
  BitSet uses(int i) {
    return uses[i];
  }

  /** The Locals written by the i-th instruction; must not be modified. */
  BitSet defs(int i) {
    return defs[i];
  }

  /** The Locals live before the i-th instruction; must not be modified. */
  BitSet liveIn(int i) {
    return liveIn[i];
  }

  /** The Locals live after the i-th instruction; must not be modified. */
  BitSet liveOut(int i) {
    return liveOut[i];
  }
}
