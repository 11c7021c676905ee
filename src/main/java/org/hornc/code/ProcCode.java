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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.hlds.CodeModel;
import org.hornc.hlds.ProcId;

/**
 * The generated code for one procedure. Execution starts at the first instruction; every label
 * referred to by an instruction is defined exactly once.
 */
public final class ProcCode {
  public final ProcId proc;
  public final CodeModel model;

  /** The number of slots in each of this procedure's frames. */
  public final int frameSize;

  public final ImmutableList<Instr> instrs;

  private final ImmutableMap<Label, Integer> labelPositions;

  public ProcCode(ProcId proc, CodeModel model, int frameSize, List<Instr> instrs) {
    this.proc = proc;
    this.model = model;
    this.frameSize = frameSize;
    this.instrs = ImmutableList.copyOf(instrs);
    Map<Label, Integer> positions = new HashMap<>();
    for (int i = 0; i < instrs.size(); i++) {
      if (instrs.get(i) instanceof Instr.Define define
          && positions.put(define.label, i) != null) {
        throw new InternalCompilerError(proc, "Label %s defined twice", define.label);
      }
    }
    this.labelPositions = ImmutableMap.copyOf(positions);
    for (Instr instr : instrs) {
      instr.labels().forEach(this::position);
    }
  }

  /** Returns the index of the instruction that defines the given label. */
  public int position(Label label) {
    Integer result = labelPositions.get(label);
    if (result == null) {
      throw new InternalCompilerError(proc, "Unknown label %s", label);
    }
    return result;
  }

  /**
   * Returns the instructions that create or update a choice point; each is annotated with the
   * variables that are live if the choice point is resumed.
   */
  public ImmutableList<Instr> choicePoints() {
    return instrs.stream()
        .filter(i -> i instanceof Instr.PushChoice || i instanceof Instr.SetResume)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the number of instructions, not counting labels and comments. */
  public int size() {
    return (int)
        instrs.stream()
            .filter(i -> !(i instanceof Instr.Define || i instanceof Instr.Comment))
            .count();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(proc)
        .append(" (")
        .append(Ascii.toLowerCase(model.name()))
        .append(", frame ")
        .append(frameSize)
        .append(")\n");
    for (Instr instr : instrs) {
      if (!(instr instanceof Instr.Define)) {
        sb.append("  ");
      }
      sb.append(instr);
      if (instr.origin != null && !(instr instanceof Instr.Define)) {
        sb.append("  [").append(instr.origin).append("]");
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
