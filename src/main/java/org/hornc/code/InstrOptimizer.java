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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.ProcId;

/**
 * Instruction-level cleanups, each enabled by its own switch:
 *
 * <ul>
 *   <li>{@code jumpOpt}: jumps to jumps are short-circuited, jumps to the next instruction are
 *       dropped, and a conditional jump over an unconditional one is replaced by its negation.
 *   <li>{@code peephole}: assignments of a slot to itself are dropped, and jumps to code that just
 *       fails (or aborts) are replaced by that code.
 *   <li>{@code dupElim}: a labeled block that is only reached by jumping to it and that is
 *       identical to an earlier such block is replaced by the earlier one.
 *   <li>{@code labelElim}: unreachable instructions, and labels that nothing refers to, are
 *       removed.
 * </ul>
 *
 * The passes are run repeatedly (up to {@code optRepeat} times) until none of them changes
 * anything.
 */
public final class InstrOptimizer {
  private static final Logger logger = LogManager.getLogger(InstrOptimizer.class);

  private InstrOptimizer() {}

  public static ImmutableList<Instr> optimize(ProcId procId, List<Instr> instrs, OptTuple opt) {
    List<Instr> code = new ArrayList<>(instrs);
    int rounds = Math.max(1, opt.value(OptTuple.Switch.OPT_REPEAT));
    for (int round = 0; round < rounds; round++) {
      List<Instr> start = code;
      if (opt.enabled(OptTuple.Switch.JUMP_OPT)) {
        code = collapseJumps(code);
      }
      if (opt.enabled(OptTuple.Switch.PEEPHOLE)) {
        code = peephole(code);
      }
      if (opt.enabled(OptTuple.Switch.DUP_ELIM)) {
        code = eliminateDuplicates(code);
      }
      if (opt.enabled(OptTuple.Switch.LABEL_ELIM)) {
        code = eliminateLabels(code);
      }
      logger.trace("{}: round {}, {} to {} instructions", procId, round, start.size(), code.size());
      if (code.equals(start)) {
        break;
      }
    }
    return ImmutableList.copyOf(code);
  }

  private static Map<Label, Integer> positions(List<Instr> code) {
    Map<Label, Integer> result = new HashMap<>();
    for (int i = 0; i < code.size(); i++) {
      if (code.get(i) instanceof Instr.Define define) {
        result.put(define.label, i);
      }
    }
    return result;
  }

  /** Returns the index of the first instruction at or after {@code i} that does something. */
  private static int firstReal(List<Instr> code, int i) {
    while (i < code.size()
        && (code.get(i) instanceof Instr.Define || code.get(i) instanceof Instr.Comment)) {
      i++;
    }
    return i;
  }

  /**
   * True if {@code label} is defined at {@code i} or after it with only labels and comments in
   * between, i.e. if jumping to it is the same as continuing from {@code i}.
   */
  private static boolean isNext(List<Instr> code, int i, Label label) {
    for (; i < code.size(); i++) {
      Instr instr = code.get(i);
      if (instr instanceof Instr.Define define) {
        if (define.label.equals(label)) {
          return true;
        }
      } else if (!(instr instanceof Instr.Comment)) {
        return false;
      }
    }
    return false;
  }

  static List<Instr> collapseJumps(List<Instr> code) {
    Map<Label, Integer> positions = positions(code);
    Map<Label, Label> finalTargets = new HashMap<>();
    UnaryOperator<Label> follow =
        label ->
            finalTargets.computeIfAbsent(
                label,
                start -> {
                  Set<Label> seen = new HashSet<>();
                  Label current = start;
                  while (seen.add(current)) {
                    int j = firstReal(code, positions.get(current));
                    if (j < code.size() && code.get(j) instanceof Instr.Goto jump) {
                      current = jump.target;
                    } else {
                      break;
                    }
                  }
                  return current;
                });
    List<Instr> result = new ArrayList<>();
    for (int i = 0; i < code.size(); i++) {
      Instr instr = code.get(i);
      if (instr instanceof Instr.Goto jump
          && (isNext(code, i + 1, jump.target) || isNext(code, i + 1, follow.apply(jump.target)))) {
        continue;
      }
      if (instr instanceof Instr.GotoIf branch
          && i + 1 < code.size()
          && code.get(i + 1) instanceof Instr.Goto jump
          && isNext(code, i + 2, branch.target)) {
        // "if c goto L1; goto L2; L1:" is "if !c goto L2; L1:"
        Label target = follow.apply(jump.target);
        result.add(new Instr.GotoIf(branch.origin, branch.cond.negate(), target));
        i++;
        continue;
      }
      result.add(instr.retarget(follow));
    }
    return result;
  }

  static List<Instr> peephole(List<Instr> code) {
    Map<Label, Integer> positions = positions(code);
    List<Instr> result = new ArrayList<>();
    for (int i = 0; i < code.size(); i++) {
      Instr instr = code.get(i);
      if (instr instanceof Instr.Assign assign && assign.dst.equals(assign.src)) {
        continue;
      } else if (instr instanceof Instr.GotoIf branch && isNext(code, i + 1, branch.target)) {
        continue;
      } else if (instr instanceof Instr.Goto jump) {
        int j = firstReal(code, positions.get(jump.target));
        Instr target = (j < code.size()) ? code.get(j) : null;
        if (target instanceof Instr.Fail) {
          result.add(new Instr.Fail(jump.origin));
          continue;
        } else if (target instanceof Instr.Abort abort) {
          result.add(new Instr.Abort(jump.origin, abort.message));
          continue;
        }
      }
      result.add(instr);
    }
    return result;
  }

  static List<Instr> eliminateDuplicates(List<Instr> code) {
    Map<List<Instr>, Label> blocks = new HashMap<>();
    Map<Label, Label> replacements = new HashMap<>();
    for (int i = 1; i < code.size(); i++) {
      if (!(code.get(i) instanceof Instr.Define define) || code.get(i - 1).fallsThrough()) {
        continue;
      }
      List<Instr> block = block(code, i + 1);
      if (block != null) {
        Label first = blocks.putIfAbsent(block, define.label);
        if (first != null) {
          replacements.put(define.label, first);
        }
      }
    }
    if (replacements.isEmpty()) {
      return code;
    }
    List<Instr> result = new ArrayList<>();
    for (Instr instr : code) {
      result.add(instr.retarget(label -> replacements.getOrDefault(label, label)));
    }
    return result;
  }

  /**
   * Returns the instructions (other than comments) from {@code start} up to and including the
   * first one that doesn't fall through, or null if a label comes first.
   */
  private static List<Instr> block(List<Instr> code, int start) {
    List<Instr> result = new ArrayList<>();
    for (int i = start; i < code.size(); i++) {
      Instr instr = code.get(i);
      if (instr instanceof Instr.Define) {
        return null;
      } else if (!(instr instanceof Instr.Comment)) {
        result.add(instr);
        if (!instr.fallsThrough()) {
          return result;
        }
      }
    }
    return null;
  }

  static List<Instr> eliminateLabels(List<Instr> code) {
    Map<Label, Integer> positions = positions(code);
    boolean[] reachable = new boolean[code.size()];
    Set<Label> referenced = new HashSet<>();
    Deque<Integer> work = new ArrayDeque<>();
    if (!code.isEmpty()) {
      work.add(0);
    }
    while (!work.isEmpty()) {
      int i = work.remove();
      if (reachable[i]) {
        continue;
      }
      reachable[i] = true;
      Instr instr = code.get(i);
      if (instr.fallsThrough() && i + 1 < code.size()) {
        work.add(i + 1);
      }
      // Resume labels are reachable by backtracking, so we follow all labels rather than just
      // successors.
      for (Label label : instr.labels()) {
        referenced.add(label);
        work.add(positions.get(label));
      }
    }
    List<Instr> result = new ArrayList<>();
    for (int i = 0; i < code.size(); i++) {
      Instr instr = code.get(i);
      if (reachable[i]
          && !(instr instanceof Instr.Define define && !referenced.contains(define.label))) {
        result.add(instr);
      }
    }
    return result;
  }
}
