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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.hornc.compiler.InternalCompilerError;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.ProcId;

/**
 * Assigns a frame slot to each {@link Lval.Local}. We could just give each Local its own slot, but
 * smaller frames make for cheaper calls and choice points.
 *
 * <p>If two Locals are assigned the same slot we refer to them as "aliased".
 *
 * <ul>
 *   <li>If Locals x and y are live at the same time and may have different values, they must not
 *       be aliased (since storing one would modify the other).
 *   <li>On the other hand, if there is an assignment {@code x := y} and it is valid to alias x and
 *       y, doing so lets us drop the assignment.
 * </ul>
 *
 * <p>We choose the assignment in two stages:
 *
 * <ul>
 *   <li>Identify maximal sets of Locals that we can alias, where each member of the set is
 *       assigned to another member of the set at least once (only if {@code excessAssign} is
 *       enabled).
 *   <li>Assign a slot to each alias set, ensuring no two alias sets get the same slot unless
 *       they're never live at the same time (only if {@code slotReuse} is enabled; otherwise each
 *       alias set gets a slot of its own).
 * </ul>
 *
 * <p>The first stage works from two two-dimensional bitmaps: {@code conflicts[x,y]} (if it or
 * {@code conflicts[y,x]} is set, x and y must not be aliased) and {@code preferAlias[x,y]} (if
 * set, aliasing x and y would let us delete an assignment). We consider each Local {@code x} in
 * turn and expand it to a maximal set of Locals that are transitively connected in {@code
 * preferAlias}, no two of which are directly connected in {@code conflicts}.
 *
 * <p>For the second stage we choose the smallest slot that has not already been assigned to any
 * Local that conflicts with one in the alias set.
 */
public final class SlotAssigner {

  /** The rewritten instructions, and the number of slots they use. */
  public static final class Result {
    public final ImmutableList<Instr> instrs;
    public final int frameSize;

    Result(List<Instr> instrs, int frameSize) {
      this.instrs = ImmutableList.copyOf(instrs);
      this.frameSize = frameSize;
    }
  }

  private final FlowGraph graph;

  /**
   * Indexed twice by Local index; if set, the Locals must not alias. Not symmetric, so we test in
   * both directions.
   *
   * <p>As alias sets are chosen the conflicts of each member are unioned into the entry for the
   * set's first member, and only that combined value is used afterwards.
   */
  private final BitSet[] conflicts;

  /**
   * For each Local, the index of the first member of its alias set (its representative). A Local
   * in an alias set by itself is its own representative.
   */
  private final int[] representative;

  /** For each representative, the members of its alias set. */
  private final BitSet[] aliasSet;

  private SlotAssigner(FlowGraph graph) {
    this.graph = graph;
    int n = graph.locals.size();
    conflicts = new BitSet[n];
    representative = new int[n];
    aliasSet = new BitSet[n];
    for (int i = 0; i < n; i++) {
      conflicts[i] = new BitSet();
      representative[i] = -1;
    }
  }

  /**
   * Returns a copy of {@code instrs} in which each Local has been replaced by a {@link
   * Lval.Slot}, assignments between aliased Locals have been dropped, and the frame allocated on
   * entry has the right size.
   */
  public static Result assign(ProcId procId, List<Instr> instrs, OptTuple opt) {
    FlowGraph graph = new FlowGraph(procId, instrs);
    BitSet dangling = graph.liveIn(0);
    if (!dangling.isEmpty()) {
      throw new InternalCompilerError(
          procId,
          "Dangling variable %s is read before it is set",
          graph.locals.get(dangling.nextSetBit(0)));
    }
    SlotAssigner assigner = new SlotAssigner(graph);
    assigner.findConflictsAndAliases(opt.enabled(OptTuple.Switch.EXCESS_ASSIGN));
    int[] slots = assigner.assignSlots(opt.enabled(OptTuple.Switch.SLOT_REUSE));
    int frameSize = 0;
    for (int slot : slots) {
      frameSize = Math.max(frameSize, slot + 1);
    }
    List<Instr> result = new ArrayList<>();
    for (Instr instr : instrs) {
      if (instr instanceof Instr.AllocFrame) {
        result.add(new Instr.AllocFrame(instr.origin, frameSize));
        continue;
      }
      Instr mapped =
          instr.mapLvals(
              lv -> {
                if (lv instanceof Lval.Local local) {
                  int index = graph.localIndex(local);
                  int rep = assigner.representative[index];
                  return new Lval.Slot(slots[index], graph.locals.get(rep));
                }
                return lv;
              });
      if (mapped instanceof Instr.Assign assign && assign.dst.equals(assign.src)) {
        // An assignment between aliases.
        continue;
      }
      result.add(mapped);
    }
    return new Result(result, frameSize);
  }

  private void findConflictsAndAliases(boolean preferAliases) {
    int n = graph.locals.size();
    // Indexed twice by Local index; updated symmetrically since we don't know which direction
    // we'll propagate in.
    BitSet[] preferAlias = new BitSet[n];
    for (int i = 0; i < graph.size(); i++) {
      Instr instr = graph.instrs.get(i);
      BitSet defs = graph.defs(i);
      for (int lhs = defs.nextSetBit(0); lhs >= 0; lhs = defs.nextSetBit(lhs + 1)) {
        // We're changing the value of lhs, so it can't alias anything else that's live
        // afterwards, or anything else this instruction sets.
        BitSet conflictsBuilder = (BitSet) graph.liveOut(i).clone();
        conflictsBuilder.or(defs);
        conflictsBuilder.clear(lhs);
        if (preferAliases
            && instr instanceof Instr.Assign assign
            && assign.src instanceof Lval.Local rhs) {
          int rhsIndex = graph.localIndex(rhs);
          if (rhsIndex != lhs) {
            if (preferAlias[lhs] == null) {
              preferAlias[lhs] = new BitSet();
            }
            if (preferAlias[rhsIndex] == null) {
              preferAlias[rhsIndex] = new BitSet();
            }
            preferAlias[lhs].set(rhsIndex);
            preferAlias[rhsIndex].set(lhs);
            // This doesn't constitute a conflict, since they have the same value.
            conflictsBuilder.clear(rhsIndex);
          }
        }
        conflicts[lhs].or(conflictsBuilder);
      }
    }

    BitSet alias = new BitSet();
    // The candidates we've already checked, or are checking on this cycle.
    BitSet allAliasCandidates = new BitSet();
    BitSet nextAliasCandidates = new BitSet();
    for (int i = 0; i < n; i++) {
      if (representative[i] >= 0) {
        // Already included in a previous Local's alias set.
        continue;
      }
      representative[i] = i;
      if (preferAlias[i] == null) {
        continue;
      }
      BitSet combinedConflicts = conflicts[i];
      BitSet currentAliasCandidates = (BitSet) preferAlias[i].clone();
      alias.clear();
      alias.set(i);
      allAliasCandidates.clear();
      allAliasCandidates.set(i);
      for (; ; ) {
        currentAliasCandidates.andNot(allAliasCandidates);
        currentAliasCandidates.andNot(combinedConflicts);
        if (currentAliasCandidates.isEmpty()) {
          break;
        }
        nextAliasCandidates.clear();
        for (int candidate = currentAliasCandidates.nextSetBit(0);
            candidate >= 0;
            candidate = currentAliasCandidates.nextSetBit(candidate + 1)) {
          if (representative[candidate] >= 0
              || combinedConflicts.get(candidate)
              || conflicts[candidate].intersects(alias)) {
            continue;
          }
          // We're committing to this candidate, so its conflicts are now ours, and we'll
          // consider its preferred aliases next time around.
          alias.set(candidate);
          representative[candidate] = i;
          combinedConflicts.or(conflicts[candidate]);
          if (preferAlias[candidate] != null) {
            nextAliasCandidates.or(preferAlias[candidate]);
          }
        }
        allAliasCandidates.or(currentAliasCandidates);
        currentAliasCandidates.clear();
        currentAliasCandidates.or(nextAliasCandidates);
      }
      assert !combinedConflicts.intersects(alias);
      if (alias.cardinality() > 1) {
        aliasSet[i] = (BitSet) alias.clone();
      }
    }
  }

  /** Returns the slot number for each Local. */
  private int[] assignSlots(boolean reuse) {
    int n = graph.locals.size();
    int[] slots = new int[n];
    // For each slot, the Locals assigned to it so far and the union of their conflicts.
    List<BitSet> slotAssignments = new ArrayList<>();
    List<BitSet> slotConflicts = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (representative[i] != i) {
        // Alias sets are numbered by their first member, which we've already seen.
        assert representative[i] < i;
        slots[i] = slots[representative[i]];
        continue;
      }
      BitSet alias = aliasSet[i];
      if (alias == null) {
        alias = new BitSet();
        alias.set(i);
      }
      int slot = 0;
      if (reuse) {
        while (slot < slotAssignments.size()
            && (slotAssignments.get(slot).intersects(conflicts[i])
                || slotConflicts.get(slot).intersects(alias))) {
          slot++;
        }
      } else {
        slot = slotAssignments.size();
      }
      if (slot == slotAssignments.size()) {
        slotAssignments.add(new BitSet());
        slotConflicts.add(new BitSet());
      }
      slotAssignments.get(slot).or(alias);
      slotConflicts.get(slot).or(conflicts[i]);
      slots[i] = slot;
    }
    return slots;
  }
}
