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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashSet;
import java.util.Set;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Goal.Unify;
import org.hornc.hlds.Inst;
import org.hornc.hlds.Var;
import org.jspecify.annotations.Nullable;

/**
 * A disjunction whose branches each begin by testing the outer constructor of the same bound
 * variable against a different constructor; at most one branch can be entered, so determinism
 * analysis treats it as a switch and the switch detector rewrites it into one.
 */
final class SwitchCandidate {
  final Var var;

  /** The leading deconstruction of each branch. */
  final ImmutableList<Unify> tests;

  /** True if the constructors {@link #var} may have on entry are known. */
  final boolean closed;

  /** If {@link #closed}, the possible constructors that are not tested by any branch. */
  final ImmutableSortedSet<ConsId> missing;

  private SwitchCandidate(
      Var var, ImmutableList<Unify> tests, boolean closed, ImmutableSortedSet<ConsId> missing) {
    this.var = var;
    this.tests = tests;
    this.closed = closed;
    this.missing = missing;
  }

  boolean isExhaustive() {
    return closed && missing.isEmpty();
  }

  /** Returns a SwitchCandidate for the given disjunction, or null if it isn't one. */
  static @Nullable SwitchCandidate find(Goal.Disj disj) {
    if (disj.goals.isEmpty() || disj.info.before == null || !disj.info.before.isReachable()) {
      return null;
    }
    ImmutableList.Builder<Unify> tests = ImmutableList.builder();
    Set<ConsId> seen = new HashSet<>();
    Var var = null;
    for (Goal branch : disj.goals) {
      Goal first = branch.conjuncts().isEmpty() ? null : branch.conjuncts().get(0);
      if (!(first instanceof Unify unify) || unify.kind != Unify.Kind.DECONSTRUCT) {
        return null;
      } else if (var == null) {
        var = unify.lhs;
      } else if (!var.equals(unify.lhs)) {
        return null;
      }
      if (!seen.add(unify.functor)) {
        return null;
      }
      tests.add(unify);
    }
    Inst entry = disj.info.before.get(var);
    if (!entry.isBound()) {
      return null;
    }
    ImmutableSortedSet<ConsId> possible = possibleConstructors(var, entry);
    if (possible == null) {
      return new SwitchCandidate(var, tests.build(), false, ImmutableSortedSet.of());
    }
    ImmutableSortedSet<ConsId> missing =
        possible.stream()
            .filter(c -> !seen.contains(c))
            .collect(ImmutableSortedSet.toImmutableSortedSet(ConsId::compareTo));
    return new SwitchCandidate(var, tests.build(), true, missing);
  }

  /**
   * Returns the constructors that a variable with the given inst may have, or null if they are
   * not known.
   */
  static @Nullable ImmutableSortedSet<ConsId> possibleConstructors(Var var, Inst inst) {
    ImmutableSortedSet<ConsId> functors = inst.functors();
    if (functors != null) {
      return functors;
    } else if (var.type != null && inst.isBound()) {
      return var.type.constructorSet();
    }
    return null;
  }
}
