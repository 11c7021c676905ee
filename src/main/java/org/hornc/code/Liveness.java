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

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.hornc.hlds.Goal;
import org.hornc.hlds.Var;

/**
 * Which variables of a procedure body are live (i.e. have a value that some later code may read)
 * before and after each goal.
 *
 * <p>A goal's pre-birth set is the difference between what is live before it and what is live
 * after it that it produces; its post-death set is what is live before it but not after. Rather
 * than storing those we store the two live sets, from which both can be derived.
 *
 * <p>For each goal that can be resumed after a failure (disjunctions, if-then-elses and
 * negations) we also record the resume set: the variables that must still have their values
 * when execution resumes after the failure, i.e. at the later disjuncts, at the else part, or
 * after the negation.
 *
 * <p>Goals are identified by identity, since the results are only used on the tree they were
 * computed from.
 */
public final class Liveness {
  private final Map<Goal, ImmutableSortedSet<Var>> liveBefore = new IdentityHashMap<>();
  private final Map<Goal, ImmutableSortedSet<Var>> liveAfter = new IdentityHashMap<>();
  private final Map<Goal, ImmutableSortedSet<Var>> resume = new IdentityHashMap<>();

  private Liveness() {}

  /**
   * Computes liveness for the given body, assuming that {@code liveAtExit} (the procedure's
   * output variables) are read after it completes.
   */
  public static Liveness compute(Goal body, Collection<Var> liveAtExit) {
    Liveness result = new Liveness();
    result.visit(body, ImmutableSortedSet.copyOf(liveAtExit));
    return result;
  }

  public ImmutableSortedSet<Var> liveBefore(Goal goal) {
    return get(liveBefore, goal);
  }

  public ImmutableSortedSet<Var> liveAfter(Goal goal) {
    return get(liveAfter, goal);
  }

  /** Returns the resume set of a disjunction, if-then-else or negation; empty for other goals. */
  public ImmutableSortedSet<Var> resume(Goal goal) {
    return resume.getOrDefault(goal, ImmutableSortedSet.of());
  }

  private static ImmutableSortedSet<Var> get(Map<Goal, ImmutableSortedSet<Var>> map, Goal goal) {
    ImmutableSortedSet<Var> result = map.get(goal);
    if (result == null) {
      throw new IllegalArgumentException("No liveness computed for " + goal.id());
    }
    return result;
  }

  private ImmutableSortedSet<Var> visit(Goal goal, ImmutableSortedSet<Var> after) {
    liveAfter.put(goal, after);
    ImmutableSortedSet<Var> before;
    if (goal.info.before != null && !goal.info.before.isReachable()) {
      // No code is generated for unreachable goals.
      before = after;
    } else if (goal instanceof Goal.Conj conj) {
      before = after;
      for (Goal g : conj.goals.reverse()) {
        before = visit(g, before);
      }
    } else if (goal instanceof Goal.Disj disj) {
      ImmutableSortedSet<Var> first = ImmutableSortedSet.of();
      ImmutableSortedSet<Var> later = ImmutableSortedSet.of();
      for (int i = disj.goals.size() - 1; i >= 0; i--) {
        ImmutableSortedSet<Var> branchBefore = visit(disj.goals.get(i), after);
        if (i == 0) {
          first = branchBefore;
        } else {
          later = union(later, branchBefore);
        }
      }
      resume.put(goal, later);
      before = union(first, later);
    } else if (goal instanceof Goal.Switch sw) {
      before = ImmutableSortedSet.of(sw.var);
      for (Goal.Case c : sw.cases) {
        before = union(before, visit(c.goal, after));
      }
    } else if (goal instanceof Goal.IfThenElse ite) {
      ImmutableSortedSet<Var> thenBefore = visit(ite.thenGoal, after);
      ImmutableSortedSet<Var> elseBefore = visit(ite.elseGoal, after);
      resume.put(goal, elseBefore);
      before = union(visit(ite.cond, thenBefore), elseBefore);
    } else if (goal instanceof Goal.Not not) {
      resume.put(goal, after);
      before = union(visit(not.goal, after), after);
    } else if (goal instanceof Goal.Scope scope) {
      before = visit(scope.goal, after);
    } else {
      before = atomic(goal, after);
    }
    liveBefore.put(goal, before);
    return before;
  }

  /**
   * Returns the variables live before an atomic goal: those it reads, plus those live after it
   * that it doesn't produce.
   */
  private static ImmutableSortedSet<Var> atomic(Goal goal, Set<Var> after) {
    Set<Var> produced = new HashSet<>();
    if (goal.info.before != null) {
      for (Var v : goal.freeVars()) {
        if (goal.info.before.get(v).isFree()) {
          produced.add(v);
        }
      }
    }
    return ImmutableSortedSet.copyOf(
        Sets.union(Sets.difference(goal.freeVars(), produced), Sets.difference(after, produced)));
  }

  private static ImmutableSortedSet<Var> union(Set<Var> x, Set<Var> y) {
    return ImmutableSortedSet.copyOf(Sets.union(x, y));
  }
}
