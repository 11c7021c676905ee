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

package org.hornc.hlds;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * A persistent map from variables to their insts at one program point. Variables that have no
 * entry are free.
 *
 * <p>An InstMap may be unreachable, in which case every variable's inst is {@link
 * Inst#NOT_REACHED}. Joining an unreachable InstMap with another just returns the other one.
 */
public final class InstMap {
  /** The InstMap at a program point that cannot be reached. */
  public static final InstMap UNREACHABLE = new InstMap(ImmutableSortedMap.of(), false);

  /** The InstMap in which every variable is free. */
  public static final InstMap EMPTY = new InstMap(ImmutableSortedMap.of(), true);

  private final ImmutableSortedMap<Var, Inst> insts;
  private final boolean reachable;

  private InstMap(ImmutableSortedMap<Var, Inst> insts, boolean reachable) {
    this.insts = insts;
    this.reachable = reachable;
  }

  public boolean isReachable() {
    return reachable;
  }

  /** Returns the inst of the given variable. */
  public Inst get(Var v) {
    if (!reachable) {
      return Inst.NOT_REACHED;
    }
    return insts.getOrDefault(v, Inst.FREE);
  }

  /** Returns a copy of this InstMap with the given variable's inst replaced. */
  public InstMap set(Var v, Inst inst) {
    if (!reachable) {
      return this;
    } else if (!inst.isReachable()) {
      return UNREACHABLE;
    } else if (inst.equals(get(v))) {
      return this;
    }
    TreeMap<Var, Inst> copy = new TreeMap<>(insts);
    if (inst.isFree()) {
      copy.remove(v);
    } else {
      copy.put(v, inst);
    }
    return new InstMap(ImmutableSortedMap.copyOfSorted(copy), true);
  }

  /** Returns a copy of this InstMap with each of the given entries applied. */
  public InstMap setAll(Map<Var, Inst> changes) {
    InstMap result = this;
    for (Map.Entry<Var, Inst> entry : changes.entrySet()) {
      result = result.set(entry.getKey(), entry.getValue());
    }
    return result;
  }

  /** Returns the variables with a non-free inst. */
  public ImmutableSortedSet<Var> boundVars() {
    return insts.keySet();
  }

  /**
   * Returns the InstMap for the program point where control from this point and from {@code other}
   * merges.
   */
  public InstMap join(InstMap other) {
    if (!other.reachable) {
      return this;
    } else if (!reachable) {
      return other;
    }
    TreeMap<Var, Inst> joined = new TreeMap<>();
    for (Var v : Sets.union(insts.keySet(), other.insts.keySet())) {
      joined.put(v, get(v).join(other.get(v)));
    }
    return new InstMap(ImmutableSortedMap.copyOfSorted(joined), true);
  }

  /**
   * Returns an InstMap with only the given variables' entries (an unreachable InstMap is returned
   * unchanged).
   */
  public InstMap restrict(Collection<Var> vars) {
    if (!reachable) {
      return this;
    }
    TreeMap<Var, Inst> result = new TreeMap<>();
    for (Var v : vars) {
      Inst inst = insts.get(v);
      if (inst != null) {
        result.put(v, inst);
      }
    }
    return new InstMap(ImmutableSortedMap.copyOfSorted(result), true);
  }

  /**
   * Returns the entries of {@code after} that differ from this InstMap, i.e. the effect of the goal
   * that leads from this program point to {@code after}.
   */
  public ImmutableMap<Var, Inst> delta(InstMap after) {
    if (!after.reachable) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<Var, Inst> builder = ImmutableMap.builder();
    for (Var v : Sets.union(insts.keySet(), after.insts.keySet())) {
      Inst inst = after.get(v);
      if (!inst.equals(get(v))) {
        builder.put(v, inst);
      }
    }
    return builder.buildOrThrow();
  }

  /** Returns a copy of this InstMap with each variable replaced by {@code renaming.apply(v)}. */
  public InstMap rename(Function<Var, Var> renaming) {
    if (!reachable) {
      return this;
    }
    TreeMap<Var, Inst> result = new TreeMap<>();
    insts.forEach((v, inst) -> result.put(renaming.apply(v), inst));
    return new InstMap(ImmutableSortedMap.copyOfSorted(result), true);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof InstMap m && m.reachable == reachable && m.insts.equals(insts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(insts, reachable);
  }

  @Override
  public String toString() {
    return reachable ? insts.toString() : "unreachable";
  }
}
