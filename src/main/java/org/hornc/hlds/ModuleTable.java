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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * An immutable snapshot of the predicates of a module. Every pass takes the table as an explicit
 * argument; updates (e.g. recording an inferred determinism) return a new table, so a pass running
 * concurrently with another never sees its changes.
 */
public final class ModuleTable {
  private final ImmutableSortedMap<PredId, PredInfo> preds;

  private ModuleTable(ImmutableSortedMap<PredId, PredInfo> preds) {
    this.preds = preds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableCollection<PredInfo> preds() {
    return preds.values();
  }

  public @Nullable PredInfo lookup(PredId id) {
    return preds.get(id);
  }

  public PredInfo pred(PredId id) {
    PredInfo result = preds.get(id);
    Preconditions.checkArgument(result != null, "No predicate %s", id);
    return result;
  }

  public ProcInfo proc(ProcId id) {
    return pred(id.pred).procs.get(id.modeNum);
  }

  /** Returns the ids of every procedure in the module, in order. */
  public ImmutableList<ProcId> procIds() {
    ImmutableList.Builder<ProcId> result = ImmutableList.builder();
    for (PredInfo pred : preds.values()) {
      result.addAll(pred.procIds());
    }
    return result.build();
  }

  /** Returns the determinism that callers of the given procedure should assume. */
  public Determinism determinism(ProcId id) {
    return proc(id).determinism();
  }

  /** Returns a copy of this table with one procedure replaced. */
  public ModuleTable withProc(ProcId id, ProcInfo proc) {
    return withProcs(Map.of(id, proc));
  }

  /** Returns a copy of this table with each of the given procedures replaced. */
  public ModuleTable withProcs(Map<ProcId, ProcInfo> procs) {
    if (procs.isEmpty()) {
      return this;
    }
    TreeMap<PredId, PredInfo> copy = new TreeMap<>(preds);
    procs.forEach(
        (id, proc) -> {
          PredInfo pred = copy.get(id.pred);
          Preconditions.checkArgument(pred != null, "No predicate %s", id.pred);
          copy.put(id.pred, pred.withProc(id.modeNum, proc));
        });
    return new ModuleTable(ImmutableSortedMap.copyOfSorted(copy));
  }

  /** Accumulates the predicates of a ModuleTable. */
  public static final class Builder {
    private final TreeMap<PredId, PredInfo> preds = new TreeMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(PredInfo pred) {
      Preconditions.checkArgument(
          preds.putIfAbsent(pred.id, pred) == null, "Duplicate predicate %s", pred.id);
      return this;
    }

    public ModuleTable build() {
      return new ModuleTable(ImmutableSortedMap.copyOfSorted(preds));
    }
  }
}
