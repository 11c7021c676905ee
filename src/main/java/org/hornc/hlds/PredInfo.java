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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything known about a predicate: its head variables and body (shared by all its modes), its
 * purity and pragmas, and its procedures (one per declared mode).
 *
 * <p>A predicate with a {@link #foreignName} is implemented outside the module and has no body.
 */
public final class PredInfo {
  public final PredId id;
  public final ImmutableList<Var> headVars;
  public final @Nullable Goal body;
  public final Purity purity;

  /** True if the predicate has an {@code inline} pragma. */
  public final boolean inline;

  /** True if the predicate has a {@code no_inline} pragma. */
  public final boolean noInline;

  public final @Nullable String foreignName;
  public final ImmutableList<ProcInfo> procs;

  private PredInfo(Builder builder, ImmutableList<ProcInfo> procs) {
    this.id = new PredId(builder.name, builder.arity());
    this.headVars = ImmutableList.copyOf(builder.headVars);
    this.body = builder.body;
    this.purity = builder.purity;
    this.inline = builder.inline;
    this.noInline = builder.noInline;
    this.foreignName = builder.foreignName;
    this.procs = procs;
  }

  private PredInfo(PredInfo base, ImmutableList<ProcInfo> procs) {
    this.id = base.id;
    this.headVars = base.headVars;
    this.body = base.body;
    this.purity = base.purity;
    this.inline = base.inline;
    this.noInline = base.noInline;
    this.foreignName = base.foreignName;
    this.procs = procs;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public boolean isForeign() {
    return foreignName != null;
  }

  public ProcId procId(int modeNum) {
    Preconditions.checkElementIndex(modeNum, procs.size());
    return new ProcId(id, modeNum);
  }

  public ImmutableList<ProcId> procIds() {
    ImmutableList.Builder<ProcId> result = ImmutableList.builder();
    for (int i = 0; i < procs.size(); i++) {
      result.add(new ProcId(id, i));
    }
    return result.build();
  }

  /** Returns a copy of this PredInfo with one of its procedures replaced. */
  public PredInfo withProc(int modeNum, ProcInfo proc) {
    List<ProcInfo> newProcs = new ArrayList<>(procs);
    newProcs.set(modeNum, proc);
    return new PredInfo(this, ImmutableList.copyOf(newProcs));
  }

  @Override
  public String toString() {
    return id.toString();
  }

  /** Accumulates the parts of a PredInfo. */
  public static final class Builder {
    private final String name;
    private List<Var> headVars = ImmutableList.of();
    private Goal body;
    private Purity purity = Purity.PURE;
    private boolean inline;
    private boolean noInline;
    private String foreignName;
    private final List<ProcInfo> procs = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder clause(List<Var> headVars, Goal body) {
      this.headVars = ImmutableList.copyOf(headVars);
      this.body = body;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder purity(Purity purity) {
      this.purity = purity;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder inline() {
      this.inline = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder noInline() {
      this.noInline = true;
      return this;
    }

    /** Declares this predicate to be implemented by the foreign procedure with the given name. */
    @CanIgnoreReturnValue
    public Builder foreign(String foreignName) {
      this.foreignName = foreignName;
      return this;
    }

    /** Adds a procedure with the given determinism; if {@code det} is null it will be inferred. */
    @CanIgnoreReturnValue
    public Builder mode(@Nullable Determinism det, Mode... argModes) {
      procs.add(new ProcInfo(Arrays.asList(argModes), det));
      return this;
    }

    private int arity() {
      return (body != null) ? headVars.size() : procs.get(0).argModes.size();
    }

    public PredInfo build() {
      Preconditions.checkState(!procs.isEmpty(), "%s has no modes", name);
      Preconditions.checkState(
          (body == null) == (foreignName != null), "%s needs exactly one of body or foreign", name);
      int arity = arity();
      for (ProcInfo proc : procs) {
        Preconditions.checkState(
            proc.argModes.size() == arity, "Wrong number of modes for %s", name);
      }
      return new PredInfo(this, ImmutableList.copyOf(procs));
    }
  }
}
