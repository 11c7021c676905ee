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
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The annotations attached to each goal. A GoalInfo starts with just an id and a source context;
 * mode analysis adds the insts of the goal's variables before and after it, and determinism
 * analysis adds the goal's determinism.
 */
public final class GoalInfo {
  public final GoalId id;
  public final Context context;

  /** The insts of this goal's free variables on entry; null until mode analysis has run. */
  public final @Nullable InstMap before;

  /** The insts of this goal's free variables on exit; null until mode analysis has run. */
  public final @Nullable InstMap after;

  /** Null until determinism analysis has run. */
  public final @Nullable Determinism determinism;

  public GoalInfo(GoalId id, Context context) {
    this(id, context, null, null, null);
  }

  private GoalInfo(
      GoalId id,
      Context context,
      @Nullable InstMap before,
      @Nullable InstMap after,
      @Nullable Determinism determinism) {
    this.id = id;
    this.context = context;
    this.before = before;
    this.after = after;
    this.determinism = determinism;
  }

  public GoalInfo withInsts(InstMap before, InstMap after) {
    return new GoalInfo(id, context, before, after, determinism);
  }

  public GoalInfo withDeterminism(Determinism determinism) {
    return new GoalInfo(id, context, before, after, determinism);
  }

  /** Returns a copy of this GoalInfo with a different id. */
  public GoalInfo withId(GoalId id) {
    return new GoalInfo(id, context, before, after, determinism);
  }

  /** Returns the changes made to variable insts by this goal. */
  public ImmutableMap<Var, Inst> delta() {
    return (before == null || after == null) ? ImmutableMap.of() : before.delta(after);
  }

  /** Returns true if mode analysis found that this goal cannot succeed. */
  public boolean isUnreachableAfter() {
    return after != null && !after.isReachable();
  }

  GoalInfo rename(GoalId newId, Function<Var, Var> renaming) {
    return new GoalInfo(
        newId,
        context,
        (before == null) ? null : before.rename(renaming),
        (after == null) ? null : after.rename(renaming),
        determinism);
  }

  @Override
  public String toString() {
    return (determinism == null) ? id.toString() : id + ":" + determinism;
  }
}
