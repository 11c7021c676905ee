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

import com.google.common.collect.ImmutableSortedSet;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Context;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;

/**
 * Reported for a switch on a variable whose possible constructors are known when some of them
 * are not covered by any arm; the switch will fail if the variable was built with one of those.
 */
public final class SwitchWarning extends Diagnostic {
  public final Var var;
  public final ImmutableSortedSet<ConsId> missing;

  public SwitchWarning(
      ProcId proc, GoalId goal, Context context, Var var, ImmutableSortedSet<ConsId> missing) {
    super(Severity.WARNING, proc.pred, proc, goal, context);
    this.var = var;
    this.missing = missing;
  }

  @Override
  public String message() {
    return "switch on " + var + " does not cover " + missing;
  }
}
