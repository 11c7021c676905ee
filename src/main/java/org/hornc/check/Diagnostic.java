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

import com.google.common.base.Ascii;
import org.hornc.hlds.Context;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.PredId;
import org.hornc.hlds.ProcId;
import org.jspecify.annotations.Nullable;

/**
 * A problem with the user's program that was found by one of the checking passes. Diagnostics are
 * collected rather than thrown, so that a single compilation can report as many as possible.
 *
 * <p>Each subclass carries enough structured information to render its message without referring
 * back to the goal tree.
 */
public abstract class Diagnostic {
  public final Severity severity;
  public final PredId pred;

  /** The procedure the problem was found in, or null if it applies to the whole predicate. */
  public final @Nullable ProcId proc;

  /** The goal the problem was found in, or null if it applies to the whole procedure. */
  public final @Nullable GoalId goal;

  public final Context context;

  Diagnostic(
      Severity severity,
      PredId pred,
      @Nullable ProcId proc,
      @Nullable GoalId goal,
      Context context) {
    this.severity = severity;
    this.pred = pred;
    this.proc = proc;
    this.goal = goal;
    this.context = context;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /** Returns a description of the problem, without location information. */
  public abstract String message();

  /** Returns the complete text of this diagnostic, suitable for showing to a user. */
  public String render() {
    return String.format(
        "%s: In %s: %s: %s",
        context,
        (proc != null) ? proc : pred,
        Ascii.toLowerCase(severity.name()),
        message());
  }

  @Override
  public String toString() {
    return render();
  }
}
