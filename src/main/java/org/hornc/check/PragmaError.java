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

import org.hornc.hlds.Context;
import org.hornc.hlds.PredId;

/** An inconsistency between the pragmas given for a predicate. */
public final class PragmaError extends Diagnostic {

  public enum Kind {
    CONFLICTING_INLINE,
    /** A foreign procedure was declared (or inferred) to have more than one solution. */
    NONDET_FOREIGN
  }

  public final Kind kind;

  public PragmaError(PredId pred, Context context, Kind kind) {
    super(Severity.ERROR, pred, null, null, context);
    this.kind = kind;
  }

  @Override
  public String message() {
    return switch (kind) {
      case CONFLICTING_INLINE -> "conflicting inline and no_inline pragmas for " + pred;
      case NONDET_FOREIGN -> "foreign procedure " + pred + " must be det or semidet";
    };
  }
}
