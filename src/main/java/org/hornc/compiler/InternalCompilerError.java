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

package org.hornc.compiler;

import com.google.errorprone.annotations.FormatMethod;
import org.hornc.hlds.ProcId;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when an invariant that an earlier pass should have established does not hold, e.g. a
 * variable that is read after its storage has been released. These indicate a bug in the
 * compiler rather than in the program being compiled, and abort compilation of the whole module.
 */
public class InternalCompilerError extends RuntimeException {
  /** The procedure being compiled when the fault was detected, if known. */
  public final @Nullable ProcId proc;

  @FormatMethod
  public InternalCompilerError(@Nullable ProcId proc, String format, Object... args) {
    super(String.format(format, args));
    this.proc = proc;
  }

  @Override
  public String getMessage() {
    String msg = super.getMessage();
    return (proc == null) ? msg : String.format("%s (in %s)", msg, proc);
  }
}
