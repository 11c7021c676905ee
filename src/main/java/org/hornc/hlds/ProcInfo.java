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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One mode of a predicate: the modes of its arguments, its declared determinism (if any), and,
 * once the procedure has been analyzed, its inferred determinism and analyzed body.
 */
public final class ProcInfo {
  public final ImmutableList<Mode> argModes;

  /** Null if the determinism of this procedure is to be inferred. */
  public final @Nullable Determinism declared;

  /** Null until determinism analysis has run. */
  public final @Nullable Determinism inferred;

  /** The body after analysis; null until then (and always null for foreign procedures). */
  public final @Nullable Goal body;

  public ProcInfo(List<Mode> argModes, @Nullable Determinism declared) {
    this(ImmutableList.copyOf(argModes), declared, null, null);
  }

  private ProcInfo(
      ImmutableList<Mode> argModes,
      @Nullable Determinism declared,
      @Nullable Determinism inferred,
      @Nullable Goal body) {
    this.argModes = argModes;
    this.declared = declared;
    this.inferred = inferred;
    this.body = body;
  }

  public ProcInfo withInferred(Determinism inferred) {
    return new ProcInfo(argModes, declared, inferred, body);
  }

  public ProcInfo withBody(Goal body) {
    return new ProcInfo(argModes, declared, inferred, body);
  }

  /**
   * Returns the determinism that callers of this procedure should assume: the declared one if
   * there is one, otherwise the inferred one. A procedure whose determinism has not yet been
   * inferred is assumed to be erroneous, which is the starting point for inference.
   */
  public Determinism determinism() {
    if (declared != null) {
      return declared;
    }
    return (inferred != null) ? inferred : Determinism.ERRONEOUS;
  }

  @Override
  public String toString() {
    return argModes + " is " + (declared != null ? declared : "?" + inferred);
  }
}
