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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import org.hornc.check.Diagnostic;
import org.hornc.code.ProcCode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.ProcId;
import org.jspecify.annotations.Nullable;

/**
 * The output of {@link ModuleCompiler#compile}: the module table with each procedure's inferred
 * determinism and analyzed body filled in, the generated code for each procedure that had no
 * errors, and every diagnostic found.
 */
public final class CompilationResult {
  public final ModuleTable table;
  public final ImmutableSortedMap<ProcId, ProcCode> code;

  /** Sorted by procedure, and within a procedure in the order the passes found them. */
  public final ImmutableList<Diagnostic> diagnostics;

  CompilationResult(ModuleTable table, Map<ProcId, ProcCode> code, List<Diagnostic> diagnostics) {
    this.table = table;
    this.code = ImmutableSortedMap.copyOf(code);
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics.stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics.stream()
        .filter(d -> !d.isError())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the code for the given procedure, or null if none was generated. */
  public @Nullable ProcCode code(ProcId proc) {
    return code.get(proc);
  }
}
