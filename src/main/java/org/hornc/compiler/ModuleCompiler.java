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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountedCompleter;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hornc.check.DetAnalyzer;
import org.hornc.check.Diagnostic;
import org.hornc.check.ModeAnalyzer;
import org.hornc.check.PragmaError;
import org.hornc.check.SwitchDetector;
import org.hornc.code.CodeGen;
import org.hornc.code.Inliner;
import org.hornc.code.ProcCode;
import org.hornc.hlds.CodeModel;
import org.hornc.hlds.Context;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.Goal;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredId;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.ProcInfo;
import org.jspecify.annotations.Nullable;

/**
 * Compiles a module: checks pragmas, then runs mode analysis, determinism inference, switch
 * detection and code generation on each of its procedures.
 *
 * <p>Within each pass the procedures are independent (they only share the immutable module
 * table), so each is handled by a separate ForkJoinTask. Determinism inference is the exception:
 * since a procedure's inferred determinism depends on those of the procedures it calls, it is
 * repeated over all procedures until no inferred determinism changes.
 *
 * <p>Problems with the program are returned as {@link Diagnostic}s; a procedure with an error is
 * not code-generated. An {@link InternalCompilerError} in any task aborts the whole compilation
 * and is rethrown to the caller.
 */
public final class ModuleCompiler {
  private static final Logger logger = LogManager.getLogger(ModuleCompiler.class);

  /**
   * Notified as each procedure's code is generated, e.g. to collect statistics. Called from the
   * compiler's worker threads, so must be thread-safe.
   */
  public interface Monitor {
    Monitor NONE = code -> {};

    void procedureGenerated(ProcCode code);
  }

  private final CompilerOptions options;

  public ModuleCompiler(CompilerOptions options) {
    this.options = options;
  }

  public CompilationResult compile(ModuleTable table) {
    logger.info("Compiling {} procedures with {}", table.procIds().size(), options);
    if (options.threads == 1) {
      return compile(table, null);
    }
    ForkJoinPool pool = new ForkJoinPool(options.threads);
    try {
      return compile(table, pool);
    } finally {
      pool.shutdown();
    }
  }

  private CompilationResult compile(ModuleTable table, @Nullable ForkJoinPool pool) {
    Map<PredId, List<Diagnostic>> pragmaErrors = checkPragmas(table);

    List<ProcId> analyzed = new ArrayList<>();
    for (ProcId id : table.procIds()) {
      if (!table.pred(id.pred).isForeign()) {
        analyzed.add(id);
      }
    }

    logger.info("Doing mode analysis...");
    Map<ProcId, ModeAnalyzer.Result> modes =
        forEach(pool, analyzed, id -> ModeAnalyzer.analyze(table, id));
    List<ProcId> modeCorrect = new ArrayList<>();
    for (ProcId id : analyzed) {
      if (!modes.get(id).hasErrors()) {
        modeCorrect.add(id);
      }
    }

    logger.info("Doing determinism inference...");
    ModuleTable current = table;
    Map<ProcId, DetAnalyzer.Result> dets;
    for (int iteration = 1; ; iteration++) {
      ModuleTable snapshot = current;
      dets =
          forEach(
              pool, modeCorrect, id -> DetAnalyzer.analyze(snapshot, id, modes.get(id).goal));
      Map<ProcId, ProcInfo> updates = new HashMap<>();
      for (ProcId id : modeCorrect) {
        ProcInfo proc = snapshot.proc(id);
        Determinism old = (proc.inferred != null) ? proc.inferred : Determinism.ERRONEOUS;
        Determinism inferred = dets.get(id).inferred;
        // For undeclared procedures the new value is the worst of the old and new, so that the
        // iteration can only move up the lattice.
        Determinism next = (proc.declared == null) ? old.switchJoin(inferred) : inferred;
        if (next != proc.inferred) {
          logger.debug("{}: old {} new {}", id, proc.inferred, next);
          updates.put(id, proc.withInferred(next));
        }
      }
      current = current.withProcs(updates);
      if (updates.isEmpty()) {
        logger.info("Determinism inference converged after {} iteration(s)", iteration);
        break;
      }
    }

    logger.info("Doing switch detection...");
    List<ProcId> detCorrect = new ArrayList<>();
    for (ProcId id : modeCorrect) {
      if (!dets.get(id).hasErrors()) {
        detCorrect.add(id);
      }
    }
    Map<ProcId, DetAnalyzer.Result> finalDets = dets;
    Map<ProcId, SwitchDetector.Result> switches =
        forEach(pool, detCorrect, id -> SwitchDetector.detect(id, finalDets.get(id).goal));
    Map<ProcId, ProcInfo> bodies = new HashMap<>();
    for (ProcId id : detCorrect) {
      bodies.put(id, current.proc(id).withBody(switches.get(id).goal));
    }
    ModuleTable finalTable = current.withProcs(bodies);

    logger.info("Doing code generation...");
    List<ProcId> generated = new ArrayList<>();
    for (ProcId id : finalTable.procIds()) {
      PredInfo pred = finalTable.pred(id.pred);
      if (!pragmaErrors.containsKey(id.pred)
          && (pred.isForeign() || finalTable.proc(id).body != null)) {
        generated.add(id);
      }
    }
    Map<ProcId, ProcCode> code = forEach(pool, generated, id -> generate(finalTable, id));

    List<Diagnostic> diagnostics = new ArrayList<>();
    for (PredInfo pred : finalTable.preds()) {
      diagnostics.addAll(pragmaErrors.getOrDefault(pred.id, ImmutableList.of()));
      for (ProcId id : pred.procIds()) {
        if (modes.containsKey(id)) {
          diagnostics.addAll(modes.get(id).errors);
        }
        if (dets.containsKey(id)) {
          diagnostics.addAll(dets.get(id).errors);
        }
        if (switches.containsKey(id) && options.reportSwitchWarnings) {
          diagnostics.addAll(switches.get(id).warnings);
        }
      }
    }
    logger.info(
        "Generated code for {} procedures; {} diagnostics", code.size(), diagnostics.size());
    return new CompilationResult(finalTable, code, diagnostics);
  }

  private ProcCode generate(ModuleTable table, ProcId id) {
    ProcCode result;
    if (table.pred(id.pred).isForeign()) {
      result = CodeGen.foreignWrapper(table, id);
    } else {
      Goal body = Inliner.inline(table, id, table.proc(id).body, options.opt);
      result = CodeGen.generate(table, id, body, options.opt, options.verifyLiveness);
    }
    options.monitor.procedureGenerated(result);
    return result;
  }

  /** Returns the pragma errors for each predicate that has any. */
  private static Map<PredId, List<Diagnostic>> checkPragmas(ModuleTable table) {
    Map<PredId, List<Diagnostic>> result = new HashMap<>();
    for (PredInfo pred : table.preds()) {
      Context context = (pred.body != null) ? pred.body.info.context : Context.UNKNOWN;
      if (pred.inline && pred.noInline) {
        result
            .computeIfAbsent(pred.id, k -> new ArrayList<>())
            .add(new PragmaError(pred.id, context, PragmaError.Kind.CONFLICTING_INLINE));
      }
      if (pred.isForeign()) {
        for (ProcInfo proc : pred.procs) {
          if (proc.declared == null || proc.declared.codeModel() == CodeModel.NON) {
            result
                .computeIfAbsent(pred.id, k -> new ArrayList<>())
                .add(new PragmaError(pred.id, context, PragmaError.Kind.NONDET_FOREIGN));
            break;
          }
        }
      }
    }
    return result;
  }

  /**
   * Applies {@code fn} to each of {@code ids}, as parallel tasks if {@code pool} is non-null, and
   * returns the results once all are done.
   */
  private static <T> Map<ProcId, T> forEach(
      @Nullable ForkJoinPool pool, List<ProcId> ids, Function<ProcId, T> fn) {
    if (pool == null) {
      Map<ProcId, T> result = new TreeMap<>();
      ids.forEach(id -> result.put(id, fn.apply(id)));
      return result;
    }
    Map<ProcId, T> result = new ConcurrentHashMap<>();
    // Each procedure gets its own task, a child of this one so that we can wait until they're
    // all done.
    CountedCompleter<Void> baseTask =
        new CountedCompleter<Void>() {
          @Override
          public void compute() {
            for (ProcId id : ids) {
              addToPendingCount(1);
              new CountedCompleter<Void>(this) {
                @Override
                public void compute() {
                  result.put(id, fn.apply(id));
                  tryComplete();
                }
              }.fork();
            }
            tryComplete();
          }
        };
    try {
      pool.invoke(baseTask);
    } catch (RuntimeException e) {
      // The pool may have wrapped the exception thrown by the failing task.
      for (Throwable t : Throwables.getCausalChain(e)) {
        if (t instanceof InternalCompilerError ice) {
          throw ice;
        }
      }
      throw e;
    }
    return new TreeMap<>(result);
  }
}
