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

package org.hornc.code;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hornc.compiler.OptTuple;
import org.hornc.hlds.Goal;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredId;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.ProcInfo;
import org.hornc.hlds.Var;

/**
 * Replaces calls to small procedures by copies of their analyzed bodies.
 *
 * <p>A call is inlined if inlining is enabled and the callee
 *
 * <ul>
 *   <li>has a body (i.e. is not foreign, and was analyzed without errors);
 *   <li>is not in the caller's own predicate, does not call itself, and does not call the
 *       caller's predicate;
 *   <li>has no {@code no_inline} pragma; and
 *   <li>either has an {@code inline} pragma or has a body no bigger than {@code inlineThreshold}.
 * </ul>
 *
 * The copy has its variables renamed (the callee's head variables become the call's arguments;
 * its other variables get fresh ones) and is wrapped in an EXISTS scope with the call's
 * annotations, so the caller's view of the goal is unchanged. Only one level of inlining is done:
 * calls in the copied body are left alone.
 */
public final class Inliner {
  private static final Logger logger = LogManager.getLogger(Inliner.class);

  private final ModuleTable table;
  private final ProcId caller;
  private final OptTuple opt;
  private final GoalBuilder builder;

  private Inliner(ModuleTable table, ProcId caller, OptTuple opt, GoalBuilder builder) {
    this.table = table;
    this.caller = caller;
    this.opt = opt;
    this.builder = builder;
  }

  /** Returns {@code body} (the analyzed body of {@code caller}) with eligible calls inlined. */
  public static Goal inline(ModuleTable table, ProcId caller, Goal body, OptTuple opt) {
    if (!opt.enabled(OptTuple.Switch.INLINING)) {
      return body;
    }
    PredInfo pred = table.pred(caller.pred);
    Inliner inliner =
        new Inliner(table, caller, opt, GoalBuilder.forRewriting(body, pred.headVars));
    return inliner.rewrite(body);
  }

  private Goal rewrite(Goal goal) {
    if (goal instanceof Goal.Call call && shouldInline(call)) {
      return inlined(call);
    }
    return goal.mapChildren(this::rewrite);
  }

  private boolean shouldInline(Goal.Call call) {
    if (call.proc == null || call.info.before == null || !call.info.before.isReachable()) {
      return false;
    }
    PredInfo callee = table.pred(call.pred);
    ProcInfo calleeProc = table.proc(call.proc);
    if (callee.isForeign()
        || calleeProc.body == null
        || callee.noInline
        || call.pred.equals(caller.pred)
        || new HashSet<>(call.args).size() != call.args.size()) {
      return false;
    }
    if (!callee.inline && calleeProc.body.size() > opt.value(OptTuple.Switch.INLINE_THRESHOLD)) {
      return false;
    }
    return !calls(calleeProc.body, call.pred) && !calls(calleeProc.body, caller.pred);
  }

  private static boolean calls(Goal goal, PredId pred) {
    if (goal instanceof Goal.Call call && call.pred.equals(pred)) {
      return true;
    }
    return goal.children().stream().anyMatch(child -> calls(child, pred));
  }

  private Goal inlined(Goal.Call call) {
    PredInfo callee = table.pred(call.pred);
    Goal body = table.proc(call.proc).body;
    Map<Var, Var> renaming = new HashMap<>();
    List<Var> headVars = callee.headVars;
    for (int i = 0; i < headVars.size(); i++) {
      renaming.put(headVars.get(i), call.args.get(i));
    }
    Goal copy =
        body.rename(
            v -> renaming.computeIfAbsent(v, builder.vars()::copyOf), builder::nextGoalId);
    logger.debug("Inlined {} into {} at {}", call.proc, caller, call.id());
    return new Goal.Scope(call.info, Goal.Scope.Kind.EXISTS, copy);
  }
}
