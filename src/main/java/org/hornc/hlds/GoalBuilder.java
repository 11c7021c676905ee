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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import org.hornc.hlds.Goal.Scope;

/**
 * Creates goals with distinct ids. Each goal is given the builder's current source context, which
 * can be changed with {@link #at}.
 *
 * <p>A GoalBuilder is used by front ends (and tests) to construct procedure bodies, and by passes
 * that need to introduce new goals into an existing body (in which case it should be created with
 * {@link #forRewriting} so that the new ids don't collide with existing ones).
 */
public class GoalBuilder {
  private final VarSet vars;
  private int nextGoalId;
  private Context context = Context.UNKNOWN;

  public GoalBuilder() {
    this(new VarSet(), 0);
  }

  private GoalBuilder(VarSet vars, int firstGoalId) {
    this.vars = vars;
    this.nextGoalId = firstGoalId;
  }

  /**
   * Returns a GoalBuilder whose variables and goal ids won't collide with those in the given body
   * or head variables.
   */
  public static GoalBuilder forRewriting(Goal body, List<Var> headVars) {
    VarSet vars =
        VarSet.after(ImmutableList.<Var>builder().addAll(body.freeVars()).addAll(headVars).build());
    return new GoalBuilder(vars, maxGoalId(body) + 1);
  }

  private static int maxGoalId(Goal goal) {
    int result = goal.id().id;
    for (Goal child : goal.children()) {
      result = Math.max(result, maxGoalId(child));
    }
    return result;
  }

  /** Sets the source context for subsequently created goals. */
  @CanIgnoreReturnValue
  public GoalBuilder at(String file, int line) {
    this.context = new Context(file, line);
    return this;
  }

  public VarSet vars() {
    return vars;
  }

  public Var var(String name) {
    return vars.newVar(name);
  }

  public Var var(String name, TypeDefn type) {
    return vars.newVar(name, type);
  }

  /** Returns a new GoalInfo with the next goal id and the current context. */
  public GoalInfo newInfo() {
    return new GoalInfo(new GoalId(nextGoalId++), context);
  }

  /** Returns the next goal id, as an int. */
  public int nextGoalId() {
    return nextGoalId++;
  }

  public Goal unify(Var x, Var y) {
    return Goal.Unify.ofVars(newInfo(), x, y);
  }

  /** Returns {@code x = functor(args)}. */
  public Goal unify(Var x, ConsId functor, Var... args) {
    return Goal.Unify.ofFunctor(newInfo(), x, functor, Arrays.asList(args));
  }

  /** Returns {@code x = closure(pred, args)}. */
  public Goal closure(Var x, PredId pred, Var... args) {
    return Goal.Unify.ofClosure(newInfo(), x, pred, Arrays.asList(args));
  }

  public Goal call(PredId pred, Var... args) {
    return call(pred, Arrays.asList(args));
  }

  public Goal call(PredId pred, List<Var> args) {
    return Goal.Call.of(newInfo(), pred, args);
  }

  /** Returns a call to the predicate with the given name and arity {@code args.length}. */
  public Goal call(String name, Var... args) {
    return call(PredId.of(name, args.length), args);
  }

  public Goal callClosure(Var closure, Var... args) {
    return Goal.HigherOrderCall.of(newInfo(), closure, Arrays.asList(args));
  }

  public Goal conj(Goal... goals) {
    return conj(Arrays.asList(goals));
  }

  public Goal conj(List<Goal> goals) {
    return new Goal.Conj(newInfo(), goals);
  }

  public Goal disj(Goal... goals) {
    return disj(Arrays.asList(goals));
  }

  public Goal disj(List<Goal> goals) {
    return new Goal.Disj(newInfo(), goals);
  }

  public Goal not(Goal goal) {
    return new Goal.Not(newInfo(), goal);
  }

  public Goal ite(Goal cond, Goal thenGoal, Goal elseGoal) {
    return new Goal.IfThenElse(newInfo(), cond, thenGoal, elseGoal);
  }

  public Goal commit(Goal goal) {
    return new Goal.Scope(newInfo(), Scope.Kind.COMMIT, goal);
  }

  public Goal some(Goal goal) {
    return new Goal.Scope(newInfo(), Scope.Kind.EXISTS, goal);
  }

  public Goal trueGoal() {
    return conj();
  }

  public Goal fail() {
    return disj();
  }
}
