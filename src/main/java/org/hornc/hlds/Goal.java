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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntSupplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A node in a procedure body. Goals are immutable; each pass that annotates or rewrites a body
 * returns a new tree, sharing any unchanged subtrees with its input.
 *
 * <p>The body is in super-homogeneous form: the arguments of calls and constructor applications
 * are always variables, and each unification mentions at most one constructor.
 *
 * <p>The subclasses are
 *
 * <ul>
 *   <li>{@link Unify}: {@code X = Y}, {@code X = f(Y1, ..., Yn)}, or {@code X = closure(p, Y1,
 *       ..., Yn)}
 *   <li>{@link Call}: a call to a named predicate (which may be implemented by foreign code)
 *   <li>{@link HigherOrderCall}: a call to a closure value
 *   <li>{@link Conj}: a sequence of goals, all of which must succeed ({@code true} is the empty
 *       Conj)
 *   <li>{@link Disj}: alternatives, each of which may provide solutions ({@code fail} is the empty
 *       Disj)
 *   <li>{@link Not}: succeeds iff its goal fails
 *   <li>{@link IfThenElse}
 *   <li>{@link Scope}: a goal whose solutions are limited to the first (COMMIT), or that just
 *       delimits the variables it introduces (EXISTS)
 *   <li>{@link Switch}: a multi-way branch on a bound variable's outer constructor; only created
 *       by switch detection
 * </ul>
 */
public abstract class Goal {
  public final GoalInfo info;

  /** Computed on demand by {@link #freeVars}. */
  private ImmutableSortedSet<Var> freeVars;

  // Only the nested classes below may extend Goal.
  private Goal(GoalInfo info) {
    this.info = info;
  }

  public final GoalId id() {
    return info.id;
  }

  /** Returns this goal's determinism; only valid after determinism analysis. */
  public final Determinism determinism() {
    Preconditions.checkState(info.determinism != null, "No determinism for %s", info.id);
    return info.determinism;
  }

  /** Returns this goal's subgoals, in order. */
  public abstract ImmutableList<Goal> children();

  /** Adds the variables that appear directly in this goal (not in its children) to the builder. */
  abstract void addOwnVars(ImmutableSortedSet.Builder<Var> builder);

  /**
   * Returns a goal of the same kind as this one with the given info and children, and with each
   * variable {@code v} appearing directly in it replaced by {@code renaming.apply(v)}.
   */
  abstract Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children);

  /** Returns the variables that appear anywhere in this goal. */
  public final ImmutableSortedSet<Var> freeVars() {
    if (freeVars == null) {
      ImmutableSortedSet.Builder<Var> builder = ImmutableSortedSet.naturalOrder();
      addOwnVars(builder);
      for (Goal child : children()) {
        builder.addAll(child.freeVars());
      }
      freeVars = builder.build();
    }
    return freeVars;
  }

  /** Returns a copy of this goal with a different info. */
  public final Goal withInfo(GoalInfo info) {
    return (info == this.info) ? this : copy(info, Function.identity(), children());
  }

  /** Returns a copy of this goal with different children; they must be of the same number. */
  public final Goal withChildren(List<Goal> children) {
    Preconditions.checkArgument(children.size() == children().size());
    return copy(info, Function.identity(), children);
  }

  /**
   * Returns a goal with each child {@code c} replaced by {@code fn.apply(c)}. Returns this goal if
   * {@code fn} returned each child unchanged.
   */
  public final Goal mapChildren(UnaryOperator<Goal> fn) {
    ImmutableList<Goal> children = children();
    ImmutableList<Goal> mapped = children.stream().map(fn).collect(toImmutableList());
    for (int i = 0; i < children.size(); i++) {
      if (mapped.get(i) != children.get(i)) {
        return withChildren(mapped);
      }
    }
    return this;
  }

  /**
   * Returns a copy of this goal with every variable renamed and every goal given a new id. Used
   * when inlining a procedure body into its caller.
   */
  public final Goal rename(Function<Var, Var> renaming, IntSupplier newIds) {
    GoalInfo newInfo = info.rename(new GoalId(newIds.getAsInt()), renaming);
    ImmutableList<Goal> children =
        children().stream().map(c -> c.rename(renaming, newIds)).collect(toImmutableList());
    return copy(newInfo, renaming, children);
  }

  /** Returns the number of atomic goals in this goal; used to decide whether to inline a body. */
  public int size() {
    int result = 0;
    for (Goal child : children()) {
      result += child.size();
    }
    return result;
  }

  /** True if this is the empty conjunction. */
  public final boolean isTrue() {
    return this instanceof Conj c && c.goals.isEmpty();
  }

  /** True if this is the empty disjunction. */
  public final boolean isFail() {
    return this instanceof Disj d && d.goals.isEmpty();
  }

  /** Returns the goals of a conjunction, or a singleton list of any other goal. */
  public ImmutableList<Goal> conjuncts() {
    return ImmutableList.of(this);
  }

  private static String join(List<?> items, String separator) {
    return items.stream().map(Object::toString).collect(Collectors.joining(separator));
  }

  /** A unification. */
  public static final class Unify extends Goal {
    /** How a unification is implemented; chosen by mode analysis. */
    public enum Kind {
      /** Not yet analyzed. */
      UNKNOWN,
      /** {@code lhs := rhsVar}; the lhs was free. */
      ASSIGN,
      /** Compare two bound variables; fails if they differ. */
      SIMPLE_TEST,
      /** {@code lhs := f(args)} or {@code lhs := closure(p, args)}; lhs was free. */
      CONSTRUCT,
      /** Check that lhs was built with {@code functor} and extract or compare its arguments. */
      DECONSTRUCT
    }

    /** What a deconstruction does with each argument. */
    public enum ArgMode {
      /** The argument was free and is assigned the corresponding field. */
      OUTPUT,
      /** The argument was bound and is compared with the corresponding field. */
      TEST
    }

    public final Var lhs;

    /** If non-null, this unification is {@code lhs = rhsVar}. */
    public final @Nullable Var rhsVar;

    /** If non-null, this unification is {@code lhs = functor(args)}. */
    public final @Nullable ConsId functor;

    /** If non-null, this unification is {@code lhs = closure(closurePred, args)}. */
    public final @Nullable PredId closurePred;

    /** The procedure of {@link #closurePred} chosen by mode analysis. */
    public final @Nullable ProcId closureProc;

    public final ImmutableList<Var> args;
    public final Kind kind;

    /** For a DECONSTRUCT, what to do with each argument; otherwise empty. */
    public final ImmutableList<ArgMode> argModes;

    /** True if this is a test that may fail; set by mode analysis. */
    public final boolean canFail;

    private Unify(
        GoalInfo info,
        Var lhs,
        @Nullable Var rhsVar,
        @Nullable ConsId functor,
        @Nullable PredId closurePred,
        @Nullable ProcId closureProc,
        List<Var> args,
        Kind kind,
        List<ArgMode> argModes,
        boolean canFail) {
      super(info);
      this.lhs = lhs;
      this.rhsVar = rhsVar;
      this.functor = functor;
      this.closurePred = closurePred;
      this.closureProc = closureProc;
      this.args = ImmutableList.copyOf(args);
      this.kind = kind;
      this.argModes = ImmutableList.copyOf(argModes);
      this.canFail = canFail;
    }

    /** Returns {@code x = y}. */
    public static Unify ofVars(GoalInfo info, Var x, Var y) {
      return new Unify(
          info, x, y, null, null, null, ImmutableList.of(), Kind.UNKNOWN, ImmutableList.of(),
          false);
    }

    /** Returns {@code x = functor(args)}. */
    public static Unify ofFunctor(GoalInfo info, Var x, ConsId functor, List<Var> args) {
      Preconditions.checkArgument(functor.arity == args.size(), "Wrong arity for %s", functor);
      Preconditions.checkArgument(!args.contains(x), "Cyclic term");
      return new Unify(
          info, x, null, functor, null, null, args, Kind.UNKNOWN, ImmutableList.of(), false);
    }

    /** Returns {@code x = closure(pred, args)}, i.e. a partial application of {@code pred}. */
    public static Unify ofClosure(GoalInfo info, Var x, PredId pred, List<Var> args) {
      Preconditions.checkArgument(args.size() <= pred.arity);
      return new Unify(
          info, x, null, null, pred, null, args, Kind.UNKNOWN, ImmutableList.of(), false);
    }

    public boolean isVarVar() {
      return rhsVar != null;
    }

    public boolean isClosure() {
      return closurePred != null;
    }

    /** Returns a copy of this unification with the results of mode analysis. */
    public Unify withKind(Kind kind, List<ArgMode> argModes, boolean canFail) {
      return new Unify(
          info, lhs, rhsVar, functor, closurePred, closureProc, args, kind, argModes, canFail);
    }

    /** Returns a copy of this closure construction with the chosen procedure. */
    public Unify withClosureProc(ProcId proc) {
      Preconditions.checkState(isClosure());
      return new Unify(
          info, lhs, rhsVar, functor, closurePred, proc, args, kind, argModes, canFail);
    }

    /** Returns {@code rhsVar = lhs}; only valid for a var-var unification. */
    public Unify swapped() {
      Preconditions.checkState(isVarVar());
      return new Unify(info, rhsVar, lhs, null, null, null, args, kind, argModes, canFail);
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of();
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {
      builder.add(lhs);
      if (rhsVar != null) {
        builder.add(rhsVar);
      }
      builder.addAll(args);
    }

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Unify(
          info,
          renaming.apply(lhs),
          (rhsVar == null) ? null : renaming.apply(rhsVar),
          functor,
          closurePred,
          closureProc,
          args.stream().map(renaming).collect(toImmutableList()),
          kind,
          argModes,
          canFail);
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public String toString() {
      String op = (kind == Kind.ASSIGN || kind == Kind.CONSTRUCT) ? " := " : " = ";
      if (rhsVar != null) {
        return lhs + (kind == Kind.SIMPLE_TEST ? " == " : op) + rhsVar;
      } else if (closurePred != null) {
        return lhs + op + "closure(" + closurePred.name
            + (args.isEmpty() ? "" : ", " + join(args, ", ")) + ")";
      }
      String result = lhs + op + functor.name;
      return args.isEmpty() ? result : result + "(" + join(args, ", ") + ")";
    }
  }

  /** A call to a named predicate. */
  public static final class Call extends Goal {
    public final PredId pred;
    public final ImmutableList<Var> args;

    /** The procedure chosen by mode analysis; null until then. */
    public final @Nullable ProcId proc;

    private Call(GoalInfo info, PredId pred, List<Var> args, @Nullable ProcId proc) {
      super(info);
      Preconditions.checkArgument(pred.arity == args.size(), "Wrong number of args for %s", pred);
      this.pred = pred;
      this.args = ImmutableList.copyOf(args);
      this.proc = proc;
    }

    public static Call of(GoalInfo info, PredId pred, List<Var> args) {
      return new Call(info, pred, args, null);
    }

    public Call withProc(ProcId proc) {
      Preconditions.checkArgument(proc.pred.equals(pred));
      return new Call(info, pred, args, proc);
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of();
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {
      builder.addAll(args);
    }

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Call(info, pred, args.stream().map(renaming).collect(toImmutableList()), proc);
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public String toString() {
      return pred.name + "(" + join(args, ", ") + ")";
    }
  }

  /** A call to the closure held in a variable. */
  public static final class HigherOrderCall extends Goal {
    public final Var closure;
    public final ImmutableList<Var> args;

    /** The closure's modes and determinism as found by mode analysis; null until then. */
    public final @Nullable HigherOrder higherOrder;

    private HigherOrderCall(
        GoalInfo info, Var closure, List<Var> args, @Nullable HigherOrder higherOrder) {
      super(info);
      this.closure = closure;
      this.args = ImmutableList.copyOf(args);
      this.higherOrder = higherOrder;
    }

    public static HigherOrderCall of(GoalInfo info, Var closure, List<Var> args) {
      return new HigherOrderCall(info, closure, args, null);
    }

    public HigherOrderCall withHigherOrder(HigherOrder higherOrder) {
      return new HigherOrderCall(info, closure, args, higherOrder);
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of();
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {
      builder.add(closure);
      builder.addAll(args);
    }

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new HigherOrderCall(
          info,
          renaming.apply(closure),
          args.stream().map(renaming).collect(toImmutableList()),
          higherOrder);
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public String toString() {
      return "call(" + closure + (args.isEmpty() ? "" : ", " + join(args, ", ")) + ")";
    }
  }

  /** A conjunction. */
  public static final class Conj extends Goal {
    public final ImmutableList<Goal> goals;

    public Conj(GoalInfo info, List<Goal> goals) {
      super(info);
      this.goals = ImmutableList.copyOf(goals);
    }

    @Override
    public ImmutableList<Goal> children() {
      return goals;
    }

    @Override
    public ImmutableList<Goal> conjuncts() {
      return goals;
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {}

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Conj(info, children);
    }

    @Override
    public String toString() {
      return goals.isEmpty() ? "true" : "(" + join(goals, ", ") + ")";
    }
  }

  /** A disjunction. */
  public static final class Disj extends Goal {
    public final ImmutableList<Goal> goals;

    public Disj(GoalInfo info, List<Goal> goals) {
      super(info);
      this.goals = ImmutableList.copyOf(goals);
    }

    @Override
    public ImmutableList<Goal> children() {
      return goals;
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {}

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Disj(info, children);
    }

    @Override
    public String toString() {
      return goals.isEmpty() ? "fail" : "(" + join(goals, " ; ") + ")";
    }
  }

  /** A negation. */
  public static final class Not extends Goal {
    public final Goal goal;

    public Not(GoalInfo info, Goal goal) {
      super(info);
      this.goal = goal;
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of(goal);
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {}

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Not(info, children.get(0));
    }

    @Override
    public String toString() {
      return "not(" + goal + ")";
    }
  }

  /**
   * {@code if cond then thenGoal else elseGoal}. Variables bound by {@code cond} are visible in
   * {@code thenGoal} but not in {@code elseGoal}.
   */
  public static final class IfThenElse extends Goal {
    public final Goal cond;
    public final Goal thenGoal;
    public final Goal elseGoal;

    public IfThenElse(GoalInfo info, Goal cond, Goal thenGoal, Goal elseGoal) {
      super(info);
      this.cond = cond;
      this.thenGoal = thenGoal;
      this.elseGoal = elseGoal;
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of(cond, thenGoal, elseGoal);
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {}

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new IfThenElse(info, children.get(0), children.get(1), children.get(2));
    }

    @Override
    public String toString() {
      return "(if " + cond + " then " + thenGoal + " else " + elseGoal + ")";
    }
  }

  /** A scope. */
  public static final class Scope extends Goal {
    public enum Kind {
      /** Only delimits the goal; has no effect on its solutions. */
      EXISTS,
      /** Commits to the first solution of the goal, discarding any others. */
      COMMIT
    }

    public final Kind kind;
    public final Goal goal;

    public Scope(GoalInfo info, Kind kind, Goal goal) {
      super(info);
      this.kind = kind;
      this.goal = goal;
    }

    @Override
    public ImmutableList<Goal> children() {
      return ImmutableList.of(goal);
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {}

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      return new Scope(info, kind, children.get(0));
    }

    @Override
    public String toString() {
      return (kind == Kind.COMMIT ? "commit(" : "some(") + goal + ")";
    }
  }

  /** One arm of a {@link Switch}. */
  public static final class Case {
    /** The constructors that select this arm; never empty. */
    public final ImmutableList<ConsId> consIds;

    public final Goal goal;

    public Case(List<ConsId> consIds, Goal goal) {
      Preconditions.checkArgument(!consIds.isEmpty());
      this.consIds = ImmutableList.copyOf(consIds);
      this.goal = goal;
    }

    @Override
    public String toString() {
      return join(consIds, ", ") + ": " + goal;
    }
  }

  /**
   * A multi-way branch on the outer constructor of a bound variable. The arms' constructors are
   * pairwise distinct.
   *
   * <p>If the set of constructors {@link #var} may have is known ({@link #closed}), {@link
   * #missing} lists the ones that no arm covers; the switch fails if the variable was built with
   * one of them. A switch that is not closed always has an implicit failing default.
   */
  public static final class Switch extends Goal {
    public final Var var;
    public final ImmutableList<Case> cases;
    public final boolean closed;
    public final ImmutableSortedSet<ConsId> missing;

    public Switch(
        GoalInfo info,
        Var var,
        List<Case> cases,
        boolean closed,
        ImmutableSortedSet<ConsId> missing) {
      super(info);
      Preconditions.checkArgument(closed || missing.isEmpty());
      this.var = var;
      this.cases = ImmutableList.copyOf(cases);
      this.closed = closed;
      this.missing = missing;
    }

    /** True if every constructor {@link #var} may have is covered by some arm. */
    public boolean isExhaustive() {
      return closed && missing.isEmpty();
    }

    @Override
    public ImmutableList<Goal> children() {
      return cases.stream().map(c -> c.goal).collect(toImmutableList());
    }

    @Override
    void addOwnVars(ImmutableSortedSet.Builder<Var> builder) {
      builder.add(var);
    }

    @Override
    Goal copy(GoalInfo info, Function<Var, Var> renaming, List<Goal> children) {
      ImmutableList.Builder<Case> newCases = ImmutableList.builder();
      for (int i = 0; i < cases.size(); i++) {
        newCases.add(new Case(cases.get(i).consIds, children.get(i)));
      }
      return new Switch(info, renaming.apply(var), newCases.build(), closed, missing);
    }

    @Override
    public String toString() {
      String body = join(cases, " ; ");
      if (!isExhaustive()) {
        body += closed ? " ; missing " + missing : " ; default: fail";
      }
      return "switch " + var + " (" + body + ")";
    }
  }
}
