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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.hornc.hlds.CodeModel;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.GoalId;
import org.hornc.hlds.ProcId;
import org.hornc.hlds.Var;
import org.jspecify.annotations.Nullable;

/**
 * One instruction of the low-level code for a procedure.
 *
 * <p>The machine these instructions run on has
 *
 * <ul>
 *   <li>general registers (r1, r2, ...), used to pass arguments to and results from procedures;
 *       a call may change any of them;
 *   <li>a stack of frames, each with a fixed number of slots, one per procedure activation;
 *   <li>a success flag, set by semidet procedures before they return;
 *   <li>a stack of return addresses; and
 *   <li>a stack of choice points, each a resume label plus a snapshot of the frame and return
 *       stacks taken when it was pushed. {@link Fail} restores the snapshot of the topmost choice
 *       point and jumps to its resume label, leaving the choice point in place; the code at the
 *       resume label either updates it ({@link SetResume}) or removes it ({@link PopChoice}).
 * </ul>
 *
 * <p>The i-th argument of a procedure is passed in register ri, both for inputs (on entry) and
 * outputs (on return).
 *
 * <p>Each instruction records the goal it was generated for, if any. Two instructions are equal if
 * they do the same thing, regardless of where they came from.
 */
public abstract class Instr {
  /** The goal this instruction was generated for; null for procedure entry and exit code. */
  public final @Nullable GoalId origin;

  // Only the nested classes below may extend Instr.
  private Instr(@Nullable GoalId origin) {
    this.origin = origin;
  }

  /** Calls {@code visitor} with each Lval read by this instruction. */
  public void forEachUse(Consumer<Lval> visitor) {}

  /** Calls {@code visitor} with each Lval written by this instruction. */
  public void forEachDef(Consumer<Lval> visitor) {}

  /** Returns a copy of this instruction with each Lval {@code x} replaced by {@code fn(x)}. */
  public Instr mapLvals(UnaryOperator<Lval> fn) {
    return this;
  }

  /** Returns each label this instruction refers to (but not the label a {@link Define} defines). */
  public ImmutableList<Label> labels() {
    return ImmutableList.of();
  }

  /**
   * Returns the labels at which execution may continue after this instruction, other than the
   * next instruction. For a {@link PushChoice} that includes each of the choice point's resume
   * labels, since backtracking to them restores the state as it was when the choice point was
   * pushed.
   */
  public ImmutableList<Label> successors() {
    return labels();
  }

  /** Returns a copy of this instruction with each label {@code x} replaced by {@code fn(x)}. */
  public Instr retarget(UnaryOperator<Label> fn) {
    return this;
  }

  /** False if execution never continues with the next instruction. */
  public boolean fallsThrough() {
    return true;
  }

  /** The values that determine whether two instructions of the same class are equal. */
  abstract List<?> key();

  @Override
  public final boolean equals(Object other) {
    return other instanceof Instr instr
        && instr.getClass() == getClass()
        && instr.key().equals(key());
  }

  @Override
  public final int hashCode() {
    return getClass().hashCode() * 31 + key().hashCode();
  }

  private static String join(List<?> items) {
    return items.stream().map(Object::toString).collect(Collectors.joining(", "));
  }

  private static ImmutableList<Rval> mapAll(List<Rval> rvals, UnaryOperator<Lval> fn) {
    return rvals.stream().map(r -> r.mapLvals(fn)).collect(toImmutableList());
  }

  /** Marks the position of a label. */
  public static final class Define extends Instr {
    public final Label label;

    public Define(@Nullable GoalId origin, Label label) {
      super(origin);
      this.label = label;
    }

    @Override
    List<?> key() {
      return List.of(label);
    }

    @Override
    public String toString() {
      return label + ":";
    }
  }

  /** Has no effect. */
  public static final class Comment extends Instr {
    public final String text;

    public Comment(@Nullable GoalId origin, String text) {
      super(origin);
      this.text = text;
    }

    @Override
    List<?> key() {
      return List.of(text);
    }

    @Override
    public String toString() {
      return "% " + text;
    }
  }

  /** Pushes a new frame with the given number of slots. */
  public static final class AllocFrame extends Instr {
    public final int size;

    public AllocFrame(@Nullable GoalId origin, int size) {
      super(origin);
      this.size = size;
    }

    @Override
    List<?> key() {
      return List.of(size);
    }

    @Override
    public String toString() {
      return "alloc_frame " + size;
    }
  }

  /** Pops the current frame. */
  public static final class FreeFrame extends Instr {
    public FreeFrame(@Nullable GoalId origin) {
      super(origin);
    }

    @Override
    List<?> key() {
      return List.of();
    }

    @Override
    public String toString() {
      return "free_frame";
    }
  }

  /** {@code dst := src}. */
  public static final class Assign extends Instr {
    public final Lval dst;
    public final Rval src;

    public Assign(@Nullable GoalId origin, Lval dst, Rval src) {
      super(origin);
      this.dst = dst;
      this.src = src;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      src.forEachLval(visitor);
    }

    @Override
    public void forEachDef(Consumer<Lval> visitor) {
      visitor.accept(dst);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new Assign(origin, fn.apply(dst), src.mapLvals(fn));
    }

    @Override
    List<?> key() {
      return List.of(dst, src);
    }

    @Override
    public String toString() {
      return dst + " := " + src;
    }
  }

  /**
   * {@code dst := functor(args)}, or, if {@link #closureProc} is non-null, {@code dst :=} a closure
   * of that procedure with {@code args} as its first arguments.
   */
  public static final class Construct extends Instr {
    public final Lval dst;
    public final @Nullable ConsId functor;
    public final @Nullable ProcId closureProc;
    public final ImmutableList<Rval> args;

    public Construct(
        @Nullable GoalId origin,
        Lval dst,
        @Nullable ConsId functor,
        @Nullable ProcId closureProc,
        List<Rval> args) {
      super(origin);
      assert (functor == null) != (closureProc == null);
      this.dst = dst;
      this.functor = functor;
      this.closureProc = closureProc;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      args.forEach(arg -> arg.forEachLval(visitor));
    }

    @Override
    public void forEachDef(Consumer<Lval> visitor) {
      visitor.accept(dst);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new Construct(origin, fn.apply(dst), functor, closureProc, mapAll(args, fn));
    }

    @Override
    List<?> key() {
      return Arrays.asList(dst, functor, closureProc, args);
    }

    @Override
    public String toString() {
      if (closureProc != null) {
        return dst + " := closure(" + closureProc + (args.isEmpty() ? "" : ", " + join(args)) + ")";
      }
      return dst + " := " + functor.name + (args.isEmpty() ? "" : "(" + join(args) + ")");
    }
  }

  /** Jumps to {@link #target} if {@link #cond} is true. */
  public static final class GotoIf extends Instr {
    public final Cond cond;
    public final Label target;

    public GotoIf(@Nullable GoalId origin, Cond cond, Label target) {
      super(origin);
      this.cond = cond;
      this.target = target;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      cond.forEachLval(visitor);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new GotoIf(origin, cond.mapLvals(fn), target);
    }

    @Override
    public ImmutableList<Label> labels() {
      return ImmutableList.of(target);
    }

    @Override
    public Instr retarget(UnaryOperator<Label> fn) {
      return new GotoIf(origin, cond, fn.apply(target));
    }

    @Override
    List<?> key() {
      return List.of(cond, target);
    }

    @Override
    public String toString() {
      return "if " + cond + " goto " + target;
    }
  }

  /** Jumps to {@link #target}. */
  public static final class Goto extends Instr {
    public final Label target;

    public Goto(@Nullable GoalId origin, Label target) {
      super(origin);
      this.target = target;
    }

    @Override
    public ImmutableList<Label> labels() {
      return ImmutableList.of(target);
    }

    @Override
    public Instr retarget(UnaryOperator<Label> fn) {
      return new Goto(origin, fn.apply(target));
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    List<?> key() {
      return List.of(target);
    }

    @Override
    public String toString() {
      return "goto " + target;
    }
  }

  /**
   * Jumps to the label for the functor of the term that {@link #value} evaluates to, or to {@link
   * #otherwise} if there is no entry for it.
   */
  public static final class ComputedGoto extends Instr {
    public final Rval value;
    public final ImmutableSortedMap<ConsId, Label> targets;
    public final Label otherwise;

    public ComputedGoto(
        @Nullable GoalId origin,
        Rval value,
        ImmutableSortedMap<ConsId, Label> targets,
        Label otherwise) {
      super(origin);
      this.value = value;
      this.targets = targets;
      this.otherwise = otherwise;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      value.forEachLval(visitor);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new ComputedGoto(origin, value.mapLvals(fn), targets, otherwise);
    }

    @Override
    public ImmutableList<Label> labels() {
      return ImmutableList.<Label>builder().addAll(targets.values()).add(otherwise).build();
    }

    @Override
    public Instr retarget(UnaryOperator<Label> fn) {
      ImmutableSortedMap.Builder<ConsId, Label> newTargets = ImmutableSortedMap.naturalOrder();
      targets.forEach((consId, label) -> newTargets.put(consId, fn.apply(label)));
      return new ComputedGoto(origin, value, newTargets.build(), fn.apply(otherwise));
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    List<?> key() {
      return List.of(value, targets, otherwise);
    }

    @Override
    public String toString() {
      String cases =
          targets.entrySet().stream()
              .map(e -> e.getKey() + ": " + e.getValue())
              .collect(Collectors.joining(", "));
      return "computed_goto tag(" + value + ") [" + cases + "] else " + otherwise;
    }
  }

  /**
   * Calls a procedure, with its inputs in registers. A det or semidet procedure returns once
   * (semidet procedures set the success flag). A nondet procedure returns once for its first
   * solution, leaving choice points that will return again for each subsequent solution when
   * backtracked into; if it has no (more) solutions it fails instead of returning.
   */
  public static final class Call extends Instr {
    public final ProcId proc;
    public final CodeModel model;

    public Call(@Nullable GoalId origin, ProcId proc, CodeModel model) {
      super(origin);
      this.proc = proc;
      this.model = model;
    }

    @Override
    List<?> key() {
      return List.of(proc, model);
    }

    @Override
    public String toString() {
      return "call " + proc + " (" + Ascii.toLowerCase(model.name()) + ")";
    }
  }

  /**
   * Calls the closure that {@link #closure} evaluates to, with {@link #arity} arguments in r1 to
   * r{arity}. The arguments the closure captured are passed ahead of them, and the results are
   * returned in the same registers as if the closure had been a procedure of {@link #arity}
   * arguments.
   */
  public static final class CallClosure extends Instr {
    public final Rval closure;
    public final int arity;
    public final CodeModel model;

    public CallClosure(@Nullable GoalId origin, Rval closure, int arity, CodeModel model) {
      super(origin);
      this.closure = closure;
      this.arity = arity;
      this.model = model;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      closure.forEachLval(visitor);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new CallClosure(origin, closure.mapLvals(fn), arity, model);
    }

    @Override
    List<?> key() {
      return List.of(closure, arity, model);
    }

    @Override
    public String toString() {
      return "call_closure " + closure + "/" + arity + " (" + Ascii.toLowerCase(model.name()) + ")";
    }
  }

  /**
   * Calls foreign code with the given inputs, storing its results in {@link #outputs}. If the
   * code model is SEMI, sets the success flag; the outputs are only stored if it succeeds.
   */
  public static final class ForeignCall extends Instr {
    public final String name;
    public final ImmutableList<Rval> inputs;
    public final ImmutableList<Lval> outputs;
    public final CodeModel model;

    public ForeignCall(
        @Nullable GoalId origin,
        String name,
        List<Rval> inputs,
        List<Lval> outputs,
        CodeModel model) {
      super(origin);
      assert model != CodeModel.NON;
      this.name = name;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      this.model = model;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      inputs.forEach(input -> input.forEachLval(visitor));
    }

    @Override
    public void forEachDef(Consumer<Lval> visitor) {
      outputs.forEach(visitor);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new ForeignCall(
          origin,
          name,
          mapAll(inputs, fn),
          outputs.stream().map(fn).collect(toImmutableList()),
          model);
    }

    @Override
    List<?> key() {
      return List.of(name, inputs, outputs, model);
    }

    @Override
    public String toString() {
      return "(" + join(outputs) + ") := foreign " + name + "(" + join(inputs) + ")";
    }
  }

  /** Returns to the address on top of the return stack. */
  public static final class Return extends Instr {
    public Return(@Nullable GoalId origin) {
      super(origin);
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    List<?> key() {
      return List.of();
    }

    @Override
    public String toString() {
      return "return";
    }
  }

  /** Sets the success flag. */
  public static final class SetSuccess extends Instr {
    public final boolean success;

    public SetSuccess(@Nullable GoalId origin, boolean success) {
      super(origin);
      this.success = success;
    }

    @Override
    List<?> key() {
      return List.of(success);
    }

    @Override
    public String toString() {
      return "succeeded := " + success;
    }
  }

  /**
   * Pushes a choice point that will resume at {@link #resume}. {@link #laterResumes} lists the
   * labels that subsequent {@link SetResume} instructions will install in the same choice point.
   * {@link #live} is the set of variables whose values are needed if the choice point is resumed.
   */
  public static final class PushChoice extends Instr {
    public final Label resume;
    public final ImmutableList<Label> laterResumes;
    public final ImmutableSortedSet<Var> live;

    public PushChoice(
        @Nullable GoalId origin,
        Label resume,
        List<Label> laterResumes,
        ImmutableSortedSet<Var> live) {
      super(origin);
      this.resume = resume;
      this.laterResumes = ImmutableList.copyOf(laterResumes);
      this.live = live;
    }

    @Override
    public ImmutableList<Label> labels() {
      return ImmutableList.<Label>builder().add(resume).addAll(laterResumes).build();
    }

    @Override
    public Instr retarget(UnaryOperator<Label> fn) {
      return new PushChoice(
          origin, fn.apply(resume), laterResumes.stream().map(fn).collect(toImmutableList()), live);
    }

    @Override
    List<?> key() {
      return List.of(resume, laterResumes, live);
    }

    @Override
    public String toString() {
      return "push_choice " + resume + " live " + live;
    }
  }

  /** Changes the resume label of the topmost choice point. */
  public static final class SetResume extends Instr {
    public final Label resume;
    public final ImmutableSortedSet<Var> live;

    public SetResume(@Nullable GoalId origin, Label resume, ImmutableSortedSet<Var> live) {
      super(origin);
      this.resume = resume;
      this.live = live;
    }

    @Override
    public ImmutableList<Label> labels() {
      return ImmutableList.of(resume);
    }

    @Override
    public ImmutableList<Label> successors() {
      // Reaching the resume label restores the state from when the choice point was pushed, so
      // for liveness that's where the edge comes from.
      return ImmutableList.of();
    }

    @Override
    public Instr retarget(UnaryOperator<Label> fn) {
      return new SetResume(origin, fn.apply(resume), live);
    }

    @Override
    List<?> key() {
      return List.of(resume, live);
    }

    @Override
    public String toString() {
      return "set_resume " + resume + " live " + live;
    }
  }

  /** Removes the topmost choice point. */
  public static final class PopChoice extends Instr {
    public PopChoice(@Nullable GoalId origin) {
      super(origin);
    }

    @Override
    List<?> key() {
      return List.of();
    }

    @Override
    public String toString() {
      return "pop_choice";
    }
  }

  /** Backtracks to the topmost choice point. */
  public static final class Fail extends Instr {
    public Fail(@Nullable GoalId origin) {
      super(origin);
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    List<?> key() {
      return List.of();
    }

    @Override
    public String toString() {
      return "fail";
    }
  }

  /** Stores the current number of choice points in {@link #dst}. */
  public static final class SaveChoiceHeight extends Instr {
    public final Lval dst;

    public SaveChoiceHeight(@Nullable GoalId origin, Lval dst) {
      super(origin);
      this.dst = dst;
    }

    @Override
    public void forEachDef(Consumer<Lval> visitor) {
      visitor.accept(dst);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new SaveChoiceHeight(origin, fn.apply(dst));
    }

    @Override
    List<?> key() {
      return List.of(dst);
    }

    @Override
    public String toString() {
      return dst + " := choice_height";
    }
  }

  /** Discards choice points until there are no more than {@link #height}. */
  public static final class CutTo extends Instr {
    public final Rval height;

    public CutTo(@Nullable GoalId origin, Rval height) {
      super(origin);
      this.height = height;
    }

    @Override
    public void forEachUse(Consumer<Lval> visitor) {
      height.forEachLval(visitor);
    }

    @Override
    public Instr mapLvals(UnaryOperator<Lval> fn) {
      return new CutTo(origin, height.mapLvals(fn));
    }

    @Override
    List<?> key() {
      return List.of(height);
    }

    @Override
    public String toString() {
      return "cut_to " + height;
    }
  }

  /** Stops execution; reaching one means a goal did something its determinism rules out. */
  public static final class Abort extends Instr {
    public final String message;

    public Abort(@Nullable GoalId origin, String message) {
      super(origin);
      this.message = message;
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    List<?> key() {
      return List.of(message);
    }

    @Override
    public String toString() {
      return "abort \"" + message + "\"";
    }
  }
}
