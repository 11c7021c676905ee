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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An Inst (instantiation state) describes what is known about a variable's value at one program
 * point. Insts form a lattice:
 *
 * <ul>
 *   <li>{@link NotReached} is the bottom: the program point can't be reached, so anything is true
 *       of the variable.
 *   <li>{@link Free}: the variable has not yet been given a value.
 *   <li>{@link Bound}: the variable's value is one of a known set of outer constructors, each
 *       with insts for its arguments.
 *   <li>{@link Ground}: the variable has a value with no free parts, but nothing more is known
 *       about it (except, for closures, the modes and determinism it can be called with).
 *   <li>{@link Mixed}: the variable is free on some paths to this point and bound on others. Any
 *       use of such a variable is an error.
 * </ul>
 *
 * <p>Bound and Ground insts also have a {@link Uniqueness}.
 *
 * <p>Insts are immutable and have value equality.
 */
public abstract class Inst {

  /** The coarse classification of an inst. */
  public enum BindingState {
    NOT_REACHED,
    FREE,
    PARTIAL,
    GROUND
  }

  public static final Inst NOT_REACHED = new NotReached();
  public static final Inst FREE = new Free();
  public static final Inst GROUND = new Ground(Uniqueness.SHARED, null);
  public static final Inst UNIQUE = new Ground(Uniqueness.UNIQUE, null);
  public static final Inst CLOBBERED = new Ground(Uniqueness.CLOBBERED, null);

  // Only the nested classes below may extend Inst.
  private Inst() {}

  /** Returns a Bound inst with a single constructor. */
  public static Inst bound(Uniqueness uniqueness, ConsId consId, List<Inst> args) {
    Preconditions.checkArgument(args.size() == consId.arity);
    return new Bound(uniqueness, ImmutableSortedMap.of(consId, ImmutableList.copyOf(args)));
  }

  /** Returns a shared Bound inst for a constant (zero-arity constructor). */
  public static Inst constant(ConsId consId) {
    return bound(Uniqueness.SHARED, consId, ImmutableList.of());
  }

  /** Returns a Ground inst for a closure with the given higher-order information. */
  public static Inst closure(HigherOrder higherOrder) {
    return new Ground(Uniqueness.SHARED, higherOrder);
  }

  /** Returns a Mixed inst whose bound part is {@code inst}, unless it already is one. */
  private static Inst mixed(Inst inst) {
    return (inst instanceof Mixed) ? inst : new Mixed(inst);
  }

  public abstract BindingState bindingState();

  public boolean isReachable() {
    return true;
  }

  public final boolean isFree() {
    return bindingState() == BindingState.FREE;
  }

  public final boolean isGround() {
    return bindingState() == BindingState.GROUND;
  }

  /** Returns true if this inst is Bound or Ground, i.e. the variable definitely has a value. */
  public final boolean isBound() {
    return this instanceof Bound || this instanceof Ground;
  }

  /** Returns this inst's uniqueness; insts without a value are considered unique. */
  public Uniqueness uniqueness() {
    return Uniqueness.UNIQUE;
  }

  /** Returns this inst with its outermost uniqueness replaced. */
  public Inst withUniqueness(Uniqueness uniqueness) {
    return this;
  }

  /**
   * Returns the constructors this inst's value may have, or null if it may have any constructor
   * (or no value at all).
   */
  public @Nullable ImmutableSortedSet<ConsId> functors() {
    return null;
  }

  /**
   * Returns the insts of the arguments of the given constructor, assuming the value was built with
   * it. Only valid for Bound and Ground insts.
   */
  public ImmutableList<Inst> argInsts(ConsId consId) {
    throw new IllegalStateException("No arguments for " + this);
  }

  /**
   * Returns what is known about a value described by this inst after a test that it was built
   * with {@code consId}; if that test can't succeed the result is {@link #NOT_REACHED}.
   */
  public Inst narrow(ConsId consId) {
    ImmutableSortedSet<ConsId> functors = functors();
    if (functors != null && !functors.contains(consId)) {
      return NOT_REACHED;
    }
    return new Bound(uniqueness(), ImmutableSortedMap.of(consId, argInsts(consId)));
  }

  /**
   * Returns the least upper bound of this and {@code other}, i.e. an inst that describes every
   * value described by either. This is used where control flow merges.
   */
  public abstract Inst join(Inst other);

  /**
   * Returns true if every value described by this inst is acceptable where {@code required} is
   * expected (e.g. as the initial inst of a procedure argument).
   */
  public abstract boolean satisfies(Inst required);

  /** The inst of a program point that cannot be reached. */
  public static final class NotReached extends Inst {
    private NotReached() {}

    @Override
    public BindingState bindingState() {
      return BindingState.NOT_REACHED;
    }

    @Override
    public boolean isReachable() {
      return false;
    }

    @Override
    public Inst join(Inst other) {
      return other;
    }

    @Override
    public boolean satisfies(Inst required) {
      return true;
    }

    @Override
    public String toString() {
      return "not_reached";
    }
  }

  /** The inst of a variable that has not been given a value. */
  public static final class Free extends Inst {
    private Free() {}

    @Override
    public BindingState bindingState() {
      return BindingState.FREE;
    }

    @Override
    public Inst join(Inst other) {
      if (other instanceof Free || other instanceof NotReached || other instanceof Mixed) {
        return (other instanceof NotReached) ? this : other;
      }
      return mixed(other);
    }

    @Override
    public boolean satisfies(Inst required) {
      return required instanceof Free;
    }

    @Override
    public String toString() {
      return "free";
    }
  }

  /**
   * A variable that has a value on some paths and is free on others. {@link #boundPart} describes
   * the value on the paths where it has one.
   */
  public static final class Mixed extends Inst {
    public final Inst boundPart;

    Mixed(Inst boundPart) {
      assert boundPart.isBound();
      this.boundPart = boundPart;
    }

    @Override
    public BindingState bindingState() {
      return BindingState.PARTIAL;
    }

    @Override
    public Inst join(Inst other) {
      if (other instanceof Mixed m) {
        return mixed(boundPart.join(m.boundPart));
      } else if (other instanceof Free || other instanceof NotReached) {
        return this;
      }
      return mixed(boundPart.join(other));
    }

    @Override
    public boolean satisfies(Inst required) {
      return equals(required);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Mixed m && m.boundPart.equals(boundPart);
    }

    @Override
    public int hashCode() {
      return boundPart.hashCode() + 1;
    }

    @Override
    public String toString() {
      return "mixed(" + boundPart + ")";
    }
  }

  /** A value with no free parts, of unknown constructor. */
  public static final class Ground extends Inst {
    public final Uniqueness uniqueness;

    /** If non-null, the value is a closure that can be called with these modes. */
    public final @Nullable HigherOrder higherOrder;

    Ground(Uniqueness uniqueness, @Nullable HigherOrder higherOrder) {
      this.uniqueness = uniqueness;
      this.higherOrder = higherOrder;
    }

    @Override
    public BindingState bindingState() {
      return BindingState.GROUND;
    }

    @Override
    public Uniqueness uniqueness() {
      return uniqueness;
    }

    @Override
    public Inst withUniqueness(Uniqueness uniqueness) {
      if (uniqueness == this.uniqueness) {
        return this;
      } else if (higherOrder == null) {
        return switch (uniqueness) {
          case UNIQUE -> UNIQUE;
          case SHARED -> GROUND;
          case CLOBBERED -> CLOBBERED;
        };
      }
      return new Ground(uniqueness, higherOrder);
    }

    @Override
    public ImmutableList<Inst> argInsts(ConsId consId) {
      Inst arg = GROUND.withUniqueness(uniqueness);
      return ImmutableList.copyOf(Collections.nCopies(consId.arity, arg));
    }

    private Inst dropHigherOrder() {
      return (higherOrder == null) ? this : new Ground(uniqueness, null);
    }

    @Override
    public Inst join(Inst other) {
      if (other instanceof Ground g) {
        HigherOrder ho = Objects.equals(higherOrder, g.higherOrder) ? higherOrder : null;
        Uniqueness u = uniqueness.join(g.uniqueness);
        return (ho == null) ? dropHigherOrder().withUniqueness(u) : new Ground(u, ho);
      } else if (other instanceof Bound b) {
        if (b.isGround()) {
          return dropHigherOrder().withUniqueness(uniqueness.join(b.uniqueness));
        }
        return new Mixed(dropHigherOrder());
      }
      // NotReached, Free and Mixed all know how to join with a Ground.
      return other.join(this);
    }

    @Override
    public boolean satisfies(Inst required) {
      if (required instanceof Ground g) {
        return uniqueness.satisfies(g.uniqueness)
            && (g.higherOrder == null || g.higherOrder.equals(higherOrder));
      }
      return false;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Ground g
          && g.uniqueness == uniqueness
          && Objects.equals(g.higherOrder, higherOrder);
    }

    @Override
    public int hashCode() {
      return uniqueness.hashCode() * 31 + Objects.hashCode(higherOrder);
    }

    @Override
    public String toString() {
      String base =
          switch (uniqueness) {
            case UNIQUE -> "unique";
            case SHARED -> "ground";
            case CLOBBERED -> "clobbered";
          };
      return (higherOrder == null) ? base : base + "(" + higherOrder + ")";
    }
  }

  /** A value whose outer constructor is one of a known set. */
  public static final class Bound extends Inst {
    public final Uniqueness uniqueness;

    /** The possible constructors, each with the insts of its arguments. */
    public final ImmutableSortedMap<ConsId, ImmutableList<Inst>> cases;

    Bound(Uniqueness uniqueness, ImmutableSortedMap<ConsId, ImmutableList<Inst>> cases) {
      Preconditions.checkArgument(!cases.isEmpty());
      this.uniqueness = uniqueness;
      this.cases = cases;
    }

    @Override
    public BindingState bindingState() {
      for (ImmutableList<Inst> args : cases.values()) {
        for (Inst arg : args) {
          if (!arg.isGround()) {
            return BindingState.PARTIAL;
          }
        }
      }
      return BindingState.GROUND;
    }

    @Override
    public Uniqueness uniqueness() {
      return uniqueness;
    }

    @Override
    public Inst withUniqueness(Uniqueness uniqueness) {
      return (uniqueness == this.uniqueness) ? this : new Bound(uniqueness, cases);
    }

    @Override
    public ImmutableSortedSet<ConsId> functors() {
      return cases.keySet();
    }

    @Override
    public ImmutableList<Inst> argInsts(ConsId consId) {
      ImmutableList<Inst> args = cases.get(consId);
      Preconditions.checkArgument(
          args != null, "%s is not a possible constructor of %s", consId, this);
      return args;
    }

    @Override
    public Inst join(Inst other) {
      if (other instanceof Bound b) {
        TreeMap<ConsId, ImmutableList<Inst>> joined = new TreeMap<>(cases);
        b.cases.forEach((consId, args) -> joined.merge(consId, args, Bound::joinArgs));
        return new Bound(uniqueness.join(b.uniqueness), ImmutableSortedMap.copyOfSorted(joined));
      }
      // Everything else already knows how to join with a Bound.
      return other.join(this);
    }

    private static ImmutableList<Inst> joinArgs(ImmutableList<Inst> x, ImmutableList<Inst> y) {
      ImmutableList.Builder<Inst> result = ImmutableList.builderWithExpectedSize(x.size());
      for (int i = 0; i < x.size(); i++) {
        result.add(x.get(i).join(y.get(i)));
      }
      return result.build();
    }

    @Override
    public boolean satisfies(Inst required) {
      if (!uniqueness.satisfies(required.uniqueness())) {
        return false;
      } else if (required instanceof Ground g) {
        return g.higherOrder == null && isGround();
      } else if (required instanceof Bound b) {
        for (Map.Entry<ConsId, ImmutableList<Inst>> entry : cases.entrySet()) {
          ImmutableList<Inst> requiredArgs = b.cases.get(entry.getKey());
          if (requiredArgs == null) {
            return false;
          }
          ImmutableList<Inst> args = entry.getValue();
          for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).satisfies(requiredArgs.get(i))) {
              return false;
            }
          }
        }
        return true;
      }
      return false;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Bound b && b.uniqueness == uniqueness && b.cases.equals(cases);
    }

    @Override
    public int hashCode() {
      return uniqueness.hashCode() * 31 + cases.hashCode();
    }

    @Override
    public String toString() {
      String prefix =
          (uniqueness == Uniqueness.SHARED)
              ? "bound("
              : Ascii.toLowerCase(uniqueness.name()) + "_bound(";
      return cases.entrySet().stream()
          .map(
              e ->
                  e.getValue().isEmpty()
                      ? e.getKey().name
                      : e.getKey().name
                          + e.getValue().stream()
                              .map(Inst::toString)
                              .collect(Collectors.joining(", ", "(", ")")))
          .collect(Collectors.joining(" ; ", prefix, ")"));
    }
  }
}
