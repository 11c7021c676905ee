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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.hornc.hlds.ConsId;

/** A test that can be made by a {@link Instr.GotoIf}. Evaluating a Cond has no side effects. */
public abstract class Cond {

  /** True if the most recently called semidet procedure succeeded. */
  public static final Cond SUCCEEDED =
      new Cond() {
        @Override
        public void forEachLval(Consumer<Lval> visitor) {}

        @Override
        public Cond mapLvals(UnaryOperator<Lval> fn) {
          return this;
        }

        @Override
        public String toString() {
          return "succeeded";
        }
      };

  // Only SUCCEEDED and the nested classes below may extend Cond.
  private Cond() {}

  /** Calls {@code visitor} with each Lval that is read to evaluate this Cond. */
  public abstract void forEachLval(Consumer<Lval> visitor);

  /** Returns a copy of this Cond with each Lval {@code x} replaced by {@code fn.apply(x)}. */
  public abstract Cond mapLvals(UnaryOperator<Lval> fn);

  /** Returns a Cond that is true iff this one is false. */
  public Cond negate() {
    return new Not(this);
  }

  public static Cond hasFunctor(Rval value, Collection<ConsId> functors) {
    return new HasFunctor(value, ImmutableSortedSet.copyOf(functors));
  }

  public static Cond equal(Rval x, Rval y) {
    return new Equal(x, y);
  }

  /** True if {@code value} is a term whose functor is one of {@code functors}. */
  public static final class HasFunctor extends Cond {
    public final Rval value;
    public final ImmutableSortedSet<ConsId> functors;

    private HasFunctor(Rval value, ImmutableSortedSet<ConsId> functors) {
      this.value = value;
      this.functors = functors;
    }

    @Override
    public void forEachLval(Consumer<Lval> visitor) {
      value.forEachLval(visitor);
    }

    @Override
    public Cond mapLvals(UnaryOperator<Lval> fn) {
      return new HasFunctor(value.mapLvals(fn), functors);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof HasFunctor h && h.value.equals(value) && h.functors.equals(functors);
    }

    @Override
    public int hashCode() {
      return value.hashCode() + functors.hashCode();
    }

    @Override
    public String toString() {
      String names = (functors.size() == 1) ? functors.first().toString() : functors.toString();
      return "tag(" + value + ") == " + names;
    }
  }

  /** True if {@code x} and {@code y} are structurally equal. */
  public static final class Equal extends Cond {
    public final Rval x;
    public final Rval y;

    private Equal(Rval x, Rval y) {
      this.x = x;
      this.y = y;
    }

    @Override
    public void forEachLval(Consumer<Lval> visitor) {
      x.forEachLval(visitor);
      y.forEachLval(visitor);
    }

    @Override
    public Cond mapLvals(UnaryOperator<Lval> fn) {
      return new Equal(x.mapLvals(fn), y.mapLvals(fn));
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Equal e && e.x.equals(x) && e.y.equals(y);
    }

    @Override
    public int hashCode() {
      return x.hashCode() * 31 + y.hashCode();
    }

    @Override
    public String toString() {
      return x + " == " + y;
    }
  }

  /** The negation of another Cond. */
  public static final class Not extends Cond {
    public final Cond cond;

    private Not(Cond cond) {
      this.cond = cond;
    }

    @Override
    public Cond negate() {
      return cond;
    }

    @Override
    public void forEachLval(Consumer<Lval> visitor) {
      cond.forEachLval(visitor);
    }

    @Override
    public Cond mapLvals(UnaryOperator<Lval> fn) {
      return new Not(cond.mapLvals(fn));
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Not not && not.cond.equals(cond);
    }

    @Override
    public int hashCode() {
      return ~cond.hashCode();
    }

    @Override
    public String toString() {
      return "!(" + cond + ")";
    }
  }
}
