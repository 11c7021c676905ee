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

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A value that an instruction reads: either the contents of an {@link Lval}, or a field of a
 * constructed term.
 */
public abstract class Rval {

  // Only Lval and the nested classes below may extend Rval.
  Rval() {}

  /** Calls {@code visitor} with each Lval that is read to evaluate this Rval. */
  public abstract void forEachLval(Consumer<Lval> visitor);

  /** Returns a copy of this Rval with each Lval {@code x} replaced by {@code fn.apply(x)}. */
  public abstract Rval mapLvals(UnaryOperator<Lval> fn);

  /** The {@code index}th argument (zero-based) of the term that {@code base} evaluates to. */
  public static final class Field extends Rval {
    public final Rval base;
    public final int index;

    public Field(Rval base, int index) {
      this.base = base;
      this.index = index;
    }

    @Override
    public void forEachLval(Consumer<Lval> visitor) {
      base.forEachLval(visitor);
    }

    @Override
    public Rval mapLvals(UnaryOperator<Lval> fn) {
      Rval newBase = base.mapLvals(fn);
      return (newBase == base) ? this : new Field(newBase, index);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Field field && field.index == index && field.base.equals(base);
    }

    @Override
    public int hashCode() {
      return base.hashCode() * 31 + index;
    }

    @Override
    public String toString() {
      return base + "[" + index + "]";
    }
  }
}
