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
import org.hornc.hlds.Var;

/**
 * A location that instructions can store into.
 *
 * <ul>
 *   <li>{@link Reg}: one of the general registers, which are used to pass arguments and results
 *       and are not preserved by calls or by backtracking
 *   <li>{@link Local}: the storage for a variable ({@link OfVar}) or a compiler temporary ({@link
 *       Temp}); these only appear until slot assignment replaces them
 *   <li>{@link Slot}: an entry in the current procedure's stack frame
 * </ul>
 */
public abstract class Lval extends Rval {

  // Only the nested classes below may extend Lval.
  private Lval() {}

  @Override
  public final void forEachLval(Consumer<Lval> visitor) {
    visitor.accept(this);
  }

  @Override
  public final Rval mapLvals(UnaryOperator<Lval> fn) {
    return fn.apply(this);
  }

  /** A general register; numbered from 1. */
  public static final class Reg extends Lval {
    public final int number;

    public Reg(int number) {
      this.number = number;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Reg reg && reg.number == number;
    }

    @Override
    public int hashCode() {
      return number;
    }

    @Override
    public String toString() {
      return "r" + number;
    }
  }

  /** Storage that has not yet been assigned a slot. */
  public abstract static class Local extends Lval {
    private Local() {}
  }

  /** The storage for a variable of the procedure body. */
  public static final class OfVar extends Local {
    public final Var var;

    public OfVar(Var var) {
      this.var = var;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OfVar ofVar && ofVar.var.equals(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** A temporary introduced by the code generator, e.g. to save the height of the choice stack. */
  public static final class Temp extends Local {
    public final int id;

    public Temp(int id) {
      this.id = id;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Temp temp && temp.id == id;
    }

    @Override
    public int hashCode() {
      return ~id;
    }

    @Override
    public String toString() {
      return "t" + id;
    }
  }

  /**
   * A slot in the current stack frame. {@link #owner} identifies the Local (or, if several were
   * given the same slot because they always hold the same value, the first of them) that this
   * Slot replaced; it has no effect on execution.
   */
  public static final class Slot extends Lval {
    public final int index;
    public final Local owner;

    public Slot(int index, Local owner) {
      this.index = index;
      this.owner = owner;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Slot slot && slot.index == index && slot.owner.equals(owner);
    }

    @Override
    public int hashCode() {
      return index * 31 + owner.hashCode();
    }

    @Override
    public String toString() {
      return "s" + index + "(" + owner + ")";
    }
  }
}
