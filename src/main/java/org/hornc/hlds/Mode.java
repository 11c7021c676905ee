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

/**
 * A mode describes the insts of one procedure argument before and after a call to the procedure.
 * Output arguments are free before the call.
 */
public final class Mode {
  public static final Mode IN = new Mode(Inst.GROUND, Inst.GROUND);
  public static final Mode OUT = new Mode(Inst.FREE, Inst.GROUND);

  /** Destructive input: the argument must be unique, and is dead after the call. */
  public static final Mode DI = new Mode(Inst.UNIQUE, Inst.CLOBBERED);

  /** Unique output. */
  public static final Mode UO = new Mode(Inst.FREE, Inst.UNIQUE);

  /** Unique input that remains unique after the call. */
  public static final Mode UI = new Mode(Inst.UNIQUE, Inst.UNIQUE);

  public final Inst before;
  public final Inst after;

  public Mode(Inst before, Inst after) {
    this.before = before;
    this.after = after;
  }

  /** True if the argument is bound by the procedure. */
  public boolean isOutput() {
    return before.isFree() && !after.isFree();
  }

  /** True if the argument must be bound by the caller. */
  public boolean isInput() {
    return !before.isFree();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Mode m && m.before.equals(before) && m.after.equals(after);
  }

  @Override
  public int hashCode() {
    return before.hashCode() * 31 + after.hashCode();
  }

  @Override
  public String toString() {
    if (equals(IN)) {
      return "in";
    } else if (equals(OUT)) {
      return "out";
    } else if (equals(DI)) {
      return "di";
    } else if (equals(UO)) {
      return "uo";
    } else if (equals(UI)) {
      return "ui";
    }
    return before + " >> " + after;
  }
}
