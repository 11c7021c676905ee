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

import org.jspecify.annotations.Nullable;

/**
 * A program variable. Variable ids are unique within a procedure body (the front end renames
 * apart any shadowed names before we see the tree), so equality is just id equality.
 *
 * <p>Variables are created by a {@link VarSet}; the inliner uses one to create fresh copies of a
 * callee's local variables, so a Var's name need not be unique.
 */
public final class Var implements Comparable<Var> {
  public final int id;
  public final String name;

  /** The variable's type if it is a known discriminated union, otherwise null. */
  public final @Nullable TypeDefn type;

  Var(int id, String name, @Nullable TypeDefn type) {
    this.id = id;
    this.name = name;
    this.type = type;
  }

  @Override
  public int compareTo(Var other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Var v && v.id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return name;
  }
}
