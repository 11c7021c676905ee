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
 * Allocates variables with distinct ids. A VarSet is not thread-safe; each procedure (or each
 * code generation task) should use its own.
 */
public class VarSet {
  private int nextId;

  public VarSet() {
    this(0);
  }

  /** Creates a VarSet whose first variable will have the given id. */
  public VarSet(int firstId) {
    this.nextId = firstId;
  }

  /** Returns a VarSet whose ids will not collide with any of the given variables. */
  public static VarSet after(Iterable<Var> vars) {
    int max = -1;
    for (Var v : vars) {
      max = Math.max(max, v.id);
    }
    return new VarSet(max + 1);
  }

  public Var newVar(String name) {
    return newVar(name, null);
  }

  public Var newVar(String name, @Nullable TypeDefn type) {
    return new Var(nextId++, name, type);
  }

  /** Returns a new variable with the same name and type as {@code v} but a fresh id. */
  public Var copyOf(Var v) {
    return new Var(nextId++, v.name, v.type);
  }

  /** Returns the id that the next variable will be given. */
  public int nextId() {
    return nextId;
  }
}
