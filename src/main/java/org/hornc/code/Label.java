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

/**
 * A point in a procedure's instruction sequence that can be the target of a jump or the resume
 * point of a choice point. Labels are numbered sequentially within a procedure and are defined by
 * an {@link Instr.Define} instruction.
 */
public final class Label implements Comparable<Label> {
  public final int id;

  public Label(int id) {
    this.id = id;
  }

  @Override
  public int compareTo(Label other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Label label && label.id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "L" + id;
  }
}
