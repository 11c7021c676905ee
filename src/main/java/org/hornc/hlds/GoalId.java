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
 * Identifies a goal within a procedure body. GoalIds are assigned by the {@link GoalBuilder} and
 * carried unchanged through every rewrite, so a diagnostic or an instruction can refer back to
 * the source goal it came from.
 */
public final class GoalId implements Comparable<GoalId> {
  public final int id;

  public GoalId(int id) {
    this.id = id;
  }

  @Override
  public int compareTo(GoalId other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof GoalId g && g.id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "g" + id;
  }
}
