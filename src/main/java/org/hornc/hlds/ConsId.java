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

import com.google.common.base.Preconditions;
import java.util.Comparator;

/**
 * Identifies a data constructor by name and arity, e.g. {@code cons/2} or {@code nil/0}. Two
 * ConsIds are equal if they have the same name and arity; they are ordered by name and then arity
 * so that sorted collections of them print predictably.
 */
public final class ConsId implements Comparable<ConsId> {
  public final String name;
  public final int arity;

  private static final Comparator<ConsId> ORDER =
      Comparator.<ConsId, String>comparing(c -> c.name).thenComparingInt(c -> c.arity);

  public ConsId(String name, int arity) {
    Preconditions.checkArgument(arity >= 0);
    this.name = Preconditions.checkNotNull(name);
    this.arity = arity;
  }

  /** A convenience for {@code new ConsId(name, arity)}. */
  public static ConsId of(String name, int arity) {
    return new ConsId(name, arity);
  }

  @Override
  public int compareTo(ConsId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ConsId c && c.arity == arity && c.name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + arity;
  }

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
