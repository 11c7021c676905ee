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

/** Identifies a predicate by name and arity. */
public final class PredId implements Comparable<PredId> {
  public final String name;
  public final int arity;

  private static final Comparator<PredId> ORDER =
      Comparator.<PredId, String>comparing(p -> p.name).thenComparingInt(p -> p.arity);

  public PredId(String name, int arity) {
    Preconditions.checkArgument(arity >= 0);
    this.name = name;
    this.arity = arity;
  }

  public static PredId of(String name, int arity) {
    return new PredId(name, arity);
  }

  @Override
  public int compareTo(PredId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PredId p && p.arity == arity && p.name.equals(name);
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
