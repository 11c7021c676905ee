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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * A discriminated union type with a closed, finite set of constructors. Variables whose type is
 * known let the switch detector decide whether a set of constructor tests is exhaustive.
 */
public final class TypeDefn {
  public final String name;

  /** The constructors, in declaration order. */
  public final ImmutableList<ConsId> constructors;

  public TypeDefn(String name, ConsId... constructors) {
    this.name = name;
    this.constructors = ImmutableList.copyOf(constructors);
    Preconditions.checkArgument(
        ImmutableSortedSet.copyOf(this.constructors).size() == this.constructors.size(),
        "Duplicate constructor in %s",
        name);
  }

  /** Returns the constructors as a sorted set. */
  public ImmutableSortedSet<ConsId> constructorSet() {
    return ImmutableSortedSet.copyOf(constructors);
  }

  /** Returns true if the given constructor belongs to this type. */
  public boolean hasConstructor(ConsId consId) {
    return constructors.contains(consId);
  }

  @Override
  public String toString() {
    return name;
  }
}
