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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The modes and determinism with which a closure value can be called. */
public final class HigherOrder {
  public final ImmutableList<Mode> argModes;
  public final Determinism determinism;

  public HigherOrder(List<Mode> argModes, Determinism determinism) {
    this.argModes = ImmutableList.copyOf(argModes);
    this.determinism = determinism;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof HigherOrder h
        && h.determinism == determinism
        && h.argModes.equals(argModes);
  }

  @Override
  public int hashCode() {
    return argModes.hashCode() * 31 + determinism.hashCode();
  }

  @Override
  public String toString() {
    return "pred" + argModes + " is " + determinism;
  }
}
