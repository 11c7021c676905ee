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
 * The purity of a predicate. Calls to impure predicates have side effects (or observe them), so
 * mode analysis may not move other goals across them; semipure calls only observe side effects,
 * so they may be reordered with pure goals but not with impure ones.
 */
public enum Purity {
  PURE,
  SEMIPURE,
  IMPURE;

  /** Returns the purity of a goal containing goals of this purity and {@code other}. */
  public Purity worst(Purity other) {
    return (ordinal() >= other.ordinal()) ? this : other;
  }
}
