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
 * Whether other references to a value may exist. A unique value may be destructively updated by
 * its consumer; after such an update the variable that held it is clobbered and must not be read
 * again.
 *
 * <p>The values are ordered from most to least permissive; joining two uniquenesses takes the
 * later one.
 */
public enum Uniqueness {
  UNIQUE,
  SHARED,
  CLOBBERED;

  public Uniqueness join(Uniqueness other) {
    return (ordinal() >= other.ordinal()) ? this : other;
  }

  /**
   * Returns true if a value with this uniqueness may be passed where {@code required} is expected.
   * Clobbered values can only be passed where a clobbered value is acceptable, and only unique
   * values can be passed where uniqueness is required.
   */
  public boolean satisfies(Uniqueness required) {
    return switch (required) {
      case UNIQUE -> this == UNIQUE;
      case SHARED -> this != CLOBBERED;
      case CLOBBERED -> true;
    };
  }
}
