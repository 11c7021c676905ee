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

import java.util.Comparator;

/**
 * Identifies one procedure (i.e. one mode) of a predicate. Modes are numbered from zero in the
 * order they were declared.
 */
public final class ProcId implements Comparable<ProcId> {
  public final PredId pred;
  public final int modeNum;

  private static final Comparator<ProcId> ORDER =
      Comparator.<ProcId, PredId>comparing(p -> p.pred).thenComparingInt(p -> p.modeNum);

  public ProcId(PredId pred, int modeNum) {
    this.pred = pred;
    this.modeNum = modeNum;
  }

  @Override
  public int compareTo(ProcId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ProcId p && p.modeNum == modeNum && p.pred.equals(pred);
  }

  @Override
  public int hashCode() {
    return pred.hashCode() * 31 + modeNum;
  }

  @Override
  public String toString() {
    return pred + "-" + modeNum;
  }
}
