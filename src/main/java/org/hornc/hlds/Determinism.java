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

import com.google.common.base.Ascii;

/**
 * The number of solutions a goal can produce. Each determinism is a pair of components: whether
 * the goal can fail, and the maximum number of solutions it can produce.
 *
 * <p>Determinisms are partially ordered by {@link #isAtLeastAsTightAs}: {@code d1} is at least as
 * tight as {@code d2} if {@code d1} can fail only if {@code d2} can, and {@code d1}'s maximum
 * number of solutions is no larger than {@code d2}'s. A declared determinism is an upper bound on
 * the inferred one.
 */
public enum Determinism {
  DET(false, MaxSolutions.ONE),
  SEMIDET(true, MaxSolutions.ONE),
  MULTI(false, MaxSolutions.MANY),
  NONDET(true, MaxSolutions.MANY),
  CC_MULTI(false, MaxSolutions.MANY_CC),
  CC_NONDET(true, MaxSolutions.MANY_CC),
  ERRONEOUS(false, MaxSolutions.ZERO),
  FAILURE(true, MaxSolutions.ZERO);

  /**
   * The maximum number of solutions of a goal. The order of these values matters: each allows
   * everything the previous one does.
   *
   * <p>{@code MANY_CC} means "more than one, but only the first will ever be used", i.e. the goal
   * is in a committed-choice context.
   */
  public enum MaxSolutions {
    ZERO,
    ONE,
    MANY_CC,
    MANY;

    boolean atMost(MaxSolutions other) {
      return ordinal() <= other.ordinal();
    }

    static MaxSolutions max(MaxSolutions x, MaxSolutions y) {
      return x.ordinal() >= y.ordinal() ? x : y;
    }
  }

  public final boolean canFail;
  public final MaxSolutions maxSolutions;

  Determinism(boolean canFail, MaxSolutions maxSolutions) {
    this.canFail = canFail;
    this.maxSolutions = maxSolutions;
  }

  /** Returns the determinism with the given components. */
  public static Determinism of(boolean canFail, MaxSolutions maxSolutions) {
    return switch (maxSolutions) {
      case ZERO -> canFail ? FAILURE : ERRONEOUS;
      case ONE -> canFail ? SEMIDET : DET;
      case MANY_CC -> canFail ? CC_NONDET : CC_MULTI;
      case MANY -> canFail ? NONDET : MULTI;
    };
  }

  /** Returns true if this determinism is at least as tight as (i.e. no looser than) {@code d}. */
  public boolean isAtLeastAsTightAs(Determinism d) {
    return (d.canFail || !canFail) && maxSolutions.atMost(d.maxSolutions);
  }

  /** True if a goal with this determinism can succeed at all. */
  public boolean canSucceed() {
    return maxSolutions != MaxSolutions.ZERO;
  }

  /** True if a goal with this determinism can produce more than one solution. */
  public boolean canSucceedMoreThanOnce() {
    return maxSolutions == MaxSolutions.MANY || maxSolutions == MaxSolutions.MANY_CC;
  }

  /** Returns the code model that code for a goal of this determinism must follow. */
  public CodeModel codeModel() {
    if (maxSolutions == MaxSolutions.MANY) {
      return CodeModel.NON;
    }
    return canFail ? CodeModel.SEMI : CodeModel.DET;
  }

  /**
   * Returns the determinism of {@code (this, tail)}. If this goal cannot succeed the tail is
   * unreachable, and the conjunction has this goal's determinism.
   */
  public Determinism conjunction(Determinism tail) {
    if (maxSolutions == MaxSolutions.ZERO) {
      return this;
    }
    return of(canFail || tail.canFail, conjunctionMax(maxSolutions, tail.maxSolutions));
  }

  private static MaxSolutions conjunctionMax(MaxSolutions head, MaxSolutions tail) {
    if (head == MaxSolutions.ZERO || tail == MaxSolutions.ZERO) {
      return MaxSolutions.ZERO;
    } else if (head == MaxSolutions.ONE) {
      return tail;
    } else if (head == MaxSolutions.MANY || tail == MaxSolutions.MANY) {
      return MaxSolutions.MANY;
    } else {
      return MaxSolutions.MANY_CC;
    }
  }

  /**
   * Returns the determinism of {@code (this ; other)} when nothing is known about whether the
   * disjuncts are mutually exclusive: the disjunction fails only if both can fail, and if both can
   * succeed it can succeed more than once.
   */
  public Determinism disjunction(Determinism other) {
    return of(canFail && other.canFail, disjunctionMax(maxSolutions, other.maxSolutions));
  }

  private static MaxSolutions disjunctionMax(MaxSolutions x, MaxSolutions y) {
    if (x == MaxSolutions.ZERO) {
      return y;
    } else if (y == MaxSolutions.ZERO) {
      return x;
    } else if (x == MaxSolutions.MANY || y == MaxSolutions.MANY) {
      return MaxSolutions.MANY;
    } else if (x == MaxSolutions.ONE && y == MaxSolutions.ONE) {
      return MaxSolutions.MANY;
    } else {
      return MaxSolutions.MANY_CC;
    }
  }

  /**
   * Returns the determinism of two alternatives at most one of which can be entered (the arms of a
   * switch, or the then and else parts of an if-then-else): it can fail if either can, and it has
   * as many solutions as the larger.
   */
  public Determinism switchJoin(Determinism other) {
    return of(canFail || other.canFail, MaxSolutions.max(maxSolutions, other.maxSolutions));
  }

  /**
   * The identity for {@link #switchJoin}: the determinism of a switch with no arms, before
   * accounting for the constructors it doesn't cover.
   */
  public static Determinism emptySwitch() {
    return ERRONEOUS;
  }

  /**
   * Returns this determinism with {@code canFail} added; used for switches that don't cover every
   * constructor.
   */
  public Determinism withCanFail() {
    return of(true, maxSolutions);
  }

  /**
   * Returns the determinism of this goal when only its first solution is wanted: any number of
   * solutions greater than one becomes {@code MANY_CC}.
   */
  public Determinism firstSolution() {
    return (maxSolutions == MaxSolutions.MANY) ? of(canFail, MaxSolutions.MANY_CC) : this;
  }

  /** Returns the determinism after committing to the first solution. */
  public Determinism commit() {
    return canSucceedMoreThanOnce() ? of(canFail, MaxSolutions.ONE) : this;
  }

  /**
   * Returns the determinism of {@code not(G)} where G has this determinism. Only success or failure
   * of the negated goal is observable, so a negation is always semideterministic.
   */
  public Determinism negation() {
    return SEMIDET;
  }

  /** Returns the determinism with the given name (e.g. "cc_nondet"). */
  public static Determinism parse(String name) {
    return valueOf(Ascii.toUpperCase(name));
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}
