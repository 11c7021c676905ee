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

package org.hornc.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The optimization policy for a compilation unit: the setting of each optimization switch,
 * determined by an optimization level (0 to 6) and any number of overrides.
 *
 * <p>An OptTuple is immutable and is built once, before any procedure is compiled; every pass
 * that has a choice to make about an optimization consults it. Each optimization can be turned on
 * or off independently of the others, and none of them changes the observable behavior of the
 * generated code.
 */
public final class OptTuple {

  public static final int MIN_LEVEL = 0;
  public static final int MAX_LEVEL = 6;

  /**
   * The settings that an OptTuple determines. Each is either a flag (with value 0 or 1) or a
   * non-negative integer, and has a default for each optimization level.
   */
  public enum Switch {
    /** Replace calls to small procedures by their bodies. */
    INLINING("inlining", false, 0, 0, 1, 1, 1, 1, 1),
    /** The largest callee body (in atomic goals) that will be inlined without a pragma. */
    INLINE_THRESHOLD("inlineThreshold", true, 0, 0, 4, 8, 12, 16, 24),
    /** Store variables that are assigned to one another in the same slot, dropping the copy. */
    EXCESS_ASSIGN("excessAssign", false, 0, 1, 1, 1, 1, 1, 1),
    /** Local rewrites of short instruction sequences. */
    PEEPHOLE("peephole", false, 0, 1, 1, 1, 1, 1, 1),
    /** Short-circuit jumps to jumps, and drop jumps to the next instruction. */
    JUMP_OPT("jumpOpt", false, 0, 1, 1, 1, 1, 1, 1),
    /** Remove labels that nothing refers to, and the code that they no longer make reachable. */
    LABEL_ELIM("labelElim", false, 0, 1, 1, 1, 1, 1, 1),
    /** Merge identical blocks of code. */
    DUP_ELIM("dupElim", false, 0, 0, 0, 1, 1, 1, 1),
    /** Turn self-recursive tail calls in det and semidet procedures into loops. */
    TAIL_CALLS("tailCalls", false, 0, 0, 1, 1, 1, 1, 1),
    /** Move the setup of loop-invariant arguments and unifications out of such loops. */
    LOOP_INVARIANTS("loopInvariants", false, 0, 0, 0, 0, 0, 1, 1),
    /** Compile large switches over a closed set of constructors into jump tables. */
    DENSE_SWITCH("denseSwitch", false, 0, 0, 0, 0, 1, 1, 1),
    /** The minimum number of arms for a switch to be compiled into a jump table. */
    DENSE_SWITCH_SIZE("denseSwitchSize", true, 4, 4, 4, 4, 4, 4, 3),
    /** Let variables whose lifetimes don't overlap share a frame slot. */
    SLOT_REUSE("slotReuse", false, 0, 1, 1, 1, 1, 1, 1),
    /** The most rounds of instruction-level optimization to run (at least one is always run). */
    OPT_REPEAT("optRepeat", true, 1, 1, 1, 1, 2, 2, 3);

    /** The name used for this switch in an override. */
    public final String optionName;

    /** True if this switch has an integer value, false if it is a flag. */
    public final boolean isInt;

    private final int[] defaults;

    Switch(String optionName, boolean isInt, int... defaults) {
      assert defaults.length == MAX_LEVEL + 1;
      this.optionName = optionName;
      this.isInt = isInt;
      this.defaults = defaults;
    }

    /** Returns this switch's value at the given optimization level, in the absence of overrides. */
    public int defaultAt(int level) {
      checkLevel(level);
      return defaults[level];
    }
  }

  private static final ImmutableMap<String, Switch> BY_NAME =
      Arrays.stream(Switch.values())
          .collect(ImmutableMap.toImmutableMap(s -> s.optionName, Function.identity()));

  private final int level;
  private final int[] values;

  private OptTuple(int level, int[] values) {
    this.level = level;
    this.values = values;
  }

  /** Returns the OptTuple for the given level with no overrides. */
  public static OptTuple forLevel(int level) {
    return builder(level).build();
  }

  /** Returns a builder initialized with the defaults for the given level. */
  public static Builder builder(int level) {
    return new Builder(level);
  }

  /** Returns the level that this OptTuple's defaults came from. */
  public int level() {
    return level;
  }

  /** Returns true if the given flag is set. */
  public boolean enabled(Switch s) {
    Preconditions.checkArgument(!s.isInt, "%s is not a flag", s.optionName);
    return values[s.ordinal()] != 0;
  }

  /** Returns the value of the given integer setting. */
  public int value(Switch s) {
    Preconditions.checkArgument(s.isInt, "%s is a flag", s.optionName);
    return values[s.ordinal()];
  }

  /** Returns the setting of each switch, keyed by its option name. */
  public ImmutableMap<String, Integer> asMap() {
    return Arrays.stream(Switch.values())
        .collect(ImmutableMap.toImmutableMap(s -> s.optionName, s -> values[s.ordinal()]));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof OptTuple o && level == o.level && Arrays.equals(values, o.values);
  }

  @Override
  public int hashCode() {
    return level * 31 + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "O" + level + asMap().entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  private static void checkLevel(int level) {
    Preconditions.checkArgument(
        level >= MIN_LEVEL && level <= MAX_LEVEL,
        "Optimization level must be between %s and %s, not %s",
        MIN_LEVEL,
        MAX_LEVEL,
        level);
  }

  /** A mutable precursor to an OptTuple. */
  public static final class Builder {
    private final int level;
    private final int[] values;

    private Builder(int level) {
      checkLevel(level);
      this.level = level;
      this.values = new int[Switch.values().length];
      for (Switch s : Switch.values()) {
        values[s.ordinal()] = s.defaultAt(level);
      }
    }

    @CanIgnoreReturnValue
    public Builder set(Switch s, boolean enabled) {
      Preconditions.checkArgument(!s.isInt, "%s is not a flag", s.optionName);
      values[s.ordinal()] = enabled ? 1 : 0;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder set(Switch s, int value) {
      Preconditions.checkArgument(s.isInt, "%s is a flag", s.optionName);
      Preconditions.checkArgument(value >= 0, "%s must not be negative", s.optionName);
      values[s.ordinal()] = value;
      return this;
    }

    /**
     * Sets the switch with the given option name. Flags accept "true" or "false"; integer
     * settings accept a non-negative decimal number.
     */
    @CanIgnoreReturnValue
    public Builder override(String name, String value) {
      Switch s = BY_NAME.get(name);
      Preconditions.checkArgument(s != null, "Unknown optimization option '%s'", name);
      if (s.isInt) {
        int intValue;
        try {
          intValue = Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              String.format("Option '%s' expects an integer, not '%s'", name, value), e);
        }
        return set(s, intValue);
      } else if (value.equals("true") || value.equals("false")) {
        return set(s, value.equals("true"));
      }
      throw new IllegalArgumentException(
          String.format("Option '%s' expects true or false, not '%s'", name, value));
    }

    /** Applies each override of the form "name=value", in order; later ones win. */
    @CanIgnoreReturnValue
    public Builder overrides(List<String> overrides) {
      for (String override : overrides) {
        int eq = override.indexOf('=');
        Preconditions.checkArgument(eq > 0, "Expected name=value, not '%s'", override);
        override(override.substring(0, eq).trim(), override.substring(eq + 1).trim());
      }
      return this;
    }

    /** Applies the given overrides; equivalent to calling {@link #override} for each entry. */
    @CanIgnoreReturnValue
    public Builder overrides(Map<String, String> overrides) {
      overrides.forEach(this::override);
      return this;
    }

    public OptTuple build() {
      return new OptTuple(level, values.clone());
    }
  }
}
