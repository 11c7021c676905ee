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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Everything other than the module itself that determines how a module is compiled. */
public final class CompilerOptions {
  public final OptTuple opt;

  /** The number of procedures to work on at once; 1 means everything runs on the caller. */
  public final int threads;

  /** If true, generated code is checked with {@link org.hornc.code.LivenessChecker}. */
  public final boolean verifyLiveness;

  /** If false, switches that don't cover every constructor are not reported. */
  public final boolean reportSwitchWarnings;

  public final ModuleCompiler.Monitor monitor;

  private CompilerOptions(Builder builder) {
    this.opt = builder.opt;
    this.threads = builder.threads;
    this.verifyLiveness = builder.verifyLiveness;
    this.reportSwitchWarnings = builder.reportSwitchWarnings;
    this.monitor = builder.monitor;
  }

  /** Returns the default options at the given optimization level. */
  public static CompilerOptions forLevel(int level) {
    return builder().opt(OptTuple.forLevel(level)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return String.format(
        "%s, %s thread(s)%s", opt, threads, verifyLiveness ? ", verifying liveness" : "");
  }

  public static final class Builder {
    private OptTuple opt = OptTuple.forLevel(2);
    private int threads = Runtime.getRuntime().availableProcessors();
    private boolean verifyLiveness;
    private boolean reportSwitchWarnings = true;
    private ModuleCompiler.Monitor monitor = ModuleCompiler.Monitor.NONE;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder opt(OptTuple opt) {
      this.opt = opt;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder threads(int threads) {
      Preconditions.checkArgument(threads > 0, "threads must be positive, not %s", threads);
      this.threads = threads;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder verifyLiveness(boolean verifyLiveness) {
      this.verifyLiveness = verifyLiveness;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder reportSwitchWarnings(boolean reportSwitchWarnings) {
      this.reportSwitchWarnings = reportSwitchWarnings;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder monitor(ModuleCompiler.Monitor monitor) {
      this.monitor = Preconditions.checkNotNull(monitor);
      return this;
    }

    public CompilerOptions build() {
      return new CompilerOptions(this);
    }
  }
}
