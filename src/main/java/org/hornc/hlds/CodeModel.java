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
 * How code for a goal interacts with its caller: DET code always succeeds exactly once, SEMI code
 * succeeds at most once and may fail (branching to a failure continuation), and NON code may
 * succeed any number of times, leaving choice points behind to produce further solutions on
 * backtracking.
 */
public enum CodeModel {
  DET,
  SEMI,
  NON
}
