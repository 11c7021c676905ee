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

/** A source position (file and line) used when rendering diagnostics. */
public final class Context {
  public static final Context UNKNOWN = new Context("", 0);

  public final String file;
  public final int line;

  public Context(String file, int line) {
    this.file = file;
    this.line = line;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Context c && c.line == line && c.file.equals(file);
  }

  @Override
  public int hashCode() {
    return file.hashCode() * 31 + line;
  }

  @Override
  public String toString() {
    return (this == UNKNOWN) ? "(unknown)" : file + ":" + line;
  }
}
