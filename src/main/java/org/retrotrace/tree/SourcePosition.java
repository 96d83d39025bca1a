/*
 * Copyright 2025 The Retrospect Authors
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

package org.retrotrace.tree;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** The position in the source program of a tree node, used in change notifications and errors. */
public final class SourcePosition {
  public final String fileName;
  public final int lineNum;
  public final int charPositionInLine;

  public SourcePosition(String fileName, int lineNum, int charPositionInLine) {
    Preconditions.checkArgument(lineNum > 0 && charPositionInLine >= 0);
    this.fileName = fileName;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** Returns a position on the same line of the same file, at the given column. */
  public SourcePosition atColumn(int charPositionInLine) {
    return new SourcePosition(fileName, lineNum, charPositionInLine);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourcePosition other)) {
      return false;
    }
    return lineNum == other.lineNum
        && charPositionInLine == other.charPositionInLine
        && fileName.equals(other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, lineNum, charPositionInLine);
  }

  @Override
  public String toString() {
    return String.format("%s:%s:%s", fileName, lineNum, charPositionInLine);
  }
}
