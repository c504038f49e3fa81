/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.p4ir.ir;

/**
 * Simple immutable class to record the source span of a node.
 * Lines and columns start at 1; a span with line 0 is invalid.
 */
public class SourceInfo {
  public static final SourceInfo INVALID = new SourceInfo(null, 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public SourceInfo(String file, int startLine, int startColumn,
                    int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /**
   * Span covering a single position
   */
  public static SourceInfo at(String file, int line, int column) {
    return new SourceInfo(file, line, column, line, column);
  }

  public static SourceInfo span(String file, int startLine, int startColumn,
                                int endLine, int endColumn) {
    return new SourceInfo(file, startLine, startColumn, endLine, endColumn);
  }

  public boolean isValid() {
    return startLine > 0;
  }

  /**
   * Union of two spans.  Invalid spans don't contribute.  Spans from
   * different files can't be combined, so the receiver is kept.
   * @param other
   * @return the union, or one of the two arguments if it already covers both
   */
  public SourceInfo merge(SourceInfo other) {
    if (other == null || !other.isValid()) {
      return this;
    } else if (!this.isValid()) {
      return other;
    }
    if (file == null ? other.file != null : !file.equals(other.file)) {
      return this;
    }
    boolean otherStartsFirst = before(other.startLine, other.startColumn,
                                      startLine, startColumn);
    boolean otherEndsLast = before(endLine, endColumn,
                                   other.endLine, other.endColumn);
    if (!otherStartsFirst && !otherEndsLast) {
      return this;
    }
    return new SourceInfo(file,
        otherStartsFirst ? other.startLine : startLine,
        otherStartsFirst ? other.startColumn : startColumn,
        otherEndsLast ? other.endLine : endLine,
        otherEndsLast ? other.endColumn : endColumn);
  }

  private static boolean before(int line1, int col1, int line2, int col2) {
    return line1 < line2 || (line1 == line2 && col1 < col2);
  }

  /**
   * @return file:line:col of the start, as used in error messages
   */
  @Override
  public String toString() {
    if (!isValid()) {
      return "<unknown>";
    }
    return file + ":" + startLine + (startColumn > 0 ? ":" + startColumn : "");
  }

  public String toSpanString() {
    if (!isValid()) {
      return "<unknown>";
    }
    return file + ":" + startLine + ":" + startColumn + "-" +
           endLine + ":" + endColumn;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceInfo)) {
      return false;
    }
    SourceInfo other = (SourceInfo) obj;
    return (file == null ? other.file == null : file.equals(other.file)) &&
           startLine == other.startLine && startColumn == other.startColumn &&
           endLine == other.endLine && endColumn == other.endColumn;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + startLine;
    result = prime * result + startColumn;
    result = prime * result + endLine;
    result = prime * result + endColumn;
    return result;
  }
}
