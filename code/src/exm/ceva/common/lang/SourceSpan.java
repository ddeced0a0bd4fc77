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

package exm.ceva.common.lang;

/**
 * A region of source text.  Lines and columns start at 1; zero means
 * unknown.  Spans order by file, then position, so diagnostics can be
 * sorted before reporting.
 */
public class SourceSpan implements Comparable<SourceSpan> {

  public static final SourceSpan NONE = new SourceSpan("", 0, 0, 0, 0);

  private final String file;
  private final int line;
  private final int column;
  private final int endLine;
  private final int endColumn;

  public SourceSpan(String file, int line, int column,
                    int endLine, int endColumn) {
    this.file = file == null ? "" : file;
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  public static SourceSpan at(String file, int line, int column) {
    return new SourceSpan(file, line, column, line, column);
  }

  public static SourceSpan line(int line) {
    return new SourceSpan("", line, 0, line, 0);
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public int getEndLine() {
    return endLine;
  }

  public int getEndColumn() {
    return endColumn;
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public int compareTo(SourceSpan o) {
    int c = file.compareTo(o.file);
    if (c != 0) {
      return c;
    }
    // Unknown positions sort after known ones
    c = Integer.compare(line <= 0 ? Integer.MAX_VALUE : line,
                        o.line <= 0 ? Integer.MAX_VALUE : o.line);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(column, o.column);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(endLine, o.endLine);
    if (c != 0) {
      return c;
    }
    return Integer.compare(endColumn, o.endColumn);
  }

  @Override
  public int hashCode() {
    int result = file.hashCode();
    result = 31 * result + line;
    result = 31 * result + column;
    result = 31 * result + endLine;
    result = 31 * result + endColumn;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceSpan)) {
      return false;
    }
    SourceSpan other = (SourceSpan) obj;
    return file.equals(other.file) && line == other.line &&
           column == other.column && endLine == other.endLine &&
           endColumn == other.endColumn;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!file.isEmpty()) {
      sb.append(file).append(':');
    }
    sb.append(line);
    if (column > 0) {
      sb.append(':').append(column);
    }
    return sb.toString();
  }
}
