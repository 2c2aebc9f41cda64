package exm.pvs.ast;

/**
 * Simple immutable class to record a point in the source text.
 * Lines and columns start from 1, offsets from 0.
 */
public class SourcePosition implements Comparable<SourcePosition> {
  public static final SourcePosition START = new SourcePosition(0, 1, 1);

  public final int offset;
  public final int line;
  public final int column;

  public SourcePosition(int offset, int line, int column) {
    super();
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  @Override
  public int compareTo(SourcePosition o) {
    if (line != o.line) {
      return Integer.compare(line, o.line);
    } else if (column != o.column) {
      return Integer.compare(column, o.column);
    }
    return Integer.compare(offset, o.offset);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + offset;
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourcePosition))
      return false;
    SourcePosition other = (SourcePosition) obj;
    return offset == other.offset && line == other.line
        && column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
