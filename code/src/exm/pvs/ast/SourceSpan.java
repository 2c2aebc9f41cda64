package exm.pvs.ast;

/**
 * Immutable start/end pair.  The end position is exclusive: it is the
 * position just after the last character covered.
 */
public class SourceSpan {
  public final SourcePosition start;
  public final SourcePosition end;

  public SourceSpan(SourcePosition start, SourcePosition end) {
    super();
    assert(start.compareTo(end) <= 0) : start + " after " + end;
    this.start = start;
    this.end = end;
  }

  public static SourceSpan at(SourcePosition pos) {
    return new SourceSpan(pos, pos);
  }

  /**
   * @return span from the start of this one to the end of other
   */
  public SourceSpan to(SourceSpan other) {
    if (other.end.compareTo(start) < 0) {
      return this;
    }
    return new SourceSpan(start, other.end);
  }

  public boolean contains(SourcePosition pos) {
    return start.compareTo(pos) <= 0 && pos.compareTo(end) < 0;
  }

  @Override
  public int hashCode() {
    return 31 * start.hashCode() + end.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceSpan))
      return false;
    SourceSpan other = (SourceSpan) obj;
    return start.equals(other.start) && end.equals(other.end);
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
