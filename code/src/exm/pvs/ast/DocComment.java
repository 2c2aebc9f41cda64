package exm.pvs.ast;

/**
 * A documentation comment kept from the source.
 */
public class DocComment {
  private static final String MARKER = "%%";

  private final String text;
  private final SourceSpan span;

  public DocComment(String text, SourceSpan span) {
    this.text = text;
    this.span = span;
  }

  /**
   * @return the comment exactly as written, markers included
   */
  public String getText() {
    return text;
  }

  /**
   * @return comment body without the surrounding markers
   */
  public String getContent() {
    String body = text;
    if (body.startsWith(MARKER)) {
      body = body.substring(MARKER.length());
    }
    if (body.endsWith(MARKER)) {
      body = body.substring(0, body.length() - MARKER.length());
    }
    return body.trim();
  }

  public SourceSpan getSpan() {
    return span;
  }

  @Override
  public String toString() {
    return "DocComment(" + getContent() + ")@" + span;
  }
}
