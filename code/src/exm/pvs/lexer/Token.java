package exm.pvs.lexer;

import exm.pvs.ast.SourcePosition;
import exm.pvs.ast.SourceSpan;

/**
 * Immutable lexical token.  ERROR tokens also carry the lexer's
 * message describing what was wrong.
 */
public class Token {
  private final TokenKind kind;
  private final String text;
  private final SourcePosition start;
  private final SourcePosition end;
  private final String errorMessage;

  public Token(TokenKind kind, String text, SourcePosition start,
               SourcePosition end) {
    this(kind, text, start, end, null);
  }

  public Token(TokenKind kind, String text, SourcePosition start,
               SourcePosition end, String errorMessage) {
    this.kind = kind;
    this.text = text;
    this.start = start;
    this.end = end;
    this.errorMessage = errorMessage;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public SourcePosition getStart() {
    return start;
  }

  public SourcePosition getEnd() {
    return end;
  }

  public SourceSpan getSpan() {
    return new SourceSpan(start, end);
  }

  /**
   * @return lexer message if the token is malformed, otherwise null
   */
  public String getErrorMessage() {
    return errorMessage;
  }

  public boolean hasError() {
    return errorMessage != null;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  public boolean isTrivia() {
    return kind.isTrivia();
  }

  @Override
  public String toString() {
    return kind + "('" + text + "')@" + start;
  }
}
