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
package exm.pvs.lexer;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.SourcePosition;

/**
 * Converts source text into tokens.
 *
 * The lexer is a lazy, restartable sequence: every call to iterator()
 * scans the text again from the start and yields tokens on demand, ending
 * with exactly one EOF token.  Malformed input never raises; it produces
 * tokens that carry an error message (see {@link Token#hasError()}).
 *
 * Comments are returned as trivia tokens rather than discarded: a line
 * comment runs from {@code %} to the end of the line.  A documentation
 * comment starts with {@code %%} and ends at the next {@code %%} on the
 * same line, or else at the end of the line.  A {@code %%} alone on its
 * line opens a block that runs to the next {@code %%}.
 */
public class Lexer implements Iterable<Token> {

  private static final char COMMENT_CHAR = '%';
  private static final String DOC_MARKER = "%%";
  private static final int MAX_OPERATOR_LENGTH = 3;

  /** Fixed-spelling operators and punctuation, for longest-match lookup */
  private static final Map<String, TokenKind> operators =
                                      new HashMap<String, TokenKind>();
  static {
    for (TokenKind kind: TokenKind.values()) {
      if (kind.text() != null && kind.category() != TokenKind.Category.KEYWORD) {
        assert(kind.text().length() <= MAX_OPERATOR_LENGTH);
        operators.put(kind.text(), kind);
      }
    }
  }

  private final String source;
  private final int tabWidth;

  public Lexer(String source) {
    this(source, 1);
  }

  public Lexer(String source, int tabWidth) {
    this.source = source == null ? "" : source;
    this.tabWidth = tabWidth;
  }

  @Override
  public Iterator<Token> iterator() {
    return new Scanner();
  }

  /**
   * Scan the whole input eagerly.
   */
  public LexResult tokenize() {
    return new LexResult(ImmutableList.copyOf(this));
  }

  public static LexResult tokenize(String source) {
    return new Lexer(source).tokenize();
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c);
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '?';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /**
   * Scanning state for one pass over the input
   */
  private class Scanner implements Iterator<Token> {
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private boolean eofEmitted = false;

    @Override
    public boolean hasNext() {
      return !eofEmitted;
    }

    @Override
    public Token next() {
      if (eofEmitted) {
        throw new NoSuchElementException();
      }
      skipWhitespace();
      SourcePosition start = position();
      if (pos >= source.length()) {
        eofEmitted = true;
        return new Token(TokenKind.EOF, "", start, start);
      }

      char c = source.charAt(pos);
      if (c == COMMENT_CHAR) {
        return comment(start);
      } else if (isIdentifierStart(c)) {
        return word(start);
      } else if (isDigit(c)) {
        while (pos < source.length() && isDigit(source.charAt(pos))) {
          advance();
        }
        return make(TokenKind.NUMBER, start, null);
      } else if (c == '"') {
        return string(start);
      }

      TokenKind op = matchOperator();
      if (op != null) {
        advance(op.text().length());
        return make(op, start, null);
      }
      return unrecognised(start);
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }

    private Token comment(SourcePosition start) {
      if (!source.startsWith(DOC_MARKER, pos)) {
        toEndOfLine();
        return make(TokenKind.LINE_COMMENT, start, null);
      }
      int textStart = pos + DOC_MARKER.length();
      int lineEnd = lineEnd(textStart);
      int close = source.indexOf(DOC_MARKER, textStart);
      if (close >= 0 && close < lineEnd) {
        advance(close + DOC_MARKER.length() - pos);
        return make(TokenKind.DOC_COMMENT, start, null);
      }
      if (!StringUtils.isBlank(source.substring(textStart, lineEnd))) {
        // %% text with no closing marker on its line
        toEndOfLine();
        return make(TokenKind.DOC_COMMENT, start, null);
      }
      // A marker alone on its line opens a block
      if (close >= 0) {
        advance(close + DOC_MARKER.length() - pos);
        return make(TokenKind.DOC_COMMENT, start, null);
      }
      // Close at end of line so the rest of the file is still lexed
      toEndOfLine();
      return make(TokenKind.DOC_COMMENT, start,
                  "unterminated documentation comment: missing closing "
                  + DOC_MARKER);
    }

    private int lineEnd(int from) {
      int i = from;
      while (i < source.length()
             && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
        i++;
      }
      return i;
    }

    private Token word(SourcePosition start) {
      while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
        advance();
      }
      String text = source.substring(start.offset, pos);
      TokenKind keyword = TokenKind.keyword(text);
      return new Token(keyword != null ? keyword : TokenKind.IDENTIFIER,
                       text, start, position());
    }

    private Token string(SourcePosition start) {
      advance(); // opening quote
      while (pos < source.length()) {
        char c = source.charAt(pos);
        if (c == '"') {
          advance();
          return make(TokenKind.STRING, start, null);
        } else if (c == '\n' || c == '\r') {
          break;
        } else if (c == '\\' && pos + 1 < source.length()
                   && source.charAt(pos + 1) != '\n') {
          advance(2);
        } else {
          advance();
        }
      }
      return make(TokenKind.STRING, start, "unterminated string literal");
    }

    /**
     * Group a run of unrecognised characters into one error token
     */
    private Token unrecognised(SourcePosition start) {
      advance();
      while (pos < source.length() && !atTokenStart()) {
        advance();
      }
      String text = source.substring(start.offset, pos);
      String what = text.length() == 1 ? "character" : "characters";
      return make(TokenKind.ERROR, start,
                  "unrecognized " + what + " '" + text + "'");
    }

    private boolean atTokenStart() {
      char c = source.charAt(pos);
      return Character.isWhitespace(c) || c == COMMENT_CHAR || c == '"'
          || isIdentifierStart(c) || isDigit(c) || matchOperator() != null;
    }

    /**
     * Longest match over the fixed operator spellings
     */
    private TokenKind matchOperator() {
      int maxLen = Math.min(MAX_OPERATOR_LENGTH, source.length() - pos);
      for (int len = maxLen; len > 0; len--) {
        TokenKind kind = operators.get(source.substring(pos, pos + len));
        if (kind != null) {
          return kind;
        }
      }
      return null;
    }

    private Token make(TokenKind kind, SourcePosition start, String error) {
      return new Token(kind, source.substring(start.offset, pos), start,
                       position(), error);
    }

    private void skipWhitespace() {
      while (pos < source.length()
             && Character.isWhitespace(source.charAt(pos))) {
        advance();
      }
    }

    private void toEndOfLine() {
      while (pos < source.length()) {
        char c = source.charAt(pos);
        if (c == '\n' || c == '\r') {
          break;
        }
        advance();
      }
    }

    private void advance(int n) {
      for (int i = 0; i < n; i++) {
        advance();
      }
    }

    private void advance() {
      char c = source.charAt(pos++);
      if (c == '\n') {
        line++;
        column = 1;
      } else if (c == '\r') {
        // \r\n counts as one line break, on the \n
        if (pos >= source.length() || source.charAt(pos) != '\n') {
          line++;
          column = 1;
        }
      } else if (c == '\t') {
        column += tabWidth;
      } else {
        column++;
      }
    }

    private SourcePosition position() {
      return new SourcePosition(pos, line, column);
    }
  }
}
