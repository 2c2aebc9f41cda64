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
import java.util.Map;

/**
 * Every kind of token the lexer can produce.  Keywords and fixed
 * operators carry their exact source spelling.
 */
public enum TokenKind {
  // Keywords: matched by exact, case-sensitive text
  THEORY("THEORY", Category.KEYWORD),
  BEGIN("BEGIN", Category.KEYWORD),
  END("END", Category.KEYWORD),
  IMPORTING("IMPORTING", Category.KEYWORD),
  ASSUMING("ASSUMING", Category.KEYWORD),
  ENDASSUMING("ENDASSUMING", Category.KEYWORD),
  LEMMA("LEMMA", Category.KEYWORD),
  THEOREM("THEOREM", Category.KEYWORD),
  ASSUMPTION("ASSUMPTION", Category.KEYWORD),
  AXIOM("AXIOM", Category.KEYWORD),
  TYPE("TYPE", Category.KEYWORD),
  VAR("VAR", Category.KEYWORD),
  WITH("WITH", Category.KEYWORD),
  COND("COND", Category.KEYWORD),
  ENDCOND("ENDCOND", Category.KEYWORD),
  IF("IF", Category.KEYWORD),
  THEN("THEN", Category.KEYWORD),
  ELSIF("ELSIF", Category.KEYWORD),
  ELSE("ELSE", Category.KEYWORD),
  ENDIF("ENDIF", Category.KEYWORD),
  FORALL("FORALL", Category.KEYWORD),
  EXISTS("EXISTS", Category.KEYWORD),
  LAMBDA("LAMBDA", Category.KEYWORD),
  LET("LET", Category.KEYWORD),
  IN("IN", Category.KEYWORD),
  TRUE("TRUE", Category.KEYWORD),
  FALSE("FALSE", Category.KEYWORD),
  NOT("NOT", Category.KEYWORD),
  AND("AND", Category.KEYWORD),
  OR("OR", Category.KEYWORD),
  IMPLIES("IMPLIES", Category.KEYWORD),
  IFF("IFF", Category.KEYWORD),

  IDENTIFIER(null, Category.IDENTIFIER),
  NUMBER(null, Category.LITERAL),
  STRING(null, Category.LITERAL),

  // Operators
  ASSIGN(":=", Category.OPERATOR),
  ARROW("->", Category.OPERATOR),
  IMPLIES_OP("=>", Category.OPERATOR),
  IFF_OP("<=>", Category.OPERATOR),
  AMPERSAND("&", Category.OPERATOR),
  EQUALS("=", Category.OPERATOR),
  NOT_EQUALS("/=", Category.OPERATOR),
  LESS("<", Category.OPERATOR),
  LESS_EQ("<=", Category.OPERATOR),
  GREATER(">", Category.OPERATOR),
  GREATER_EQ(">=", Category.OPERATOR),
  PLUS("+", Category.OPERATOR),
  MINUS("-", Category.OPERATOR),
  STAR("*", Category.OPERATOR),
  SLASH("/", Category.OPERATOR),
  BACKTICK("`", Category.OPERATOR),

  // Punctuation
  LPAREN("(", Category.PUNCTUATION),
  RPAREN(")", Category.PUNCTUATION),
  LBRACKET("[", Category.PUNCTUATION),
  RBRACKET("]", Category.PUNCTUATION),
  LBRACE("{", Category.PUNCTUATION),
  RBRACE("}", Category.PUNCTUATION),
  LRECORD("[#", Category.PUNCTUATION),
  RRECORD("#]", Category.PUNCTUATION),
  LPAREN_HASH("(#", Category.PUNCTUATION),
  RPAREN_HASH("#)", Category.PUNCTUATION),
  COMMA(",", Category.PUNCTUATION),
  COLON(":", Category.PUNCTUATION),
  SEMICOLON(";", Category.PUNCTUATION),
  BAR("|", Category.PUNCTUATION),

  // Trivia
  LINE_COMMENT(null, Category.COMMENT),
  DOC_COMMENT(null, Category.COMMENT),

  /** Placeholder for unrecognised input */
  ERROR(null, Category.ERROR),
  EOF(null, Category.EOF);

  public static enum Category {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    LITERAL,
    PUNCTUATION,
    COMMENT,
    ERROR,
    EOF,
  }

  private static final Map<String, TokenKind> keywords =
                                        new HashMap<String, TokenKind>();
  static {
    for (TokenKind kind: values()) {
      if (kind.category == Category.KEYWORD) {
        keywords.put(kind.text, kind);
      }
    }
  }

  private final String text;
  private final Category category;

  TokenKind(String text, Category category) {
    this.text = text;
    this.category = category;
  }

  /**
   * @return fixed spelling, or null for kinds with variable text
   */
  public String text() {
    return text;
  }

  public Category category() {
    return category;
  }

  public boolean isTrivia() {
    return category == Category.COMMENT;
  }

  /**
   * @return keyword spelled exactly as word, or null if word is not
   *        reserved
   */
  public static TokenKind keyword(String word) {
    return keywords.get(word);
  }

  /**
   * Human readable description for error messages
   */
  public String describe() {
    if (text != null) {
      return category == Category.KEYWORD ? text : "'" + text + "'";
    }
    switch (this) {
      case IDENTIFIER:
        return "identifier";
      case NUMBER:
        return "number";
      case STRING:
        return "string";
      case EOF:
        return "end of input";
      default:
        return name().toLowerCase();
    }
  }
}
