package exm.pvs.lexer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.pvs.common.diag.Diagnostic;

public class LexerTest {

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (Token t: tokens) {
      result.add(t.getKind());
    }
    return result;
  }

  private static List<TokenKind> kinds(TokenKind... ks) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (TokenKind k: ks) {
      result.add(k);
    }
    return result;
  }

  @Test
  public void testKeywordsAreCaseSensitive() {
    LexResult r = Lexer.tokenize("THEORY theory x_1? Begin");
    assertEquals(kinds(TokenKind.THEORY, TokenKind.IDENTIFIER,
                       TokenKind.IDENTIFIER, TokenKind.IDENTIFIER,
                       TokenKind.EOF), kinds(r.getTokens()));
    assertEquals("x_1?", r.getTokens().get(2).getText());
    assertFalse(r.hasErrors());
  }

  @Test
  public void testOperatorsLongestMatch() {
    LexResult r = Lexer.tokenize("<=> <= < => := -> /= [# #] (# #) & `");
    assertEquals(kinds(TokenKind.IFF_OP, TokenKind.LESS_EQ, TokenKind.LESS,
        TokenKind.IMPLIES_OP, TokenKind.ASSIGN, TokenKind.ARROW,
        TokenKind.NOT_EQUALS, TokenKind.LRECORD, TokenKind.RRECORD,
        TokenKind.LPAREN_HASH, TokenKind.RPAREN_HASH, TokenKind.AMPERSAND,
        TokenKind.BACKTICK, TokenKind.EOF), kinds(r.getTokens()));
  }

  @Test
  public void testAdjacentOperatorsWithoutSpaces() {
    LexResult r = Lexer.tokenize("x:=y-1");
    assertEquals(kinds(TokenKind.IDENTIFIER, TokenKind.ASSIGN,
        TokenKind.IDENTIFIER, TokenKind.MINUS, TokenKind.NUMBER,
        TokenKind.EOF), kinds(r.getTokens()));
  }

  @Test
  public void testPositions() {
    LexResult r = Lexer.tokenize("a\n  bc");
    Token bc = r.getTokens().get(1);
    assertEquals(2, bc.getStart().line);
    assertEquals(3, bc.getStart().column);
    assertEquals(4, bc.getStart().offset);
    assertEquals(5, bc.getEnd().column);
  }

  @Test
  public void testCarriageReturnLineFeed() {
    Token b = Lexer.tokenize("a\r\nb").getTokens().get(1);
    assertEquals(2, b.getStart().line);
    assertEquals(1, b.getStart().column);
  }

  @Test
  public void testTabWidth() {
    Token x = new Lexer("\tx", 4).tokenize().getTokens().get(0);
    assertEquals(5, x.getStart().column);
  }

  @Test
  public void testCommentsAreTrivia() {
    LexResult r = Lexer.tokenize("x % note\n%%\n  doc text\n%%\ny");
    assertEquals(kinds(TokenKind.IDENTIFIER, TokenKind.LINE_COMMENT,
        TokenKind.DOC_COMMENT, TokenKind.IDENTIFIER, TokenKind.EOF),
        kinds(r.getTokens()));
    assertEquals(kinds(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER,
        TokenKind.EOF), kinds(r.getSignificantTokens()));
    assertEquals("% note", r.getTokens().get(1).getText());
    assertTrue(r.getTokens().get(2).isTrivia());
    assertEquals(5, r.getTokens().get(3).getStart().line);
  }

  @Test
  public void testUnterminatedDocComment() {
    LexResult r = Lexer.tokenize("%%  \nx");
    Token doc = r.getTokens().get(0);
    assertEquals(TokenKind.DOC_COMMENT, doc.getKind());
    assertEquals("%%  ", doc.getText());
    assertTrue(doc.hasError());
    assertEquals(TokenKind.IDENTIFIER, r.getTokens().get(1).getKind());
    assertEquals(1, r.getErrors().size());
  }

  @Test
  public void testDocCommentEndsWithItsLine() {
    LexResult r = Lexer.tokenize("%% doc for x\nx\n%% doc for y\ny");
    assertEquals(kinds(TokenKind.DOC_COMMENT, TokenKind.IDENTIFIER,
        TokenKind.DOC_COMMENT, TokenKind.IDENTIFIER, TokenKind.EOF),
        kinds(r.getTokens()));
    assertEquals("%% doc for x", r.getTokens().get(0).getText());
    assertEquals("x", r.getTokens().get(1).getText());
    assertFalse(r.hasErrors());

    r = Lexer.tokenize("%% short %% y");
    assertEquals("%% short %%", r.getTokens().get(0).getText());
    assertEquals("y", r.getSignificantTokens().get(0).getText());
  }

  @Test
  public void testStrings() {
    LexResult r = Lexer.tokenize("\"a \\\" b\" \"open\nx");
    Token closed = r.getTokens().get(0);
    assertEquals(TokenKind.STRING, closed.getKind());
    assertEquals("\"a \\\" b\"", closed.getText());
    assertFalse(closed.hasError());

    Token open = r.getTokens().get(1);
    assertEquals(TokenKind.STRING, open.getKind());
    assertNotNull(open.getErrorMessage());
    assertEquals(TokenKind.IDENTIFIER, r.getTokens().get(2).getKind());
  }

  @Test
  public void testUnrecognisedRunIsOneToken() {
    LexResult r = Lexer.tokenize("x $$@ y");
    assertEquals(kinds(TokenKind.IDENTIFIER, TokenKind.ERROR,
        TokenKind.IDENTIFIER, TokenKind.EOF), kinds(r.getTokens()));
    assertEquals("$$@", r.getTokens().get(1).getText());

    List<Diagnostic> errors = r.getErrors();
    assertEquals(1, errors.size());
    assertEquals(Diagnostic.Kind.LEXICAL, errors.get(0).getKind());
    assertEquals(3, errors.get(0).getPosition().column);
  }

  @Test
  public void testUnrecognisedRunStopsAtOperator() {
    LexResult r = Lexer.tokenize("$#]");
    assertEquals(kinds(TokenKind.ERROR, TokenKind.RRECORD, TokenKind.EOF),
                 kinds(r.getTokens()));
  }

  @Test
  public void testEmptyInput() {
    LexResult r = Lexer.tokenize("");
    assertEquals(kinds(TokenKind.EOF), kinds(r.getTokens()));
    assertNull(r.getTokens().get(0).getErrorMessage());
  }

  @Test
  public void testRestartable() {
    Lexer lexer = new Lexer("a: nat = 1");
    List<Token> first = new ArrayList<Token>();
    for (Token t: lexer) {
      first.add(t);
    }
    List<Token> second = new ArrayList<Token>();
    for (Token t: lexer) {
      second.add(t);
    }
    assertEquals(kinds(first), kinds(second));
    assertEquals(6, first.size());
  }
}
