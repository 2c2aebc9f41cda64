package exm.pvs.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pvs.common.diag.Diagnostic;
import exm.pvs.common.diag.Diagnostics;

/**
 * Fully scanned token sequence plus the lexical errors found in it.
 */
public class LexResult {
  private final ImmutableList<Token> tokens;

  public LexResult(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /**
   * @return all tokens including trivia, ending with EOF
   */
  public ImmutableList<Token> getTokens() {
    return tokens;
  }

  /**
   * @return tokens without comments, ending with EOF
   */
  public List<Token> getSignificantTokens() {
    List<Token> result = new ArrayList<Token>(tokens.size());
    for (Token t: tokens) {
      if (!t.isTrivia()) {
        result.add(t);
      }
    }
    return Collections.unmodifiableList(result);
  }

  public List<Diagnostic> getErrors() {
    Diagnostics errors = new Diagnostics();
    for (Token t: tokens) {
      if (t.hasError()) {
        errors.lexError(t.getStart(), t.getErrorMessage());
      }
    }
    return errors.getDiagnostics();
  }

  public boolean hasErrors() {
    for (Token t: tokens) {
      if (t.hasError()) {
        return true;
      }
    }
    return false;
  }
}
