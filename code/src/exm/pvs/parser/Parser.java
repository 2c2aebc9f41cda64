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
package exm.pvs.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.pvs.ast.DocComment;
import exm.pvs.ast.Exprs.Application;
import exm.pvs.ast.Exprs.BinaryOp;
import exm.pvs.ast.Exprs.Binding;
import exm.pvs.ast.Exprs.BindingKind;
import exm.pvs.ast.Exprs.Cond;
import exm.pvs.ast.Exprs.CondBranch;
import exm.pvs.ast.Exprs.ErrorExpr;
import exm.pvs.ast.Exprs.Expr;
import exm.pvs.ast.Exprs.FieldAssignment;
import exm.pvs.ast.Exprs.FieldSelect;
import exm.pvs.ast.Exprs.If;
import exm.pvs.ast.Exprs.Let;
import exm.pvs.ast.Exprs.LetBinding;
import exm.pvs.ast.Exprs.Literal;
import exm.pvs.ast.Exprs.LiteralKind;
import exm.pvs.ast.Exprs.Name;
import exm.pvs.ast.Exprs.Operator;
import exm.pvs.ast.Exprs.RecordLiteral;
import exm.pvs.ast.Exprs.Tuple;
import exm.pvs.ast.Exprs.UnaryOp;
import exm.pvs.ast.Exprs.Update;
import exm.pvs.ast.Decls.ConstDecl;
import exm.pvs.ast.Decls.Decl;
import exm.pvs.ast.Decls.FormulaDecl;
import exm.pvs.ast.Decls.FormulaKind;
import exm.pvs.ast.Decls.TypeDecl;
import exm.pvs.ast.Decls.VarDecl;
import exm.pvs.ast.Importing;
import exm.pvs.ast.Param;
import exm.pvs.ast.ParamClause;
import exm.pvs.ast.SourcePosition;
import exm.pvs.ast.SourceSpan;
import exm.pvs.ast.Theory;
import exm.pvs.ast.TypeExprs.FieldDecl;
import exm.pvs.ast.TypeExprs.FunctionType;
import exm.pvs.ast.TypeExprs.NamedType;
import exm.pvs.ast.TypeExprs.PredicateSubtype;
import exm.pvs.ast.TypeExprs.RecordType;
import exm.pvs.ast.TypeExprs.TupleType;
import exm.pvs.ast.TypeExprs.TypeExpr;
import exm.pvs.common.diag.Diagnostics;
import exm.pvs.common.exceptions.ParserInternalError;
import exm.pvs.lexer.Token;
import exm.pvs.lexer.TokenKind;

/**
 * Recursive descent parser for one compilation unit, with precedence
 * climbing for binary operators.  A Parser instance is single use.
 *
 * Errors never abort the parse.  After an error is reported the parser
 * unwinds to the nearest recovery point and skips ahead to a
 * synchronisation token; no further errors are reported until a token has
 * been matched again, so one defect gives one diagnostic.
 * Synchronisation tokens by context:
 * <ul>
 *   <li>theory body and ASSUMING block: END, IMPORTING, ASSUMING,
 *       ENDASSUMING, or the start of a declaration (an identifier
 *       followed by ':', or an identifier opening its line followed by
 *       '(' or ','), always outside brackets;</li>
 *   <li>theory header: additionally BEGIN, which is consumed;</li>
 *   <li>inside a bracketed or keyword-delimited construct: the matching
 *       closing delimiter of the innermost open construct; if the body
 *       level or a declaration starting a line at the current
 *       declaration's column or left of it comes first, recovery
 *       continues there.</li>
 * </ul>
 */
class Parser {

  /** Unwinds to the nearest recovery point; the error is already reported */
  private static class ParseFailure extends RuntimeException {
    ParseFailure() {
      super(null, null, false, false);
    }

    private static final long serialVersionUID = 1L;
  }

  private static final String MISSING_NAME = "<missing>";

  private static final Set<TokenKind> OPENERS = EnumSet.of(
      TokenKind.LPAREN, TokenKind.LBRACKET, TokenKind.LBRACE,
      TokenKind.LRECORD, TokenKind.LPAREN_HASH, TokenKind.IF,
      TokenKind.COND);

  private static final Set<TokenKind> CLOSERS = EnumSet.of(
      TokenKind.RPAREN, TokenKind.RBRACKET, TokenKind.RBRACE,
      TokenKind.RRECORD, TokenKind.RPAREN_HASH, TokenKind.ENDIF,
      TokenKind.ENDCOND);

  private static final Set<TokenKind> BODY_KEYWORDS = EnumSet.of(
      TokenKind.END, TokenKind.IMPORTING, TokenKind.ASSUMING,
      TokenKind.ENDASSUMING);

  private static final Map<TokenKind, FormulaKind> FORMULA_KINDS =
                              new HashMap<TokenKind, FormulaKind>();
  private static final Map<TokenKind, Operator> BINARY_OPS =
                              new HashMap<TokenKind, Operator>();
  static {
    FORMULA_KINDS.put(TokenKind.LEMMA, FormulaKind.LEMMA);
    FORMULA_KINDS.put(TokenKind.THEOREM, FormulaKind.THEOREM);
    FORMULA_KINDS.put(TokenKind.ASSUMPTION, FormulaKind.ASSUMPTION);
    FORMULA_KINDS.put(TokenKind.AXIOM, FormulaKind.AXIOM);

    BINARY_OPS.put(TokenKind.IMPLIES, Operator.IMPLIES);
    BINARY_OPS.put(TokenKind.IMPLIES_OP, Operator.IMPLIES);
    BINARY_OPS.put(TokenKind.IFF, Operator.IFF);
    BINARY_OPS.put(TokenKind.IFF_OP, Operator.IFF);
    BINARY_OPS.put(TokenKind.OR, Operator.OR);
    BINARY_OPS.put(TokenKind.AND, Operator.AND);
    BINARY_OPS.put(TokenKind.AMPERSAND, Operator.AND);
    BINARY_OPS.put(TokenKind.EQUALS, Operator.EQ);
    BINARY_OPS.put(TokenKind.NOT_EQUALS, Operator.NEQ);
    BINARY_OPS.put(TokenKind.LESS, Operator.LT);
    BINARY_OPS.put(TokenKind.LESS_EQ, Operator.LE);
    BINARY_OPS.put(TokenKind.GREATER, Operator.GT);
    BINARY_OPS.put(TokenKind.GREATER_EQ, Operator.GE);
    BINARY_OPS.put(TokenKind.PLUS, Operator.PLUS);
    BINARY_OPS.put(TokenKind.MINUS, Operator.MINUS);
    BINARY_OPS.put(TokenKind.STAR, Operator.TIMES);
    BINARY_OPS.put(TokenKind.SLASH, Operator.DIVIDE);
  }

  private final ParserOptions options;
  /** Swapped for a scratch collector while re-parsing */
  private Diagnostics diagnostics;
  private final DocCommentAttacher comments;
  /** Significant tokens only, always ending with EOF */
  private final List<Token> tokens;
  private int pos = 0;
  /** Suppress reports until the next successful match */
  private boolean recovering = false;
  /** Nesting depth, for trace output */
  private int depth = 0;
  /**
   * Column of the declaration being parsed.  Recovery inside it stops at
   * a declaration opening a line no further right.
   */
  private int declColumn = Integer.MAX_VALUE;

  Parser(List<Token> allTokens, ParserOptions options) {
    this.options = options;
    this.diagnostics = new Diagnostics(options.getMaxErrors());
    this.tokens = new ArrayList<Token>(allTokens.size() + 1);
    for (Token t: allTokens) {
      if (t.hasError()) {
        diagnostics.lexError(t.getStart(), t.getErrorMessage());
      }
      if (!t.isTrivia() && !t.is(TokenKind.ERROR)
          && !t.is(TokenKind.EOF)) {
        tokens.add(t);
      }
    }
    SourcePosition end = tokens.isEmpty() ? SourcePosition.START :
                              tokens.get(tokens.size() - 1).getEnd();
    if (!allTokens.isEmpty()) {
      Token last = allTokens.get(allTokens.size() - 1);
      if (last.getEnd().compareTo(end) > 0) {
        end = last.getEnd();
      }
    }
    tokens.add(new Token(TokenKind.EOF, "", end, end));
    this.comments = new DocCommentAttacher(allTokens);
  }

  ParseResult parseUnit() {
    List<Theory> theories = new ArrayList<Theory>();
    Map<String, Theory> byName = new HashMap<String, Theory>();
    do {
      if (!theories.isEmpty() && !atTheoryStart()) {
        report(peek(), "expected theory declaration but found "
                       + describe(peek()));
        while (!at(TokenKind.EOF) && !atTheoryStart()) {
          skip();
        }
        if (at(TokenKind.EOF)) {
          break;
        }
      }
      int before = pos;
      Theory theory = parseTheory();
      Theory previous = byName.get(theory.getName());
      if (previous != null && !theory.getName().equals(MISSING_NAME)) {
        diagnostics.syntaxError(theory.getNameSpan().start,
            previous.getNameSpan().start, "duplicate theory name '"
            + theory.getName() + "', first declared at "
            + previous.getNameSpan().start);
      } else {
        byName.put(theory.getName(), theory);
      }
      theories.add(theory);
      if (pos == before) {
        skip();
      }
    } while (!at(TokenKind.EOF));

    attachDangling(theories);
    LogHelper.debug(null, "parsed " + theories.size() + " theories from "
        + tokens.size() + " tokens with " + diagnostics.size()
        + " diagnostics");
    return new ParseResult(theories, diagnostics.getDiagnostics(),
                           diagnostics.droppedErrorCount());
  }

  /**
   * Give each unclaimed documentation comment to the theory it appears
   * in, or follows.
   */
  private void attachDangling(List<Theory> theories) {
    List<List<DocComment>> perTheory = new ArrayList<List<DocComment>>();
    for (int i = 0; i < theories.size(); i++) {
      perTheory.add(new ArrayList<DocComment>());
    }
    for (DocComment c: comments.unclaimed()) {
      int owner = 0;
      for (int i = 0; i < theories.size(); i++) {
        if (theories.get(i).getSpan().start.compareTo(c.getSpan().start) <= 0) {
          owner = i;
        }
      }
      perTheory.get(owner).add(c);
    }
    for (int i = 0; i < theories.size(); i++) {
      if (!perTheory.get(i).isEmpty()) {
        theories.set(i, theories.get(i).withDanglingComments(perTheory.get(i)));
      }
    }
  }

  /*
   * Theory structure
   */

  private Theory parseTheory() {
    Token first = peek();
    LogHelper.trace(depth, first.getStart(), "theory " + first.getText());
    declColumn = first.getStart().column;
    String name = MISSING_NAME;
    SourceSpan nameSpan = first.getSpan();
    List<Param> params = new ArrayList<Param>();
    try {
      Token nameTok = expect(TokenKind.IDENTIFIER, "theory name");
      name = nameTok.getText();
      nameSpan = nameTok.getSpan();
      if (at(TokenKind.LBRACKET)) {
        next();
        params = parseParamList(TokenKind.RBRACKET, true);
      }
      expect(TokenKind.COLON, null);
      expect(TokenKind.THEORY, null);
      expect(TokenKind.BEGIN, null);
    } catch (ParseFailure f) {
      syncHeader();
    }

    List<FormulaDecl> assumptions = new ArrayList<FormulaDecl>();
    List<Importing> importings = new ArrayList<Importing>();
    List<Decl> decls = new ArrayList<Decl>();
    boolean bodyStarted = false;
    depth++;
    while (!at(TokenKind.END) && !at(TokenKind.EOF)
           && !atTheoryHeader()) {
      int before = pos;
      try {
        if (at(TokenKind.ASSUMING)) {
          if (bodyStarted) {
            diagnostics.syntaxError(peek().getStart(), "ASSUMING block must "
                + "come before importings and declarations");
          }
          parseAssuming(assumptions);
        } else if (at(TokenKind.IMPORTING)) {
          parseImportings(importings);
        } else if (at(TokenKind.IDENTIFIER)) {
          parseDeclarations(decls);
        } else {
          throw fail(peek(), "expected declaration or END but found "
                             + describe(peek()));
        }
        accept(TokenKind.SEMICOLON);
      } catch (ParseFailure f) {
        syncBody();
      }
      if (pos == before) {
        skip();
      }
      bodyStarted = true;
    }
    depth--;

    String endName = null;
    SourceSpan endNameSpan = null;
    if (accept(TokenKind.END)) {
      if (at(TokenKind.IDENTIFIER)) {
        Token endTok = next();
        endName = endTok.getText();
        endNameSpan = endTok.getSpan();
        if (!endName.equals(name)) {
          diagnostics.syntaxError(endTok.getStart(), nameSpan.start,
              "closing name '" + endName + "' at " + endTok.getStart()
              + " does not match theory name '" + name + "' at "
              + nameSpan.start);
        }
      } else {
        report(peek(), "expected theory name '" + name + "' after END "
                       + "but found " + describe(peek()));
      }
    } else {
      report(peek(), "expected END for theory '" + name + "' but found "
                     + describe(peek()));
    }

    return new Theory(spanFrom(first), name, nameSpan, params, assumptions,
                      importings, decls, endName, endNameSpan,
                      comments.claim(first), new ArrayList<DocComment>());
  }

  private void parseAssuming(List<FormulaDecl> assumptions) {
    expect(TokenKind.ASSUMING, null);
    while (!at(TokenKind.ENDASSUMING) && !at(TokenKind.END)
           && !at(TokenKind.EOF)) {
      int before = pos;
      try {
        assumptions.add(parseNamedFormula());
        accept(TokenKind.SEMICOLON);
      } catch (ParseFailure f) {
        syncBody();
      }
      if (pos == before && !atBodyKeyword()) {
        skip();
      } else if (pos == before) {
        break;
      }
    }
    if (!accept(TokenKind.ENDASSUMING)) {
      report(peek(), "expected ENDASSUMING but found " + describe(peek()));
    }
  }

  private FormulaDecl parseNamedFormula() {
    declColumn = peek().getStart().column;
    Token nameTok = expect(TokenKind.IDENTIFIER, "assumption name");
    expect(TokenKind.COLON, null);
    FormulaKind kind = FORMULA_KINDS.get(peek().getKind());
    if (kind == null) {
      throw fail(peek(), "expected ASSUMPTION, LEMMA or AXIOM but found "
                         + describe(peek()));
    }
    next();
    Expr formula = parseExpr();
    return new FormulaDecl(spanFrom(nameTok), nameTok.getText(),
        nameTok.getSpan(), comments.claim(nameTok), kind, formula);
  }

  private void parseImportings(List<Importing> importings) {
    Token start = expect(TokenKind.IMPORTING, null);
    do {
      Token nameTok = expect(TokenKind.IDENTIFIER, "theory name");
      List<Expr> actuals = new ArrayList<Expr>();
      if (at(TokenKind.LBRACKET)) {
        next();
        actuals = parseExprList(TokenKind.RBRACKET);
      }
      importings.add(new Importing(spanFrom(start), nameTok.getText(),
                                   nameTok.getSpan(), actuals));
      start = peek(1);
    } while (accept(TokenKind.COMMA));
  }

  /**
   * Parse one declaration, or several for {@code a, b: VAR T}
   */
  private void parseDeclarations(List<Decl> decls) {
    Token first = peek();
    LogHelper.trace(depth, first.getStart(), "declaration " + first.getText());
    declColumn = first.getStart().column;
    List<Token> names = new ArrayList<Token>();
    names.add(expect(TokenKind.IDENTIFIER, "declaration name"));
    while (accept(TokenKind.COMMA)) {
      names.add(expect(TokenKind.IDENTIFIER, "declaration name"));
    }
    List<ParamClause> clauses = new ArrayList<ParamClause>();
    if (names.size() == 1) {
      while (at(TokenKind.LPAREN)) {
        clauses.add(parseParamClause());
      }
    }

    if (!at(TokenKind.COLON) && !at(TokenKind.EQUALS)) {
      throw fail(peek(), "expected ':' after '" + first.getText()
                         + "' but found " + describe(peek()));
    }

    List<Decl> parsed = new ArrayList<Decl>(names.size());
    if (accept(TokenKind.COLON)) {
      if (at(TokenKind.TYPE)) {
        Token typeKw = next();
        boolean nonEmpty = accept(TokenKind.PLUS);
        TypeExpr definition = null;
        int defStart = pos;
        if (accept(TokenKind.EQUALS)) {
          defStart = pos;
          definition = parseTypeExpr();
        }
        if (!clauses.isEmpty()) {
          diagnostics.syntaxError(typeKw.getStart(),
              "type declaration '" + first.getText()
              + "' cannot take parameters");
        }
        for (int i = 0; i < names.size(); i++) {
          Token n = names.get(i);
          parsed.add(new TypeDecl(spanFrom(n), n.getText(), n.getSpan(),
              noComments(), typeFor(i, definition, defStart), nonEmpty));
        }
      } else if (FORMULA_KINDS.containsKey(peek().getKind())) {
        FormulaKind kind = FORMULA_KINDS.get(next().getKind());
        int formulaStart = pos;
        Expr formula = parseExpr();
        for (int i = 0; i < names.size(); i++) {
          Token n = names.get(i);
          parsed.add(new FormulaDecl(spanFrom(n), n.getText(), n.getSpan(),
              noComments(), kind, exprFor(i, formula, formulaStart)));
        }
      } else if (accept(TokenKind.VAR)) {
        int typeStart = pos;
        TypeExpr type = parseTypeExpr();
        for (int i = 0; i < names.size(); i++) {
          Token n = names.get(i);
          parsed.add(new VarDecl(spanFrom(n), n.getText(), n.getSpan(),
                                 noComments(), typeFor(i, type, typeStart)));
        }
      } else {
        int typeStart = pos;
        TypeExpr type = parseTypeExpr();
        Expr body = null;
        int bodyStart = pos;
        if (accept(TokenKind.EQUALS)) {
          bodyStart = pos;
          body = parseExpr();
        }
        for (int i = 0; i < names.size(); i++) {
          Token n = names.get(i);
          parsed.add(new ConstDecl(spanFrom(n), n.getText(), n.getSpan(),
              noComments(), clauses, typeFor(i, type, typeStart),
              exprFor(i, body, bodyStart)));
        }
      }
    } else {
      expect(TokenKind.EQUALS, null);
      int bodyStart = pos;
      Expr body = parseExpr();
      for (int i = 0; i < names.size(); i++) {
        Token n = names.get(i);
        parsed.add(new ConstDecl(spanFrom(n), n.getText(), n.getSpan(),
            noComments(), clauses, null, exprFor(i, body, bodyStart)));
      }
    }

    // Claim comments only once the declaration is complete, so that
    // comments before a broken declaration stay with the theory
    List<DocComment> docs = comments.claim(first);
    if (!docs.isEmpty()) {
      parsed.set(0, withComments(parsed.get(0), docs));
    }
    decls.addAll(parsed);
  }

  /**
   * The i-th of several names sharing one written type gets the type
   * parsed at start again, so that every node has a single parent.
   */
  private TypeExpr typeFor(int i, TypeExpr parsed, int start) {
    if (i == 0 || parsed == null) {
      return parsed;
    }
    int resume = pos;
    Diagnostics reported = diagnostics;
    boolean wasRecovering = recovering;
    pos = start;
    diagnostics = new Diagnostics();
    try {
      TypeExpr copy = parseTypeExpr();
      checkResumed(resume);
      return copy;
    } finally {
      diagnostics = reported;
      recovering = wasRecovering;
      pos = resume;
    }
  }

  /**
   * Expression counterpart of {@link #typeFor}
   */
  private Expr exprFor(int i, Expr parsed, int start) {
    if (i == 0 || parsed == null) {
      return parsed;
    }
    int resume = pos;
    Diagnostics reported = diagnostics;
    boolean wasRecovering = recovering;
    pos = start;
    diagnostics = new Diagnostics();
    try {
      Expr copy = parseExpr();
      checkResumed(resume);
      return copy;
    } finally {
      diagnostics = reported;
      recovering = wasRecovering;
      pos = resume;
    }
  }

  private void checkResumed(int resume) {
    if (pos != resume) {
      throw new ParserInternalError("re-parse ended at token " + pos
                                    + ", first parse at " + resume);
    }
  }

  private static List<DocComment> noComments() {
    return new ArrayList<DocComment>(0);
  }

  private static Decl withComments(Decl d, List<DocComment> docs) {
    switch (d.getKind()) {
      case TYPE_DECL: {
        TypeDecl t = (TypeDecl)d;
        return new TypeDecl(t.getSpan(), t.getName(), t.getNameSpan(), docs,
                            t.getDefinition(), t.isNonEmpty());
      }
      case CONST_DECL: {
        ConstDecl c = (ConstDecl)d;
        return new ConstDecl(c.getSpan(), c.getName(), c.getNameSpan(), docs,
                             c.getClauses(), c.getReturnType(), c.getBody());
      }
      case FORMULA_DECL: {
        FormulaDecl f = (FormulaDecl)d;
        return new FormulaDecl(f.getSpan(), f.getName(), f.getNameSpan(),
                               docs, f.getFormulaKind(), f.getFormula());
      }
      case VAR_DECL: {
        VarDecl v = (VarDecl)d;
        return new VarDecl(v.getSpan(), v.getName(), v.getNameSpan(), docs,
                           v.getType());
      }
      default:
        throw new ParserInternalError(
            "Unexpected declaration kind " + d.getKind());
    }
  }

  /*
   * Parameters
   */

  private ParamClause parseParamClause() {
    Token open = expect(TokenKind.LPAREN, null);
    List<Param> params = parseParamList(TokenKind.RPAREN, false);
    return new ParamClause(spanFrom(open), params);
  }

  /**
   * Parse parameters up to and including the closing token.  Names
   * without their own type take the next type given, so
   * {@code x, y: int} types both.
   * @param theoryParams allow {@code T: TYPE} and require every
   *        parameter to be typed
   */
  private List<Param> parseParamList(TokenKind close, boolean theoryParams) {
    List<Param> params = new ArrayList<Param>();
    List<Token> untyped = new ArrayList<Token>();
    try {
      do {
        untyped.add(expect(TokenKind.IDENTIFIER, "parameter name"));
        if (accept(TokenKind.COLON)) {
          if (theoryParams && at(TokenKind.TYPE)) {
            next();
            boolean nonEmpty = accept(TokenKind.PLUS);
            for (Token n: untyped) {
              params.add(Param.typeParameter(spanFrom(n), n.getText(),
                                             n.getSpan(), nonEmpty));
            }
          } else {
            int typeStart = pos;
            TypeExpr type = parseTypeExpr();
            for (int i = 0; i < untyped.size(); i++) {
              Token n = untyped.get(i);
              params.add(new Param(spanFrom(n), n.getText(), n.getSpan(),
                                   typeFor(i, type, typeStart)));
            }
          }
          untyped.clear();
        }
      } while (accept(TokenKind.COMMA));
      for (Token n: untyped) {
        if (theoryParams) {
          diagnostics.syntaxError(n.getStart(), "theory parameter '"
                                  + n.getText() + "' needs a type");
        }
        params.add(new Param(n.getSpan(), n.getText(), n.getSpan(), null));
      }
      expect(close, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, close);
    }
    checkUniqueParams(params);
    return params;
  }

  private void checkUniqueParams(List<Param> params) {
    Map<String, Param> seen = new HashMap<String, Param>();
    for (Param p: params) {
      Param prev = seen.get(p.getName());
      if (prev != null) {
        diagnostics.syntaxError(p.getNameSpan().start,
            prev.getNameSpan().start, "duplicate parameter name '"
            + p.getName() + "', first declared at "
            + prev.getNameSpan().start);
      } else {
        seen.put(p.getName(), p);
      }
    }
  }

  /*
   * Type expressions: the opening token decides the alternative
   */

  private TypeExpr parseTypeExpr() {
    Token t = peek();
    switch (t.getKind()) {
      case LBRACE:
        return parsePredicateSubtype();
      case LRECORD:
        return parseRecordType();
      case LBRACKET:
        return parseBracketType();
      case LPAREN: {
        next();
        Expr predicate;
        try {
          predicate = parseExpr();
          expect(TokenKind.RPAREN, null);
        } catch (ParseFailure f) {
          recoverOrRethrow(f, TokenKind.RPAREN);
          predicate = new ErrorExpr(spanFrom(t));
        }
        return PredicateSubtype.shorthand(spanFrom(t), predicate);
      }
      case IDENTIFIER: {
        next();
        List<Expr> actuals = new ArrayList<Expr>();
        if (at(TokenKind.LBRACKET)) {
          next();
          actuals = parseExprList(TokenKind.RBRACKET);
        } else if (at(TokenKind.LPAREN)) {
          next();
          actuals = parseExprList(TokenKind.RPAREN);
        }
        return new NamedType(spanFrom(t), t.getText(), actuals);
      }
      default:
        throw fail(t, "expected type expression but found " + describe(t));
    }
  }

  private TypeExpr parsePredicateSubtype() {
    Token open = expect(TokenKind.LBRACE, null);
    try {
      Token binder = expect(TokenKind.IDENTIFIER, "bound variable");
      expect(TokenKind.COLON, null);
      TypeExpr base = parseTypeExpr();
      expect(TokenKind.BAR, null);
      Expr predicate = parseExpr();
      expect(TokenKind.RBRACE, null);
      return new PredicateSubtype(spanFrom(open), binder.getText(), base,
                                  predicate);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, TokenKind.RBRACE);
      return PredicateSubtype.shorthand(spanFrom(open),
                                        new ErrorExpr(spanFrom(open)));
    }
  }

  private TypeExpr parseRecordType() {
    Token open = expect(TokenKind.LRECORD, null);
    List<FieldDecl> fields = new ArrayList<FieldDecl>();
    try {
      do {
        Token nameTok = expect(TokenKind.IDENTIFIER, "field name");
        expect(TokenKind.COLON, null);
        TypeExpr type = parseTypeExpr();
        fields.add(new FieldDecl(spanFrom(nameTok), nameTok.getText(),
                                 nameTok.getSpan(), type));
      } while (accept(TokenKind.COMMA));
      expect(TokenKind.RRECORD, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, TokenKind.RRECORD);
    }

    Map<String, FieldDecl> seen = new HashMap<String, FieldDecl>();
    for (FieldDecl field: fields) {
      FieldDecl prev = seen.get(field.getName());
      if (prev != null) {
        diagnostics.syntaxError(field.getNameSpan().start,
            prev.getNameSpan().start, "duplicate field '" + field.getName()
            + "' in record type, first declared at "
            + prev.getNameSpan().start);
      } else {
        seen.put(field.getName(), field);
      }
    }
    return new RecordType(spanFrom(open), fields);
  }

  /**
   * {@code [A, B -> C]} or {@code [A, B]}
   */
  private TypeExpr parseBracketType() {
    Token open = expect(TokenKind.LBRACKET, null);
    List<TypeExpr> components = new ArrayList<TypeExpr>();
    TypeExpr range = null;
    try {
      do {
        components.add(parseTypeExpr());
      } while (accept(TokenKind.COMMA));
      if (accept(TokenKind.ARROW)) {
        range = parseTypeExpr();
      }
      expect(TokenKind.RBRACKET, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, TokenKind.RBRACKET);
    }
    if (range != null) {
      return new FunctionType(spanFrom(open), components, range);
    }
    return new TupleType(spanFrom(open), components);
  }

  /*
   * Expressions
   */

  Expr parseExpr() {
    return parseBinary(Operator.IMPLIES.precedence());
  }

  /**
   * Precedence climbing: parse operators binding at least as tightly as
   * minPrec.
   */
  private Expr parseBinary(int minPrec) {
    Expr left = parseUnary();
    while (true) {
      Operator op = BINARY_OPS.get(peek().getKind());
      if (op == null || op.precedence() < minPrec) {
        return left;
      }
      next();
      int nextMin = op.isRightAssoc() ? op.precedence()
                                      : op.precedence() + 1;
      Expr right = parseBinary(nextMin);
      left = new BinaryOp(op, left, right);
    }
  }

  private Expr parseUnary() {
    Token t = peek();
    if (t.is(TokenKind.NOT)) {
      next();
      Expr operand = parseBinary(Operator.NOT.precedence());
      return new UnaryOp(spanFrom(t), Operator.NOT, operand);
    } else if (t.is(TokenKind.MINUS)) {
      next();
      Expr operand = parseBinary(Operator.NEGATE.precedence());
      return new UnaryOp(spanFrom(t), Operator.NEGATE, operand);
    }
    return parsePostfix();
  }

  /**
   * Application, field selection and WITH updates bind tightest
   */
  private Expr parsePostfix() {
    Token start = peek();
    Expr e = parsePrimary();
    while (true) {
      if (at(TokenKind.LPAREN)) {
        next();
        List<Expr> args = parseExprList(TokenKind.RPAREN);
        e = new Application(spanFrom(start), e, args);
      } else if (at(TokenKind.BACKTICK)) {
        next();
        Token field = peek();
        if (!field.is(TokenKind.IDENTIFIER) && !field.is(TokenKind.NUMBER)) {
          throw fail(field, "expected field name after '`' but found "
                            + describe(field));
        }
        next();
        e = new FieldSelect(spanFrom(start), e, field.getText());
      } else if (at(TokenKind.WITH)) {
        next();
        expect(TokenKind.LBRACKET, null);
        List<FieldAssignment> assignments =
                          parseAssignments(TokenKind.RBRACKET);
        e = new Update(spanFrom(start), e, assignments);
      } else {
        return e;
      }
    }
  }

  private Expr parsePrimary() {
    Token t = peek();
    switch (t.getKind()) {
      case NUMBER:
        next();
        return new Literal(t.getSpan(), LiteralKind.NUMBER, t.getText());
      case STRING:
        next();
        return new Literal(t.getSpan(), LiteralKind.STRING, t.getText());
      case TRUE:
      case FALSE:
        next();
        return new Literal(t.getSpan(), LiteralKind.BOOLEAN, t.getText());
      case IDENTIFIER:
        next();
        return new Name(t.getSpan(), t.getText());
      case LPAREN: {
        next();
        List<Expr> elements = parseExprList(TokenKind.RPAREN);
        if (elements.size() == 1) {
          return elements.get(0);
        }
        return new Tuple(spanFrom(t), elements);
      }
      case LRECORD:
        next();
        return new RecordLiteral(spanFrom(t),
                                 parseAssignments(TokenKind.RRECORD));
      case LPAREN_HASH:
        next();
        return new RecordLiteral(spanFrom(t),
                                 parseAssignments(TokenKind.RPAREN_HASH));
      case IF:
        return parseIf();
      case COND:
        return parseCond();
      case LAMBDA:
      case FORALL:
      case EXISTS:
        return parseBinding();
      case LET:
        return parseLet();
      default:
        throw fail(t, "expected expression but found " + describe(t));
    }
  }

  /**
   * One or more comma separated expressions, then the closing token
   */
  private List<Expr> parseExprList(TokenKind close) {
    List<Expr> result = new ArrayList<Expr>();
    Token start = peek();
    try {
      do {
        result.add(parseExpr());
      } while (accept(TokenKind.COMMA));
      expect(close, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, close);
      result.add(new ErrorExpr(spanFrom(start)));
    }
    return result;
  }

  /**
   * {@code f1 := e1, f2 := e2} then the closing token.  Repeated field
   * names are kept as written.
   */
  private List<FieldAssignment> parseAssignments(TokenKind close) {
    List<FieldAssignment> result = new ArrayList<FieldAssignment>();
    try {
      do {
        Token field = expect(TokenKind.IDENTIFIER, "field name");
        expect(TokenKind.ASSIGN, null);
        Expr value = parseExpr();
        result.add(new FieldAssignment(spanFrom(field), field.getText(),
                                       field.getSpan(), value));
      } while (accept(TokenKind.COMMA));
      expect(close, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, close);
    }

    if (options.warnDuplicateFields()) {
      Map<String, FieldAssignment> seen =
                            new HashMap<String, FieldAssignment>();
      for (FieldAssignment a: result) {
        if (seen.containsKey(a.getField())) {
          diagnostics.warning(a.getFieldSpan().start, "field '"
              + a.getField() + "' is assigned more than once");
        } else {
          seen.put(a.getField(), a);
        }
      }
    }
    return result;
  }

  private Expr parseIf() {
    Token kw = expect(TokenKind.IF, null);
    try {
      Expr cond = parseExpr();
      expect(TokenKind.THEN, null);
      Expr thenExpr = parseExpr();
      Expr elseExpr = parseElse();
      expect(TokenKind.ENDIF, null);
      return new If(spanFrom(kw), cond, thenExpr, elseExpr);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, TokenKind.ENDIF);
      return new ErrorExpr(spanFrom(kw));
    }
  }

  /**
   * ELSIF chains become nested IF nodes
   */
  private Expr parseElse() {
    if (at(TokenKind.ELSIF)) {
      Token kw = next();
      Expr cond = parseExpr();
      expect(TokenKind.THEN, null);
      Expr thenExpr = parseExpr();
      Expr elseExpr = parseElse();
      return new If(spanFrom(kw), cond, thenExpr, elseExpr);
    }
    if (!at(TokenKind.ELSE)) {
      throw fail(peek(), "expected ELSE branch of IF but found "
                         + describe(peek()));
    }
    next();
    return parseExpr();
  }

  private Expr parseCond() {
    Token kw = expect(TokenKind.COND, null);
    List<CondBranch> branches = new ArrayList<CondBranch>();
    try {
      do {
        Token start = peek();
        Expr guard = null;
        if (!accept(TokenKind.ELSE)) {
          guard = parseExpr();
        }
        expect(TokenKind.ARROW, null);
        Expr value = parseExpr();
        branches.add(new CondBranch(spanFrom(start), guard, value));
      } while (accept(TokenKind.COMMA));
      expect(TokenKind.ENDCOND, null);
    } catch (ParseFailure f) {
      recoverOrRethrow(f, TokenKind.ENDCOND);
    }

    // An ELSE anywhere but last is reported and left out of the tree
    List<CondBranch> kept = new ArrayList<CondBranch>(branches.size());
    for (int i = 0; i < branches.size(); i++) {
      CondBranch b = branches.get(i);
      if (b.isElse() && i != branches.size() - 1) {
        diagnostics.syntaxError(b.getSpan().start,
                        "ELSE must be the last branch of COND");
      } else {
        kept.add(b);
      }
    }
    return new Cond(spanFrom(kw), kept);
  }

  private Expr parseBinding() {
    Token kw = next();
    BindingKind kind;
    switch (kw.getKind()) {
      case LAMBDA:
        kind = BindingKind.LAMBDA;
        break;
      case FORALL:
        kind = BindingKind.FORALL;
        break;
      case EXISTS:
        kind = BindingKind.EXISTS;
        break;
      default:
        throw new ParserInternalError(
            "Not a binding keyword: " + kw);
    }
    List<Param> bindings = new ArrayList<Param>();
    if (at(TokenKind.LPAREN)) {
      // (x: A)(y: B) or (x: A), (y: B)
      while (true) {
        bindings.addAll(parseParamClause().getParams());
        if (at(TokenKind.COMMA) && peek(1).is(TokenKind.LPAREN)) {
          next();
        } else if (!at(TokenKind.LPAREN)) {
          break;
        }
      }
    } else {
      do {
        Token n = expect(TokenKind.IDENTIFIER, "bound variable");
        bindings.add(new Param(n.getSpan(), n.getText(), n.getSpan(), null));
      } while (accept(TokenKind.COMMA));
    }
    expect(TokenKind.COLON, null);
    Expr body = parseExpr();
    return new Binding(spanFrom(kw), kind, bindings, body);
  }

  private Expr parseLet() {
    Token kw = expect(TokenKind.LET, null);
    List<LetBinding> bindings = new ArrayList<LetBinding>();
    do {
      Token n = expect(TokenKind.IDENTIFIER, "LET variable");
      TypeExpr type = null;
      if (accept(TokenKind.COLON)) {
        type = parseTypeExpr();
      }
      expect(TokenKind.EQUALS, null);
      Expr value = parseExpr();
      bindings.add(new LetBinding(spanFrom(n), n.getText(), n.getSpan(),
                                  type, value));
    } while (accept(TokenKind.COMMA));
    expect(TokenKind.IN, null);
    Expr body = parseExpr();
    return new Let(spanFrom(kw), bindings, body);
  }

  /*
   * Error recovery
   */

  /**
   * Skip to the closing token of the construct the failure happened in.
   * If found it is consumed and parsing carries on after it; otherwise
   * the failure propagates to the enclosing recovery point.
   */
  private void recoverOrRethrow(ParseFailure f, TokenKind close) {
    int nesting = 0;
    while (!at(TokenKind.EOF)) {
      Token t = peek();
      if (nesting == 0) {
        if (t.is(close)) {
          next();
          return;
        } else if (BODY_KEYWORDS.contains(t.getKind())
                   || CLOSERS.contains(t.getKind())) {
          // Closer belongs to an enclosing construct
          throw f;
        } else if (atNextDeclaration()) {
          throw f;
        }
      }
      if (OPENERS.contains(t.getKind())) {
        nesting++;
      } else if (CLOSERS.contains(t.getKind())) {
        nesting--;
      }
      skip();
    }
    throw f;
  }

  /**
   * Skip to BEGIN (consumed) or anywhere the theory body can resume
   */
  private void syncHeader() {
    while (!at(TokenKind.EOF)) {
      if (at(TokenKind.BEGIN)) {
        skip();
        return;
      } else if (atBodyKeyword() || atDeclarationStart()) {
        return;
      }
      skip();
    }
  }

  /**
   * Skip to the next declaration, body keyword or end of input, outside
   * of any brackets.
   */
  private void syncBody() {
    int nesting = 0;
    while (!at(TokenKind.EOF)) {
      if (nesting == 0 && (atBodyKeyword() || atDeclarationStart())) {
        return;
      }
      Token t = peek();
      if (OPENERS.contains(t.getKind())) {
        nesting++;
      } else if (CLOSERS.contains(t.getKind()) && nesting > 0) {
        nesting--;
      }
      skip();
    }
  }

  /**
   * A declaration start opening its line, at or left of the column of
   * the declaration being parsed.  Continuation lines are indented
   * further and do not count.
   */
  private boolean atNextDeclaration() {
    return atDeclarationStart() && opensLine()
           && peek().getStart().column <= declColumn;
  }

  private boolean opensLine() {
    return pos == 0 ||
           tokens.get(pos - 1).getEnd().line < peek().getStart().line;
  }

  private boolean atTheoryStart() {
    return at(TokenKind.IDENTIFIER) && (peek(1).is(TokenKind.COLON)
                                    || peek(1).is(TokenKind.LBRACKET));
  }

  /**
   * {@code name: THEORY}, i.e. the previous theory is missing its END
   */
  private boolean atTheoryHeader() {
    return at(TokenKind.IDENTIFIER) && peek(1).is(TokenKind.COLON)
           && peek(2).is(TokenKind.THEORY);
  }

  private boolean atBodyKeyword() {
    return BODY_KEYWORDS.contains(peek().getKind());
  }

  /**
   * Heuristic for "a declaration starts here": {@code name :}, or a name
   * opening its line followed by a parameter clause or another name.
   */
  private boolean atDeclarationStart() {
    if (!at(TokenKind.IDENTIFIER)) {
      return false;
    }
    Token following = peek(1);
    if (following.is(TokenKind.COLON)) {
      return true;
    }
    return opensLine() && (following.is(TokenKind.LPAREN) ||
                           following.is(TokenKind.COMMA));
  }

  /*
   * Token access
   */

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private boolean at(TokenKind kind) {
    return peek().is(kind);
  }

  /**
   * Consume the current token as a successful match
   */
  private Token next() {
    Token t = peek();
    if (!t.is(TokenKind.EOF)) {
      pos++;
    }
    recovering = false;
    return t;
  }

  /**
   * Discard the current token during recovery
   */
  private void skip() {
    if (!at(TokenKind.EOF)) {
      pos++;
    }
  }

  private boolean accept(TokenKind kind) {
    if (at(kind)) {
      next();
      return true;
    }
    return false;
  }

  /**
   * @param what description of what is expected, or null to use the
   *        token kind
   */
  private Token expect(TokenKind kind, String what) {
    if (at(kind)) {
      return next();
    }
    String expected = what != null ? what : kind.describe();
    throw fail(peek(), "expected " + expected + " but found "
                       + describe(peek()));
  }

  private ParseFailure fail(Token at, String msg) {
    report(at, msg);
    return new ParseFailure();
  }

  private void report(Token at, String msg) {
    if (!recovering) {
      diagnostics.syntaxError(at.getStart(), msg);
    }
    recovering = true;
  }

  /**
   * Span from the start of the given token to the end of the last token
   * consumed.
   */
  private SourceSpan spanFrom(Token start) {
    SourcePosition end = pos > 0 ? tokens.get(pos - 1).getEnd()
                                 : start.getStart();
    if (end.compareTo(start.getStart()) < 0) {
      end = start.getStart();
    }
    return new SourceSpan(start.getStart(), end);
  }

  private static String describe(Token t) {
    switch (t.getKind()) {
      case EOF:
        return "end of input";
      case IDENTIFIER:
        return "identifier '" + t.getText() + "'";
      case NUMBER:
        return "number " + t.getText();
      case STRING:
        return "string " + t.getText();
      default:
        return t.getKind().describe();
    }
  }
}
