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

import java.util.List;

import exm.pvs.lexer.LexResult;
import exm.pvs.lexer.Lexer;
import exm.pvs.lexer.Token;

/**
 * Entry points for tokenizing and parsing PVS theories.
 *
 * Parsing never throws on bad input: problems come back as diagnostics
 * on the result, next to a best-effort tree.
 */
public class PvsParser {

  public static LexResult tokenize(String source) {
    return tokenize(source, ParserOptions.defaults());
  }

  public static LexResult tokenize(String source, ParserOptions options) {
    return new Lexer(source, options.getTabWidth()).tokenize();
  }

  /**
   * Parse a token sequence, as produced by {@link #tokenize(String)}.
   * Trivia tokens may be included; documentation comments among them are
   * attached to the declarations they precede.  Lexical errors carried by
   * tokens are reported as diagnostics.
   */
  public static ParseResult parse(List<Token> tokens) {
    return parse(tokens, ParserOptions.defaults());
  }

  public static ParseResult parse(List<Token> tokens, ParserOptions options) {
    return new Parser(tokens, options).parseUnit();
  }

  public static ParseResult parseSource(String source) {
    return parseSource(source, ParserOptions.defaults());
  }

  public static ParseResult parseSource(String source,
                                        ParserOptions options) {
    return parse(tokenize(source, options).getTokens(), options);
  }
}
