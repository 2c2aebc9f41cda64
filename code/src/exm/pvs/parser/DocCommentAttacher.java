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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import exm.pvs.ast.DocComment;
import exm.pvs.lexer.Token;
import exm.pvs.lexer.TokenKind;

/**
 * Associates documentation comments with the declarations they document.
 *
 * Each run of documentation comments is keyed by the first significant
 * token after it.  When the parser starts a declaration at that token it
 * claims the run; anything never claimed is dangling and ends up on the
 * enclosing theory.  Line comments are trivia but are not documentation.
 */
class DocCommentAttacher {

  /** Comments keyed by the token they precede */
  private final ListMultimap<Token, DocComment> pending =
                                        ArrayListMultimap.create();
  /** Every documentation comment, in source order */
  private final List<DocComment> all = new ArrayList<DocComment>();
  private final Map<DocComment, Boolean> claimed =
                                  new IdentityHashMap<DocComment, Boolean>();

  DocCommentAttacher(List<Token> tokens) {
    List<DocComment> run = new ArrayList<DocComment>();
    for (Token t: tokens) {
      if (t.is(TokenKind.DOC_COMMENT)) {
        DocComment c = new DocComment(t.getText(), t.getSpan());
        run.add(c);
        all.add(c);
      } else if (!t.isTrivia() && !t.is(TokenKind.ERROR)) {
        if (!run.isEmpty()) {
          pending.putAll(t, run);
          run.clear();
        }
      }
    }
  }

  /**
   * Claim the comments directly preceding a declaration's first token.
   * @return comments in source order, possibly empty
   */
  List<DocComment> claim(Token declStart) {
    List<DocComment> result = pending.removeAll(declStart);
    for (DocComment c: result) {
      claimed.put(c, Boolean.TRUE);
    }
    return result;
  }

  /**
   * @return comments not claimed by any declaration, in source order
   */
  List<DocComment> unclaimed() {
    ImmutableList.Builder<DocComment> result = ImmutableList.builder();
    for (DocComment c: all) {
      if (!claimed.containsKey(c)) {
        result.add(c);
      }
    }
    return result.build();
  }
}
