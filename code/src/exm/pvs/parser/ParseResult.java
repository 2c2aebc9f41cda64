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

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.Theory;
import exm.pvs.common.diag.Diagnostic;
import exm.pvs.common.exceptions.ParserInternalError;

/**
 * Theories parsed from one compilation unit, with every diagnostic found
 * along the way.  A result always holds at least one theory, even when
 * the input was unusable.
 */
public class ParseResult {
  private final ImmutableList<Theory> theories;
  private final ImmutableList<Diagnostic> diagnostics;
  /** Errors dropped by the diagnostic limit */
  private final int droppedErrors;

  public ParseResult(List<Theory> theories, List<Diagnostic> diagnostics) {
    this(theories, diagnostics, 0);
  }

  public ParseResult(List<Theory> theories, List<Diagnostic> diagnostics,
                     int droppedErrors) {
    if (theories.isEmpty()) {
      throw new ParserInternalError("parse result without a theory");
    }
    this.theories = ImmutableList.copyOf(theories);
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.droppedErrors = droppedErrors;
  }

  /**
   * @return the first theory of the unit
   */
  public Theory getTheory() {
    return theories.get(0);
  }

  public ImmutableList<Theory> getTheories() {
    return theories;
  }

  public Theory getTheory(String name) {
    for (Theory t: theories) {
      if (t.getName().equals(name)) {
        return t;
      }
    }
    return null;
  }

  /**
   * @return lexical and syntax diagnostics ordered by position
   */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  /**
   * @return true if any error was found, including errors left out of
   *        the diagnostics by the limit
   */
  public boolean hasErrors() {
    if (droppedErrors > 0) {
      return true;
    }
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  public int errorCount() {
    int count = droppedErrors;
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        count++;
      }
    }
    return count;
  }
}
