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
package exm.pvs.common.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import exm.pvs.ast.SourcePosition;
import exm.pvs.common.diag.Diagnostic.Kind;

/**
 * Accumulates diagnostics for a single lex or parse run.  Recording never
 * throws; once the limit is reached further diagnostics are counted but
 * not kept.  Each run owns its own collector.
 */
public class Diagnostics {

  private static final Comparator<Diagnostic> BY_POSITION =
      new Comparator<Diagnostic>() {
        @Override
        public int compare(Diagnostic d1, Diagnostic d2) {
          return d1.getPosition().compareTo(d2.getPosition());
        }
      };

  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private final int limit;
  private int dropped = 0;
  private int droppedErrors = 0;

  public Diagnostics() {
    this(Integer.MAX_VALUE);
  }

  public Diagnostics(int limit) {
    this.limit = limit;
  }

  public void lexError(SourcePosition position, String message) {
    add(position, null, message, Severity.ERROR, Kind.LEXICAL);
  }

  public void syntaxError(SourcePosition position, String message) {
    add(position, null, message, Severity.ERROR, Kind.SYNTAX);
  }

  public void syntaxError(SourcePosition position, SourcePosition related,
                          String message) {
    add(position, related, message, Severity.ERROR, Kind.SYNTAX);
  }

  public void warning(SourcePosition position, String message) {
    add(position, null, message, Severity.WARNING, Kind.SYNTAX);
  }

  private void add(SourcePosition position, SourcePosition related,
                   String message, Severity severity, Kind kind) {
    if (diagnostics.size() >= limit) {
      dropped++;
      if (severity == Severity.ERROR) {
        droppedErrors++;
      }
      return;
    }
    if (position == null) {
      position = SourcePosition.START;
    }
    diagnostics.add(new Diagnostic(position, related,
        message == null ? "" : message,
        severity == null ? Severity.ERROR : severity, kind));
  }

  /**
   * @return all kept diagnostics sorted by source position.  Diagnostics
   *        at the same position keep the order they were recorded in.
   *        If any were dropped, a final note says how many.
   */
  public List<Diagnostic> getDiagnostics() {
    List<Diagnostic> sorted = new ArrayList<Diagnostic>(diagnostics);
    Collections.sort(sorted, BY_POSITION);
    if (dropped > 0) {
      // Last, so that it is the final line of output
      SourcePosition at = sorted.isEmpty() ? SourcePosition.START :
                          sorted.get(sorted.size() - 1).getPosition();
      sorted.add(new Diagnostic(at, null, dropped
          + " further diagnostics suppressed (" + droppedErrors
          + " of them errors)", Severity.NOTE, Kind.SYNTAX));
    }
    return Collections.unmodifiableList(sorted);
  }

  public int errorCount() {
    int count = 0;
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        count++;
      }
    }
    return count;
  }

  public boolean hasErrors() {
    return droppedErrors > 0 || errorCount() > 0;
  }

  /**
   * @return number of diagnostics discarded because of the limit
   */
  public int droppedCount() {
    return dropped;
  }

  /**
   * @return number of errors among the dropped diagnostics
   */
  public int droppedErrorCount() {
    return droppedErrors;
  }

  public int size() {
    return diagnostics.size();
  }
}
