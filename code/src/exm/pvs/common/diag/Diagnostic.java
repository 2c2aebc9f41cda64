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

import exm.pvs.ast.SourcePosition;

/**
 * One problem found in the input, with where it was found.
 */
public class Diagnostic {

  public static enum Kind {
    /** Unrecognised character, unterminated literal or comment */
    LEXICAL,
    /** Token sequence not matching the grammar */
    SYNTAX,
  }

  private final SourcePosition position;
  /** Second position the message refers to, or null */
  private final SourcePosition related;
  private final String message;
  private final Severity severity;
  private final Kind kind;

  public Diagnostic(SourcePosition position, SourcePosition related,
                    String message, Severity severity, Kind kind) {
    this.position = position;
    this.related = related;
    this.message = message;
    this.severity = severity;
    this.kind = kind;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public SourcePosition getRelated() {
    return related;
  }

  public String getMessage() {
    return message;
  }

  public Severity getSeverity() {
    return severity;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /**
   * Compiler-style one line rendering, e.g.
   * <code>pump.pvs:12:3: error: expected ENDCOND</code>
   */
  public String format(String file) {
    return file + ":" + position.line + ":" + position.column + ": "
          + severity.label() + ": " + message;
  }

  @Override
  public String toString() {
    return position + ": " + severity.label() + ": " + message;
  }
}
