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
package exm.pvs.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import exm.pvs.ast.Decls.Decl;

/**
 * Indented dump of a syntax tree, one node per line.  This is a debugging
 * aid rather than a printer back to source syntax.
 */
public class AstPrinter {

  private final boolean showSpans;

  public AstPrinter(boolean showSpans) {
    this.showSpans = showSpans;
  }

  public static String printTree(Node root) {
    return new AstPrinter(true).print(root);
  }

  public String print(Node root) {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, root, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, Node tree, int indent) {
    for (DocComment c: docComments(tree)) {
      indent(writer, indent);
      writer.println("%% " + c.getContent());
    }
    indent(writer, indent);
    writer.print(tree.label());
    if (showSpans) {
      writer.print(" [" + tree.getSpan() + "]");
    }
    writer.println();
    for (Node child: tree.children()) {
      printTree(writer, child, indent + 2);
    }
    if (tree instanceof Theory) {
      for (DocComment c: ((Theory)tree).getDanglingComments()) {
        indent(writer, indent + 2);
        writer.println("%% (dangling) " + c.getContent());
      }
    }
  }

  private static List<DocComment> docComments(Node tree) {
    if (tree instanceof Decl) {
      return ((Decl)tree).getDocComments();
    } else if (tree instanceof Theory) {
      return ((Theory)tree).getDocComments();
    }
    return Collections.emptyList();
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }
}
