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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.Decls.Decl;
import exm.pvs.ast.Decls.FormulaDecl;

/**
 * Top level unit: a named, possibly parameterised theory with its
 * assumptions, importings and declarations.
 */
public class Theory extends Node {

  private static final Comparator<Node> SOURCE_ORDER = new Comparator<Node>() {
    @Override
    public int compare(Node n1, Node n2) {
      return n1.getSpan().start.compareTo(n2.getSpan().start);
    }
  };

  private final String name;
  private final SourceSpan nameSpan;
  private final ImmutableList<Param> params;
  private final ImmutableList<FormulaDecl> assumptions;
  private final ImmutableList<Importing> importings;
  private final ImmutableList<Decl> declarations;
  /** Name after END, or null if missing */
  private final String endName;
  private final SourceSpan endNameSpan;
  private final ImmutableList<DocComment> docComments;
  /** Documentation comments not followed by any declaration */
  private final ImmutableList<DocComment> danglingComments;

  public Theory(SourceSpan span, String name, SourceSpan nameSpan,
                List<Param> params, List<FormulaDecl> assumptions,
                List<Importing> importings, List<Decl> declarations,
                String endName, SourceSpan endNameSpan,
                List<DocComment> docComments,
                List<DocComment> danglingComments) {
    super(span);
    this.name = name;
    this.nameSpan = nameSpan;
    this.params = ImmutableList.copyOf(params);
    this.assumptions = ImmutableList.copyOf(assumptions);
    this.importings = ImmutableList.copyOf(importings);
    this.declarations = ImmutableList.copyOf(declarations);
    this.endName = endName;
    this.endNameSpan = endNameSpan;
    this.docComments = ImmutableList.copyOf(docComments);
    this.danglingComments = ImmutableList.copyOf(danglingComments);
  }

  /**
   * @return copy of this theory with the given dangling comments
   */
  public Theory withDanglingComments(List<DocComment> dangling) {
    return new Theory(getSpan(), name, nameSpan, params, assumptions,
                      importings, declarations, endName, endNameSpan,
                      docComments, dangling);
  }

  public String getName() {
    return name;
  }

  public SourceSpan getNameSpan() {
    return nameSpan;
  }

  public ImmutableList<Param> getParams() {
    return params;
  }

  public ImmutableList<FormulaDecl> getAssumptions() {
    return assumptions;
  }

  public ImmutableList<Importing> getImportings() {
    return importings;
  }

  public ImmutableList<Decl> getDeclarations() {
    return declarations;
  }

  /**
   * @return first declaration with the given name, or null
   */
  public Decl getDeclaration(String declName) {
    for (Decl d: declarations) {
      if (d.getName().equals(declName)) {
        return d;
      }
    }
    return null;
  }

  public String getEndName() {
    return endName;
  }

  public SourceSpan getEndNameSpan() {
    return endNameSpan;
  }

  public ImmutableList<DocComment> getDocComments() {
    return docComments;
  }

  public ImmutableList<DocComment> getDanglingComments() {
    return danglingComments;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.THEORY;
  }

  /**
   * Importings may be interleaved with declarations, so children are
   * merged back into source order.
   */
  @Override
  public List<Node> children() {
    List<Node> result = new ArrayList<Node>(nodes(params, assumptions,
                                           importings, declarations));
    Collections.sort(result, SOURCE_ORDER);
    return result;
  }

  @Override
  public String label() {
    return "Theory " + name;
  }
}
