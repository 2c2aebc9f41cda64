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
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.Exprs.Expr;
import exm.pvs.ast.TypeExprs.PredicateSubtype;
import exm.pvs.ast.TypeExprs.TypeExpr;

/**
 * Declarations inside a theory body or ASSUMING block.
 */
public class Decls {

  public abstract static class Decl extends Node {
    private final String name;
    private final SourceSpan nameSpan;
    private final ImmutableList<DocComment> docComments;

    protected Decl(SourceSpan span, String name, SourceSpan nameSpan,
                   List<DocComment> docComments) {
      super(span);
      this.name = name;
      this.nameSpan = nameSpan;
      this.docComments = ImmutableList.copyOf(docComments);
    }

    public String getName() {
      return name;
    }

    public SourceSpan getNameSpan() {
      return nameSpan;
    }

    /**
     * @return documentation comments immediately preceding the
     *        declaration, in source order
     */
    public ImmutableList<DocComment> getDocComments() {
      return docComments;
    }
  }

  /**
   * {@code T: TYPE}, {@code T: TYPE+} or {@code T: TYPE = typeExpr}
   */
  public static class TypeDecl extends Decl {
    /** null for uninterpreted types */
    private final TypeExpr definition;
    private final boolean nonEmpty;

    public TypeDecl(SourceSpan span, String name, SourceSpan nameSpan,
                    List<DocComment> docComments, TypeExpr definition,
                    boolean nonEmpty) {
      super(span, name, nameSpan, docComments);
      this.definition = definition;
      this.nonEmpty = nonEmpty;
    }

    public TypeExpr getDefinition() {
      return definition;
    }

    public boolean isUninterpreted() {
      return definition == null;
    }

    public boolean isNonEmpty() {
      return nonEmpty;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.TYPE_DECL;
    }

    @Override
    public List<Node> children() {
      return nodes(definition);
    }

    @Override
    public String label() {
      return "TypeDecl " + getName() + (nonEmpty ? " (nonempty)" : "");
    }
  }

  /**
   * Constant or function definition, e.g.
   * {@code tick(st: (per_tick)): state = st WITH [...]}.
   * Curried parameter clauses are kept separately, in order.
   */
  public static class ConstDecl extends Decl {
    private final ImmutableList<ParamClause> clauses;
    /** null if no type was given */
    private final TypeExpr returnType;
    /** null for uninterpreted constants */
    private final Expr body;

    public ConstDecl(SourceSpan span, String name, SourceSpan nameSpan,
                     List<DocComment> docComments, List<ParamClause> clauses,
                     TypeExpr returnType, Expr body) {
      super(span, name, nameSpan, docComments);
      this.clauses = ImmutableList.copyOf(clauses);
      this.returnType = returnType;
      this.body = body;
    }

    public ImmutableList<ParamClause> getClauses() {
      return clauses;
    }

    public boolean isFunction() {
      return !clauses.isEmpty();
    }

    public TypeExpr getReturnType() {
      return returnType;
    }

    public Expr getBody() {
      return body;
    }

    public boolean isUninterpreted() {
      return body == null;
    }

    /**
     * @return parameters whose type is a predicate subtype, i.e. those
     *        that restrict the domain of the function
     */
    public List<Param> getDomainRestrictions() {
      List<Param> result = new ArrayList<Param>();
      for (ParamClause clause: clauses) {
        for (Param p: clause.getParams()) {
          if (p.getType() instanceof PredicateSubtype) {
            result.add(p);
          }
        }
      }
      return result;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.CONST_DECL;
    }

    @Override
    public List<Node> children() {
      return nodes(clauses, returnType, body);
    }

    @Override
    public String label() {
      return "ConstDecl " + getName() + ": "
             + TypeExprs.describe(returnType);
    }
  }

  public static enum FormulaKind {
    LEMMA,
    THEOREM,
    ASSUMPTION,
    AXIOM,
  }

  /**
   * {@code name: LEMMA expr} and friends
   */
  public static class FormulaDecl extends Decl {
    private final FormulaKind formulaKind;
    private final Expr formula;

    public FormulaDecl(SourceSpan span, String name, SourceSpan nameSpan,
                       List<DocComment> docComments, FormulaKind formulaKind,
                       Expr formula) {
      super(span, name, nameSpan, docComments);
      this.formulaKind = formulaKind;
      this.formula = formula;
    }

    public FormulaKind getFormulaKind() {
      return formulaKind;
    }

    public Expr getFormula() {
      return formula;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.FORMULA_DECL;
    }

    @Override
    public List<Node> children() {
      return nodes(formula);
    }

    @Override
    public String label() {
      return "FormulaDecl " + formulaKind + " " + getName();
    }
  }

  /**
   * {@code x: VAR T}
   */
  public static class VarDecl extends Decl {
    private final TypeExpr type;

    public VarDecl(SourceSpan span, String name, SourceSpan nameSpan,
                   List<DocComment> docComments, TypeExpr type) {
      super(span, name, nameSpan, docComments);
      this.type = type;
    }

    public TypeExpr getType() {
      return type;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.VAR_DECL;
    }

    @Override
    public List<Node> children() {
      return nodes(type);
    }

    @Override
    public String label() {
      return "VarDecl " + getName();
    }
  }
}
