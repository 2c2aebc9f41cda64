package exm.pvs.ast;

import java.util.List;

import exm.pvs.ast.Exprs.Expr;
import exm.pvs.ast.TypeExprs.PredicateSubtype;
import exm.pvs.ast.TypeExprs.TypeExpr;

/**
 * Formal parameter of a theory, definition clause or binding.
 *
 * A parameter is either a value parameter with an optional type, or a
 * type parameter ({@code T: TYPE}).  A predicate subtype as the type
 * restricts the parameter's domain.
 */
public class Param extends Node {
  private final String name;
  private final SourceSpan nameSpan;
  /** null if untyped or a type parameter */
  private final TypeExpr type;
  private final boolean typeParameter;
  /** TYPE+ rather than TYPE */
  private final boolean nonEmpty;

  public Param(SourceSpan span, String name, SourceSpan nameSpan,
               TypeExpr type) {
    this(span, name, nameSpan, type, false, false);
  }

  public Param(SourceSpan span, String name, SourceSpan nameSpan,
               TypeExpr type, boolean typeParameter, boolean nonEmpty) {
    super(span);
    this.name = name;
    this.nameSpan = nameSpan;
    this.type = type;
    this.typeParameter = typeParameter;
    this.nonEmpty = nonEmpty;
  }

  public static Param typeParameter(SourceSpan span, String name,
                            SourceSpan nameSpan, boolean nonEmpty) {
    return new Param(span, name, nameSpan, null, true, nonEmpty);
  }

  public String getName() {
    return name;
  }

  public SourceSpan getNameSpan() {
    return nameSpan;
  }

  public TypeExpr getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public boolean isTypeParameter() {
    return typeParameter;
  }

  public boolean isNonEmpty() {
    return nonEmpty;
  }

  /**
   * @return predicate restricting this parameter, or null if its type is
   *        not a predicate subtype
   */
  public Expr getConstraint() {
    if (type instanceof PredicateSubtype) {
      return ((PredicateSubtype)type).getPredicate();
    }
    return null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PARAM;
  }

  @Override
  public List<Node> children() {
    return nodes(type);
  }

  @Override
  public String label() {
    if (typeParameter) {
      return "Param " + name + ": " + (nonEmpty ? "TYPE+" : "TYPE");
    }
    return "Param " + name;
  }
}
