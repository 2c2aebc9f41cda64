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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.Exprs.Expr;

/**
 * Type expressions.
 *
 * The base class for type expressions is TypeExpr.  The set of
 * subclasses is closed: named types (optionally applied to actuals),
 * record types, predicate subtypes, function types and tuple types.
 */
public class TypeExprs {

  public abstract static class TypeExpr extends Node {
    protected TypeExpr(SourceSpan span) {
      super(span);
    }
  }

  /**
   * Reference to a type by name, e.g. {@code nat} or {@code below(10)}
   */
  public static class NamedType extends TypeExpr {
    private final String name;
    private final ImmutableList<Expr> actuals;

    public NamedType(SourceSpan span, String name, List<Expr> actuals) {
      super(span);
      this.name = name;
      this.actuals = ImmutableList.copyOf(actuals);
    }

    public String getName() {
      return name;
    }

    public ImmutableList<Expr> getActuals() {
      return actuals;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.NAMED_TYPE;
    }

    @Override
    public List<Node> children() {
      return nodes(actuals);
    }

    @Override
    public String label() {
      return "NamedType " + name;
    }
  }

  public static class FieldDecl extends Node {
    private final String name;
    private final SourceSpan nameSpan;
    private final TypeExpr type;

    public FieldDecl(SourceSpan span, String name, SourceSpan nameSpan,
                     TypeExpr type) {
      super(span);
      this.name = name;
      this.nameSpan = nameSpan;
      this.type = type;
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

    @Override
    public NodeKind getKind() {
      return NodeKind.FIELD_DECL;
    }

    @Override
    public List<Node> children() {
      return nodes(type);
    }

    @Override
    public String label() {
      return "Field " + name;
    }
  }

  /**
   * {@code [# f1: T1, f2: T2 #]}, fields in declaration order
   */
  public static class RecordType extends TypeExpr {
    private final ImmutableList<FieldDecl> fields;

    public RecordType(SourceSpan span, List<FieldDecl> fields) {
      super(span);
      this.fields = ImmutableList.copyOf(fields);
    }

    public ImmutableList<FieldDecl> getFields() {
      return fields;
    }

    public FieldDecl getField(String name) {
      for (FieldDecl f: fields) {
        if (f.getName().equals(name)) {
          return f;
        }
      }
      return null;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.RECORD_TYPE;
    }

    @Override
    public List<Node> children() {
      return nodes(fields);
    }

    @Override
    public String label() {
      return "RecordType";
    }
  }

  /**
   * {@code {x: T | P}}.  The shorthand {@code (P)} has neither binder nor
   * base type: it stands for the elements satisfying predicate P.
   */
  public static class PredicateSubtype extends TypeExpr {
    private final String binder;
    private final TypeExpr baseType;
    private final Expr predicate;

    public PredicateSubtype(SourceSpan span, String binder,
                            TypeExpr baseType, Expr predicate) {
      super(span);
      this.binder = binder;
      this.baseType = baseType;
      this.predicate = predicate;
    }

    public static PredicateSubtype shorthand(SourceSpan span, Expr predicate) {
      return new PredicateSubtype(span, null, null, predicate);
    }

    /** @return bound variable name, or null for the (P) shorthand */
    public String getBinder() {
      return binder;
    }

    /** @return base type, or null for the (P) shorthand */
    public TypeExpr getBaseType() {
      return baseType;
    }

    public Expr getPredicate() {
      return predicate;
    }

    public boolean isShorthand() {
      return binder == null;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.PREDICATE_SUBTYPE;
    }

    @Override
    public List<Node> children() {
      return nodes(baseType, predicate);
    }

    @Override
    public String label() {
      return isShorthand() ? "PredicateSubtype (shorthand)"
                           : "PredicateSubtype " + binder;
    }
  }

  /**
   * {@code [D1, D2 -> R]}
   */
  public static class FunctionType extends TypeExpr {
    private final ImmutableList<TypeExpr> domain;
    private final TypeExpr range;

    public FunctionType(SourceSpan span, List<TypeExpr> domain,
                        TypeExpr range) {
      super(span);
      this.domain = ImmutableList.copyOf(domain);
      this.range = range;
    }

    public ImmutableList<TypeExpr> getDomain() {
      return domain;
    }

    public TypeExpr getRange() {
      return range;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.FUNCTION_TYPE;
    }

    @Override
    public List<Node> children() {
      return nodes(domain, range);
    }

    @Override
    public String label() {
      return "FunctionType";
    }
  }

  /**
   * {@code [T1, T2]}
   */
  public static class TupleType extends TypeExpr {
    private final ImmutableList<TypeExpr> components;

    public TupleType(SourceSpan span, List<TypeExpr> components) {
      super(span);
      this.components = ImmutableList.copyOf(components);
    }

    public ImmutableList<TypeExpr> getComponents() {
      return components;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.TUPLE_TYPE;
    }

    @Override
    public List<Node> children() {
      return nodes(components);
    }

    @Override
    public String label() {
      return "TupleType";
    }
  }

  /**
   * Short textual form of a type, for messages.
   */
  public static String describe(TypeExpr type) {
    if (type == null) {
      return "<untyped>";
    }
    switch (type.getKind()) {
      case NAMED_TYPE:
        return ((NamedType)type).getName();
      case RECORD_TYPE: {
        RecordType rec = (RecordType)type;
        String[] fields = new String[rec.getFields().size()];
        for (int i = 0; i < fields.length; i++) {
          FieldDecl f = rec.getFields().get(i);
          fields[i] = f.getName() + ": " + describe(f.getType());
        }
        return "[# " + StringUtils.join(fields, ", ") + " #]";
      }
      case PREDICATE_SUBTYPE: {
        PredicateSubtype sub = (PredicateSubtype)type;
        if (sub.isShorthand()) {
          return "(...)";
        }
        return "{" + sub.getBinder() + ": " + describe(sub.getBaseType())
               + " | ...}";
      }
      case FUNCTION_TYPE: {
        FunctionType fn = (FunctionType)type;
        return "[" + describeAll(fn.getDomain()) + " -> "
               + describe(fn.getRange()) + "]";
      }
      case TUPLE_TYPE:
        return "[" + describeAll(((TupleType)type).getComponents()) + "]";
      default:
        return type.label();
    }
  }

  private static String describeAll(List<TypeExpr> types) {
    String[] parts = new String[types.size()];
    for (int i = 0; i < parts.length; i++) {
      parts[i] = describe(types.get(i));
    }
    return StringUtils.join(parts, ", ");
  }
}
