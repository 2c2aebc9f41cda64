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

import java.math.BigInteger;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.TypeExprs.TypeExpr;

/**
 * Expressions.  Every expression carries the span it was parsed from.
 */
public class Exprs {

  public abstract static class Expr extends Node {
    protected Expr(SourceSpan span) {
      super(span);
    }
  }

  /**
   * Built-in operators, with binding strength: higher binds tighter.
   */
  public static enum Operator {
    IMPLIES("=>", 1, true),
    IFF("<=>", 1, false),
    OR("OR", 2, false),
    AND("AND", 3, false),
    NOT("NOT", 4, false),
    EQ("=", 5, false),
    NEQ("/=", 5, false),
    LT("<", 5, false),
    LE("<=", 5, false),
    GT(">", 5, false),
    GE(">=", 5, false),
    PLUS("+", 6, false),
    MINUS("-", 6, false),
    TIMES("*", 7, false),
    DIVIDE("/", 7, false),
    NEGATE("-", 8, false);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssoc;

    Operator(String symbol, int precedence, boolean rightAssoc) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.rightAssoc = rightAssoc;
    }

    public String symbol() {
      return symbol;
    }

    public int precedence() {
      return precedence;
    }

    public boolean isRightAssoc() {
      return rightAssoc;
    }

    public boolean isUnary() {
      return this == NOT || this == NEGATE;
    }
  }

  public static enum LiteralKind {
    NUMBER,
    STRING,
    BOOLEAN,
  }

  public static class Literal extends Expr {
    private final LiteralKind literalKind;
    /** Source text: digits, quoted string, TRUE or FALSE */
    private final String text;

    public Literal(SourceSpan span, LiteralKind literalKind, String text) {
      super(span);
      this.literalKind = literalKind;
      this.text = text;
    }

    public LiteralKind getLiteralKind() {
      return literalKind;
    }

    public String getText() {
      return text;
    }

    public BigInteger getNumber() {
      assert(literalKind == LiteralKind.NUMBER);
      return new BigInteger(text);
    }

    public boolean getBoolean() {
      assert(literalKind == LiteralKind.BOOLEAN);
      return text.equals("TRUE");
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.LITERAL;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Literal " + text;
    }
  }

  /**
   * Reference to a named entity.  Not resolved: a name may denote a
   * constant, function, variable or record field.
   */
  public static class Name extends Expr {
    private final String id;

    public Name(SourceSpan span, String id) {
      super(span);
      this.id = id;
    }

    public String getId() {
      return id;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.NAME;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Name " + id;
    }
  }

  public static class Application extends Expr {
    private final Expr function;
    private final ImmutableList<Expr> args;

    public Application(SourceSpan span, Expr function, List<Expr> args) {
      super(span);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    public Expr getFunction() {
      return function;
    }

    public ImmutableList<Expr> getArgs() {
      return args;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.APPLICATION;
    }

    @Override
    public List<Node> children() {
      return nodes(function, args);
    }

    @Override
    public String label() {
      return "Application";
    }
  }

  public static class BinaryOp extends Expr {
    private final Operator op;
    private final Expr left;
    private final Expr right;

    public BinaryOp(Operator op, Expr left, Expr right) {
      super(left.getSpan().to(right.getSpan()));
      assert(!op.isUnary());
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public Operator getOp() {
      return op;
    }

    public Expr getLeft() {
      return left;
    }

    public Expr getRight() {
      return right;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.BINARY_OP;
    }

    @Override
    public List<Node> children() {
      return nodes(left, right);
    }

    @Override
    public String label() {
      return "BinaryOp " + op.symbol();
    }
  }

  public static class UnaryOp extends Expr {
    private final Operator op;
    private final Expr operand;

    public UnaryOp(SourceSpan span, Operator op, Expr operand) {
      super(span);
      assert(op.isUnary());
      this.op = op;
      this.operand = operand;
    }

    public Operator getOp() {
      return op;
    }

    public Expr getOperand() {
      return operand;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.UNARY_OP;
    }

    @Override
    public List<Node> children() {
      return nodes(operand);
    }

    @Override
    public String label() {
      return "UnaryOp " + op.symbol();
    }
  }

  /**
   * {@code field := value}, inside record literals and WITH updates
   */
  public static class FieldAssignment extends Node {
    private final String field;
    private final SourceSpan fieldSpan;
    private final Expr value;

    public FieldAssignment(SourceSpan span, String field,
                           SourceSpan fieldSpan, Expr value) {
      super(span);
      this.field = field;
      this.fieldSpan = fieldSpan;
      this.value = value;
    }

    public String getField() {
      return field;
    }

    public SourceSpan getFieldSpan() {
      return fieldSpan;
    }

    public Expr getValue() {
      return value;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.FIELD_ASSIGNMENT;
    }

    @Override
    public List<Node> children() {
      return nodes(value);
    }

    @Override
    public String label() {
      return "FieldAssignment " + field;
    }
  }

  /**
   * Record construction.  Repeated field names are kept as written.
   */
  public static class RecordLiteral extends Expr {
    private final ImmutableList<FieldAssignment> fields;

    public RecordLiteral(SourceSpan span, List<FieldAssignment> fields) {
      super(span);
      this.fields = ImmutableList.copyOf(fields);
    }

    public ImmutableList<FieldAssignment> getFields() {
      return fields;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.RECORD_LITERAL;
    }

    @Override
    public List<Node> children() {
      return nodes(fields);
    }

    @Override
    public String label() {
      return "RecordLiteral";
    }
  }

  /**
   * {@code record`field}
   */
  public static class FieldSelect extends Expr {
    private final Expr record;
    private final String field;

    public FieldSelect(SourceSpan span, Expr record, String field) {
      super(span);
      this.record = record;
      this.field = field;
    }

    public Expr getRecord() {
      return record;
    }

    public String getField() {
      return field;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.FIELD_SELECT;
    }

    @Override
    public List<Node> children() {
      return nodes(record);
    }

    @Override
    public String label() {
      return "FieldSelect " + field;
    }
  }

  /**
   * Functional update {@code base WITH [f1 := e1, f2 := e2]}.  The
   * assignments are kept in source order, duplicates included.
   */
  public static class Update extends Expr {
    private final Expr base;
    private final ImmutableList<FieldAssignment> assignments;

    public Update(SourceSpan span, Expr base,
                  List<FieldAssignment> assignments) {
      super(span);
      this.base = base;
      this.assignments = ImmutableList.copyOf(assignments);
    }

    public Expr getBase() {
      return base;
    }

    public ImmutableList<FieldAssignment> getAssignments() {
      return assignments;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.UPDATE;
    }

    @Override
    public List<Node> children() {
      return nodes(base, assignments);
    }

    @Override
    public String label() {
      return "Update";
    }
  }

  /**
   * {@code IF c THEN a ELSE b ENDIF}.  ELSIF chains are nested in the
   * else branch.
   */
  public static class If extends Expr {
    private final Expr condition;
    private final Expr thenExpr;
    private final Expr elseExpr;

    public If(SourceSpan span, Expr condition, Expr thenExpr, Expr elseExpr) {
      super(span);
      this.condition = condition;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    public Expr getCondition() {
      return condition;
    }

    public Expr getThenExpr() {
      return thenExpr;
    }

    public Expr getElseExpr() {
      return elseExpr;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.IF;
    }

    @Override
    public List<Node> children() {
      return nodes(condition, thenExpr, elseExpr);
    }

    @Override
    public String label() {
      return "If";
    }
  }

  public static class CondBranch extends Node {
    /** null for the ELSE branch */
    private final Expr guard;
    private final Expr value;

    public CondBranch(SourceSpan span, Expr guard, Expr value) {
      super(span);
      this.guard = guard;
      this.value = value;
    }

    public Expr getGuard() {
      return guard;
    }

    public Expr getValue() {
      return value;
    }

    public boolean isElse() {
      return guard == null;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.COND_BRANCH;
    }

    @Override
    public List<Node> children() {
      return nodes(guard, value);
    }

    @Override
    public String label() {
      return isElse() ? "CondBranch ELSE" : "CondBranch";
    }
  }

  /**
   * Multi-branch conditional.  Branches are in source order; at most one
   * is an ELSE branch and if present it is the last.
   */
  public static class Cond extends Expr {
    private final ImmutableList<CondBranch> branches;

    public Cond(SourceSpan span, List<CondBranch> branches) {
      super(span);
      this.branches = ImmutableList.copyOf(branches);
      for (int i = 0; i < this.branches.size() - 1; i++) {
        assert(!this.branches.get(i).isElse()) : "ELSE must be last";
      }
    }

    public ImmutableList<CondBranch> getBranches() {
      return branches;
    }

    public boolean hasElse() {
      return !branches.isEmpty() && branches.get(branches.size() - 1).isElse();
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.COND;
    }

    @Override
    public List<Node> children() {
      return nodes(branches);
    }

    @Override
    public String label() {
      return "Cond";
    }
  }

  public static enum BindingKind {
    LAMBDA,
    FORALL,
    EXISTS,
  }

  /**
   * {@code LAMBDA (x: T): e}, {@code FORALL (x: T): p} and
   * {@code EXISTS (x: T): p}
   */
  public static class Binding extends Expr {
    private final BindingKind bindingKind;
    private final ImmutableList<Param> bindings;
    private final Expr body;

    public Binding(SourceSpan span, BindingKind bindingKind,
                   List<Param> bindings, Expr body) {
      super(span);
      this.bindingKind = bindingKind;
      this.bindings = ImmutableList.copyOf(bindings);
      this.body = body;
    }

    public BindingKind getBindingKind() {
      return bindingKind;
    }

    public ImmutableList<Param> getBindings() {
      return bindings;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.BINDING;
    }

    @Override
    public List<Node> children() {
      return nodes(bindings, body);
    }

    @Override
    public String label() {
      return "Binding " + bindingKind;
    }
  }

  public static class LetBinding extends Node {
    private final String name;
    private final SourceSpan nameSpan;
    private final TypeExpr type;
    private final Expr value;

    public LetBinding(SourceSpan span, String name, SourceSpan nameSpan,
                      TypeExpr type, Expr value) {
      super(span);
      this.name = name;
      this.nameSpan = nameSpan;
      this.type = type;
      this.value = value;
    }

    public String getName() {
      return name;
    }

    public SourceSpan getNameSpan() {
      return nameSpan;
    }

    /** @return declared type, or null */
    public TypeExpr getType() {
      return type;
    }

    public Expr getValue() {
      return value;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.LET_BINDING;
    }

    @Override
    public List<Node> children() {
      return nodes(type, value);
    }

    @Override
    public String label() {
      return "LetBinding " + name;
    }
  }

  public static class Let extends Expr {
    private final ImmutableList<LetBinding> bindings;
    private final Expr body;

    public Let(SourceSpan span, List<LetBinding> bindings, Expr body) {
      super(span);
      this.bindings = ImmutableList.copyOf(bindings);
      this.body = body;
    }

    public ImmutableList<LetBinding> getBindings() {
      return bindings;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.LET;
    }

    @Override
    public List<Node> children() {
      return nodes(bindings, body);
    }

    @Override
    public String label() {
      return "Let";
    }
  }

  public static class Tuple extends Expr {
    private final ImmutableList<Expr> elements;

    public Tuple(SourceSpan span, List<Expr> elements) {
      super(span);
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Expr> getElements() {
      return elements;
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.TUPLE;
    }

    @Override
    public List<Node> children() {
      return nodes(elements);
    }

    @Override
    public String label() {
      return "Tuple";
    }
  }

  /**
   * Stands in for an expression that failed to parse.  Only present in
   * trees whose parse reported errors.
   */
  public static class ErrorExpr extends Expr {
    public ErrorExpr(SourceSpan span) {
      super(span);
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.ERROR;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "<error>";
    }
  }
}
