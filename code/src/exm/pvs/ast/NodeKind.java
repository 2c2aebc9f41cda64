package exm.pvs.ast;

/**
 * Closed set of node kinds, for switching over nodes without casts
 * scattered through client code.
 */
public enum NodeKind {
  THEORY,
  PARAM,
  PARAM_CLAUSE,
  IMPORTING,

  // Declarations
  TYPE_DECL,
  CONST_DECL,
  FORMULA_DECL,
  VAR_DECL,

  // Type expressions
  NAMED_TYPE,
  RECORD_TYPE,
  FIELD_DECL,
  PREDICATE_SUBTYPE,
  FUNCTION_TYPE,
  TUPLE_TYPE,

  // Expressions
  LITERAL,
  NAME,
  APPLICATION,
  BINARY_OP,
  UNARY_OP,
  RECORD_LITERAL,
  FIELD_ASSIGNMENT,
  FIELD_SELECT,
  UPDATE,
  IF,
  COND,
  COND_BRANCH,
  BINDING,
  LET,
  LET_BINDING,
  TUPLE,
  /** Placeholder for input that could not be parsed */
  ERROR,
}
