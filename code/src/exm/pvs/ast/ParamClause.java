package exm.pvs.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One parenthesised formal parameter list of a definition.  Curried
 * definitions such as {@code f(x, y)(st: state)} have several clauses,
 * kept in order.
 */
public class ParamClause extends Node {
  private final ImmutableList<Param> params;

  public ParamClause(SourceSpan span, List<Param> params) {
    super(span);
    this.params = ImmutableList.copyOf(params);
  }

  public ImmutableList<Param> getParams() {
    return params;
  }

  public int size() {
    return params.size();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PARAM_CLAUSE;
  }

  @Override
  public List<Node> children() {
    return nodes(params);
  }

  @Override
  public String label() {
    return "ParamClause";
  }
}
