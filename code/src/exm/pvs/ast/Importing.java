package exm.pvs.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pvs.ast.Exprs.Expr;

/**
 * Importing of another theory, possibly instantiated with actuals.
 */
public class Importing extends Node {
  private final String theoryName;
  private final SourceSpan nameSpan;
  private final ImmutableList<Expr> actuals;

  public Importing(SourceSpan span, String theoryName, SourceSpan nameSpan,
                   List<Expr> actuals) {
    super(span);
    this.theoryName = theoryName;
    this.nameSpan = nameSpan;
    this.actuals = ImmutableList.copyOf(actuals);
  }

  public String getTheoryName() {
    return theoryName;
  }

  public SourceSpan getNameSpan() {
    return nameSpan;
  }

  public ImmutableList<Expr> getActuals() {
    return actuals;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IMPORTING;
  }

  @Override
  public List<Node> children() {
    return nodes(actuals);
  }

  @Override
  public String label() {
    return "Importing " + theoryName;
  }
}
