package exm.pvs.ast;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.pvs.ast.Exprs.Expr;
import exm.pvs.ast.Exprs.Literal;
import exm.pvs.ast.Exprs.LiteralKind;
import exm.pvs.ast.Exprs.Name;
import exm.pvs.ast.Exprs.Operator;
import exm.pvs.ast.Exprs.BinaryOp;
import exm.pvs.ast.Exprs.UnaryOp;

public class TraversalTest {

  private static SourceSpan span(int col, int len) {
    return new SourceSpan(new SourcePosition(col - 1, 1, col),
                          new SourcePosition(col - 1 + len, 1, col + len));
  }

  /** a + -b, built by hand */
  private static Expr sample() {
    Expr a = new Name(span(1, 1), "a");
    Expr b = new Name(span(6, 1), "b");
    Expr neg = new UnaryOp(span(5, 2), Operator.NEGATE, b);
    return new BinaryOp(Operator.PLUS, a, neg);
  }

  @Test
  public void testPreOrder() {
    List<NodeKind> kinds = new ArrayList<NodeKind>();
    for (Node n: Traversal.depthFirst(sample())) {
      kinds.add(n.getKind());
    }
    assertEquals(4, kinds.size());
    assertEquals(NodeKind.BINARY_OP, kinds.get(0));
    assertEquals(NodeKind.NAME, kinds.get(1));
    assertEquals(NodeKind.UNARY_OP, kinds.get(2));
    assertEquals(NodeKind.NAME, kinds.get(3));
  }

  @Test
  public void testRestartable() {
    Iterable<Node> walk = Traversal.depthFirst(sample());
    int first = 0;
    for (@SuppressWarnings("unused") Node n: walk) {
      first++;
    }
    int second = 0;
    for (@SuppressWarnings("unused") Node n: walk) {
      second++;
    }
    assertEquals(first, second);
    assertEquals(4, Traversal.size(sample()));
  }

  @Test
  public void testBinarySpanCoversOperands() {
    Expr e = sample();
    assertEquals(1, e.getSpan().start.column);
    assertEquals(7, e.getSpan().end.column);
  }

  @Test
  public void testLiteralValues() {
    Literal n = new Literal(span(1, 3), LiteralKind.NUMBER, "120");
    assertEquals(120, n.getNumber().intValue());
    Literal t = new Literal(span(1, 4), LiteralKind.BOOLEAN, "TRUE");
    assertEquals(true, t.getBoolean());
  }

  @Test
  public void testPrinterWithoutSpans() {
    String dump = new AstPrinter(false).print(sample());
    String[] lines = dump.split("\n");
    assertEquals(4, lines.length);
    assertEquals("  " + new Name(span(1, 1), "a").label(), lines[1]);
    assertEquals(' ', lines[3].charAt(3));
  }
}
