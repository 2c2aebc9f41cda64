package exm.pvs.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import org.apache.commons.io.IOUtils;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.pvs.ast.AstPrinter;
import exm.pvs.ast.Decls.ConstDecl;
import exm.pvs.ast.Exprs.Cond;
import exm.pvs.ast.Exprs.Update;
import exm.pvs.ast.NodeKind;
import exm.pvs.ast.Theory;
import exm.pvs.ast.Traversal;
import exm.pvs.ast.Node;

/**
 * Parse a realistic theory describing an infusion pump state machine.
 */
public class InfusionPumpTest {

  private static String source;

  @BeforeClass
  public static void loadSource() throws IOException {
    InputStream in = InfusionPumpTest.class.getResourceAsStream(
                                                  "infusion_pump.pvs");
    assertNotNull("missing test resource", in);
    try {
      source = IOUtils.toString(in, StandardCharsets.UTF_8);
    } finally {
      in.close();
    }
  }

  @Test
  public void testParsesCleanly() {
    ParseResult r = PvsParser.parseSource(source);
    assertEquals("unexpected diagnostics: " + r.getDiagnostics(),
                 0, r.getDiagnostics().size());
    Theory t = r.getTheory();
    assertEquals("infusion_pump", t.getName());
    assertEquals(2, t.getParams().size());
    assertEquals(1, t.getAssumptions().size());
    assertEquals(3, t.getImportings().size());
    assertEquals(20, t.getDeclarations().size());
    assertEquals(1, t.getDocComments().size());
    assertEquals(1, t.getDanglingComments().size());
    assertEquals(1, t.getDeclaration("state").getDocComments().size());
  }

  @Test
  public void testTransitions() {
    Theory t = PvsParser.parseSource(source).getTheory();

    ConstDecl start = (ConstDecl)t.getDeclaration("start");
    assertEquals(1, start.getDomainRestrictions().size());
    Update u = (Update)start.getBody();
    assertEquals(2, u.getAssignments().size());
    assertEquals("mode", u.getAssignments().get(0).getField());

    ConstDecl step = (ConstDecl)t.getDeclaration("step");
    Cond c = (Cond)step.getBody();
    assertEquals(3, c.getBranches().size());
    assertTrue(c.hasElse());

    ConstDecl setRate = (ConstDecl)t.getDeclaration("set_rate");
    assertEquals(2, setRate.getClauses().size());
    assertEquals(NodeKind.IF, setRate.getBody().getKind());
  }

  @Test
  public void testDeterministic() {
    ParseResult r1 = PvsParser.parseSource(source);
    ParseResult r2 = PvsParser.parseSource(source);
    String dump1 = AstPrinter.printTree(r1.getTheory());
    String dump2 = AstPrinter.printTree(r2.getTheory());
    assertEquals(dump1, dump2);
    assertTrue(dump1.startsWith(
        "%% Limits and machine state of a volumetric infusion pump\n"
        + "Theory infusion_pump ["));
    assertTrue(dump1.contains("%% (dangling) Kept here for reference"));
  }

  @Test
  public void testEveryNodeVisitedOnce() {
    Theory t = PvsParser.parseSource(source).getTheory();
    Set<Node> seen = Collections.newSetFromMap(
                          new IdentityHashMap<Node, Boolean>());
    for (Node n: Traversal.depthFirst(t)) {
      assertTrue(n + " has more than one parent", seen.add(n));
    }
  }

  @Test
  public void testChildSpansNested() {
    Theory t = PvsParser.parseSource(source).getTheory();
    for (Node n: Traversal.depthFirst(t)) {
      for (Node child: n.children()) {
        assertFalse(child + " starts before " + n,
            child.getSpan().start.compareTo(n.getSpan().start) < 0);
        assertFalse(child + " ends after " + n,
            child.getSpan().end.compareTo(n.getSpan().end) > 0);
      }
    }
  }
}
