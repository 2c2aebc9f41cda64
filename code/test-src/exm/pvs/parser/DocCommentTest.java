package exm.pvs.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.pvs.ast.Decls.Decl;
import exm.pvs.ast.Theory;

public class DocCommentTest {

  @Test
  public void testAttachToFollowingDeclaration() {
    ParseResult r = PvsParser.parseSource(
          "%% theory doc %%\n"
        + "t: THEORY BEGIN\n"
        + "  % plain comment, not documentation\n"
        + "  %%\n  about x\n  over two lines\n  %%\n"
        + "  x: nat = 1\n"
        + "  y: nat = 2\n"
        + "END t");
    assertEquals(0, r.getDiagnostics().size());
    Theory t = r.getTheory();
    assertEquals(1, t.getDocComments().size());
    assertEquals("theory doc", t.getDocComments().get(0).getContent());

    Decl x = t.getDeclaration("x");
    assertEquals(1, x.getDocComments().size());
    assertTrue(x.getDocComments().get(0).getContent().startsWith("about x"));
    assertEquals(4, x.getDocComments().get(0).getSpan().start.line);
    assertEquals(0, t.getDeclaration("y").getDocComments().size());
    assertEquals(0, t.getDanglingComments().size());
  }

  @Test
  public void testLineCommentsWithoutClosingMarker() {
    ParseResult r = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "%% doc for x\nx: nat = 1\n%% doc for y\ny: nat = 2\nEND t");
    assertEquals(0, r.getDiagnostics().size());
    Theory t = r.getTheory();
    assertEquals(2, t.getDeclarations().size());
    assertEquals("doc for x",
        t.getDeclaration("x").getDocComments().get(0).getContent());
    assertEquals("doc for y",
        t.getDeclaration("y").getDocComments().get(0).getContent());
  }

  @Test
  public void testConsecutiveComments() {
    Theory t = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "%% one %%\n%% two %%\nx: nat = 1\nEND t").getTheory();
    Decl x = t.getDeclaration("x");
    assertEquals(2, x.getDocComments().size());
    assertEquals("one", x.getDocComments().get(0).getContent());
    assertEquals("two", x.getDocComments().get(1).getContent());
  }

  @Test
  public void testOnlyFirstOfSeveralNamesGetsComment() {
    Theory t = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "%% vars %%\na, b: VAR nat\nEND t").getTheory();
    assertEquals(1, t.getDeclaration("a").getDocComments().size());
    assertEquals(0, t.getDeclaration("b").getDocComments().size());
  }

  @Test
  public void testTrailingCommentIsDangling() {
    Theory t = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "x: nat = 1\n%% trailing note %%\nEND t").getTheory();
    assertEquals(0, t.getDeclaration("x").getDocComments().size());
    assertEquals(1, t.getDanglingComments().size());
    assertEquals("trailing note",
                 t.getDanglingComments().get(0).getContent());
  }

  @Test
  public void testCommentBeforeBrokenDeclarationKept() {
    ParseResult r = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "%% doc for x %%\nx: nat = )\ny: nat = 1\nEND t");
    assertEquals(1, r.getDiagnostics().size());
    Theory t = r.getTheory();
    assertEquals(0, t.getDeclaration("y").getDocComments().size());
    assertEquals(1, t.getDanglingComments().size());
    assertEquals("doc for x", t.getDanglingComments().get(0).getContent());
  }

  @Test
  public void testDanglingGoesToEnclosingTheory() {
    ParseResult r = PvsParser.parseSource(
          "a: THEORY BEGIN %% end of a %% END a\n"
        + "b: THEORY BEGIN END b\n"
        + "%% after everything %%");
    assertEquals(0, r.getDiagnostics().size());
    Theory a = r.getTheories().get(0);
    Theory b = r.getTheories().get(1);
    assertEquals(1, a.getDanglingComments().size());
    assertEquals("end of a", a.getDanglingComments().get(0).getContent());
    assertEquals(1, b.getDanglingComments().size());
    assertEquals("after everything",
                 b.getDanglingComments().get(0).getContent());
  }

  @Test
  public void testAssumptionComment() {
    Theory t = PvsParser.parseSource("t: THEORY BEGIN\n"
        + "ASSUMING\n%% positive %%\na: ASSUMPTION 1 > 0\nENDASSUMING\n"
        + "END t").getTheory();
    assertEquals("positive",
        t.getAssumptions().get(0).getDocComments().get(0).getContent());
  }
}
