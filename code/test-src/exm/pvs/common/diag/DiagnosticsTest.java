package exm.pvs.common.diag;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.pvs.ast.SourcePosition;

public class DiagnosticsTest {

  private static SourcePosition pos(int line, int col) {
    return new SourcePosition(0, line, col);
  }

  @Test
  public void testSortedByPosition() {
    Diagnostics d = new Diagnostics();
    d.syntaxError(pos(3, 1), "third");
    d.lexError(pos(1, 5), "first");
    d.warning(pos(2, 2), "second");
    List<Diagnostic> list = d.getDiagnostics();
    assertEquals("first", list.get(0).getMessage());
    assertEquals(Diagnostic.Kind.LEXICAL, list.get(0).getKind());
    assertEquals("second", list.get(1).getMessage());
    assertEquals("third", list.get(2).getMessage());
    assertEquals(2, d.errorCount());
  }

  @Test
  public void testWarningsAreNotErrors() {
    Diagnostics d = new Diagnostics();
    d.warning(pos(1, 1), "careful");
    assertFalse(d.hasErrors());
    assertEquals(1, d.size());
  }

  @Test
  public void testLimit() {
    Diagnostics d = new Diagnostics(1);
    d.warning(pos(1, 1), "kept");
    d.warning(pos(2, 1), "dropped");
    assertFalse(d.hasErrors());
    d.syntaxError(pos(3, 1), "dropped error");
    assertEquals(1, d.size());
    assertEquals(2, d.droppedCount());
    assertEquals(1, d.droppedErrorCount());
    assertTrue(d.hasErrors());

    List<Diagnostic> all = d.getDiagnostics();
    assertEquals(2, all.size());
    assertEquals("kept", all.get(0).getMessage());
    assertEquals(Severity.NOTE, all.get(1).getSeverity());
    assertFalse(all.get(1).isError());
    assertEquals("pump.pvs:1:1: note: 2 further diagnostics suppressed "
                 + "(1 of them errors)", all.get(1).format("pump.pvs"));
  }

  @Test
  public void testFormat() {
    Diagnostics d = new Diagnostics();
    d.syntaxError(pos(12, 3), pos(1, 1), "expected ENDCOND");
    Diagnostic diag = d.getDiagnostics().get(0);
    assertEquals("pump.pvs:12:3: error: expected ENDCOND",
                 diag.format("pump.pvs"));
    assertEquals(pos(1, 1), diag.getRelated());
  }
}
