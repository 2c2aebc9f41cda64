package exm.pvs.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.pvs.common.Settings;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private File write(String name, String contents) throws IOException {
    File f = tmp.newFile(name);
    FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
    return f;
  }

  private ExitCode run(String... args) {
    return Main.run(args, new PrintStream(out, true),
                    new PrintStream(err, true));
  }

  private String errText() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  private String outText() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testCleanFile() throws IOException {
    File f = write("ok.pvs", "t: THEORY BEGIN x: nat = 0 END t\n");
    assertEquals(ExitCode.SUCCESS, run(f.getPath()));
    assertEquals("", errText());
  }

  @Test
  public void testSyntaxErrorReported() throws IOException {
    File f = write("bad.pvs", "t: THEORY BEGIN\nx: nat = )\nEND t\n");
    assertEquals(ExitCode.ERROR_USER, run(f.getPath()));
    assertTrue(errText(), errText().startsWith(f.getPath() + ":2:10: error: "));
  }

  @Test
  public void testTreeDump() throws IOException {
    File f = write("tree.pvs", "t: THEORY BEGIN x: nat = 0 END t\n");
    assertEquals(ExitCode.SUCCESS, run("-t", f.getPath()));
    assertTrue(outText(), outText().startsWith("Theory t ["));
  }

  @Test
  public void testQuietHidesWarnings() throws IOException {
    File f = write("warn.pvs",
        "t: THEORY BEGIN f: LEMMA s WITH [a := 1, a := 2] END t\n");
    assertEquals(ExitCode.SUCCESS, run("-w", f.getPath()));
    assertTrue(errText(), errText().contains("warning: "));

    err.reset();
    assertEquals(ExitCode.SUCCESS, run("-w", "-q", f.getPath()));
    assertEquals("", errText());
  }

  @Test
  public void testWarnFlagOnlyAffectsItsOwnRun() throws IOException {
    File f = write("warn.pvs",
        "t: THEORY BEGIN f: LEMMA s WITH [a := 1, a := 2] END t\n");
    assertEquals(ExitCode.SUCCESS, run("-w", f.getPath()));
    assertTrue(errText(), errText().contains("warning: "));

    err.reset();
    assertEquals(ExitCode.SUCCESS, run(f.getPath()));
    assertEquals("", errText());
    assertEquals("false", Settings.get(Settings.WARN_DUPLICATE_FIELDS));
  }

  @Test
  public void testErrorsBeyondLimitStillFail() throws IOException {
    File f = write("capped.pvs", "t: THEORY BEGIN\n"
        + "f: LEMMA s WITH [a := 1, a := 2, a := 3]\n"
        + "x: nat = )\n"
        + "END t\n");
    System.setProperty(Settings.MAX_ERRORS, "1");
    try {
      assertEquals(ExitCode.ERROR_USER, run("-w", f.getPath()));
    } finally {
      System.clearProperty(Settings.MAX_ERRORS);
      Settings.set(Settings.MAX_ERRORS, "100");
    }
    assertTrue(errText(), errText().contains("warning: "));
    assertTrue(errText(), errText().contains(
               "note: 2 further diagnostics suppressed (1 of them errors)"));
  }

  @Test
  public void testMissingFile() {
    File missing = new File(tmp.getRoot(), "missing.pvs");
    assertEquals(ExitCode.ERROR_IO, run(missing.getPath()));
    assertTrue(errText(), errText().contains("not readable"));
  }

  @Test
  public void testNoArguments() {
    assertEquals(ExitCode.ERROR_COMMAND, run());
  }

  @Test
  public void testUnknownOption() {
    assertEquals(ExitCode.ERROR_COMMAND, run("--bogus", "x.pvs"));
  }
}
