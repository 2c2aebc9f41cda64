package exm.pvs.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.pvs.common.exceptions.InvalidOptionException;
import exm.pvs.parser.ParserOptions;

public class SettingsTest {

  @After
  public void restoreDefaults() {
    System.clearProperty(Settings.MAX_ERRORS);
    Settings.set(Settings.MAX_ERRORS, "100");
    Settings.set(Settings.WARN_DUPLICATE_FIELDS, "false");
    Settings.set(Settings.TAB_WIDTH, "1");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    ParserOptions opts = ParserOptions.fromSettings();
    assertEquals(100, opts.getMaxErrors());
    assertFalse(opts.warnDuplicateFields());
    assertEquals(1, opts.getTabWidth());
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.MAX_ERRORS, "7");
    Settings.initPvsProperties();
    assertEquals(7, ParserOptions.fromSettings().getMaxErrors());
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.WARN_DUPLICATE_FIELDS, "maybe");
    Settings.getBoolean(Settings.WARN_DUPLICATE_FIELDS);
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadLimitRejected() throws InvalidOptionException {
    System.setProperty(Settings.MAX_ERRORS, "0");
    Settings.initPvsProperties();
  }
}
