package exm.pvs.parser;

import exm.pvs.common.Settings;
import exm.pvs.common.exceptions.InvalidOptionException;

/**
 * Immutable snapshot of the settings that affect lexing and parsing, so
 * that concurrent parses share no mutable state.
 */
public class ParserOptions {
  private static final ParserOptions DEFAULTS =
                                      new ParserOptions(100, false, 1);

  private final int maxErrors;
  private final boolean warnDuplicateFields;
  private final int tabWidth;

  public ParserOptions(int maxErrors, boolean warnDuplicateFields,
                       int tabWidth) {
    this.maxErrors = maxErrors;
    this.warnDuplicateFields = warnDuplicateFields;
    this.tabWidth = tabWidth;
  }

  public static ParserOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Snapshot current values from {@link Settings}
   */
  public static ParserOptions fromSettings() throws InvalidOptionException {
    return new ParserOptions(Settings.getInt(Settings.MAX_ERRORS),
                    Settings.getBoolean(Settings.WARN_DUPLICATE_FIELDS),
                    Settings.getInt(Settings.TAB_WIDTH));
  }

  public int getMaxErrors() {
    return maxErrors;
  }

  public boolean warnDuplicateFields() {
    return warnDuplicateFields;
  }

  public int getTabWidth() {
    return tabWidth;
  }

  public ParserOptions withWarnDuplicateFields(boolean warn) {
    return new ParserOptions(maxErrors, warn, tabWidth);
  }
}
