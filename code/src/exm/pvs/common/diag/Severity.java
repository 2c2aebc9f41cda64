package exm.pvs.common.diag;

public enum Severity {
  /** Information about the diagnostics themselves, never an error */
  NOTE("note"),
  WARNING("warning"),
  ERROR("error");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
