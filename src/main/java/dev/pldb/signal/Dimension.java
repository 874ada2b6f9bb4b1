package dev.pldb.signal;

/** The four signals every entity is ranked on. */
public enum Dimension {
  JOBS("Jobs"),
  USERS("Users"),
  FACTS("Facts"),
  INBOUND_LINKS("Links");

  private final String label;

  Dimension(String label) {
    this.label = label;
  }

  /** Short label used in rank explanations. */
  public String label() {
    return label;
  }
}
