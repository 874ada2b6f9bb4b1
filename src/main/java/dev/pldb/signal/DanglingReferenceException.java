package dev.pldb.signal;

/**
 * A record declares a cross-reference to an entity id that does not exist. This is a data
 * integrity error: the ranking computation that hit it is aborted.
 */
public class DanglingReferenceException extends IllegalStateException {

  private final String sourceId;
  private final String targetId;

  public DanglingReferenceException(String sourceId, String targetId) {
    super("Broken reference in '" + sourceId + "': no entity '" + targetId + "' found");
    this.sourceId = sourceId;
    this.targetId = targetId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }
}
