package dev.pldb.ranking;

/** The requested entity id does not exist in the record set. */
public class UnknownEntityException extends IllegalArgumentException {

  private final String entityId;

  public UnknownEntityException(String entityId) {
    super("No entity with id '" + entityId + "'");
    this.entityId = entityId;
  }

  public String getEntityId() {
    return entityId;
  }
}
