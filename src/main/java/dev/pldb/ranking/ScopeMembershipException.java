package dev.pldb.ranking;

/** The entity exists but is not a member of the scope it was looked up in. */
public class ScopeMembershipException extends IllegalArgumentException {

  private final String entityId;
  private final RankScope scope;

  public ScopeMembershipException(String entityId, RankScope scope) {
    super("Entity '" + entityId + "' is not in the " + scope.scopeName() + " scope");
    this.entityId = entityId;
    this.scope = scope;
  }

  public String getEntityId() {
    return entityId;
  }

  public RankScope getScope() {
    return scope;
  }
}
