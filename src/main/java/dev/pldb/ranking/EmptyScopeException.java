package dev.pldb.ranking;

/** A positional query was made against a scope that has no entities. */
public class EmptyScopeException extends IllegalStateException {

  private final RankScope scope;

  public EmptyScopeException(RankScope scope) {
    super("No entities in the " + scope.scopeName() + " scope");
    this.scope = scope;
  }

  public RankScope getScope() {
    return scope;
  }
}
