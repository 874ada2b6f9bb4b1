package dev.pldb.ranking;

import dev.pldb.record.RecordAccessor;

/**
 * A subset of entities over which an independent ordering is computed.
 *
 * <p>{@code GLOBAL} holds every entity. {@code LANGUAGE} holds the entities the record back end
 * classifies as languages.
 */
public enum RankScope {
  GLOBAL("global"),
  LANGUAGE(RecordAccessor.LANGUAGE_SCOPE);

  private final String scopeName;

  RankScope(String scopeName) {
    this.scopeName = scopeName;
  }

  public String scopeName() {
    return scopeName;
  }
}
