package dev.pldb.record;

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Classifies entity {@code type} values. Everything that is not a known tool, format or platform
 * type counts as a language, including records with no type at all.
 */
public final class EntityType {

  static final Set<String> NON_LANGUAGE_TYPES =
      Set.of(
          "vm",
          "linter",
          "library",
          "webApi",
          "characterEncoding",
          "cloud",
          "editor",
          "filesystem",
          "feature",
          "packageManager",
          "os",
          "application",
          "framework",
          "standard",
          "hashFunction",
          "compiler",
          "decompiler",
          "binaryExecutable",
          "binaryDataFormat",
          "equation",
          "interpreter",
          "computingMachine",
          "dataStructure");

  private EntityType() {}

  public static boolean isLanguage(@Nullable String type) {
    return type == null || !NON_LANGUAGE_TYPES.contains(type.trim());
  }
}
