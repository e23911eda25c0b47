package org.eao.jsa.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.eao.jsa.application.ingest.HeaderExtractor;
import org.eao.jsa.application.ingest.RunAliases;

/**
 * Run-id aliases read from a recipe-instance mapping file.
 *
 * <p>Each non-comment line holds {@code <alias-id> <job-id> [tag]}. The two ids name the same
 * recipe run, so each is an alias of the other. Ids are normalized the same way as
 * {@code DPRCINST} values.
 */
public final class RecipeInstanceMapping implements RunAliases {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Map<String, Set<String>> aliases;

  private RecipeInstanceMapping(Map<String, Set<String>> aliases) {
    this.aliases = aliases;
  }

  public static RecipeInstanceMapping empty() {
    return new RecipeInstanceMapping(Map.of());
  }

  /**
   * @param path mapping file
   * @return parsed mapping
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when a line has fewer than two ids
   */
  public static RecipeInstanceMapping load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Map<String, Set<String>> aliases = new HashMap<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        int hash = line.indexOf('#');
        String content = (hash >= 0 ? line.substring(0, hash) : line).strip();
        if (content.isEmpty()) {
          continue;
        }
        String[] fields = WHITESPACE.split(content);
        if (fields.length < 2) {
          throw new IllegalArgumentException(
              path + ":" + lineNumber + ": expected '<alias-id> <job-id> [tag]'");
        }
        String alias = HeaderExtractor.normalizeRunId(fields[0]);
        String job = HeaderExtractor.normalizeRunId(fields[1]);
        aliases.computeIfAbsent(alias, ignored -> new TreeSet<>()).add(job);
        aliases.computeIfAbsent(job, ignored -> new TreeSet<>()).add(alias);
      }
    }
    return new RecipeInstanceMapping(aliases);
  }

  @Override
  public Set<String> aliasesOf(String runId) {
    Set<String> found = aliases.get(runId);
    return found == null ? Set.of() : Collections.unmodifiableSet(found);
  }

  public int size() {
    return aliases.size();
  }
}
