package org.eao.jsa.application.ingest;

import java.util.Set;

/** Other identifiers under which the archive may know a recipe instance. */
@FunctionalInterface
public interface RunAliases {
  Set<String> aliasesOf(String runId);

  RunAliases NONE = runId -> Set.of();
}
