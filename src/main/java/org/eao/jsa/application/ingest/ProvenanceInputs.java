package org.eao.jsa.application.ingest;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * Inputs of one file after the first provenance pass.
 *
 * @param planes input planes already known
 * @param pendingFiles input file ids left for the second pass
 */
public record ProvenanceInputs(SortedSet<PlaneUri> planes, SortedSet<String> pendingFiles) {
  public static final ProvenanceInputs NONE = new ProvenanceInputs(new TreeSet<>(), new TreeSet<>());

  public ProvenanceInputs {
    planes = Collections.unmodifiableSortedSet(new TreeSet<>(planes));
    pendingFiles = Collections.unmodifiableSortedSet(new TreeSet<>(pendingFiles));
  }
}
