package org.eao.jsa.infrastructure.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.infrastructure.json.JsonDocuments;
import org.eao.jsa.infrastructure.json.ObservationJsonCodec;
import org.eao.jsa.infrastructure.json.ObservationJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Record store keeping one JSON document per observation in a directory.
 * <p><strong>Role:</strong> File-backed stand-in for the remote repository; queries are answered
 * from the in-memory index loaded at open.</p>
 * <p>An optional {@code proposals.json} in the same directory maps proposal ids to
 * {@code {"pi": ..., "title": ...}} and feeds proposal lookups.</p>
 * <p><strong>Thread-safety:</strong> Safe for one writer per observation; file writes replace
 * documents atomically.</p>
 *
 * @since 0.1.0
 */
public final class JsonDirectoryRecordStore extends InMemoryRecordStore {
  private static final Logger log = LoggerFactory.getLogger(JsonDirectoryRecordStore.class);
  static final String PROPOSALS_FILE = "proposals.json";

  private final ObservationJsonWriter writer;

  private JsonDirectoryRecordStore(ObservationJsonWriter writer) {
    this.writer = writer;
  }

  /**
   * Opens the store, creating the directory when missing, and loads every stored observation.
   *
   * @param directory store directory
   * @return opened store
   * @throws StoreException when a stored document cannot be read
   */
  public static JsonDirectoryRecordStore open(Path directory) throws StoreException {
    Objects.requireNonNull(directory, "directory");
    ObservationJsonCodec codec = new ObservationJsonCodec();
    JsonDirectoryRecordStore store;
    try {
      store = new JsonDirectoryRecordStore(new ObservationJsonWriter(directory, codec));
    } catch (IllegalArgumentException ex) {
      throw new StoreException("cannot open store directory " + directory, ex);
    }
    store.load(codec);
    return store;
  }

  public Path directory() {
    return writer.directory();
  }

  @Override
  public void put(Observation observation) throws StoreException {
    try {
      writer.write(observation);
    } catch (IOException ex) {
      throw new StoreException("failed to write " + observation.uri(), ex);
    }
    super.put(observation);
  }

  @Override
  public void remove(ObservationUri uri) throws StoreException {
    try {
      Files.deleteIfExists(writer.fileFor(uri));
    } catch (IOException ex) {
      throw new StoreException("failed to delete " + uri, ex);
    }
    super.remove(uri);
  }

  private void load(ObservationJsonCodec codec) throws StoreException {
    Path dir = writer.directory();
    int loaded = 0;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
      for (Path file : stream) {
        if (file.getFileName().toString().equals(PROPOSALS_FILE)) {
          loadProposals(file);
          continue;
        }
        try (InputStream in = Files.newInputStream(file)) {
          super.put(codec.read(in, file.toString()));
          loaded++;
        }
      }
    } catch (IOException ex) {
      throw new StoreException("failed to load store directory " + dir, ex);
    }
    log.info("Loaded {} observations from {}", loaded, dir);
  }

  private void loadProposals(Path file) throws IOException {
    Map<String, Object> document;
    try (InputStream in = Files.newInputStream(file)) {
      document = new JsonDocuments().parseObject(in, file.toString());
    }
    for (Map.Entry<String, Object> entry : document.entrySet()) {
      if (!(entry.getValue() instanceof Map<?, ?> proposal)) {
        throw new IOException(file + ": proposal " + entry.getKey() + " must be an object");
      }
      addProposal(entry.getKey(), text(proposal.get("pi")), text(proposal.get("title")));
    }
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
