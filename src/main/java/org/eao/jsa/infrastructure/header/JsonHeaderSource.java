package org.eao.jsa.infrastructure.header;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.eao.jsa.application.port.HeaderSource;
import org.eao.jsa.domain.header.FileHeader;
import org.eao.jsa.domain.naming.FileIds;
import org.eao.jsa.infrastructure.json.JsonDocuments;
import org.eao.jsa.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HeaderSource} reading one JSON document per FITS file from a
 * directory.
 * <p><strong>Why:</strong> Header dumps decouple ingestion from the FITS readers, which run
 * elsewhere.</p>
 * <p>Two layouts are accepted:</p>
 * <ul>
 *   <li>structured: {@code {"fileName": ..., "primary": {...}, "firstExtension": {...},
 *       "moc": {"areaSqDeg": ...}}}, where the last two are optional;</li>
 *   <li>flat: the primary header itself, with the file name taken from {@code FILENAME} or from
 *       the JSON file name.</li>
 * </ul>
 * <p>Keywords are upper-cased; {@code null} values are dropped as if the keyword were absent.</p>
 *
 * @since 0.1.0
 */
public final class JsonHeaderSource implements HeaderSource {
  private static final Logger log = LoggerFactory.getLogger(JsonHeaderSource.class);

  private final Path directory;
  private final JsonDocuments documents;

  public JsonHeaderSource(Path directory) {
    this(directory, new JsonDocuments());
  }

  public JsonHeaderSource(Path directory, JsonDocuments documents) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.documents = Objects.requireNonNull(documents, "documents");
  }

  @Override
  public List<FileHeader> readAll() throws IOException {
    Path dir;
    try {
      dir = Paths.requireReadableDirectory("headers", directory);
    } catch (IllegalArgumentException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
      for (Path file : stream) {
        if (Files.isRegularFile(file)) {
          files.add(file);
        }
      }
    }
    files.sort(Comparator.comparing(path -> path.getFileName().toString()));

    List<FileHeader> headers = new ArrayList<>(files.size());
    for (Path file : files) {
      headers.add(read(file));
    }
    headers.sort(Comparator.comparing(FileHeader::fileId));
    log.info("Read {} headers from {}", headers.size(), dir);
    return headers;
  }

  FileHeader read(Path file) throws IOException {
    Map<String, Object> document;
    try (InputStream in = Files.newInputStream(file)) {
      document = documents.parseObject(in, file.toString());
    }
    String jsonName = file.getFileName().toString();
    String fallbackName = jsonName.substring(0, jsonName.length() - ".json".length());

    if (document.get("primary") instanceof Map<?, ?> primary) {
      String fileName = stringOr(document.get("fileName"), fallbackName);
      Map<String, Object> extension = document.get("firstExtension") instanceof Map<?, ?> ext
          ? keywords(ext, file)
          : null;
      Double area = null;
      if (document.get("moc") instanceof Map<?, ?> moc && moc.get("areaSqDeg") != null) {
        if (!(moc.get("areaSqDeg") instanceof Number number)) {
          throw new IOException(file + ": moc.areaSqDeg must be a number");
        }
        area = number.doubleValue();
      }
      return new FileHeader(FileIds.fileIdOf(fileName), fileName, keywords(primary, file), extension, area);
    }

    Map<String, Object> primary = keywords(document, file);
    String fileName = stringOr(primary.get("FILENAME"), fallbackName);
    return new FileHeader(FileIds.fileIdOf(fileName), fileName, primary, null, null);
  }

  private static Map<String, Object> keywords(Map<?, ?> raw, Path file) throws IOException {
    Map<String, Object> keywords = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (value instanceof Map<?, ?> || value instanceof List<?>) {
        throw new IOException(file + ": keyword " + entry.getKey() + " must hold a scalar value");
      }
      keywords.put(entry.getKey().toString().trim().toUpperCase(Locale.ROOT), value);
    }
    return keywords;
  }

  private static String stringOr(Object value, String fallback) {
    if (value instanceof String text && !text.isBlank()) {
      return text.trim();
    }
    return fallback;
  }
}
