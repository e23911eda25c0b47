package org.eao.jsa.application.port;

import java.io.IOException;
import java.util.List;
import org.eao.jsa.domain.header.FileHeader;

/**
 * Supplies the headers of the files making up one ingestion batch.
 *
 * @since 0.1.0
 */
public interface HeaderSource {
  /**
   * Reads every header of the batch.
   *
   * @return headers sorted by file id
   * @throws IOException when the headers cannot be read
   */
  List<FileHeader> readAll() throws IOException;
}
