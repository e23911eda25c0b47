package org.eao.jsa.infrastructure.header;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.eao.jsa.domain.header.FileHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonHeaderSourceTest {

  @TempDir Path tempDir;

  @Test
  void structuredDocumentCarriesExtensionAndMocArea() throws IOException {
    Files.writeString(tempDir.resolve("cat.json"), """
        {
          "fileName": "jcmts20140322_850_peak-cat001.fits",
          "primary": {"instream": "JCMTLS", "MBRCNT": 2, "OBJECT": null},
          "firstExtension": {"NAXIS2": 17},
          "moc": {"areaSqDeg": 0.25}
        }
        """);

    List<FileHeader> headers = new JsonHeaderSource(tempDir).readAll();

    assertEquals(1, headers.size());
    FileHeader header = headers.get(0);
    assertEquals("jcmts20140322_850_peak-cat001", header.fileId());
    assertEquals("JCMTLS", header.primary().get("INSTREAM"));
    assertEquals(2, header.primary().get("MBRCNT"));
    assertFalse(header.primary().containsKey("OBJECT"));
    assertEquals(17, header.firstExtension().get("NAXIS2"));
    assertEquals(0.25, header.mocAreaSqDeg());
  }

  @Test
  void flatDocumentUsesFilenameKeywordOrJsonName() throws IOException {
    Files.writeString(tempDir.resolve("b.json"), "{\"FILENAME\": \"a20130403_00051_01_0001.sdf\"}");
    Files.writeString(tempDir.resolve("jcmth_cube_001.fits.json"), "{\"INSTREAM\": \"JCMT\"}");
    Files.writeString(tempDir.resolve("notes.txt"), "ignored");

    List<FileHeader> headers = new JsonHeaderSource(tempDir).readAll();

    assertEquals(List.of("a20130403_00051_01_0001", "jcmth_cube_001"),
        headers.stream().map(FileHeader::fileId).toList());
    assertEquals("jcmth_cube_001.fits", headers.get(1).fileName());
    assertNull(headers.get(1).firstExtension());
  }

  @Test
  void nestedKeywordValueIsRejected() throws IOException {
    Files.writeString(tempDir.resolve("bad.json"), "{\"INSTREAM\": [\"JCMT\"]}");

    IOException ex = assertThrows(IOException.class, () -> new JsonHeaderSource(tempDir).readAll());
    assertTrue(ex.getMessage().contains("keyword INSTREAM must hold a scalar value"));
  }

  @Test
  void nonNumericMocAreaIsRejected() throws IOException {
    Files.writeString(tempDir.resolve("moc.json"),
        "{\"primary\": {\"INSTREAM\": \"JCMT\"}, \"moc\": {\"areaSqDeg\": \"large\"}}");

    assertThrows(IOException.class, () -> new JsonHeaderSource(tempDir).readAll());
  }

  @Test
  void missingDirectoryIsAnIoError() {
    assertThrows(IOException.class, () -> new JsonHeaderSource(tempDir.resolve("absent")).readAll());
  }
}
