package org.eao.jsa.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.eao.jsa.config.IngestMode;
import org.eao.jsa.infrastructure.store.JsonDirectoryRecordStore;
import org.eao.jsa.testutil.ArchiveFixtures;
import org.eao.jsa.testutil.HeaderFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IngestCliTest {
  private static final String NIGHT_FILE = "JCMT_" + HeaderFixtures.NIGHT_ID + ".json";

  @TempDir Path tempDir;

  private Path headers;
  private Path store;
  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() throws Exception {
    headers = Files.createDirectories(tempDir.resolve("headers"));
    store = tempDir.resolve("store");
    JsonDirectoryRecordStore.open(store).put(ArchiveFixtures.scuba2Raw());
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
  }

  @Test
  void ingestWritesObservationToStoreAndBatchOutput() throws IOException {
    writeHeader("jcmts20140322_850_reduced001.fits", HeaderFixtures.scuba2Night("reduced"));
    Path out = tempDir.resolve("out");

    ExitCode code = IngestCli.run(IngestMode.INGEST, args("out=" + out));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(store.resolve(NIGHT_FILE)));
    assertTrue(Files.exists(out.resolve(NIGHT_FILE)));
    String report = buffer.toString();
    assertTrue(report.contains("Ingestion of JCMT: 1 files read, 0 rejected"));
    assertTrue(report.contains("written caom:JCMT/" + HeaderFixtures.NIGHT_ID));
  }

  @Test
  void checkModeIsDryRunByDefault() throws IOException {
    writeHeader("jcmts20140322_850_reduced001.fits", HeaderFixtures.scuba2Night("reduced"));

    ExitCode code = IngestCli.run(IngestMode.CHECK, args());

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(Files.exists(store.resolve(NIGHT_FILE)));
    assertTrue(buffer.toString().contains("would write caom:JCMT/" + HeaderFixtures.NIGHT_ID));
  }

  @Test
  void rejectedFileStopsIngestBeforeWriting() throws IOException {
    Map<String, Object> bad = HeaderFixtures.scuba2Night("reduced");
    bad.remove("RECIPE");
    writeHeader("jcmts20140322_850_reduced001.fits", bad);
    writeHeader("jcmts20140322_850_rsp001.fits", HeaderFixtures.scuba2Night("rsp"));

    ExitCode code = IngestCli.run(IngestMode.INGEST, args());

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertFalse(Files.exists(store.resolve(NIGHT_FILE)));
    assertTrue(buffer.toString().contains("Batch rejected; nothing was written:"));
    assertTrue(buffer.toString().contains("jcmts20140322_850_reduced001: RECIPE is mandatory"));
  }

  @Test
  void checkModeReportsRejectedFilesAndContinues() throws IOException {
    Map<String, Object> bad = HeaderFixtures.scuba2Night("rsp");
    bad.remove("RECIPE");
    writeHeader("jcmts20140322_850_reduced001.fits", HeaderFixtures.scuba2Night("reduced"));
    writeHeader("jcmts20140322_850_rsp001.fits", bad);

    ExitCode code = IngestCli.run(IngestMode.CHECK, args());

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertTrue(buffer.toString().contains("rejected jcmts20140322_850_rsp001"));
    assertTrue(buffer.toString().contains("would write caom:JCMT/" + HeaderFixtures.NIGHT_ID));
  }

  @Test
  void unknownCollectionIsInvalidArgs() {
    ExitCode code = IngestCli.run(IngestMode.INGEST, args("collection=ALMA"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: <ingest|check>"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("collection must be one of")));
  }

  @Test
  void unknownSwitchIsInvalidArgs() {
    ExitCode code = IngestCli.run(IngestMode.INGEST, args("--force"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("--force")));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = IngestCli.run(IngestMode.INGEST, args("config=" + tempDir.resolve("absent.yaml")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void yamlSettingsApplyUnlessOverridden() throws IOException {
    writeHeader("jcmts20140322_850_reduced001.fits", HeaderFixtures.scuba2Night("reduced"));
    Path config = tempDir.resolve("jsa.yaml");
    Files.writeString(config, """
        common:
          metricsExporter: none
        ingest:
          dryRun: true
        """);

    ExitCode code = IngestCli.run(IngestMode.INGEST, new String[] {
        "config=" + config, "headers=" + headers, "store=" + store});

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(Files.exists(store.resolve(NIGHT_FILE)));
    assertTrue(buffer.toString().contains("Dry run of JCMT"));
  }

  private String[] args(String... extra) {
    String[] base = {"headers=" + headers, "store=" + store, "metricsExporter=none"};
    String[] all = new String[base.length + extra.length];
    System.arraycopy(base, 0, all, 0, base.length);
    System.arraycopy(extra, 0, all, base.length, extra.length);
    return all;
  }

  private void writeHeader(String fileName, Map<String, Object> primary) throws IOException {
    Path file = headers.resolve(fileName + ".json");
    try (JsonGenerator gen = new JsonFactory().createGenerator(Files.newBufferedWriter(file))) {
      gen.writeStartObject();
      gen.writeStringField("fileName", fileName);
      gen.writeObjectFieldStart("primary");
      for (Map.Entry<String, Object> entry : primary.entrySet()) {
        gen.writeFieldName(entry.getKey());
        gen.writeObject(entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }
}
