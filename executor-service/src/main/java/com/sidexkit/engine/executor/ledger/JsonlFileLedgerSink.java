package com.sidexkit.engine.executor.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.ledger.LedgerSink;
import com.sidexkit.engine.ledger.VenueTraceEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only JSON-lines files: one {@code <venue>_debug.log} per venue for request and
 * response traces, and one cross-venue trade ledger. Write failures are logged and dropped.
 */
@Slf4j
public class JsonlFileLedgerSink implements LedgerSink {

  private final Path directory;
  private final Path tradesFile;
  private final ObjectMapper objectMapper;

  public JsonlFileLedgerSink(Path directory, String tradesFileName, ObjectMapper objectMapper) {
    this.directory = directory;
    this.tradesFile = directory.resolve(tradesFileName);
    this.objectMapper = objectMapper;
  }

  public Path traceFile(String venueId) {
    return directory.resolve(venueId + "_debug.log");
  }

  public Path tradesFile() {
    return tradesFile;
  }

  @Override
  public void trace(VenueTraceEntry entry) {
    write(traceFile(entry.venue().id()), entry, entry.intentId());
  }

  @Override
  public void append(ExecutionResult result) {
    write(tradesFile, result, result.intentId());
  }

  private synchronized void write(Path file, Object record, String intentId) {
    try {
      Files.createDirectories(directory);
      String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
      Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      log.warn("ledger write failed file={} intent={} error={}", file, intentId, e.toString());
    }
  }
}
