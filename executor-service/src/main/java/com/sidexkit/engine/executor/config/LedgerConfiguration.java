package com.sidexkit.engine.executor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.executor.ledger.JsonlFileLedgerSink;
import com.sidexkit.engine.ledger.CompositeLedgerSink;
import com.sidexkit.engine.ledger.InMemoryLedgerSink;
import com.sidexkit.engine.ledger.LedgerSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class LedgerConfiguration {

  @Bean
  public InMemoryLedgerSink recentExecutions(ExecutorProperties properties) {
    return new InMemoryLedgerSink(properties.ledger().recentCapacity());
  }

  @Bean
  @Primary
  public LedgerSink ledgerSink(ExecutorProperties properties, InMemoryLedgerSink recentExecutions, ObjectMapper objectMapper) {
    ExecutorProperties.Ledger ledger = properties.ledger();
    List<LedgerSink> sinks = new ArrayList<>();
    if (ledger.enabled()) {
      Path directory = Path.of(ledger.directory());
      sinks.add(new JsonlFileLedgerSink(directory, ledger.tradesFile(), objectMapper));
      log.info("ledger: writing traces and trades under {}", directory.toAbsolutePath());
    } else {
      log.info("ledger: file ledger disabled, keeping recent executions in memory only");
    }
    sinks.add(recentExecutions);
    return new CompositeLedgerSink(sinks);
  }
}
