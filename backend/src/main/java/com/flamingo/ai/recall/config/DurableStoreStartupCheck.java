package com.flamingo.ai.recall.config;

import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.exception.ExternalServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Startup check that the durable store is reachable.
 *
 * <p>Unlike the similarity index, the durable store has no degraded mode: the application refuses
 * to start without it. Rows left unindexed by a previous run are reported and picked up by the
 * reconciliation sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DurableStoreStartupCheck implements CommandLineRunner {

  private final MemoryRepository memoryRepository;

  @Override
  public void run(String... args) {
    long total;
    long unindexed;
    try {
      total = memoryRepository.count();
      unindexed =
          memoryRepository.countByIndexStatus(IndexStatus.CREATED)
              + memoryRepository.countByIndexStatus(IndexStatus.INDEX_PENDING);
    } catch (DataAccessException e) {
      log.error("Durable memory store unreachable: {}", e.getMessage());
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.STORE, "Durable memory store unreachable", e);
    }

    log.info("Durable memory store ready: {} memories", total);
    if (unindexed > 0) {
      log.info("{} memories awaiting indexing, reconciliation will retry them", unindexed);
    }
  }
}
