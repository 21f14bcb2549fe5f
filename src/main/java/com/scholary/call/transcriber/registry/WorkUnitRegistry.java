package com.scholary.call.transcriber.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of work units, keyed by call id.
 *
 * <p>Backed by a Caffeine cache so finished calls age out and memory stays bounded. It also
 * guards against starting a second work unit for a call whose current one is still running.
 */
@Repository
public class WorkUnitRegistry {

  private final Cache<String, WorkUnitStatus> cache;

  public WorkUnitRegistry(
      @Value("${registry.maxSize}") int maxSize,
      @Value("${registry.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  /**
   * Register a work unit unless the call already has an active one with the same or a later
   * sequence.
   *
   * @return true if the status was registered
   */
  public boolean tryStart(WorkUnitStatus status) {
    boolean[] registered = {false};
    cache
        .asMap()
        .compute(
            status.getCallId(),
            (callId, existing) -> {
              if (existing != null
                  && existing.isActive()
                  && existing.getSequence() >= status.getSequence()) {
                return existing;
              }
              registered[0] = true;
              return status;
            });
    return registered[0];
  }

  /** Replace the status for the call unconditionally. */
  public void save(WorkUnitStatus status) {
    cache.put(status.getCallId(), status);
  }

  public Optional<WorkUnitStatus> findByCallId(String callId) {
    return Optional.ofNullable(cache.getIfPresent(callId));
  }

  public void delete(String callId) {
    cache.invalidate(callId);
  }
}
