package com.flamingo.ai.recall.service.scoring;

import com.flamingo.ai.recall.config.MemoryConfig;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Exponential recency weight, computed at query time from a memory's creation time. */
@Component
@RequiredArgsConstructor
public class TemporalDecayModel {

  private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  private final MemoryConfig memoryConfig;

  /** recency = exp(-ageDays / halfLife); future timestamps count as age 0. */
  public double recency(LocalDateTime createdAt, LocalDateTime now) {
    if (createdAt == null) {
      return 0.0;
    }
    double ageDays = Duration.between(createdAt, now).toMillis() / MILLIS_PER_DAY;
    return recency(ageDays, memoryConfig.getDecay().getHalfLifeDays());
  }

  public static double recency(double ageDays, double halfLifeDays) {
    double age = Math.max(0.0, ageDays);
    return Math.exp(-age / halfLifeDays);
  }
}
