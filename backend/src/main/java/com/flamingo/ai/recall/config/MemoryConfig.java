package com.flamingo.ai.recall.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the memory lifecycle engine. */
@Configuration
@ConfigurationProperties(prefix = "memory")
@Validated
@Getter
@Setter
public class MemoryConfig {

  @Valid private Extraction extraction = new Extraction();
  @Valid private Dedup dedup = new Dedup();
  @Valid private Conflict conflict = new Conflict();
  @Valid private Decay decay = new Decay();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Index index = new Index();
  @Valid private Cache cache = new Cache();
  @Valid private Worker worker = new Worker();
  @Valid private Reconciliation reconciliation = new Reconciliation();
  @Valid private Stats stats = new Stats();

  @Getter
  @Setter
  public static class Extraction {
    private boolean enabled = true;

    /** Number of prior turns of the same conversation sent along for grounding. */
    @Min(0)
    private int contextWindow = 3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.5;
    @Positive private int maxContentLength = 5000;
  }

  @Getter
  @Setter
  public static class Dedup {
    /**
     * Cosine similarity at or above which a candidate is a duplicate of an existing memory. Also
     * used by the consolidation step of the reconciliation sweep.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.95;

    /** How many of the user's most recently created memories are compared. */
    @Positive private int neighborWindow = 50;

    private boolean sameTypeOnly = false;
  }

  @Getter
  @Setter
  public static class Conflict {
    private boolean enabled = true;

    /** How many of the user's most recent active memories are scanned for category matches. */
    private int scanWindow = 200;

    /** Upper bound on existing memories offered to the classifier per category. */
    private int maxExistingPerCategory = 10;
  }

  @Getter
  @Setter
  public static class Decay {
    @DecimalMin(value = "0.0", inclusive = false)
    private double halfLifeDays = 90.0;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityWeight = 0.35;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double importanceWeight = 0.25;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double recencyWeight = 0.20;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double accessFrequencyWeight = 0.15;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceWeight = 0.05;

    /** Divisor for ln(1 + accessCount); ln(101) saturates the term at 100 accesses. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double accessFrequencyConstant = Math.log(101);

    @Positive private int candidatePoolSize = 50;
    @Positive private int topK = 15;
    @Positive private int tokenBudget = 2000;

    /** Turn numbers at or below this still count as the start of a conversation. */
    private int greetingTurnWindow = 2;

    private int broadMaxWords = 4;
  }

  @Getter
  @Setter
  public static class Index {
    @Positive private int maxAttempts = 5;
    private Duration failedRetryInterval = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Cache {
    private Duration profileTtl = Duration.ofMinutes(10);
    private long maximumSize = 10_000;
  }

  @Getter
  @Setter
  public static class Worker {
    @Positive private int corePoolSize = 2;
    @Positive private int maxPoolSize = 4;
    @Positive private int queueCapacity = 200;
    private Duration taskTimeout = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Reconciliation {
    private boolean enabled = true;
    private Duration interval = Duration.ofSeconds(60);
    @Positive private int batchSize = 100;
    private Duration consolidationWindow = Duration.ofHours(24);
  }

  @Getter
  @Setter
  public static class Stats {
    private int hotAccessThreshold = 5;
  }
}
