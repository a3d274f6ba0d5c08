package com.flamingo.ai.recall.service.pipeline;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.service.extraction.TurnContext;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Bounded queue of turns awaiting the write path, drained by the memory write worker pool.
 *
 * <p>A full queue rejects the turn. A task running past the configured timeout, measured from the
 * moment a worker picks it up, is cancelled and counted as a failure; it is not retried.
 */
@Component
@Slf4j
public class MemoryWriteQueue {

  private final ThreadPoolTaskExecutor executor;
  private final MemoryWritePipeline pipeline;
  private final MeterRegistry meterRegistry;
  private final Duration taskTimeout;
  private final AtomicInteger inFlight = new AtomicInteger();

  public MemoryWriteQueue(
      @Qualifier("memoryWriteExecutor") ThreadPoolTaskExecutor executor,
      MemoryWritePipeline pipeline,
      MemoryConfig memoryConfig,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.pipeline = pipeline;
    this.meterRegistry = meterRegistry;
    this.taskTimeout = memoryConfig.getWorker().getTaskTimeout();

    Gauge.builder("memory.write.queue.depth", executor, ThreadPoolTaskExecutor::getQueueSize)
        .description("Turns waiting for a write worker")
        .register(meterRegistry);
    Gauge.builder("memory.write.in_flight", inFlight, AtomicInteger::get)
        .description("Turns being processed")
        .register(meterRegistry);
  }

  /**
   * Enqueues a turn.
   *
   * @return a future completing with the pipeline result; completes exceptionally with {@link
   *     TaskRejectedException} when the queue is full, or {@link TimeoutException} when the task
   *     was abandoned
   */
  public CompletableFuture<PipelineResult> submit(TurnContext turn) {
    CompletableFuture<PipelineResult> result = new CompletableFuture<>();
    Future<?> task;
    try {
      task =
          executor.submit(
              () -> {
                inFlight.incrementAndGet();
                CompletableFuture<Void> deadline = startDeadline(result);
                try {
                  result.complete(pipeline.process(turn));
                } catch (Throwable t) {
                  result.completeExceptionally(t);
                } finally {
                  deadline.cancel(false);
                  inFlight.decrementAndGet();
                }
              });
    } catch (TaskRejectedException e) {
      log.warn(
          "Memory write queue full, dropping turn {} of conversation {}",
          turn.turnNumber(),
          turn.conversationId());
      meterRegistry.counter("memory.write.rejected").increment();
      result.completeExceptionally(e);
      return result;
    }
    meterRegistry.counter("memory.write.submitted").increment();

    return result.whenComplete(
        (r, error) -> {
          if (error == null) {
            meterRegistry.counter("memory.write.completed").increment();
          } else if (error instanceof TimeoutException) {
            task.cancel(true);
            log.error(
                "Memory write for turn {} of conversation {} timed out after {}, abandoned",
                turn.turnNumber(),
                turn.conversationId(),
                taskTimeout);
            meterRegistry.counter("memory.write.timeouts").increment();
          } else {
            log.error(
                "Memory write for turn {} of conversation {} failed: {}",
                turn.turnNumber(),
                turn.conversationId(),
                error.getMessage(),
                error);
            meterRegistry.counter("memory.write.failures").increment();
          }
        });
  }

  /** Fails the turn once it has run for the task timeout; the clock starts on the worker. */
  private CompletableFuture<Void> startDeadline(CompletableFuture<PipelineResult> result) {
    return CompletableFuture.runAsync(
        () ->
            result.completeExceptionally(
                new TimeoutException("Memory write exceeded " + taskTimeout)),
        CompletableFuture.delayedExecutor(taskTimeout.toMillis(), TimeUnit.MILLISECONDS));
  }
}
