package com.scholary.call.transcriber.recognition;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.transcribestreaming.model.AudioEvent;
import software.amazon.awssdk.services.transcribestreaming.model.AudioStream;

/**
 * Pull-based subscription over an {@link AudioPipe}.
 *
 * <p>Frames are delivered on the work unit's audio executor while there is outstanding demand,
 * because {@code onNext} may call back into {@link #request(long)}. The subscription completes once
 * the pipe is closed and drained. Shutting the executor down interrupts the delivery loop.
 */
class AudioPipeSubscription implements Subscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioPipeSubscription.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final Subscriber<? super AudioStream> subscriber;
  private final AudioPipe pipe;
  private final Executor executor;
  private final AtomicLong demand = new AtomicLong();
  private final AtomicBoolean terminated = new AtomicBoolean();

  private AudioStream pendingConfiguration;

  AudioPipeSubscription(
      Subscriber<? super AudioStream> subscriber,
      AudioPipe pipe,
      AudioStream configurationEvent,
      Executor executor) {
    this.subscriber = subscriber;
    this.pipe = pipe;
    this.pendingConfiguration = configurationEvent;
    this.executor = executor;
  }

  @Override
  public void request(long n) {
    if (n <= 0) {
      terminate();
      subscriber.onError(new IllegalArgumentException("Demand must be positive"));
      return;
    }
    // Only the request that raises demand from zero starts a delivery loop
    if (demand.getAndAdd(n) == 0 && !terminated.get()) {
      try {
        executor.execute(this::deliver);
      } catch (RejectedExecutionException e) {
        LOGGER.warn("Audio executor is shut down, ending the audio stream");
        terminate();
        subscriber.onError(e);
      }
    }
  }

  @Override
  public void cancel() {
    terminate();
  }

  private void deliver() {
    try {
      while (!terminated.get()) {
        AudioStream next = nextEvent();
        if (next == null) {
          if (pipe.isFinished()) {
            terminate();
            subscriber.onComplete();
            return;
          }
          continue;
        }
        subscriber.onNext(next);
        if (demand.decrementAndGet() == 0) {
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      LOGGER.error("Failed to push audio to recognition session", e);
      terminate();
      subscriber.onError(e);
    }
  }

  private AudioStream nextEvent() throws InterruptedException {
    if (pendingConfiguration != null) {
      AudioStream configuration = pendingConfiguration;
      pendingConfiguration = null;
      return configuration;
    }
    byte[] frame = pipe.poll(POLL_INTERVAL);
    if (frame == null) {
      return null;
    }
    return AudioEvent.builder().audioChunk(SdkBytes.fromByteArray(frame)).build();
  }

  private void terminate() {
    terminated.set(true);
  }
}
