package com.scholary.call.transcriber.continuity;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything one work unit shares between its concurrent tasks: the stop flag, the executors the
 * tasks run on and the local recording. Created per work unit and closed when it ends, which stops
 * every task still running.
 */
public class WorkUnitContext implements AutoCloseable {

  private final String id;
  private final CallSession session;
  private final Instant startedAt;
  private final AtomicBoolean stopRequested = new AtomicBoolean();

  // Interleave and keep-alive ticks share one thread so they never run concurrently
  private final ScheduledExecutorService ticker;
  private final ScheduledExecutorService timers;
  private final ExecutorService readers;
  private final ExecutorService audioPush;

  private volatile Path recordingPath;

  public WorkUnitContext(String id, CallSession session, Instant startedAt) {
    this.id = id;
    this.session = session;
    this.startedAt = startedAt;
    this.ticker = Executors.newSingleThreadScheduledExecutor(threadFactory("interleave-" + id));
    this.timers = Executors.newSingleThreadScheduledExecutor(threadFactory("timer-" + id));
    this.readers = Executors.newCachedThreadPool(threadFactory("demux-" + id));
    // A retried session start subscribes again while the old loop winds down
    this.audioPush = Executors.newCachedThreadPool(threadFactory("audio-push-" + id));
  }

  public static String workUnitId(CallSession session) {
    return session.callId() + "#" + session.workUnitSequence();
  }

  public String id() {
    return id;
  }

  public CallSession session() {
    return session;
  }

  public Instant startedAt() {
    return startedAt;
  }

  /**
   * Ask all sources to stop at their next fragment boundary.
   *
   * @return true for the call that actually set the flag
   */
  public boolean requestStop() {
    return stopRequested.compareAndSet(false, true);
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  public ScheduledExecutorService ticker() {
    return ticker;
  }

  public ScheduledExecutorService timers() {
    return timers;
  }

  public ExecutorService readers() {
    return readers;
  }

  /** Runs the loops that push audio to the recognition session. */
  public ExecutorService audioPush() {
    return audioPush;
  }

  public Path recordingPath() {
    return recordingPath;
  }

  public void setRecordingPath(Path recordingPath) {
    this.recordingPath = recordingPath;
  }

  @Override
  public void close() {
    stopRequested.set(true);
    ticker.shutdownNow();
    timers.shutdownNow();
    readers.shutdownNow();
    audioPush.shutdownNow();
  }

  private static ThreadFactory threadFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
