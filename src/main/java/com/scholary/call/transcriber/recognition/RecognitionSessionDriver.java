package com.scholary.call.transcriber.recognition;

import com.scholary.call.transcriber.events.EventSink;
import com.scholary.call.transcriber.logging.StructuredLogger;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives one recognition session per work unit.
 *
 * <p>Starting a session is retried with a fixed backoff; once the attempts are used up the work
 * unit fails with {@link RecognitionException}. Results are classified and handed to the event
 * sink in the order the service delivers them. A segment or utterance id that has been delivered
 * as final is never forwarded again, so finality is monotonic for downstream consumers.
 */
@Component
public class RecognitionSessionDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecognitionSessionDriver.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final RecognitionService recognitionService;
  private final EventSink eventSink;
  private final RecognitionProperties properties;

  public RecognitionSessionDriver(
      RecognitionService recognitionService,
      EventSink eventSink,
      RecognitionProperties properties) {
    this.recognitionService = recognitionService;
    this.eventSink = eventSink;
    this.properties = properties;
  }

  /**
   * Start a session that pulls its audio from the given pipe.
   *
   * @param callId the call being transcribed
   * @param resumeSessionId session id of the previous work unit, or null
   * @param audio the pipe the fan-out stage writes to
   * @param audioExecutor runs the audio push loop; shut down by the owner when the work unit ends
   * @return the started session
   * @throws RecognitionException if every start attempt failed
   */
  public RecognitionSession start(
      String callId, String resumeSessionId, AudioPipe audio, Executor audioExecutor) {
    RecognitionRequest request = new RecognitionRequest(callId, resumeSessionId, audioExecutor);
    ResultForwarder forwarder = new ResultForwarder(callId, audio);
    int maxAttempts = properties.startAttempts();

    int attempt = 0;
    RecognitionException lastException = null;

    while (attempt < maxAttempts) {
      try {
        RecognitionSession session = recognitionService.start(request, audio, forwarder);
        LOGGER.info(
            "Recognition session started: sessionId={}, resumed={}, attempt={}",
            session.sessionId(),
            resumeSessionId != null,
            attempt + 1);
        return session;
      } catch (RecognitionException e) {
        lastException = e;
        attempt++;
        if (attempt < maxAttempts) {
          STRUCTURED_LOGGER.logSessionStartRetry(
              attempt, maxAttempts, e.getClass().getSimpleName(), e.getMessage());
          try {
            Thread.sleep(properties.startBackoff().toMillis());
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RecognitionException("Recognition session start interrupted", ie);
          }
        }
      }
    }

    STRUCTURED_LOGGER.logSessionStartFailed(
        maxAttempts,
        lastException == null ? "none" : lastException.getClass().getSimpleName(),
        lastException == null ? "no attempts configured" : lastException.getMessage());
    throw new RecognitionException(
        String.format("Recognition session start failed after %d attempts", maxAttempts),
        lastException);
  }

  /** Classifies results for one session and keeps track of finalized ids. */
  class ResultForwarder implements RecognitionListener {

    private final String callId;
    private final AudioPipe audio;
    private final Set<String> finalizedIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong superseded = new AtomicLong();

    ResultForwarder(String callId, AudioPipe audio) {
      this.callId = callId;
      this.audio = audio;
    }

    @Override
    public void onResult(RecognitionResult result) {
      if (result instanceof TranscriptSegment segment) {
        if (!alreadyFinal(segment.segmentId(), segment.partial())) {
          eventSink.transcriptSegment(callId, segment);
        }
      } else if (result instanceof Utterance utterance) {
        if (!alreadyFinal(utterance.utteranceId(), utterance.partial())) {
          eventSink.utterance(callId, utterance);
        }
      } else if (result instanceof CategoryMatch match) {
        eventSink.categoryMatch(callId, match);
      } else {
        LOGGER.warn("Ignoring unknown recognition result type {}", result.getClass().getName());
      }
    }

    @Override
    public void onError(Throwable error) {
      LOGGER.error(
          "Recognition session failed mid-stream, audio is now only recorded: call={}",
          callId,
          error);
      audio.abandon();
    }

    @Override
    public void onComplete() {
      LOGGER.info(
          "Recognition session completed: call={}, finalized={}, superseded={}",
          callId,
          finalizedIds.size(),
          superseded.get());
    }

    private boolean alreadyFinal(String id, boolean partial) {
      if (finalizedIds.contains(id)) {
        superseded.incrementAndGet();
        LOGGER.debug("Dropping result for already finalized segment {}", id);
        return true;
      }
      if (!partial) {
        finalizedIds.add(id);
      }
      return false;
    }
  }
}
