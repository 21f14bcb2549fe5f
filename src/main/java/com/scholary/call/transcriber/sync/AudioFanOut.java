package com.scholary.call.transcriber.sync;

import com.scholary.call.transcriber.audio.InterleavedFrame;
import com.scholary.call.transcriber.recognition.AudioPipe;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends every interleaved frame to the local recording and to the recognition session.
 *
 * <p>Neither target may stall the other: a recording write failure is logged and the frame still
 * goes to the session, and a full session pipe only costs the session that frame. Nothing here
 * blocks; a session that falls behind is reported through {@link #isBackedUp()} so the
 * synchronizer holds audio back upstream.
 */
public class AudioFanOut implements FrameSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioFanOut.class);

  private final RecordingBuffer recording;
  private final AudioPipe pipe;

  private long recordingFailures;
  private boolean warnedDrop;

  public AudioFanOut(RecordingBuffer recording, AudioPipe pipe) {
    this.recording = recording;
    this.pipe = pipe;
  }

  @Override
  public void accept(InterleavedFrame frame) {
    if (recording != null) {
      try {
        recording.write(frame.pcm());
      } catch (IOException e) {
        recordingFailures++;
        if (recordingFailures == 1) {
          LOGGER.error("Failed to write frame {} to local recording", frame.sequence(), e);
        }
      }
    }

    if (!pipe.offer(frame.pcm()) && !pipe.isAbandoned() && !warnedDrop) {
      warnedDrop = true;
      LOGGER.warn(
          "Recognition session is not keeping up, dropping frames from frame {}",
          frame.sequence());
    }
  }

  @Override
  public boolean isBackedUp() {
    return pipe.isBackedUp();
  }

  public long recordingFailures() {
    return recordingFailures;
  }
}
