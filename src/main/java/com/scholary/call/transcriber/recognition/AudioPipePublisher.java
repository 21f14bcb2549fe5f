package com.scholary.call.transcriber.recognition;

import java.util.concurrent.Executor;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import software.amazon.awssdk.services.transcribestreaming.model.AudioStream;

/**
 * Publishes the frames of an {@link AudioPipe} as Transcribe audio events.
 *
 * <p>An optional configuration event is sent before the first audio event. A retried session start
 * subscribes again and continues from whatever is left in the pipe.
 */
class AudioPipePublisher implements Publisher<AudioStream> {

  private final AudioPipe pipe;
  private final AudioStream configurationEvent;
  private final Executor executor;

  AudioPipePublisher(AudioPipe pipe, AudioStream configurationEvent, Executor executor) {
    this.pipe = pipe;
    this.configurationEvent = configurationEvent;
    this.executor = executor;
  }

  @Override
  public void subscribe(Subscriber<? super AudioStream> subscriber) {
    subscriber.onSubscribe(
        new AudioPipeSubscription(subscriber, pipe, configurationEvent, executor));
  }
}
