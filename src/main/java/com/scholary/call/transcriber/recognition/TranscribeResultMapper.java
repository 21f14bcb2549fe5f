package com.scholary.call.transcriber.recognition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.transcribestreaming.model.Alternative;
import software.amazon.awssdk.services.transcribestreaming.model.CallAnalyticsTranscriptResultStream;
import software.amazon.awssdk.services.transcribestreaming.model.CategoryEvent;
import software.amazon.awssdk.services.transcribestreaming.model.PointsOfInterest;
import software.amazon.awssdk.services.transcribestreaming.model.Result;
import software.amazon.awssdk.services.transcribestreaming.model.TimestampRange;
import software.amazon.awssdk.services.transcribestreaming.model.TranscriptEvent;
import software.amazon.awssdk.services.transcribestreaming.model.TranscriptResultStream;
import software.amazon.awssdk.services.transcribestreaming.model.UtteranceEvent;

/** Converts Transcribe result stream events into {@link RecognitionResult}s. */
final class TranscribeResultMapper {

  private TranscribeResultMapper() {}

  /** Results without an alternative or without a channel are skipped. */
  static List<RecognitionResult> fromTranscriptStream(TranscriptResultStream event) {
    List<RecognitionResult> results = new ArrayList<>();
    if (!(event instanceof TranscriptEvent transcriptEvent)
        || transcriptEvent.transcript() == null) {
      return results;
    }
    for (Result result : transcriptEvent.transcript().results()) {
      if (result.alternatives().isEmpty() || result.channelId() == null) {
        continue;
      }
      Alternative best = result.alternatives().get(0);
      results.add(
          new TranscriptSegment(
              result.channelId(),
              valueOr(result.startTime(), 0.0),
              valueOr(result.endTime(), 0.0),
              best.transcript(),
              Boolean.TRUE.equals(result.isPartial())));
    }
    return results;
  }

  static List<RecognitionResult> fromAnalyticsStream(CallAnalyticsTranscriptResultStream event) {
    List<RecognitionResult> results = new ArrayList<>();
    if (event instanceof UtteranceEvent utterance) {
      results.add(
          new Utterance(
              utterance.utteranceId(),
              utterance.participantRoleAsString(),
              valueOr(utterance.beginOffsetMillis(), 0L),
              valueOr(utterance.endOffsetMillis(), 0L),
              utterance.transcript(),
              Boolean.TRUE.equals(utterance.isPartial()),
              utterance.sentimentAsString()));
    } else if (event instanceof CategoryEvent categoryEvent) {
      Map<String, PointsOfInterest> details = categoryEvent.matchedDetails();
      for (String category : categoryEvent.matchedCategories()) {
        List<CategoryMatch.OffsetRange> ranges = new ArrayList<>();
        PointsOfInterest points = details.get(category);
        if (points != null) {
          for (TimestampRange range : points.timestampRanges()) {
            ranges.add(
                new CategoryMatch.OffsetRange(
                    valueOr(range.beginOffsetMillis(), 0L),
                    valueOr(range.endOffsetMillis(), 0L)));
          }
        }
        results.add(new CategoryMatch(category, ranges));
      }
    }
    return results;
  }

  private static <T> T valueOr(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
