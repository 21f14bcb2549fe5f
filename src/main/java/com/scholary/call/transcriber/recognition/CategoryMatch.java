package com.scholary.call.transcriber.recognition;

import java.util.List;

/**
 * A call category rule that matched.
 *
 * @param category the category label
 * @param ranges where in the call the rule matched, may be empty
 */
public record CategoryMatch(String category, List<OffsetRange> ranges)
    implements RecognitionResult {

  public CategoryMatch {
    ranges = List.copyOf(ranges);
  }

  /** Offsets in milliseconds from session start. */
  public record OffsetRange(long beginOffsetMillis, long endOffsetMillis) {}
}
