package com.scholary.call.transcriber.continuity;

import com.scholary.call.transcriber.demux.DemuxResult;
import java.nio.file.Path;
import java.util.List;

/**
 * What the streaming phase of a work unit produced.
 *
 * @param lastCallerFragment resume marker for the caller source
 * @param lastAgentFragment resume marker for the agent source
 * @param recognitionSessionId session id assigned by the recognition service
 * @param deadlineReached true if the work unit stopped because its time budget ran out
 * @param recordingPath local raw recording, null when recording is off
 * @param framesEmitted interleaved frames produced
 * @param demuxResults one result per source reader
 */
public record StreamingResult(
    String lastCallerFragment,
    String lastAgentFragment,
    String recognitionSessionId,
    boolean deadlineReached,
    Path recordingPath,
    long framesEmitted,
    List<DemuxResult> demuxResults) {}
