package com.scholary.call.transcriber.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;

/** Writes call events to a Kinesis data stream, partitioned by call id. */
public class KinesisEventLog implements EventLog {

  private static final Logger LOGGER = LoggerFactory.getLogger(KinesisEventLog.class);

  private final KinesisClient kinesisClient;
  private final String streamName;

  public KinesisEventLog(KinesisClient kinesisClient, String streamName) {
    this.kinesisClient = kinesisClient;
    this.streamName = streamName;
    LOGGER.info("Kinesis event log initialized: stream={}", streamName);
  }

  @Override
  public void append(String partitionKey, byte[] record) {
    try {
      kinesisClient.putRecord(
          PutRecordRequest.builder()
              .streamName(streamName)
              .partitionKey(partitionKey)
              .data(SdkBytes.fromByteArray(record))
              .build());
    } catch (SdkException e) {
      String message =
          String.format(
              "Failed to put record: stream=%s, partitionKey=%s, bytes=%d",
              streamName, partitionKey, record.length);
      throw new EventLogException(message, e);
    }
  }
}
