package com.scholary.call.transcriber.events;

/** Append-only, partitioned log of call events. */
public interface EventLog {

  /**
   * Append one serialized record. Records with the same partition key keep their order.
   *
   * @throws EventLogException if the record could not be written
   */
  void append(String partitionKey, byte[] record);
}
