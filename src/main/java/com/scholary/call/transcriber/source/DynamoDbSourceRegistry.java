package com.scholary.call.transcriber.source;

import com.scholary.call.transcriber.audio.ChannelRole;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

/**
 * Reads source registrations from the call event table.
 *
 * <p>Each party has its own item: {@code PK = ce#{callId}}, {@code SK = CALLER | AGENT}, with the
 * stream ARN in {@code StreamArn}.
 */
public class DynamoDbSourceRegistry implements SourceRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamoDbSourceRegistry.class);

  static final String PARTITION_KEY = "PK";
  static final String SORT_KEY = "SK";
  static final String STREAM_ARN = "StreamArn";

  private final DynamoDbClient dynamoDb;
  private final String tableName;

  public DynamoDbSourceRegistry(DynamoDbClient dynamoDb, String tableName) {
    this.dynamoDb = dynamoDb;
    this.tableName = tableName;
  }

  @Override
  public ChannelSources lookup(String callId) {
    return new ChannelSources(
        streamArn(callId, ChannelRole.CALLER), streamArn(callId, ChannelRole.AGENT));
  }

  private String streamArn(String callId, ChannelRole role) {
    GetItemRequest request =
        GetItemRequest.builder()
            .tableName(tableName)
            .key(
                Map.of(
                    PARTITION_KEY, AttributeValue.fromS("ce#" + callId),
                    SORT_KEY, AttributeValue.fromS(role.name())))
            .consistentRead(true)
            .build();
    try {
      GetItemResponse response = dynamoDb.getItem(request);
      if (!response.hasItem() || !response.item().containsKey(STREAM_ARN)) {
        LOGGER.debug("{} source not registered yet for call {}", role, callId);
        return null;
      }
      return response.item().get(STREAM_ARN).s();
    } catch (SdkException e) {
      String errorMsg =
          String.format(
              "Failed to look up %s source for call %s in table %s", role, callId, tableName);
      LOGGER.error(errorMsg, e);
      throw new SourceLookupException(errorMsg, e);
    }
  }
}
