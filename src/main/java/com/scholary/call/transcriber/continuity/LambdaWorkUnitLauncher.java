package com.scholary.call.transcriber.continuity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

/**
 * Starts successors as asynchronous Lambda invocations.
 *
 * <p>The payload is {@code {"action": "CONTINUE_WORK_UNIT", "checkpoint": {...}}}; the function
 * hands the checkpoint to the continuation endpoint of a transcriber instance.
 */
public class LambdaWorkUnitLauncher implements WorkUnitLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(LambdaWorkUnitLauncher.class);

  static final String ACTION = "CONTINUE_WORK_UNIT";

  private final LambdaClient lambda;
  private final ObjectMapper objectMapper;
  private final String functionArn;

  public LambdaWorkUnitLauncher(
      LambdaClient lambda, ObjectMapper objectMapper, String functionArn) {
    this.lambda = lambda;
    this.objectMapper = objectMapper;
    this.functionArn = functionArn;
  }

  @Override
  public void launch(CallSession checkpoint) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("action", ACTION);
    payload.put("checkpoint", checkpoint);

    try {
      InvokeResponse response =
          lambda.invoke(
              InvokeRequest.builder()
                  .functionName(functionArn)
                  .invocationType(InvocationType.EVENT)
                  .payload(SdkBytes.fromByteArray(objectMapper.writeValueAsBytes(payload)))
                  .build());
      LOGGER.info(
          "Invoked {} for call {} work unit {}: status={}",
          functionArn,
          checkpoint.callId(),
          checkpoint.workUnitSequence(),
          response.statusCode());
    } catch (JsonProcessingException | SdkException e) {
      String errorMsg =
          String.format(
              "Failed to launch work unit %d of call %s via %s",
              checkpoint.workUnitSequence(), checkpoint.callId(), functionArn);
      LOGGER.error(errorMsg, e);
      throw new LaunchException(errorMsg, e);
    }
  }
}
