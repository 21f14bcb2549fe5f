package com.scholary.call.transcriber.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.call.transcriber.continuity.CallSession;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

/**
 * Invokes a Lambda function synchronously with the call as JSON payload and reads a
 * {@link HookResult} back. A response that carries a function error is a failure.
 */
public class LambdaCustomizationHook implements CustomizationHook {

  private static final Logger LOGGER = LoggerFactory.getLogger(LambdaCustomizationHook.class);

  private final LambdaClient lambda;
  private final ObjectMapper objectMapper;
  private final String functionArn;

  public LambdaCustomizationHook(
      LambdaClient lambda, ObjectMapper objectMapper, String functionArn) {
    this.lambda = lambda;
    this.objectMapper = objectMapper;
    this.functionArn = functionArn;
  }

  @Override
  public HookResult customize(CallSession call) {
    LOGGER.info("Invoking customization hook {} for call {}", functionArn, call.callId());
    InvokeResponse response;
    try {
      response =
          lambda.invoke(
              InvokeRequest.builder()
                  .functionName(functionArn)
                  .invocationType(InvocationType.REQUEST_RESPONSE)
                  .payload(SdkBytes.fromByteArray(objectMapper.writeValueAsBytes(call)))
                  .build());
    } catch (JsonProcessingException | SdkException e) {
      String errorMsg =
          String.format(
              "Failed to invoke customization hook %s for call %s", functionArn, call.callId());
      LOGGER.error(errorMsg, e);
      throw new CustomizationHookException(errorMsg, e);
    }

    String payload = response.payload() == null ? "" : response.payload().asUtf8String();
    if (response.functionError() != null) {
      String errorMsg =
          String.format(
              "Customization hook %s failed for call %s: %s: %s",
              functionArn, call.callId(), response.functionError(), payload);
      LOGGER.error(errorMsg);
      throw new CustomizationHookException(errorMsg);
    }
    LOGGER.info("Customization hook response for call {}: {}", call.callId(), payload);

    if (payload.isBlank() || "null".equals(payload.trim())) {
      return HookResult.unchanged();
    }
    try {
      return objectMapper.readValue(payload, HookResult.class);
    } catch (IOException e) {
      String errorMsg =
          String.format("Unreadable customization hook response for call %s", call.callId());
      LOGGER.error(errorMsg, e);
      throw new CustomizationHookException(errorMsg, e);
    }
  }
}
