package com.scholary.call.transcriber.continuity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
class LambdaWorkUnitLauncherTest {

  private static final String FUNCTION = "arn:aws:lambda:us-east-1:123:function:transcriber";

  @Mock private LambdaClient lambda;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final CallSession checkpoint =
      CallSession.newCall("call-1", "caller-stream", "agent-stream", "+1", "+2", "agent-7", null)
          .successor("100", "200", "s-1");

  @Test
  void launch_shouldInvokeAsynchronouslyWithCheckpoint() throws Exception {
    when(lambda.invoke(any(InvokeRequest.class)))
        .thenReturn(InvokeResponse.builder().statusCode(202).build());

    new LambdaWorkUnitLauncher(lambda, objectMapper, FUNCTION).launch(checkpoint);

    ArgumentCaptor<InvokeRequest> request = ArgumentCaptor.forClass(InvokeRequest.class);
    verify(lambda).invoke(request.capture());
    assertThat(request.getValue().functionName()).isEqualTo(FUNCTION);
    assertThat(request.getValue().invocationType()).isEqualTo(InvocationType.EVENT);
    JsonNode payload = objectMapper.readTree(request.getValue().payload().asByteArray());
    assertThat(payload.get("action").asText()).isEqualTo(LambdaWorkUnitLauncher.ACTION);
    CallSession sent = objectMapper.treeToValue(payload.get("checkpoint"), CallSession.class);
    assertThat(sent).isEqualTo(checkpoint);
  }

  @Test
  void launch_shouldWrapInvocationFailure() {
    when(lambda.invoke(any(InvokeRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("no such function").build());

    assertThatThrownBy(
            () -> new LambdaWorkUnitLauncher(lambda, objectMapper, FUNCTION).launch(checkpoint))
        .isInstanceOf(LaunchException.class)
        .hasMessageContaining("work unit 1 of call call-1");
  }
}
