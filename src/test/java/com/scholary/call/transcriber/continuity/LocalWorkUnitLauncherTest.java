package com.scholary.call.transcriber.continuity;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class LocalWorkUnitLauncherTest {

  @Mock private ObjectProvider<ContinuityController> provider;
  @Mock private ContinuityController controller;

  private final CallSession checkpoint =
      CallSession.newCall("call-1", "caller-stream", "agent-stream", "+1", "+2", null, null)
          .successor("100", "200", "s-1");

  @BeforeEach
  void setUp() {
    when(provider.getObject()).thenReturn(controller);
  }

  @Test
  void launch_shouldSubmitSuccessorLocally() {
    when(controller.submit(checkpoint)).thenReturn(Optional.of("call-1#1"));

    assertThatCode(() -> new LocalWorkUnitLauncher(provider).launch(checkpoint))
        .doesNotThrowAnyException();
  }

  @Test
  void launch_shouldFailWhenSuccessorIsRejected() {
    when(controller.submit(checkpoint)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> new LocalWorkUnitLauncher(provider).launch(checkpoint))
        .isInstanceOf(LaunchException.class)
        .hasMessageContaining("sequence 1");
  }
}
