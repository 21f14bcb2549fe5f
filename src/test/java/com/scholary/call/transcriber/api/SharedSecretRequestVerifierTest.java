package com.scholary.call.transcriber.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class SharedSecretRequestVerifierTest {

  private final SharedSecretRequestVerifier verifier = new SharedSecretRequestVerifier("s3cret");

  @Test
  void verify_shouldAcceptMatchingSecret() {
    assertThat(verifier.verify(headers("s3cret"))).isTrue();
  }

  @Test
  void verify_shouldRejectWrongOrMissingSecret() {
    assertThat(verifier.verify(headers("s3cret2"))).isFalse();
    assertThat(verifier.verify(new HttpHeaders())).isFalse();
  }

  @Test
  void hasSharedSecret_shouldTreatEmptySecretAsDisabled() {
    assertThat(new SecurityProperties("").hasSharedSecret()).isFalse();
    assertThat(new SecurityProperties(null).hasSharedSecret()).isFalse();
    assertThat(new SecurityProperties("s3cret").hasSharedSecret()).isTrue();
  }

  private static HttpHeaders headers(String secret) {
    HttpHeaders headers = new HttpHeaders();
    headers.add(SharedSecretRequestVerifier.HEADER, secret);
    return headers;
  }
}
