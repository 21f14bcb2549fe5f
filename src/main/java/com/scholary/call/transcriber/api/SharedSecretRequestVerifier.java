package com.scholary.call.transcriber.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.http.HttpHeaders;

/** Accepts requests that carry the configured secret in {@value #HEADER}. */
public class SharedSecretRequestVerifier implements RequestVerifier {

  public static final String HEADER = "X-Transcriber-Secret";

  private final byte[] secret;

  public SharedSecretRequestVerifier(String secret) {
    this.secret = secret.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public boolean verify(HttpHeaders headers) {
    String presented = headers.getFirst(HEADER);
    if (presented == null) {
      return false;
    }
    return MessageDigest.isEqual(secret, presented.getBytes(StandardCharsets.UTF_8));
  }
}
