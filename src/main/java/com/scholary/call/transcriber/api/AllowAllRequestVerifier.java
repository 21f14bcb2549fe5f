package com.scholary.call.transcriber.api;

import org.springframework.http.HttpHeaders;

/** Accepts every request. Used when no shared secret is configured. */
public class AllowAllRequestVerifier implements RequestVerifier {

  @Override
  public boolean verify(HttpHeaders headers) {
    return true;
  }
}
