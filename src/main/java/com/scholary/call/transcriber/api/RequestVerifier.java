package com.scholary.call.transcriber.api;

import org.springframework.http.HttpHeaders;

/** Decides whether an inbound request may start or continue a call. */
public interface RequestVerifier {

  boolean verify(HttpHeaders headers);
}
