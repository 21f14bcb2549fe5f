package com.scholary.call.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CallTranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(CallTranscriberApplication.class, args);
  }
}
