package com.scholary.call.transcriber.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Region shared by the AWS service clients. Credentials come from the default chain. */
@ConfigurationProperties(prefix = "aws")
@Validated
public record AwsProperties(@NotBlank String region) {}
