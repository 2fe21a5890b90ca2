package com.example.reminderscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Chat gateway connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.chat-gateway")
public class ChatGatewayProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 10;
}
