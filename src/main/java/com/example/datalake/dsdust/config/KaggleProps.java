package com.example.datalake.dsdust.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dsdust.kaggle")
public class KaggleProps {
    private String baseUrl = "https://www.kaggle.com/api/v1";
    private String username;
    private String key;
    private Duration timeout = Duration.ofSeconds(20);
}
