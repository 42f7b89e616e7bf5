package com.example.datalake.dsdust;

import com.example.datalake.dsdust.config.KaggleProps;
import com.example.datalake.dsdust.config.SearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SearchProperties.class, KaggleProps.class})
public class DsDustApplication {

    public static void main(String[] args) {
        SpringApplication.run(DsDustApplication.class, args);
    }

}
