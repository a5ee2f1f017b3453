package com.example.docstandards;

import com.example.docstandards.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class DocStandardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocStandardsApplication.class, args);
    }

}
