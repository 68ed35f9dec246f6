package com.deepansh.sectools;

import com.deepansh.sectools.config.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ToolProperties.class)
public class SecurityToolsApplication {
    public static void main(String[] args) {
        SpringApplication.run(SecurityToolsApplication.class, args);
    }
}
