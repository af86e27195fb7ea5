package com.deepansh.mcpendpoint;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EndpointProperties.class)
public class McpEndpointServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpEndpointServerApplication.class, args);
    }
}
