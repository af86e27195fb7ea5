package com.deepansh.mcpendpoint.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final EndpointProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (!properties.getSecurity().isEnableCors()) {
            return;
        }
        registry.addMapping("/**")
                .allowedOriginPatterns(properties.getSecurity().getAllowedOriginList().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
