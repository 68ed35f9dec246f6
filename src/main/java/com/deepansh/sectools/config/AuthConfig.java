package com.deepansh.sectools.config;

import com.deepansh.sectools.auth.BearerAuthFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Registers the bearer filter ahead of everything else, on every path.
 */
@Configuration
public class AuthConfig {

    @Bean
    public FilterRegistrationBean<BearerAuthFilter> bearerAuthFilter(ToolProperties toolProperties,
                                                                     ObjectMapper objectMapper) {
        FilterRegistrationBean<BearerAuthFilter> registration = new FilterRegistrationBean<>(
                new BearerAuthFilter(toolProperties.security().authToken(), objectMapper));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.setName("bearerAuthFilter");
        return registration;
    }
}
