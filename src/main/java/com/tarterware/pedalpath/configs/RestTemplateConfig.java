package com.tarterware.pedalpath.configs;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig
{
    // Routing calls give up after this long.
    @Value("${com.tarterware.pedalpath.routing-timeout:15s}")
    private Duration routingTimeout;

    @Bean
    RestTemplate restTemplate(RestTemplateBuilder builder)
    {
        return builder.connectTimeout(routingTimeout).readTimeout(routingTimeout).build();
    }
}
