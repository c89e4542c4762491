package com.beerpong.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(BeerPongProperties.class)
public class WebCorsConfig implements WebMvcConfigurer {

    private final BeerPongProperties beerPongProperties;

    public WebCorsConfig(BeerPongProperties beerPongProperties) {
        this.beerPongProperties = beerPongProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        BeerPongProperties.Cors cors = beerPongProperties.getCors();
        registry.addMapping("/api/**")
                .allowedOrigins(cors.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods(cors.getAllowedMethods().toArray(String[]::new));
    }
}
