package com.beerpong.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Service settings bound from the {@code beerpong.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "beerpong")
public class BeerPongProperties {

    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Cors {
        /**
         * Origins allowed to call {@code /api/**}. Narrow this to the published front end in production.
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE"));
    }
}
