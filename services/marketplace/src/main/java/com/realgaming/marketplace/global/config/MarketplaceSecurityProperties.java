package com.realgaming.marketplace.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "marketplace.security")
public record MarketplaceSecurityProperties(
        int bcryptStrength,
        List<String> allowedOrigins
) {
    private static final int DEFAULT_BCRYPT_STRENGTH = 10;

    public MarketplaceSecurityProperties {
        if (bcryptStrength == 0) {
            bcryptStrength = DEFAULT_BCRYPT_STRENGTH;
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("*");
        }
    }
}
