package com.realgaming.marketplace.adapter.out.security;

import com.realgaming.marketplace.application.port.out.PasswordEncodePort;
import com.realgaming.marketplace.global.config.MarketplaceSecurityProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 해시 문자열에 cost 와 salt 가 들어 있으므로 검증할 때 따로 설정이 필요 없다.
 */
@Component
public class BCryptPasswordEncodeAdapter implements PasswordEncodePort {
    private final PasswordEncoder passwordEncoder;

    public BCryptPasswordEncodeAdapter(MarketplaceSecurityProperties properties) {
        this.passwordEncoder = new BCryptPasswordEncoder(properties.bcryptStrength());
    }

    @Override
    public String encode(String data) {
        return passwordEncoder.encode(data);
    }

    @Override
    public boolean matches(String data, String hashedData) {
        return passwordEncoder.matches(data, hashedData);
    }
}
