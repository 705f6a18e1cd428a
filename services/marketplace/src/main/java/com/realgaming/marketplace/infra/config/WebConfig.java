package com.realgaming.marketplace.infra.config;

import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 쿼리 파라미터의 role, status 를 JSON 과 같은 소문자 값으로 받는다.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Role.class, toRole());
        registry.addConverter(String.class, Status.class, toStatus());
    }

    private static Converter<String, Role> toRole() {
        return source -> StringUtils.hasText(source) ? Role.from(source.trim()) : null;
    }

    private static Converter<String, Status> toStatus() {
        return source -> StringUtils.hasText(source) ? Status.from(source.trim()) : null;
    }
}
