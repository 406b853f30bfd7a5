package com.voicetutor.config;

import com.voicetutor.types.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 语音前端跨域配置：会话接口与存活探针对前端开放，并暴露链路头。
 */
@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final String[] allowedOriginPatterns;

    public WebCorsConfig(@Value("${tutor.web.allowed-origin-patterns:http://localhost:5173,http://127.0.0.1:5173}")
                         String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(Constants.HEADER_TRACE_ID, Constants.HEADER_REQUEST_ID)
                .maxAge(1800);
        registry.addMapping("/healthz")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET");
    }
}
