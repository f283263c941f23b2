package com.pulseanalytics.api;

import com.pulseanalytics.domain.service.TenantResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {
    
    private final TenantResolver tenantResolver;
    
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Health checks are not tenant-scoped
        registry.addInterceptor(new TenantAuthInterceptor(tenantResolver))
                .addPathPatterns("/**")
                .excludePathPatterns("/health", "/health/**", "/actuator/**", "/error");
    }
    
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
