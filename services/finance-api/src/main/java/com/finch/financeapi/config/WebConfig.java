package com.finch.financeapi.config;

import com.finch.financeapi.infrastructure.web.AuthorizationInterceptor;
import com.finch.financeapi.infrastructure.web.CurrentPrincipalArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, authorization guards and principal injection.
 *
 * <p>In production, CORS origins should be externalized to config.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthorizationInterceptor authorizationInterceptor;
    private final CurrentPrincipalArgumentResolver currentPrincipalArgumentResolver;

    public WebConfig(
            AuthorizationInterceptor authorizationInterceptor,
            CurrentPrincipalArgumentResolver currentPrincipalArgumentResolver) {
        this.authorizationInterceptor = authorizationInterceptor;
        this.currentPrincipalArgumentResolver = currentPrincipalArgumentResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authorizationInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(currentPrincipalArgumentResolver);
    }
}
