package com.example.securitycore.config;

import com.example.securitycore.http.SecurityMiddlewareFilter;
import com.example.securitycore.service.AuditLogService;
import com.example.securitycore.service.CsrfTokenService;
import com.example.securitycore.service.IpAccessList;
import com.example.securitycore.service.RateLimiterService;
import com.example.securitycore.service.SessionSecurityService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Installs the security middleware right behind the request id filter.
 */
@Configuration
public class SecurityFilterConfig {

    @Bean
    public FilterRegistrationBean<SecurityMiddlewareFilter> securityMiddleware(
            MiddlewareProperties properties,
            IpAccessList ipAccessList,
            SessionSecurityService sessionService,
            RateLimiterService rateLimiter,
            CsrfTokenService csrfTokens,
            AuditLogService auditLogService,
            ObjectMapper objectMapper) {
        FilterRegistrationBean<SecurityMiddlewareFilter> registration = new FilterRegistrationBean<>(
                new SecurityMiddlewareFilter(properties, ipAccessList, sessionService, rateLimiter,
                        csrfTokens, auditLogService, objectMapper));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
