package com.platform.resourcecontroller.observability;

import ch.qos.logback.classic.LoggerContext;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for requests and resource context
 * for reconciliation passes.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_RESOURCE_TYPE = "resourceType";
    public static final String MDC_RESOURCE_NAME = "resourceName";
    
    @Value("${spring.application.name:resource-controller}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set the resource a reconciliation pass works on in MDC.
     */
    public static void setResourceContext(ResourceIdentity identity) {
        MDC.put(MDC_RESOURCE_TYPE, identity.resourceType());
        MDC.put(MDC_RESOURCE_NAME, identity.name());
    }
    
    /**
     * Clear resource context from MDC.
     */
    public static void clearResourceContext() {
        MDC.remove(MDC_RESOURCE_TYPE);
        MDC.remove(MDC_RESOURCE_NAME);
    }
}
