package com.studioledger.backup.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs method, path, status and duration of API calls. Mutating calls (backup runs,
 * restores, destination edits) are logged at INFO, reads at DEBUG.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String START_TIME_ATTR = "backupApi.requestStart";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.nanoTime());
        log.debug("Request: {} {} from {}", request.getMethod(), request.getRequestURI(), clientAddress(request));
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTR);
        long durationMs = start instanceof Long nanos ? (System.nanoTime() - nanos) / 1_000_000 : 0;

        int status = response.getStatus();
        String method = request.getMethod();
        String path = request.getRequestURI();

        if (status >= 500) {
            log.error("Response: {} {} -> {} ({}ms){}", method, path, status, durationMs,
                    ex != null ? " - " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Response: {} {} -> {} ({}ms)", method, path, status, durationMs);
        } else if (isMutating(method)) {
            log.info("Response: {} {} -> {} ({}ms)", method, path, status, durationMs);
        } else {
            log.debug("Response: {} {} -> {} ({}ms)", method, path, status, durationMs);
        }
    }

    static boolean isMutating(String method) {
        return "POST".equals(method) || "PUT".equals(method)
                || "DELETE".equals(method) || "PATCH".equals(method);
    }

    static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
