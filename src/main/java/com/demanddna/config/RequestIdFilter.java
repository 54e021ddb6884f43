package com.demanddna.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Echoes the caller's {@code X-Request-ID} or assigns a fresh one, on every API response.
 * The resolved id is also exposed as a request attribute for controllers and error handling.
 */
@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        request.setAttribute(ATTRIBUTE, requestId);
        response.setHeader(HEADER, requestId);
        log.debug("{} {} | requestId={}", request.getMethod(), request.getRequestURI(), requestId);
        filterChain.doFilter(request, response);
    }

    /**
     * Id assigned by this filter, falling back to the raw header or a new id when the
     * request did not pass through it.
     */
    public static String requestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(ATTRIBUTE);
        if (assigned instanceof String id) {
            return id;
        }
        return resolveRequestId(request);
    }

    private static String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }
}
