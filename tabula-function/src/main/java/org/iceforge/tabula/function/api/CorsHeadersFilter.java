package org.iceforge.tabula.function.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Answers CORS preflight requests before anything else runs and stamps
 * {@code Access-Control-Allow-Origin: *} on every other response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorsHeadersFilter extends OncePerRequestFilter {

    static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
    static final String MAX_AGE = "Access-Control-Max-Age";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        response.setHeader(ALLOW_ORIGIN, "*");

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setHeader(ALLOW_METHODS, "POST");
            response.setHeader(ALLOW_HEADERS, "Content-Type, Authorization");
            response.setHeader(MAX_AGE, "3600");
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }

        chain.doFilter(request, response);
    }
}
