package com.bbthechange.mealvoting.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Exposes the authenticated signer to controllers and to the logging MDC.
 *
 * Signature verification happens in front of this service; by the time a
 * request arrives, X-Chain-Signer holds an already verified identity.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SignerFilter extends OncePerRequestFilter {

    public static final String SIGNER_HEADER = "X-Chain-Signer";
    public static final String SIGNER_ATTRIBUTE = "signer";
    private static final String MDC_SIGNER = "signer";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String signer = request.getHeader(SIGNER_HEADER);
        if (signer == null || signer.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        request.setAttribute(SIGNER_ATTRIBUTE, signer.trim());
        MDC.put(MDC_SIGNER, signer.trim());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_SIGNER);
        }
    }
}
