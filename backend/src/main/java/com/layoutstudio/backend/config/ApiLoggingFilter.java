package com.layoutstudio.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One line per API call. Health probes and successful reads go to debug,
 * edits and failures to info.
 */
@Component
public class ApiLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long t0 = System.currentTimeMillis();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = System.currentTimeMillis() - t0;
            int status = res.getStatus();
            boolean quiet = req.getRequestURI().equals("/health")
                    || (req.getMethod().equals("GET") && status < 400);
            String query = req.getQueryString() == null ? "" : "?" + req.getQueryString();
            if (quiet) {
                log.debug("{} {}{} -> {} ({}ms)", req.getMethod(), req.getRequestURI(), query, status, ms);
            } else {
                log.info("{} {}{} -> {} ({}ms)", req.getMethod(), req.getRequestURI(), query, status, ms);
            }
        }
    }
}
