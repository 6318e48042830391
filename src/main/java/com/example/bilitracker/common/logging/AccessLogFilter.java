package com.example.bilitracker.common.logging;

import java.io.IOException;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each API request with a request id and writes one access line when it completes.
 * The status endpoint is polled by the UI, so it is only logged at DEBUG.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String POLLED_URI = "/api/v1/status";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.trim().isEmpty()) {
            requestId = UUID.randomUUID().toString().replace("-", "");
        }
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (POLLED_URI.equals(request.getRequestURI())) {
                log.debug("ACCESS method={} uri={} status={} costMs={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), cost);
            } else {
                log.info("ACCESS method={} uri={} status={} costMs={} ip={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), cost,
                        request.getRemoteAddr());
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
