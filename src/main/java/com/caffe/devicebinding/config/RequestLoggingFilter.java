package com.caffe.devicebinding.config;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.UUID;

/**
 * Logs every request and tags it with a trace ID, taken from {@code X-Trace-Id} when the
 * caller sends one. Runs ahead of the security chain so rejected requests are traced too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String TRACE_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".traceId";
    static final String MDC_KEY = "traceId";
    private static final int MAX_TRACE_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String method = httpRequest.getMethod();
        String uri = httpRequest.getRequestURI();
        String traceId = resolveTraceId(httpRequest.getHeader(TRACE_HEADER));

        httpRequest.setAttribute(TRACE_ATTRIBUTE, traceId);
        httpResponse.setHeader(TRACE_HEADER, traceId);
        MDC.put(MDC_KEY, traceId);

        long startTime = System.currentTimeMillis();
        try {
            log.info("REQUEST: {} {} [trace {}]", method, uri, traceId);
            chain.doFilter(request, response);
            log.info("REQUEST: Completed {} {} - Status: {} - Time: {}ms",
                    method, uri, httpResponse.getStatus(), System.currentTimeMillis() - startTime);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("REQUEST: Error processing {} {}: {}", method, uri, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    public static String traceIdOf(HttpServletRequest request) {
        Object traceId = request.getAttribute(TRACE_ATTRIBUTE);
        return traceId != null ? traceId.toString() : request.getHeader(TRACE_HEADER);
    }

    static String resolveTraceId(String header) {
        if (StringUtils.hasText(header) && header.length() <= MAX_TRACE_LENGTH && header.matches("[A-Za-z0-9._-]+")) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
