package com.caffe.devicebinding.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    @Test
    void keepsWellFormedClientTraceId() {
        assertThat(RequestLoggingFilter.resolveTraceId("mobile-7f3a.42_x")).isEqualTo("mobile-7f3a.42_x");
    }

    @Test
    void replacesMissingOrMalformedTraceIdWithUuid() {
        assertThat(UUID.fromString(RequestLoggingFilter.resolveTraceId(null))).isNotNull();
        assertThat(UUID.fromString(RequestLoggingFilter.resolveTraceId("  "))).isNotNull();
        assertThat(RequestLoggingFilter.resolveTraceId("bad id\r\ninjected")).doesNotContain("injected");
        assertThat(RequestLoggingFilter.resolveTraceId("x".repeat(65))).hasSize(36);
    }

    @Test
    void exposesTraceIdOnRequestAndResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/metadata");
        request.addHeader(RequestLoggingFilter.TRACE_HEADER, "trace-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new RequestLoggingFilter().doFilter(request, response, new MockFilterChain());

        assertThat(RequestLoggingFilter.traceIdOf(request)).isEqualTo("trace-123");
        assertThat(response.getHeader(RequestLoggingFilter.TRACE_HEADER)).isEqualTo("trace-123");
    }
}
