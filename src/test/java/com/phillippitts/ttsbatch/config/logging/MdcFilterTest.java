package com.phillippitts.ttsbatch.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/synthesize");
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void populatesContextDuringChainAndClearsAfter() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        Map<String, String> seen = new HashMap<>();
        doAnswer(inv -> {
            seen.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(request, response);

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "req-123")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/synthesize");
        assertThat(ThreadContext.isEmpty()).isTrue();
        verify(response).setHeader("X-Request-ID", "req-123");
    }

    @Test
    void generatesIdWhenHeaderMissingOrOversized() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("x".repeat(65));

        filter.doFilter(request, response, chain);

        ArgumentCaptor<String> id = ArgumentCaptor.forClass(String.class);
        verify(response).setHeader(eq("X-Request-ID"), id.capture());
        assertThat(id.getValue()).hasSize(36).isNotEqualTo("x".repeat(65));
    }

    @Test
    void clearsContextWhenChainThrows() throws ServletException, IOException {
        doThrow(new ServletException("boom")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain)).isInstanceOf(ServletException.class);
        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
