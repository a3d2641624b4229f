package com.phillippitts.transcodeguard.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;
import java.util.UUID;

/**
 * Tags every log line written while serving an API call with the call's correlation keys.
 *
 * <p>{@code requestId} comes from the {@code X-Request-ID} header, or a fresh UUID, and is
 * returned on the response so clients can quote it. {@code method} and {@code uri} describe the
 * call. Requests addressed to a single job ({@code /api/jobs/{id}/...}) also carry {@code jobId},
 * the same key the coordinator sets around job work.</p>
 *
 * <p>The context is cleared when the request completes, including on failure.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String JOBS_PREFIX = "/api/jobs/";

    // Collection endpoints under /api/jobs that are not job ids
    private static final Set<String> JOB_COLLECTION_SEGMENTS = Set.of("active", "history", "statistics");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestIdOf(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                String jobId = jobIdOf(http.getRequestURI());
                if (jobId != null) {
                    ThreadContext.put("jobId", jobId);
                }
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestIdOf(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }

    static String jobIdOf(String uri) {
        if (uri == null || !uri.startsWith(JOBS_PREFIX)) {
            return null;
        }
        String rest = uri.substring(JOBS_PREFIX.length());
        int slash = rest.indexOf('/');
        String segment = slash < 0 ? rest : rest.substring(0, slash);
        if (segment.isEmpty() || JOB_COLLECTION_SEGMENTS.contains(segment)) {
            return null;
        }
        return segment;
    }
}
