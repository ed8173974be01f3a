package com.phillippitts.engramdesk.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every HTTP request with logging context held in Log4j2's {@link ThreadContext}.
 *
 * <p>Keys written:</p>
 * <ul>
 *   <li>{@code requestId}: the caller's X-Request-ID, or a fresh UUID when absent</li>
 *   <li>{@code method} and {@code uri} of the request</li>
 *   <li>{@code command}: the sidecar command segment for {@code /api/sidecar/*} paths</li>
 * </ul>
 *
 * <p>The sidecar executor's task decorator copies these keys onto tasks a request submits,
 * so worker output logged after a manual start carries the requestId that started it.
 * Keys are removed once the request completes.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SIDECAR_PATH_PREFIX = "/api/sidecar/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));
                ThreadContext.put("method", http.getMethod());
                String uri = http.getRequestURI();
                ThreadContext.put("uri", uri);
                String command = sidecarCommand(uri);
                if (command != null) {
                    ThreadContext.put("command", command);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String sidecarCommand(String uri) {
        if (uri == null || !uri.startsWith(SIDECAR_PATH_PREFIX)) {
            return null;
        }
        String rest = uri.substring(SIDECAR_PATH_PREFIX.length());
        int slash = rest.indexOf('/');
        String command = slash < 0 ? rest : rest.substring(0, slash);
        return command.isBlank() ? null : command;
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
