package com.expirebot.expiry.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    private static final String TRANSACTION_PATH = "/transactions/";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        String txnId = transactionId(request.getRequestURI());
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, txnId));
        MDC.put("trace_id", traceId);
        if (txnId != null) {
            MDC.put("txn_id", txnId);
        }
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("trace_id");
            MDC.remove("txn_id");
            RequestContextHolder.clear();
        }
    }

    static String transactionId(String uri) {
        if (uri == null) {
            return null;
        }
        int idx = uri.lastIndexOf(TRANSACTION_PATH);
        if (idx < 0 || idx + TRANSACTION_PATH.length() >= uri.length()) {
            return null;
        }
        return uri.substring(idx + TRANSACTION_PATH.length());
    }
}
