package com.memberly.backend.common.web;

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
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 每個 request 一個 id：錯誤 body 的 requestId、response header、log 的 [rid=...] 都是同一個值。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    static final String ATTR = RequestIdFilter.class.getName() + ".id";
    static final String MDC_KEY = "rid";

    // header 會原樣進 log，只收不會破壞 log 行的字元
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String id = resolve(req.getHeader(HEADER));
        req.setAttribute(ATTR, id);
        res.setHeader(HEADER, id);

        String outer = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, id);
        try {
            chain.doFilter(req, res);
        } finally {
            if (outer == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, outer);
        }
    }

    static String resolve(String incoming) {
        if (incoming != null && SAFE_ID.matcher(incoming).matches()) return incoming;
        return UUID.randomUUID().toString();
    }

    /** filter 沒跑過（例如 slice test 之外的呼叫）時給一個新的，不回 null */
    public static String currentId(HttpServletRequest req) {
        Object id = req.getAttribute(ATTR);
        return id instanceof String s ? s : UUID.randomUUID().toString();
    }
}
