package com.clinicmate.backend.global.web;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with an {@code X-Request-Id} (propagated into the MDC) and resolves the
 * caller's {@link ClientContext} once, before the security chain runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CLIENT_CONTEXT_ATTRIBUTE = ClientContext.class.getName();
    public static final String MDC_REQUEST_ID = "requestId";
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final int REQUEST_ID_MAX_LENGTH = 64;
    private static final int IP_MAX_LENGTH = 45;
    private static final Pattern IPV4 = Pattern.compile(
            "((25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1?\\d?\\d)");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(MDC_REQUEST_ID, requestId);
        request.setAttribute(REQUEST_ID_HEADER, requestId);
        request.setAttribute(CLIENT_CONTEXT_ATTRIBUTE, new ClientContext(
                resolveClientIp(request),
                ClientContext.truncate(request.getHeader("User-Agent"))
        ));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header) && header.trim().length() <= REQUEST_ID_MAX_LENGTH) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            // first hop is the original client
            String firstHop = forwarded.split(",")[0].trim();
            // IP 형식이 아니면 헤더를 버리고 소켓 주소를 쓴다.
            if (isIpLiteral(firstHop)) {
                return firstHop;
            }
        }
        return request.getRemoteAddr();
    }

    /**
     * Shape check only, no name resolution: IPv4 dotted quads or IPv6 hex groups.
     */
    static boolean isIpLiteral(String candidate) {
        if (candidate.isEmpty() || candidate.length() > IP_MAX_LENGTH) {
            return false;
        }
        return IPV4.matcher(candidate).matches()
                || (candidate.indexOf(':') >= 0 && IPV6_CHARS.matcher(candidate).matches());
    }
}
