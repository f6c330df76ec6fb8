package com.automate.ScanOps.Filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.filter.CommonsRequestLoggingFilter;

import java.util.regex.Pattern;

/**
 * Request logging that keeps query strings but never writes an {@code access_token} value.
 * SSE subscribers pass their bearer token that way.
 */
public class TokenMaskingRequestLoggingFilter extends CommonsRequestLoggingFilter {

    private static final Pattern ACCESS_TOKEN = Pattern.compile("(access_token=)[^&\\s,\\]]*", Pattern.CASE_INSENSITIVE);

    @Override
    protected String createMessage(HttpServletRequest request, String prefix, String suffix) {
        return maskTokens(super.createMessage(request, prefix, suffix));
    }

    static String maskTokens(String message) {
        return message == null ? null : ACCESS_TOKEN.matcher(message).replaceAll("$1****");
    }
}
