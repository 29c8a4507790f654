package com.callflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 统一 HTTP 链路日志过滤器：写入 traceId / requestId 到 MDC 与响应头，并输出 HTTP_IN / HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        ContentCachingRequestWrapper requestWrapper = request instanceof ContentCachingRequestWrapper
                ? (ContentCachingRequestWrapper) request
                : new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper
                ? (ContentCachingResponseWrapper) response
                : new ContentCachingResponseWrapper(response);

        log.info("HTTP_IN method={}, path={}, query={}", method, path, StringUtils.defaultIfBlank(request.getQueryString(), "-"));
        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
            if (error == null) {
                if (costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L)) {
                    log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=slow, requestBodySummary={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs, summarizeRequestBody(requestWrapper));
                } else {
                    log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=success, requestBodySummary={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs, summarizeRequestBody(requestWrapper));
                }
            } else {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs,
                        error.getClass().getSimpleName(), truncate(error.getMessage(), 200));
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            Map<String, Object> responseMap = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
            Object code = responseMap.get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response body is not an envelope. error={}", ex.getMessage());
            return null;
        }
    }

    private String summarizeRequestBody(ContentCachingRequestWrapper requestWrapper) {
        if (!properties.isLogRequestBody()) {
            return "-";
        }
        byte[] body = requestWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(requestWrapper.getContentType())) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
            Map<String, Object> summary = new LinkedHashMap<>();
            List<String> whitelist = properties.getRequestBodyWhitelist();
            if (whitelist != null) {
                for (String key : whitelist) {
                    if (StringUtils.isNotBlank(key) && source.containsKey(key)) {
                        summary.put(key, source.get(key));
                    }
                }
            }
            return summary.isEmpty() ? "-" : truncate(objectMapper.writeValueAsString(summary),
                    Math.max(64, properties.getMaxBodyLength()));
        } catch (JsonProcessingException ex) {
            return "-";
        } catch (IOException ex) {
            log.debug("Request body could not be summarized. error={}", ex.getMessage());
            return "-";
        }
    }

    private boolean isJson(String contentType) {
        return StringUtils.isNotBlank(contentType)
                && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
    }

    private String resolveOrCreate(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (StringUtils.isBlank(path) || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
