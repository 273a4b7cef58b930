package com.syncnest.identityservice.utils;

import com.syncnest.identityservice.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps successful JSON responses of this service's controllers in {@link ApiResponse}:
 * <pre>
 * { "timestamp": "...Z", "requestId": "...", "message": "OK", "data": {...}, "meta": {...} }
 * </pre>
 * Problem responses, non-2xx statuses, empty bodies and non-JSON media types pass through untouched.
 * A {@link Page} body is unwrapped into its content with paging info in {@code meta}.
 */
@RestControllerAdvice(basePackages = "com.syncnest.identityservice.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    private final Clock clock;

    public SuccessEnvelopeAdvice(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body == null || body instanceof ProblemDetail || body instanceof ApiResponse<?>
                || body instanceof byte[] || body instanceof Resource) {
            return body;
        }
        if (!isJsonLike(selectedContentType)) return body;

        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus status = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (status != null && !status.is2xxSuccessful()) return body;
        }

        Object data = body;
        Object meta = null;
        if (body instanceof Page<?> page) {
            data = page.getContent();
            meta = pageMeta(page);
        }
        return ApiResponse.of(Instant.now(clock), requestId(request, response), resolveMessage(returnType), data, meta);
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    /** Message from @ResponseMessage on the method or controller, default "OK". */
    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : "OK";
    }

    private String requestId(ServerHttpRequest req, ServerHttpResponse resp) {
        if (req instanceof ServletServerHttpRequest sreq) {
            var servletResp = resp instanceof ServletServerHttpResponse s ? s.getServletResponse() : null;
            return RequestIds.resolve(sreq.getServletRequest(), servletResp);
        }
        return req.getHeaders().getFirst(RequestIds.HEADER);
    }

    private Map<String, Object> pageMeta(Page<?> page) {
        Map<String, Object> map = new LinkedHashMap<>(5);
        map.put("page", page.getNumber());
        map.put("size", page.getSize());
        map.put("totalItems", page.getTotalElements());
        map.put("totalPages", page.getTotalPages());
        if (page.getSort().isSorted()) {
            map.put("sort", page.getSort().toString());
        }
        return map;
    }
}
