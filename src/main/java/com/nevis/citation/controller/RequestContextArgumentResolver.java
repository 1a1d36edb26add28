package com.nevis.citation.controller;

import com.nevis.citation.exception.MissingRequestContextException;
import com.nevis.citation.model.RequestContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the caller's {@link RequestContext} from the identity headers set by the gateway.
 */
public class RequestContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String PROJECT_HEADER = "X-Project-Id";
    public static final String USER_HEADER = "X-User-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return RequestContext.class.equals(parameter.getParameterType());
    }

    @Override
    public RequestContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return new RequestContext(
            required(webRequest, TENANT_HEADER),
            required(webRequest, PROJECT_HEADER),
            required(webRequest, USER_HEADER)
        );
    }

    private static String required(NativeWebRequest request, String header) {
        String value = request.getHeader(header);
        if (value == null || value.isBlank()) {
            throw new MissingRequestContextException(header);
        }
        return value.strip();
    }
}
