package com.strata.platform.infrastructure.web;

import com.strata.observability.CorrelationContextHolder;
import com.strata.security.BearerTokenExtractor;
import com.strata.security.Principal;
import com.strata.security.SessionCodec;
import com.strata.security.SessionTokenException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies a verified {@link Principal} to any handler method that declares one. Declaring the
 * parameter is what makes an endpoint authenticated; a missing or invalid bearer token fails the
 * request with {@link SessionTokenException}.
 */
@Component
public class SessionPrincipalResolver implements HandlerMethodArgumentResolver {

    private final SessionCodec sessionCodec;

    public SessionPrincipalResolver(SessionCodec sessionCodec) {
        this.sessionCodec = sessionCodec;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Principal.class.equals(parameter.getParameterType());
    }

    @Override
    public Principal resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String header = request == null ? null : request.getHeader(HttpHeaders.AUTHORIZATION);
        String token = BearerTokenExtractor.extract(header)
                .orElseThrow(() -> new SessionTokenException("Missing session token"));

        Principal principal = sessionCodec.verify(token);
        CorrelationContextHolder.bindPrincipal(
                principal.id().toString(),
                principal.tenant().map(Object::toString).orElse(null));
        return principal;
    }
}
