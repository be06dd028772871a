package com.kincircle.trust.config;

import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.Role;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;

/**
 * Builds the {@link Principal} handed over by the identity collaborator
 * in the {@code X-Principal-Id} and {@code X-Principal-Role} headers.
 */
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ID_HEADER = "X-Principal-Id";
    public static final String ROLE_HEADER = "X-Principal-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Principal.class.equals(parameter.getParameterType());
    }

    @Override
    public Principal resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                     NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String id = webRequest.getHeader(ID_HEADER);
        String role = webRequest.getHeader(ROLE_HEADER);
        if (!StringUtils.hasText(id) || !StringUtils.hasText(role)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "principal headers required");
        }
        try {
            return new Principal(id.trim(), Role.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unknown role: " + role, e);
        }
    }
}
