package net.unishelf.controller.support;

import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.caller.CallerRole;
import net.unishelf.exception.MissingCallerIdentityException;
import net.unishelf.util.SearchQueryUtils;
import org.springframework.core.MethodParameter;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentCaller} parameters from the headers the authenticating
 * gateway sets on every forwarded request.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";
    public static final String DEPARTMENTS_HEADER = "X-User-Departments";
    public static final String COURSES_HEADER = "X-User-Courses";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentCaller.class)
            && CallerIdentity.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        if (!StringUtils.hasText(userId)) {
            CurrentCaller annotation = parameter.getParameterAnnotation(CurrentCaller.class);
            if (annotation != null && annotation.required()) {
                throw new MissingCallerIdentityException();
            }
            return null;
        }
        return new CallerIdentity(
            userId.trim(),
            CallerRole.fromHeader(webRequest.getHeader(ROLE_HEADER)),
            SearchQueryUtils.splitCsv(webRequest.getHeader(DEPARTMENTS_HEADER)),
            SearchQueryUtils.splitCsv(webRequest.getHeader(COURSES_HEADER))
        );
    }
}
