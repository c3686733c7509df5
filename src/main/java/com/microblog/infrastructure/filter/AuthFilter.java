package com.microblog.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microblog.adapter.in.web.ErrorResponse;
import com.microblog.application.port.in.ResolveIdentityUseCase;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Resolves the {@code api-key} header to a user for every {@code /api/} request.
 * Profile-by-id reads are public; everything outside {@code /api/} (actuator, docs) is not guarded.
 * The public check runs on the decoded path without matrix parameters, which is the path the
 * handler mapping routes on. Only an all-digit id is a public profile.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    public static final String API_KEY_HEADER = "api-key";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String API_PREFIX = "/api/";
    private static final Pattern PUBLIC_PROFILE = Pattern.compile("^/api/users/[0-9]+$");

    private final ResolveIdentityUseCase resolveIdentityUseCase;
    private final ObjectMapper objectMapper;
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    public AuthFilter(ResolveIdentityUseCase resolveIdentityUseCase, ObjectMapper objectMapper) {
        this.resolveIdentityUseCase = resolveIdentityUseCase;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = urlPathHelper.getPathWithinApplication(request);
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            RequestContext.setRequestId(requestId);

            if (isPublic(request.getMethod(), path)) {
                filterChain.doFilter(request, response);
                return;
            }

            Result<User, IdentityError> identity = resolveIdentityUseCase.resolve(request.getHeader(API_KEY_HEADER));
            if (identity.isFailure()) {
                IdentityError error = identity.errorOrNull();
                log.warn("Rejected {} {}: {}", request.getMethod(), path, error.message());
                writeError(response, error);
                return;
            }

            User user = identity.getOrThrow();
            RequestContext.setUser(user);
            log.debug("Request authenticated: userId={}, requestId={}, path={}", user.id(), requestId, path);

            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean isPublic(String method, String path) {
        if (!path.startsWith(API_PREFIX)) {
            return true;
        }
        return "GET".equals(method) && PUBLIC_PROFILE.matcher(path).matches();
    }

    private void writeError(HttpServletResponse response, IdentityError error) throws IOException {
        response.setStatus(ErrorResponse.statusOf(error.kind()).value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), ErrorResponse.from(error));
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
