package com.taskadmin.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskadmin.api.response.Response;
import com.taskadmin.domain.identity.adapter.gateway.IAccessTokenVerifier;
import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;
import com.taskadmin.types.common.Constants;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * `/api/**` 统一鉴权过滤器：校验 Bearer 令牌并把声明放入请求域 {@link Constants#REQ_ATTR_AUTH_CLAIMS}。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiAuthFilter extends OncePerRequestFilter {

    private static final String API_PREFIX = "/api/";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper;
    private final IAccessTokenVerifier accessTokenVerifier;

    public ApiAuthFilter(ObjectMapper objectMapper, IAccessTokenVerifier accessTokenVerifier) {
        this.objectMapper = objectMapper;
        this.accessTokenVerifier = accessTokenVerifier;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();
        return !path.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authorization = StringUtils.trimToNull(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (authorization == null || !StringUtils.startsWithIgnoreCase(authorization, BEARER_PREFIX)) {
            writeUnauthorized(response, ResponseCode.NO_AUTH_CONTEXT, ResponseCode.NO_AUTH_CONTEXT.getInfo());
            return;
        }
        ValidatedClaims claims;
        try {
            claims = accessTokenVerifier.verify(authorization.substring(BEARER_PREFIX.length()).trim());
        } catch (AppException ex) {
            if (log.isDebugEnabled()) {
                log.debug("Auth rejected. method={}, path={}, reason={}", request.getMethod(), request.getRequestURI(), ex.getInfo());
            }
            writeUnauthorized(response, ResponseCode.INVALID_CLAIMS, ex.getInfo());
            return;
        }
        request.setAttribute(Constants.REQ_ATTR_AUTH_CLAIMS, claims);
        filterChain.doFilter(request, response);
    }

    private void writeUnauthorized(HttpServletResponse response, ResponseCode code, String message) throws IOException {
        Response<Void> body = Response.failure(code, message);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }
}
