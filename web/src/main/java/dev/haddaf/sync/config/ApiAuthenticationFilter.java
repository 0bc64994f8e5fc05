package dev.haddaf.sync.config;

import dev.haddaf.sync.web.IdTokenVerifier;
import dev.haddaf.sync.web.InvalidCredentialsException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every API request on its own. End users present {@code Authorization: Bearer <ID token>},
 * verified on each call; internal event producers present the shared {@code X-Internal-Token}. Requests with
 * neither, or with a credential that does not verify, continue anonymously and are refused by the
 * authorization rules.
 */
public class ApiAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiAuthenticationFilter.class);

    public static final String INTERNAL_TOKEN_HEADER = "X-Internal-Token";
    public static final String USER_ROLE = "USER";
    public static final String INTERNAL_ROLE = "INTERNAL";
    static final String INTERNAL_PRINCIPAL = "internal";

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdTokenVerifier idTokenVerifier;
    private final byte[] internalToken;

    public ApiAuthenticationFilter(IdTokenVerifier idTokenVerifier, String internalToken) {
        this.idTokenVerifier = Objects.requireNonNull(idTokenVerifier, "idTokenVerifier");
        this.internalToken = StringUtils.hasText(internalToken)
            ? internalToken.trim().getBytes(StandardCharsets.UTF_8)
            : null;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Authentication authentication = authenticate(request);
        if (authentication != null) {
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
        }
        filterChain.doFilter(request, response);
    }

    private Authentication authenticate(HttpServletRequest request) {
        String presentedInternalToken = request.getHeader(INTERNAL_TOKEN_HEADER);
        if (StringUtils.hasText(presentedInternalToken)) {
            if (matchesInternalToken(presentedInternalToken.trim())) {
                return UsernamePasswordAuthenticationToken.authenticated(INTERNAL_PRINCIPAL, null,
                    AuthorityUtils.createAuthorityList("ROLE_" + INTERNAL_ROLE));
            }
            log.warn("Rejected internal token on {} {}", request.getMethod(), request.getRequestURI());
            return null;
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null
            || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        try {
            String uid = idTokenVerifier.verifyIdToken(authorization.substring(BEARER_PREFIX.length()).trim());
            return UsernamePasswordAuthenticationToken.authenticated(uid, null,
                AuthorityUtils.createAuthorityList("ROLE_" + USER_ROLE));
        } catch (InvalidCredentialsException ex) {
            log.debug("Bearer token refused on {} {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage());
            return null;
        }
    }

    private boolean matchesInternalToken(String presented) {
        return internalToken != null
            && MessageDigest.isEqual(internalToken, presented.getBytes(StandardCharsets.UTF_8));
    }
}
