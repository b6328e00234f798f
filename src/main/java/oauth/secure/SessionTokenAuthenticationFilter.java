package oauth.secure;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import oauth.config.AdminUsers;
import oauth.identity.IdentityProvider;
import oauth.log.MDCContext;
import oauth.model.AuthenticatedUser;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates the bearer session token of the identity provider. Requests without a valid token pass through
 * unauthenticated and are rejected by the authorization rules of the filter chain.
 */
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Log LOG = LogFactory.getLog(SessionTokenAuthenticationFilter.class);

    private static final String BEARER = "Bearer ";

    private final IdentityProvider identityProvider;
    private final AdminUsers adminUsers;

    public SessionTokenAuthenticationFilter(IdentityProvider identityProvider, AdminUsers adminUsers) {
        this.identityProvider = identityProvider;
        this.adminUsers = adminUsers;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(authorization) && authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            String sessionToken = authorization.substring(BEARER.length()).trim();
            Optional<AuthenticatedUser> optionalUser = identityProvider.authenticate(sessionToken);
            if (optionalUser.isPresent()) {
                AuthenticatedUser user = optionalUser.get();
                String role = adminUsers.isAdmin(user.getEmail()) ? "ROLE_admin" : "ROLE_user";
                PreAuthenticatedAuthenticationToken authentication =
                        new PreAuthenticatedAuthenticationToken(user, sessionToken, AuthorityUtils.createAuthorityList(role));
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
                MDCContext.mdcContext(user);
            } else {
                LOG.info("Invalid session token presented for " + request.getRequestURI());
            }
        }
        filterChain.doFilter(request, response);
    }
}
