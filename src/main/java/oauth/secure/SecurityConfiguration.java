package oauth.secure;

import oauth.config.AdminUsers;
import oauth.identity.IdentityProvider;
import oauth.log.MDCContextFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.preauth.AbstractPreAuthenticatedProcessingFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfiguration {

    @Configuration
    @Order(1)
    public static class AdminSecurity {

        private final IdentityProvider identityProvider;
        private final AdminUsers adminUsers;

        public AdminSecurity(IdentityProvider identityProvider, AdminUsers adminUsers) {
            this.identityProvider = identityProvider;
            this.adminUsers = adminUsers;
        }

        @Bean
        protected SecurityFilterChain adminSecurityFilterChain(HttpSecurity http) throws Exception {
            return http
                    .securityMatcher("/admin/**")
                    .authorizeHttpRequests(auth -> auth
                            .requestMatchers("/admin/**").hasRole("admin"))
                    .csrf(AbstractHttpConfigurer::disable)
                    .sessionManagement(session ->
                            session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                    .exceptionHandling(exceptions ->
                            exceptions.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                    .addFilterAfter(new MDCContextFilter(), SecurityContextHolderFilter.class)
                    .addFilterBefore(new SessionTokenAuthenticationFilter(identityProvider, adminUsers),
                            AbstractPreAuthenticatedProcessingFilter.class)
                    .build();
        }
    }

    @Configuration
    @Order(2)
    public static class ProtocolSecurity {

        /**
         * The protocol endpoints authenticate clients and users themselves.
         */
        @Bean
        protected SecurityFilterChain protocolSecurityFilterChain(HttpSecurity http) throws Exception {
            return http
                    .authorizeHttpRequests(auth -> auth
                            .anyRequest().permitAll())
                    .csrf(AbstractHttpConfigurer::disable)
                    .sessionManagement(session ->
                            session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                    .addFilterAfter(new MDCContextFilter(), SecurityContextHolderFilter.class)
                    .build();
        }
    }
}
