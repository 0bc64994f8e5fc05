package dev.haddaf.sync.config;

import dev.haddaf.sync.web.IdTokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.util.StringUtils;

@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   IdTokenVerifier idTokenVerifier,
                                                   SyncProperties syncProperties) throws Exception {
        if (!StringUtils.hasText(syncProperties.internalToken())) {
            log.info("No internal token configured; /api/notification-events refuses every caller. "
                + "Set sync.internal-token to accept events from internal producers.");
        }

        http
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers(
                    "/actuator/health",
                    "/actuator/health/**",
                    "/actuator/info",
                    "/error"
                ).permitAll()
                // Sign-in carries its own credential in the body.
                .requestMatchers(HttpMethod.POST, "/api/session").permitAll()
                .requestMatchers("/api/notification-events/**").hasRole(ApiAuthenticationFilter.INTERNAL_ROLE)
                .anyRequest().hasRole(ApiAuthenticationFilter.USER_ROLE)
            )
            .addFilterBefore(new ApiAuthenticationFilter(idTokenVerifier, syncProperties.internalToken()),
                AnonymousAuthenticationFilter.class)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable);

        return http.build();
    }
}
