package com.orgsuite.docflow.config;

import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Stateless security chain.
 * <ul>
 * <li>Security headers: HSTS, X-Content-Type-Options, X-Frame-Options, CSP</li>
 * <li>Actor authentication, then rate limiting</li>
 * <li>/public/**, /actuator/health, /actuator/info: permitAll</li>
 * <li>Everything else requires an authenticated actor; document-level access is
 * decided by the permission resolver, not here</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        private final ActorAuthFilter actorAuthFilter;
        private final RateLimitFilter rateLimitFilter;
        private final DocflowProperties properties;

        public SecurityConfig(ActorAuthFilter actorAuthFilter, RateLimitFilter rateLimitFilter,
                        DocflowProperties properties) {
                this.actorAuthFilter = actorAuthFilter;
                this.rateLimitFilter = rateLimitFilter;
                this.properties = properties;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                                // ── Security Headers ──
                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                })
                                                .frameOptions(frame -> frame.deny())
                                                .httpStrictTransportSecurity(hsts -> hsts
                                                                .includeSubDomains(true)
                                                                .maxAgeInSeconds(31536000))
                                                .contentSecurityPolicy(csp -> csp
                                                                .policyDirectives("default-src 'none'; frame-ancestors 'none'"))
                                                .cacheControl(cache -> {
                                                }))

                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/public/**").permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .requestMatchers("/actuator/info").permitAll()
                                                .anyRequest().authenticated())
                                .addFilterBefore(actorAuthFilter, UsernamePasswordAuthenticationFilter.class)
                                .addFilterAfter(rateLimitFilter, ActorAuthFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }

        /** Both filters run inside the security chain only. */
        @Bean
        public FilterRegistrationBean<ActorAuthFilter> actorAuthFilterRegistration() {
                FilterRegistrationBean<ActorAuthFilter> registration = new FilterRegistrationBean<>(actorAuthFilter);
                registration.setEnabled(false);
                return registration;
        }

        @Bean
        public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
                FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
                registration.setEnabled(false);
                return registration;
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration config = new CorsConfiguration();
                config.setAllowedOrigins(List.of(properties.getFrontendUrl()));
                config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
                config.setAllowedHeaders(List.of("*"));
                config.setExposedHeaders(List.of(CorrelationIdFilter.HEADER));
                config.setAllowCredentials(true);
                config.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", config);
                return source;
        }
}
