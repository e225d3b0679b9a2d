/**
 * Spring Security settings for the mods API.
 *
 * Features:
 * - Reads of /mods are open; anonymous callers are narrowed to public mods by the services
 * - Every write under /mods needs HTTP Basic credentials; /admin/** needs ROLE_ADMIN
 * - Stateless sessions, so CSRF protection is off
 * - Referrer-Policy and a locked-down Content-Security-Policy for JSON responses
 * - In-memory accounts from {@link ModsHubSecurityProperties}, BCrypt-encoded at startup
 */
package net.modshub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.StaticHeadersWriter;

@Configuration
@EnableWebSecurity
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    static final String CONTENT_SECURITY_POLICY = "default-src 'none'; frame-ancestors 'none'";

    private final CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint;
    private final ModsHubSecurityProperties securityProperties;

    public SecurityConfig(CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint,
                          ModsHubSecurityProperties securityProperties) {
        this.customBasicAuthenticationEntryPoint = customBasicAuthenticationEntryPoint;
        this.securityProperties = securityProperties;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityMatcher("/**")
            .authorizeHttpRequests(authorizeRequests ->
                authorizeRequests
                    .requestMatchers("/actuator/health", "/actuator/health/**", "/error").permitAll()
                    .requestMatchers("/admin/**").hasRole("ADMIN")
                    .requestMatchers(HttpMethod.GET, "/mods", "/mods/**").permitAll()
                    .anyRequest().authenticated()
            )
            .httpBasic(httpBasic -> httpBasic
                .authenticationEntryPoint(customBasicAuthenticationEntryPoint)
            )
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(customBasicAuthenticationEntryPoint)
            )
            // Credentials travel on every request; no session cookie is ever issued
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .csrf(csrf -> csrf.disable());

        ModsHubSecurityProperties.Headers headerSettings = securityProperties.getHeaders();
        ReferrerPolicyHeaderWriter.ReferrerPolicy policy =
            ReferrerPolicyHeaderWriter.ReferrerPolicy.valueOf(headerSettings.getReferrerPolicy());
        http.headers(headers -> {
            headers.referrerPolicy(referrer -> referrer.policy(policy));
            if (headerSettings.isContentSecurityPolicyEnabled()) {
                headers.addHeaderWriter(new StaticHeadersWriter("Content-Security-Policy", CONTENT_SECURITY_POLICY));
            }
        });
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder) {
        InMemoryUserDetailsManager userDetailsManager = new InMemoryUserDetailsManager();

        ModsHubSecurityProperties.Account admin = securityProperties.getAdmin();
        if (admin != null && admin.isUsable()) {
            userDetailsManager.createUser(User.builder()
                .username(admin.getUsername().trim())
                .password(passwordEncoder.encode(admin.getPassword().trim()))
                .roles("ADMIN", "USER")
                .build());
        } else {
            log.error("Admin endpoints disabled: missing app.security.admin.password. Set the secret to re-enable /admin/**.");
        }

        int registeredUsers = 0;
        for (ModsHubSecurityProperties.Account account : securityProperties.getUsers()) {
            if (!account.isUsable()) {
                log.warn("Skipping basic-auth account '{}': username and password are both required", account.getUsername());
                continue;
            }
            String username = account.getUsername().trim();
            if (userDetailsManager.userExists(username)) {
                log.warn("Skipping duplicate basic-auth account '{}'", username);
                continue;
            }
            userDetailsManager.createUser(User.builder()
                .username(username)
                .password(passwordEncoder.encode(account.getPassword().trim()))
                .roles("USER")
                .build());
            registeredUsers++;
        }
        log.info("Registered {} mod author account(s)", registeredUsers);
        return userDetailsManager;
    }
}
