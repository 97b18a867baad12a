package uk.gegc.livequiz.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import uk.gegc.livequiz.features.auth.infra.security.JwtAuthenticationFilter;
import uk.gegc.livequiz.features.auth.infra.security.JwtTokenService;
import uk.gegc.livequiz.shared.api.problem.ErrorTypes;
import uk.gegc.livequiz.shared.api.problem.ProblemDetailBuilder;

import java.io.IOException;

/**
 * Hosts authenticate with a bearer token; participants are anonymous and identified
 * by the participant id they received when joining.
 */
@Configuration
@RequiredArgsConstructor
@EnableMethodSecurity
public class SecurityConfig {

    public static final String[] PARTICIPANT_POST_ENDPOINTS = {
            "/api/v1/sessions/*/participants",
            "/api/v1/sessions/*/answers",
            "/api/v1/sessions/*/ratings"
    };

    public static final String[] PUBLIC_GET_ENDPOINTS = {
            "/api/v1/sessions/*/leaderboard",
            "/api/v1/sessions/*/ranking-results",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/actuator/health",
            "/actuator/health/**"
    };

    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity httpSecurity) throws Exception {
        httpSecurity
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(sessions -> sessions.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint((request, response, ex) -> writeUnauthenticated(request, response))
                        .accessDeniedHandler((request, response, ex) -> writeForbidden(request, response)))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(HttpMethod.POST, PARTICIPANT_POST_ENDPOINTS).permitAll()
                        .requestMatchers(HttpMethod.GET, PUBLIC_GET_ENDPOINTS).permitAll()
                        // session creation, host transitions, results and analytics
                        .anyRequest().authenticated())
                .addFilterBefore(new JwtAuthenticationFilter(jwtTokenService), UsernamePasswordAuthenticationFilter.class);

        return httpSecurity.build();
    }

    private void writeUnauthenticated(HttpServletRequest request, HttpServletResponse response) throws IOException {
        write(response, ProblemDetailBuilder.build(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHENTICATED,
                "Unauthenticated", "A host token is required for this operation",
                "unauthenticated", ProblemDetailBuilder.pathOf(request)));
    }

    private void writeForbidden(HttpServletRequest request, HttpServletResponse response) throws IOException {
        write(response, ProblemDetailBuilder.build(HttpStatus.FORBIDDEN, ErrorTypes.PERMISSION_DENIED,
                "Permission Denied", "You do not have permission to access this resource",
                "permission-denied", ProblemDetailBuilder.pathOf(request)));
    }

    private void write(HttpServletResponse response, ProblemDetail problem) throws IOException {
        response.setStatus(problem.getStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), problem);
    }
}
