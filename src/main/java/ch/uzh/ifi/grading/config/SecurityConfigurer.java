package ch.uzh.ifi.grading.config;

import ch.uzh.ifi.grading.service.ApiKeyService;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.web.filter.CommonsRequestLoggingFilter;

import java.io.IOException;
import java.util.Map;

@Slf4j
@AllArgsConstructor
@Configuration
@EnableWebSecurity
public class SecurityConfigurer {

    private ApiKeyService apiKeyService;

    private JsonMapper jsonMapper;

    private boolean isAuthorizedAPIKey(RequestAuthorizationContext context) {
        return apiKeyService.isValid(context.getRequest().getHeader("X-API-Key"));
    }

    private void rejectUnauthorized(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        jsonMapper.writeValue(response.getOutputStream(), Map.of("error", "Unauthorized. Provide X-API-Key header."));
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http.csrf(AbstractHttpConfigurer::disable);
        http.sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
        http.authorizeHttpRequests(requests -> requests
                .requestMatchers(HttpMethod.GET, "/health", "/status").permitAll()
                .requestMatchers(HttpMethod.POST, "/submit").access((authentication, context) ->
                        new AuthorizationDecision(isAuthorizedAPIKey(context)))
                .requestMatchers(HttpMethod.GET, "/results", "/results/**").access((authentication, context) ->
                        new AuthorizationDecision(isAuthorizedAPIKey(context)))
                .anyRequest().permitAll());
        http.exceptionHandling(handling -> handling
                .authenticationEntryPoint((request, response, exception) -> rejectUnauthorized(response))
                .accessDeniedHandler((request, response, exception) -> rejectUnauthorized(response)));
        return http.build();
    }

    @Bean
    public CommonsRequestLoggingFilter logFilter() {
        CommonsRequestLoggingFilter filter = new CommonsRequestLoggingFilter();
        filter.setIncludeQueryString(true);
        filter.setIncludeClientInfo(true);
        filter.setIncludePayload(false);
        filter.setIncludeHeaders(false);
        return filter;
    }
}
