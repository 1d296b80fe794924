package com.bko.delegation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

/**
 * Applies to the RestClient used by the chat model starter.
 */
@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new ModelRequestInterceptor());
    }

    static class ModelRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.bko.delegation.http");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // Local OpenAI-compatible servers reject a placeholder bearer token
            var headers = request.getHeaders();
            String auth = headers.getFirst("Authorization");
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.remove("Authorization");
                }
            }
            long started = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("Model HTTP call: method={}, uri={}, requestBytes={}, status={}, elapsedMs={}",
                        request.getMethod(), request.getURI(), body.length, response.getStatusCode(),
                        System.currentTimeMillis() - started);
            }
            return response;
        }
    }
}
