package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.mailgoat.dispatcher.config.MailgoatConfig;
import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Creates a {@link MailApiClient} bound to one profile's server and credentials.
 */
@RequiredArgsConstructor
public class MailApiClientFactory {

    private final MailgoatConfig.Http httpConfig;
    private final ObjectMapper objectMapper;

    public MailApiClient create(MailProfile profile) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(httpConfig.resolveConnectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(httpConfig.resolveReadTimeoutMs()));

        RestClient.Builder builder = RestClient.builder().requestFactory(requestFactory);
        return new RestMailApiClient(configure(builder, profile, httpConfig.getUserAgent()).build(), objectMapper);
    }

    /**
     * Applies base URL and default headers for a profile, leaving the request factory untouched.
     */
    static RestClient.Builder configure(RestClient.Builder builder, MailProfile profile, String userAgent) {
        String baseUrl = profile.server().trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + profile.apiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent == null ? MailgoatConfig.Http.DEFAULT_USER_AGENT : userAgent);
    }
}
