package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MailApiClient} over HTTP.
 * <ul>
 *     <li>send: {@code POST /api/v1/messages/send}, form encoded, multipart when attachments are present</li>
 *     <li>read: {@code GET /api/v1/messages/{id}}</li>
 * </ul>
 * The {@link RestClient} is expected to carry base URL, authentication and timeouts (see {@link MailApiClientFactory}).
 */
@Slf4j
public class RestMailApiClient implements MailApiClient {

    static final String SEND_PATH = "/api/v1/messages/send";
    static final String READ_PATH = "/api/v1/messages/{id}";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestMailApiClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String send(List<String> to, String subject, String body, String fromAddress, List<Path> attachments) {
        Objects.requireNonNull(to, "to must not be null");
        List<Path> files = attachments == null ? List.of() : attachments;

        ApiResponse response;
        if (files.isEmpty()) {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            to.forEach(recipient -> form.add("to", recipient));
            form.add("subject", subject);
            form.add("body", body);
            if (fromAddress != null && !fromAddress.isBlank()) {
                form.add("from", fromAddress);
            }
            response = post(form, MediaType.APPLICATION_FORM_URLENCODED);
        } else {
            MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
            to.forEach(recipient -> parts.add("to", recipient));
            parts.add("subject", subject);
            parts.add("body", body);
            if (fromAddress != null && !fromAddress.isBlank()) {
                parts.add("from", fromAddress);
            }
            for (Path file : files) {
                parts.add("attachments", new FileSystemResource(file));
            }
            response = post(parts, MediaType.MULTIPART_FORM_DATA);
        }

        Map<String, Object> data = parse(response);
        Object messageId = data.get("message_id") != null ? data.get("message_id") : data.get("id");
        if (messageId == null || String.valueOf(messageId).isBlank()) {
            throw new MailApiResponseException(response.statusCode(), "missing message_id in API response");
        }
        log.debug("event=message_submitted, to={}, messageId={}", to, messageId);
        return String.valueOf(messageId);
    }

    @Override
    public MailMessage read(String messageId) {
        Objects.requireNonNull(messageId, "messageId must not be null");
        ApiResponse response;
        try {
            response = restClient.get()
                    .uri(READ_PATH, messageId)
                    .exchange((request, res) -> new ApiResponse(res.getStatusCode().value(), readBody(res.getBody())));
        } catch (RestClientException e) {
            throw new MailApiNetworkException("failed to read message " + messageId + ": " + e.getMessage(), e);
        }
        return MailMessage.fromApi(parse(response));
    }

    private ApiResponse post(Object body, MediaType contentType) {
        try {
            return restClient.post()
                    .uri(SEND_PATH)
                    .contentType(contentType)
                    .body(body)
                    .exchange((request, res) -> new ApiResponse(res.getStatusCode().value(), readBody(res.getBody())));
        } catch (RestClientException e) {
            throw new MailApiNetworkException("failed to reach mail API: " + e.getMessage(), e);
        }
    }

    /**
     * Error responses become {@link MailApiResponseException} with the server's {@code error} or {@code message}
     * text; a success response must be a JSON object.
     */
    private Map<String, Object> parse(ApiResponse response) {
        Map<String, Object> data = null;
        try {
            if (response.body() != null && !response.body().isBlank()) {
                Object tree = objectMapper.readValue(response.body(), Object.class);
                if (tree instanceof Map<?, ?>) {
                    data = objectMapper.convertValue(tree, PAYLOAD_TYPE);
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("event=non_json_response, status={}", response.statusCode());
        }

        if (response.statusCode() >= 400) {
            String message;
            if (data != null) {
                Object error = data.get("error") != null ? data.get("error") : data.get("message");
                message = error != null ? String.valueOf(error) : "unknown API error";
            } else {
                message = response.body() == null || response.body().isBlank() ? "unknown API error" : response.body();
            }
            throw new MailApiResponseException(response.statusCode(), message);
        }

        if (data == null) {
            throw new MailApiResponseException(response.statusCode(), "invalid JSON response from API");
        }
        return data;
    }

    private static String readBody(InputStream body) throws IOException {
        if (body == null) {
            return "";
        }
        return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }

    private record ApiResponse(int statusCode, String body) {
    }
}
