package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiResponseException;

import java.util.List;
import java.util.Objects;

/**
 * Result of attempting one recipient row.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageOutcome(int rowIndex, List<String> to, OutcomeStatus status, String messageId, String error,
                             FailureKind failureKind, Integer apiStatusCode) {

    public MessageOutcome {
        to = to == null ? List.of() : List.copyOf(to);
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Creates a sent outcome
     */
    public static MessageOutcome sent(int rowIndex, List<String> to, String messageId) {
        return new MessageOutcome(rowIndex, to, OutcomeStatus.SENT, messageId, null, null, null);
    }

    /**
     * Creates a failed outcome from the exception that stopped the row
     */
    public static MessageOutcome failed(int rowIndex, List<String> to, Throwable cause) {
        Integer statusCode = cause instanceof MailApiResponseException apiError ? apiError.getStatusCode() : null;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new MessageOutcome(rowIndex, to, OutcomeStatus.FAILED, null, message, FailureKind.fromException(cause), statusCode);
    }

    @JsonIgnore
    public boolean isSent() {
        return status == OutcomeStatus.SENT;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }
}
