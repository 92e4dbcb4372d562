package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutcomeStatus {
    SENT,
    FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
