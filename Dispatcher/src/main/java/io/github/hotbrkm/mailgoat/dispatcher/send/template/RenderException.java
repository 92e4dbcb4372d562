package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import lombok.Getter;

import java.util.List;

/**
 * A single row could not be turned into a message. Scoped to that row only.
 */
@Getter
public class RenderException extends RuntimeException {

    private final int rowIndex;
    private final List<String> missingPlaceholders;

    public RenderException(int rowIndex, String message) {
        this(rowIndex, message, List.of());
    }

    public RenderException(int rowIndex, String message, List<String> missingPlaceholders) {
        super(message);
        this.rowIndex = rowIndex;
        this.missingPlaceholders = List.copyOf(missingPlaceholders);
    }
}
