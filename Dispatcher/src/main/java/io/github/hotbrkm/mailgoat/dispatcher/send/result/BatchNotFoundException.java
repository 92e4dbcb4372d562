package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import lombok.Getter;

@Getter
public class BatchNotFoundException extends RuntimeException {
    private final String batchId;

    public BatchNotFoundException(String batchId) {
        super("batch not found: " + batchId);
        this.batchId = batchId;
    }
}
