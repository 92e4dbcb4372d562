package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import io.github.hotbrkm.mailgoat.dispatcher.send.template.RenderException;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiNetworkException;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiResponseException;

/**
 * Where a failed row went wrong. Carried as detail only; every kind is handled the same way by the dispatcher.
 */
public enum FailureKind {
    RENDER,
    NETWORK,
    API,
    UNKNOWN;

    /**
     * Maps exceptions to failure kinds.
     */
    public static FailureKind fromException(Throwable e) {
        if (e instanceof RenderException) {
            return RENDER;
        }
        if (e instanceof MailApiNetworkException) {
            return NETWORK;
        }
        if (e instanceof MailApiResponseException) {
            return API;
        }
        return UNKNOWN;
    }
}
