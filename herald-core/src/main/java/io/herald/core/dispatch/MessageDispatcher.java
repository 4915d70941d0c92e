package io.herald.core.dispatch;

/**
 * Delivers one message to a webhook. Implementations report every failure through the returned
 * {@link DispatchResult} and never throw.
 */
public interface MessageDispatcher {
    DispatchResult dispatch(String webhookUrl, OutboundMessage message);
}
