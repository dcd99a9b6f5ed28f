package com.hookrelay.provider;

import com.hookrelay.model.TransformResult;

/**
 * Adapter for one webhook source.
 *
 * <p>Implementations are registered as Spring beans and picked up by
 * {@link ProviderRegistry}; adding a source means adding another bean.
 *
 * <p>Contract for {@link #transform(WebhookRequest)}:
 * <ul>
 *   <li>deterministic: the same request always yields an equal result</li>
 *   <li>no I/O and no shared state: it classifies and extracts, it never triggers anything</li>
 *   <li>{@link TransformResult#skip(String)} for events that are understood but need no build</li>
 *   <li>{@link TransformResult#error(String)} for payloads it cannot read</li>
 *   <li>{@link TransformResult#triggers(java.util.List)} with one entry per build otherwise</li>
 * </ul>
 * Implementations are called from many request threads at once and must be stateless.
 */
public interface HookProvider {

    /** Key used in the hook URL, e.g. {@code github}. */
    String serviceId();

    TransformResult transform(WebhookRequest request);
}
