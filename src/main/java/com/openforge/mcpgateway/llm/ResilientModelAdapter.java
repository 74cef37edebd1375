package com.openforge.mcpgateway.llm;

import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.error.TransportException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates a {@link ModelAdapter} with its own circuit breaker and retry.
 *
 * Call graph:
 *
 *   call(conversation, tools)
 *     └─ circuitBreaker
 *           └─ retry (network failures only)
 *                 └─ delegate.call(conversation, tools)
 *
 * Fully programmatic, no AOP proxies.  An open breaker surfaces as a 503
 * TransportException; every other failure propagates unchanged.
 */
@Slf4j
public class ResilientModelAdapter implements ModelAdapter {

    private final ModelAdapter   delegate;
    private final CircuitBreaker circuitBreaker;
    private final Retry          retry;

    public ResilientModelAdapter(ModelAdapter delegate, CircuitBreaker circuitBreaker, Retry retry) {
        this.delegate       = delegate;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public ModelReply call(Conversation conversation, List<ToolSpec> tools) {
        Supplier<ModelReply> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, () -> delegate.call(conversation, tools)));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("[Resilience] Circuit for model \"{}\" is {}, rejecting call",
                    delegate.name(), circuitBreaker.getState());
            throw new TransportException(503, "Model provider unavailable", e);
        }
    }
}
