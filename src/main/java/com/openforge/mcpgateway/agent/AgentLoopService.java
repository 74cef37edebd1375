package com.openforge.mcpgateway.agent;

import com.openforge.mcpgateway.config.GatewayProperties;
import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.Message;
import com.openforge.mcpgateway.conversation.ModelDecision;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.ToolCall;
import com.openforge.mcpgateway.conversation.UsageTokens;
import com.openforge.mcpgateway.error.GatewayException;
import com.openforge.mcpgateway.error.LoopLimitException;
import com.openforge.mcpgateway.llm.ModelAdapter;
import com.openforge.mcpgateway.mcp.ToolCatalog;
import com.openforge.mcpgateway.mcp.ToolProvider;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * The tool-calling loop run for every workspace request.
 *
 * Loop shape:
 *   1. CATALOG    list the tools of every provider of the workspace
 *   2. THINK      call the model with the conversation and the catalog
 *   3. DECIDE     append text decisions; for tool calls go to ACT
 *   4. ACT        append the calls, run each one in order, append one
 *                 output per call id
 *   5. CHECK      any tool call this turn? back to THINK; otherwise DONE
 *
 * Bounds: at most {@code gateway.max-iterations} model calls, and the whole
 * loop runs on the gateway executor under a TimeLimiter so a stuck provider
 * or tool can't hold a request forever.
 */
@Slf4j
@Service
public class AgentLoopService {

    static final String UNKNOWN_TOOL_OUTPUT = "Function doesn't exist";

    private final ExecutorService executor;
    private final TimeLimiter     timeLimiter;
    private final int             maxIterations;

    @Autowired
    public AgentLoopService(@Qualifier("gatewayExecutor") ExecutorService gatewayExecutor,
                            @Qualifier("requestTimeLimiter") TimeLimiter requestTimeLimiter,
                            GatewayProperties properties) {
        this(gatewayExecutor, requestTimeLimiter, properties.maxIterations());
    }

    public AgentLoopService(ExecutorService executor, TimeLimiter timeLimiter, int maxIterations) {
        this.executor      = executor;
        this.timeLimiter   = timeLimiter;
        this.maxIterations = maxIterations;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Run the loop on a copy of {@code request} and return the completed
     * conversation, usage included.
     *
     * @throws LoopLimitException on too many iterations (500) or timeout (504)
     * @throws GatewayException   for any model, transport or tool failure
     */
    public Conversation run(String workspace, ModelAdapter model, List<ToolProvider> tools,
                            Conversation request) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> executor.submit(() -> executeLoop(workspace, model, tools, request)));
        } catch (TimeoutException e) {
            log.warn("[Agent:{}] Request timed out after {}", workspace,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw LoopLimitException.timeout();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(500, "Request interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            log.error("[Agent:{}] Unhandled exception in loop: {}", workspace, e.getMessage(), e);
            throw new GatewayException(500, "Internal server error", e);
        }
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    Conversation executeLoop(String workspace, ModelAdapter model, List<ToolProvider> tools,
                             Conversation request) {
        Conversation conversation = request.copy();
        ToolCatalog  catalog      = ToolCatalog.build(tools);
        UsageTokens  usage        = UsageTokens.ZERO;
        log.info("[Agent:{}] Loop started. model={} messages={} tools={}",
                workspace, model.name(), conversation.messages().size(), catalog.size());

        for (int iteration = 1; ; iteration++) {
            if (iteration > maxIterations) {
                log.warn("[Agent:{}] Max iterations ({}) reached.", workspace, maxIterations);
                throw LoopLimitException.iterations(maxIterations);
            }
            if (Thread.currentThread().isInterrupted()) {
                throw LoopLimitException.timeout();
            }
            log.debug("[Agent:{}] Iteration {}", workspace, iteration);

            // ── THINK ────────────────────────────────────────────────────────
            ModelReply reply = model.call(conversation, catalog.specs());
            usage = usage.plus(reply.usage());

            // ── DECIDE / ACT ─────────────────────────────────────────────────
            boolean calledTools = false;
            for (ModelDecision decision : reply.decisions()) {
                if (decision instanceof ModelDecision.TextMessage text) {
                    conversation.append(Message.assistantText(text.text()));
                } else {
                    ModelDecision.ToolCalls calls = (ModelDecision.ToolCalls) decision;
                    conversation.append(Message.assistantToolCalls(calls.calls()));
                    for (ToolCall call : calls.calls()) {
                        conversation.append(Message.toolOutput(call.id(), dispatch(workspace, catalog, call)));
                    }
                    calledTools = true;
                }
            }

            // ── CHECK ────────────────────────────────────────────────────────
            if (!calledTools) {
                conversation.setUsage(usage);
                log.info("[Agent:{}] Completed in {} iteration(s). usage={}", workspace, iteration, usage);
                return conversation;
            }
        }
    }

    // ── Tool execution ───────────────────────────────────────────────────────

    private String dispatch(String workspace, ToolCatalog catalog, ToolCall call) {
        Optional<ToolProvider> provider = catalog.providerOf(call.name());
        if (provider.isEmpty()) {
            log.warn("[Agent:{}] Model called unknown tool \"{}\" (id={})", workspace, call.name(), call.id());
            return UNKNOWN_TOOL_OUTPUT;
        }
        log.info("[Agent:{}] Executing tool: {} via {} args={}",
                workspace, call.name(), provider.get().name(), call.arguments());
        return provider.get().callTool(call.name(), call.arguments());
    }
}
