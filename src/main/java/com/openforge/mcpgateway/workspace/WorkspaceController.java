package com.openforge.mcpgateway.workspace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpgateway.agent.AgentLoopService;
import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.error.GatewayException;
import com.openforge.mcpgateway.error.InvalidConversationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UrlPathHelper;

/**
 * Single catch-all endpoint: every path on every listener lands here and
 * is routed through the {@link WorkspaceRegistry}.
 *
 *   unknown path            → 404 "Path not found"
 *   known path, not POST    → 406 "Method not allowed"
 *   known path, POST        → agent loop, 200 with the completed conversation
 *
 * The body is decoded only after routing, so an unknown path is a 404 even
 * when the body is garbage.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WorkspaceController {

    private static final UrlPathHelper PATHS = new UrlPathHelper();

    private final WorkspaceRegistry registry;
    private final AgentLoopService  agentLoop;
    private final ObjectMapper      objectMapper;

    @RequestMapping("/**")
    public Conversation handle(HttpServletRequest request,
                               @RequestBody(required = false) String body) {
        // Percent-decoded, so "/my%20chat" matches a workspace registered at "/my chat".
        String path = PATHS.getPathWithinApplication(request);

        Workspace workspace = registry.resolve(request.getLocalPort(), path)
                .orElseThrow(() -> new GatewayException(HttpStatus.NOT_FOUND.value(), "Path not found"));
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            throw new GatewayException(HttpStatus.NOT_ACCEPTABLE.value(), "Method not allowed");
        }

        Conversation conversation = decode(body);
        log.info("[Workspace:{}] {} {} messages={}", workspace.name(), request.getMethod(), path,
                conversation.messages().size());
        return agentLoop.run(workspace.name(), workspace.model(), workspace.tools(), conversation);
    }

    private Conversation decode(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidConversationException("Missing request body");
        }
        Conversation conversation;
        try {
            conversation = objectMapper.readValue(body, Conversation.class);
        } catch (JsonProcessingException e) {
            log.info("[Workspace] Malformed request body: {}", e.getOriginalMessage());
            throw new InvalidConversationException("Malformed request body");
        }
        if (conversation.messages().isEmpty()) {
            throw new InvalidConversationException("Conversation has no messages");
        }
        if (conversation.messages().contains(null)) {
            throw new InvalidConversationException("Conversation contains a null message");
        }
        return conversation;
    }
}
