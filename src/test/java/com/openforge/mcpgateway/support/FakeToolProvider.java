package com.openforge.mcpgateway.support;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.mcp.ToolProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** In-memory tool provider; each tool is a function of its arguments. */
public final class FakeToolProvider implements ToolProvider {

    public record Invocation(String tool, ObjectNode arguments) {}

    private final String                                    name;
    private final Map<String, Function<ObjectNode, String>> tools       = new LinkedHashMap<>();
    private final List<Invocation>                          invocations = new ArrayList<>();

    public FakeToolProvider(String name) {
        this.name = name;
    }

    public FakeToolProvider tool(String toolName, Function<ObjectNode, String> body) {
        tools.put(toolName, body);
        return this;
    }

    public synchronized List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ToolSpec> listTools() {
        return tools.keySet().stream()
                .map(tool -> new ToolSpec(tool, name + " " + tool,
                        JsonNodeFactory.instance.objectNode().put("type", "object")))
                .toList();
    }

    @Override
    public String callTool(String toolName, ObjectNode arguments) {
        synchronized (this) {
            invocations.add(new Invocation(toolName, arguments));
        }
        return tools.get(toolName).apply(arguments);
    }
}
