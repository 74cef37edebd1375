package com.openforge.mcpgateway.mcp;

import com.openforge.mcpgateway.conversation.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tools of one workspace for one request: the flattened spec list
 * handed to the model plus the provider that owns each tool name.
 *
 * When two providers expose the same name the one listed later wins; the
 * shadowed spec is dropped from the list so the model never sees a tool the
 * gateway would route elsewhere.
 */
@Slf4j
public final class ToolCatalog {

    private final Map<String, ToolSpec>     specs;
    private final Map<String, ToolProvider> owners;

    private ToolCatalog(Map<String, ToolSpec> specs, Map<String, ToolProvider> owners) {
        this.specs  = specs;
        this.owners = owners;
    }

    public static ToolCatalog empty() {
        return new ToolCatalog(Map.of(), Map.of());
    }

    /** Call {@link ToolProvider#listTools()} on every provider, in order. */
    public static ToolCatalog build(List<ToolProvider> providers) {
        Map<String, ToolSpec>     specs  = new LinkedHashMap<>();
        Map<String, ToolProvider> owners = new LinkedHashMap<>();

        for (ToolProvider provider : providers) {
            for (ToolSpec spec : provider.listTools()) {
                ToolProvider previous = owners.put(spec.name(), provider);
                if (previous != null) {
                    log.warn("[ToolCatalog] Tool \"{}\" of \"{}\" shadows the one of \"{}\"",
                            spec.name(), provider.name(), previous.name());
                    specs.remove(spec.name());
                }
                specs.put(spec.name(), spec);
            }
        }
        return new ToolCatalog(Collections.unmodifiableMap(specs), Collections.unmodifiableMap(owners));
    }

    public List<ToolSpec> specs() {
        return new ArrayList<>(specs.values());
    }

    public Optional<ToolProvider> providerOf(String toolName) {
        return Optional.ofNullable(owners.get(toolName));
    }

    public int size() {
        return specs.size();
    }
}
