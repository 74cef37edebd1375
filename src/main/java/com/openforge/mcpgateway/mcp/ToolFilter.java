package com.openforge.mcpgateway.mcp;

import java.util.Set;

/**
 * Narrows the tools a provider exposes, either by allow-list or by
 * deny-list.  A provider without a configured filter exposes everything.
 */
public sealed interface ToolFilter permits ToolFilter.Include, ToolFilter.Exclude {

    boolean allows(String toolName);

    record Include(Set<String> names) implements ToolFilter {

        public Include {
            names = Set.copyOf(names);
        }

        @Override
        public boolean allows(String toolName) {
            return names.contains(toolName);
        }
    }

    record Exclude(Set<String> names) implements ToolFilter {

        public Exclude {
            names = Set.copyOf(names);
        }

        @Override
        public boolean allows(String toolName) {
            return !names.contains(toolName);
        }
    }

    static ToolFilter allowAll() {
        return new Exclude(Set.of());
    }
}
