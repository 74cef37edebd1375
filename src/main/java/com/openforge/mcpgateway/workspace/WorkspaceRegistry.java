package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routing table: listener port → path → workspace.
 *
 * Workspaces without their own port, or with a port equal to the server
 * port, live on the default listener.  A request is resolved against the
 * table of the port it arrived on; ports with no workspaces of their own
 * (the default listener, or a test client) fall back to the default table.
 *
 * Lookups run on every request and take the read lock; registration takes
 * the write lock.
 */
@Slf4j
@Component
public class WorkspaceRegistry {

    private final int                                 defaultPort;
    private final Map<String, Workspace>              defaultListener = new HashMap<>();
    private final Map<Integer, Map<String, Workspace>> listeners      = new HashMap<>();
    private final ReentrantReadWriteLock              lock            = new ReentrantReadWriteLock();

    public WorkspaceRegistry(@Value("${server.port:7000}") int defaultPort) {
        this.defaultPort = defaultPort;
    }

    /**
     * @throws ConfigurationException if the path doesn't start with "/" or
     *                                is already taken on the same listener
     */
    public void register(Workspace workspace) {
        if (workspace.path() == null || !workspace.path().startsWith("/")) {
            throw new ConfigurationException(
                    "Invalid path '%s'. Paths start with '/'".formatted(workspace.path()));
        }
        lock.writeLock().lock();
        try {
            Map<String, Workspace> table = isDefault(workspace.port())
                    ? defaultListener
                    : listeners.computeIfAbsent(workspace.port(), port -> new HashMap<>());
            Workspace existing = table.putIfAbsent(workspace.path(), workspace);
            if (existing != null) {
                throw new ConfigurationException("Workspaces \"%s\" and \"%s\" share path %s on port %d"
                        .formatted(existing.name(), workspace.name(), workspace.path(), listenerPort(workspace)));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Workspace] Registered \"{}\" at :{}{}", workspace.name(), listenerPort(workspace), workspace.path());
    }

    public Optional<Workspace> resolve(int localPort, String path) {
        lock.readLock().lock();
        try {
            Map<String, Workspace> table = listeners.getOrDefault(localPort, defaultListener);
            return Optional.ofNullable(table.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Workspace> all() {
        lock.readLock().lock();
        try {
            List<Workspace> all = new ArrayList<>(defaultListener.values());
            listeners.values().forEach(table -> all.addAll(table.values()));
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int defaultPort() {
        return defaultPort;
    }

    private boolean isDefault(Integer port) {
        return port == null || port == defaultPort;
    }

    private int listenerPort(Workspace workspace) {
        return isDefault(workspace.port()) ? defaultPort : workspace.port();
    }
}
