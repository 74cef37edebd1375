package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.catalina.connector.Connector;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opens one extra Tomcat connector per distinct workspace port, bound to
 * the workspace's address.  The default server port is left to Spring
 * Boot's own connector.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspaceConnectorCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory> {

    private final GatewayProperties properties;

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        Map<Integer, String> ports = new LinkedHashMap<>();
        properties.workspaces().forEach((name, workspace) -> {
            Integer port = workspace.port();
            if (port == null || port == factory.getPort()) {
                return;
            }
            String previous = ports.putIfAbsent(port, workspace.address());
            if (previous != null && !Objects.equals(previous, workspace.address())) {
                log.warn("[Workspace] Port {} already bound to {}, ignoring address {} of \"{}\"",
                        port, previous, workspace.address(), name);
            }
        });

        ports.forEach((port, address) -> {
            Connector connector = new Connector(TomcatServletWebServerFactory.DEFAULT_PROTOCOL);
            connector.setPort(port);
            if (address != null) {
                connector.setProperty("address", address);
            }
            factory.addAdditionalTomcatConnectors(connector);
            log.info("[Workspace] Extra listener on {}:{}", address, port);
        });
    }
}
