package io.quarkiverse.stickyheader.proxy;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkiverse.stickyheader.StickyHeaderOptions;
import io.quarkiverse.stickyheader.server.ServiceConfig;
import io.quarkiverse.stickyheader.server.StickyProxyServer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;

@ApplicationScoped
public class QuarkusStickyProxyServer {
    protected static final Logger log = Logger.getLogger(QuarkusStickyProxyServer.class);

    @Inject
    @ConfigProperty(name = "service.name")
    protected String serviceName;

    @Inject
    @ConfigProperty(name = "service.host")
    protected String serviceHost;

    @Inject
    @ConfigProperty(name = "service.port")
    protected int servicePort;

    @Inject
    @ConfigProperty(name = "service.ssl", defaultValue = "false")
    protected boolean serviceSsl;

    @Inject
    @ConfigProperty(name = "sticky.cookie-path", defaultValue = StickyHeaderOptions.DEFAULT_COOKIE_PATH)
    protected String cookiePath;

    @Inject
    @ConfigProperty(name = "sticky.legacy-cookie-path")
    protected Optional<String> legacyCookiePath;

    protected StickyProxyServer proxyServer;

    public void start(@Observes StartupEvent start, Vertx vertx, Router proxyRouter) {
        StickyHeaderOptions options = new StickyHeaderOptions().setCookiePath(cookiePath);
        legacyCookiePath.ifPresent(path -> {
            log.info("Expiring legacy sticky cookies on path " + path);
            options.setLegacyCookiePath(path);
        });
        ServiceConfig config = new ServiceConfig(serviceName, serviceHost, servicePort, serviceSsl);
        proxyServer = new StickyProxyServer();
        proxyServer.init(vertx, proxyRouter, config, options);
    }

    public void stop(@Observes ShutdownEvent stop) {
        if (proxyServer != null) {
            proxyServer.shutdown();
        }
    }
}
