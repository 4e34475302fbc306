package com.p14n.upsbridge.vertx;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.upsbridge.status.HealthCheck;
import com.p14n.upsbridge.status.HealthReport;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;

/**
 * HTTP status surface built on the Vert.x core HTTP server.
 *
 * <ul>
 * <li>{@code GET /health}: the health report, 200 when healthy and 503
 * otherwise</li>
 * <li>{@code POST /republish}: republishes discovery, 200 on success and 503
 * otherwise</li>
 * </ul>
 */
public class StatusServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StatusServer.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Vertx vertx;
    private final HealthCheck healthCheck;
    private HttpServer server;

    public StatusServer(Vertx vertx, HealthCheck healthCheck) {
        this.vertx = vertx;
        this.healthCheck = healthCheck;
    }

    /**
     * Binds the server and waits for it to listen.
     *
     * @param port port to bind, 0 for any free port
     * @return the bound port
     * @throws IllegalStateException if the server cannot bind
     */
    public int start(int port) {
        try {
            server = vertx.createHttpServer()
                    .requestHandler(this::handle)
                    .listen(port)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting status server", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Unable to start status server on port " + port, e);
        }
        logger.atInfo().log("Status server listening on port {}", server.actualPort());
        return server.actualPort();
    }

    void handle(HttpServerRequest req) {
        String path = req.path();
        if ("/health".equals(path) && req.method() == HttpMethod.GET) {
            health(req);
        } else if ("/republish".equals(path) && req.method() == HttpMethod.POST) {
            republish(req);
        } else {
            respond(req, 404, Map.of("error", "not found"));
        }
    }

    private void health(HttpServerRequest req) {
        HealthReport report = healthCheck.report();
        respond(req, report.isHealthy() ? 200 : 503, report);
    }

    private void republish(HttpServerRequest req) {
        vertx.executeBlocking(healthCheck::republishDiscovery, false)
                .onComplete(ar -> {
                    boolean success = ar.succeeded() && Boolean.TRUE.equals(ar.result());
                    if (ar.failed()) {
                        logger.atError().setCause(ar.cause()).log("Discovery republish failed");
                    }
                    respond(req, success ? 200 : 503, Map.of("success", success));
                });
    }

    private void respond(HttpServerRequest req, int status, Object body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            logger.atError().setCause(e).log("Unable to serialise response");
            status = 500;
            json = "{}";
        }
        req.response()
                .setStatusCode(status)
                .putHeader("content-type", "application/json")
                .end(json);
    }

    @Override
    public void close() {
        if (server == null) {
            return;
        }
        try {
            server.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.atWarn().setCause(e).log("Error closing status server");
        }
        logger.atInfo().log("Status server stopped");
    }
}
