/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.surveillance.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.helios.surveillance.api.ISurveillanceEngine;
import com.helios.surveillance.core.compiler.CompilationException;
import com.helios.surveillance.model.ExplanationResult;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight HTTP front end for the surveillance engine.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /match - match a killmail against the active profiles</li>
 *   <li>POST /reload - rebuild the profile generation from the store</li>
 *   <li>GET /stats - engine statistics</li>
 *   <li>POST /test-filter - trace an ad-hoc filter tree against a killmail</li>
 *   <li>GET /metrics - Prometheus text exposition</li>
 *   <li>GET /health - health check</li>
 * </ul>
 */
public class HttpServer {
    private static final Logger logger = Logger.getLogger(HttpServer.class.getName());

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ISurveillanceEngine engine;
    private final Tracer tracer;
    private final CollectorRegistry collectorRegistry;
    private final ObjectMapper objectMapper;

    /**
     * @param port              port to listen on; 0 picks a free one
     * @param collectorRegistry registry exposed on /metrics
     */
    public HttpServer(int port, ISurveillanceEngine engine, Tracer tracer, CollectorRegistry collectorRegistry)
            throws IOException {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.collectorRegistry = Objects.requireNonNull(collectorRegistry, "CollectorRegistry cannot be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/match", new MatchHandler());
        server.createContext("/reload", new ReloadHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/test-filter", new TestFilterHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/health", new HealthHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2);
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Surveillance engine HTTP server started on port " + port());
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping HTTP server...");
        server.stop(delaySeconds);
        executor.shutdown();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    class MatchHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Span span = tracer.spanBuilder("http-match").startSpan();
            try (Scope scope = span.makeCurrent()) {
                Killmail killmail;
                try (InputStream is = exchange.getRequestBody()) {
                    killmail = objectMapper.readValue(is, Killmail.class);
                }
                span.setAttribute("killmail.id", killmail.killmailId());
                MatchResult result = engine.evaluate(killmail);
                sendJson(exchange, 200, result);
            } catch (JsonProcessingException e) {
                span.recordException(e);
                sendError(exchange, 400, "Malformed killmail: " + e.getOriginalMessage());
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error during match", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class ReloadHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            boolean reloaded = engine.reload();
            long generation = engine.stats().generation();
            sendJson(exchange, reloaded ? 200 : 503, Map.of("reloaded", reloaded, "generation", generation));
        }
    }

    class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, engine.stats());
        }
    }

    /**
     * Body: {@code {"filter_tree": {...}, "killmail": {...}}}.
     */
    class TestFilterHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            try {
                JsonNode body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = objectMapper.readTree(is);
                }
                if (body == null || !body.hasNonNull("filter_tree") || !body.hasNonNull("killmail")) {
                    sendError(exchange, 400, "Body must contain filter_tree and killmail");
                    return;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> tree = objectMapper.convertValue(body.get("filter_tree"), Map.class);
                Killmail killmail = objectMapper.treeToValue(body.get("killmail"), Killmail.class);
                ExplanationResult result = engine.testFilter(tree, killmail);
                sendJson(exchange, 200, result);
            } catch (CompilationException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                sendError(exchange, 400, "Malformed request: " + e.getMessage());
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Error during filter test", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
            send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (engine.stats().generation() > 0) {
                sendJson(exchange, 200, Map.of("status", "UP"));
            } else {
                sendJson(exchange, 503, Map.of("status", "DOWN", "reason", "No profile generation loaded"));
            }
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        send(exchange, statusCode, "application/json", objectMapper.writeValueAsString(body));
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message == null ? "" : message));
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
