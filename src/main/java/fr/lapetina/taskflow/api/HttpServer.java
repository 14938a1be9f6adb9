package fr.lapetina.taskflow.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.taskflow.auth.AuthenticatedUser;
import fr.lapetina.taskflow.auth.RequestAuthenticator;
import fr.lapetina.taskflow.disruptor.DisruptorPipeline;
import fr.lapetina.taskflow.disruptor.exception.BackpressureException;
import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.infrastructure.config.TaskflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP front end using the JDK's built-in HttpServer.
 *
 * A single context hands every request to the Disruptor pipeline, which owns
 * routing. This class only translates between the exchange and
 * {@link ApiRequest}/{@link ApiResponse}: request id, client ip, caller identity,
 * JSON body parsing, and writing the response back.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final DisruptorPipeline pipeline;
    private final ErrorHandlingMiddleware middleware;
    private final RequestAuthenticator authenticator;
    private final long responseTimeoutMs;
    private final Set<String> trustedProxies;

    public HttpServer(
            TaskflowConfig.ServerConfig config,
            DisruptorPipeline pipeline,
            ErrorHandlingMiddleware middleware,
            RequestAuthenticator authenticator
    ) throws IOException {
        this.pipeline = pipeline;
        this.middleware = middleware;
        this.authenticator = authenticator;
        this.responseTimeoutMs = config.getResponseTimeoutMs();
        this.trustedProxies = config.getTrustedProxies() != null
                ? Set.copyOf(config.getTrustedProxies())
                : Set.of();
        this.objectMapper = JsonMapper.create();

        InetSocketAddress address = config.getHost() == null || config.getHost().isBlank()
                ? new InetSocketAddress(config.getPort())
                : new InetSocketAddress(config.getHost(), config.getPort());
        this.server = com.sun.net.httpserver.HttpServer.create(address, config.getBacklog());

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.createContext("/", new PipelineHandler());

        log.info("HTTP server configured: port={}, workerThreads={}", config.getPort(), config.getWorkerThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when port 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        log.info("HTTP server stopped");
    }

    private class PipelineHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Headers requestHeaders = exchange.getRequestHeaders();
            String requestId = requestIdOf(requestHeaders);
            MDC.put("requestId", requestId);

            try {
                ApiResponse response = process(exchange, requestId);
                send(exchange, requestId, response);
            } catch (IOException e) {
                log.warn("Failed to write response: requestId={}, error={}", requestId, e.getMessage());
                throw e;
            } finally {
                MDC.remove("requestId");
                exchange.close();
            }
        }

        private ApiResponse process(HttpExchange exchange, String requestId) throws IOException {
            Map<String, String> headers = lowerCaseHeaders(exchange.getRequestHeaders());
            URI uri = exchange.getRequestURI();
            AuthenticatedUser user = authenticator.authenticate(headers).orElse(null);

            ApiRequest bare = new ApiRequest(
                    requestId,
                    exchange.getRequestMethod(),
                    uri.getPath(),
                    parseQuery(uri.getRawQuery()),
                    headers,
                    Map.of(),
                    clientIp(exchange.getRemoteAddress(), headers.get("x-forwarded-for"), trustedProxies),
                    user,
                    Instant.now()
            );

            ApiRequest request;
            try {
                request = withBody(bare, exchange);
            } catch (JsonProcessingException e) {
                return middleware.handle(e, bare);
            }

            CompletableFuture<ApiResponse> future;
            try {
                future = pipeline.submit(request);
            } catch (BackpressureException e) {
                log.warn("Backpressure: requestId={}, reason={}", requestId, e.getReason());
                return middleware.handle(StructuredError.builder(ErrorCode.SERVICE_UNAVAILABLE)
                        .technicalMessage(e.getMessage())
                        .cause(e)
                        .build(), request);
            }

            try {
                return future.get(responseTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                return middleware.handle(ErrorFactory.timeout("request", responseTimeoutMs), request);
            } catch (ExecutionException e) {
                return middleware.handle(e.getCause(), request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return middleware.handle(e, request);
            }
        }

        private ApiRequest withBody(ApiRequest request, HttpExchange exchange) throws IOException {
            byte[] bytes;
            try (InputStream is = exchange.getRequestBody()) {
                bytes = is.readAllBytes();
            }
            if (bytes.length == 0) {
                return request;
            }
            Map<String, Object> body = objectMapper.readValue(bytes, JSON_OBJECT);
            return new ApiRequest(request.requestId(), request.method(), request.path(), request.query(),
                    request.headers(), body, request.ip(), request.user(), request.receivedAt());
        }
    }

    private void send(HttpExchange exchange, String requestId, ApiResponse response) throws IOException {
        Headers responseHeaders = exchange.getResponseHeaders();
        response.headers().forEach(responseHeaders::set);
        responseHeaders.set(REQUEST_ID_HEADER, requestId);

        if (response.body() == null) {
            exchange.sendResponseHeaders(response.status(), -1);
            return;
        }

        byte[] bytes = response.body() instanceof String text
                ? text.getBytes(StandardCharsets.UTF_8)
                : objectMapper.writeValueAsBytes(response.body());
        responseHeaders.set("Content-Type", response.contentType());
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String requestIdOf(Headers headers) {
        String incoming = headers.getFirst(REQUEST_ID_HEADER);
        if (incoming != null && !incoming.isBlank()) {
            return incoming.trim();
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "req_" + System.currentTimeMillis() + "_" + suffix;
    }

    private static Map<String, String> lowerCaseHeaders(Headers headers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                result.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().get(0));
            }
        }
        return result;
    }

    /**
     * Peer address, or the nearest untrusted hop of X-Forwarded-For when the peer
     * is a trusted proxy. Package-private for tests.
     */
    static String clientIp(InetSocketAddress remote, String forwardedFor, Set<String> trustedProxies) {
        String peer = remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : null;
        if (peer == null || !trustedProxies.contains(peer) || forwardedFor == null || forwardedFor.isBlank()) {
            return peer;
        }
        String[] hops = forwardedFor.split(",");
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (!hop.isEmpty() && !trustedProxies.contains(hop)) {
                return hop;
            }
        }
        return peer;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> query = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            query.putIfAbsent(key, value);
        }
        return query;
    }
}
