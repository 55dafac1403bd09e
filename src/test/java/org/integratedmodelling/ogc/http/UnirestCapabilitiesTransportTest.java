package org.integratedmodelling.ogc.http;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.integratedmodelling.ogc.configuration.ExplorerConfiguration;
import org.integratedmodelling.ogc.exceptions.HttpStatusException;
import org.integratedmodelling.ogc.exceptions.PayloadTooLargeException;
import org.integratedmodelling.ogc.exceptions.TransportException;
import org.integratedmodelling.ogc.exceptions.TransportTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs against a local HTTP server. The transport itself does not care about the scheme; https is
 * enforced when the URL is built.
 */
class UnirestCapabilitiesTransportTest {

    private static final byte[] DOCUMENT =
            "<WMS_Capabilities version=\"1.3.0\"/>".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private ExecutorService executor;
    private final Deque<Integer> statuses = new ArrayDeque<>();
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private byte[] body = DOCUMENT;

    @BeforeEach
    public void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext(
                "/ows",
                exchange -> {
                    requests.incrementAndGet();
                    userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
                    Integer status = statuses.poll();
                    int code = status == null ? 200 : status;
                    byte[] content = code == 200 ? body : new byte[0];
                    exchange.sendResponseHeaders(code, content.length == 0 ? -1 : content.length);
                    try (OutputStream out = exchange.getResponseBody()) {
                        out.write(content);
                    }
                });
        server.createContext(
                "/slow",
                exchange -> {
                    requests.incrementAndGet();
                    try {
                        Thread.sleep(3000);
                        exchange.sendResponseHeaders(200, DOCUMENT.length);
                        try (OutputStream out = exchange.getResponseBody()) {
                            out.write(DOCUMENT);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        exchange.close();
                    }
                });
        // slow handlers must not hold up the next request
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
    }

    @AfterEach
    public void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private String url() {
        return "http://localhost:" + server.getAddress().getPort() + "/ows?request=GetCapabilities";
    }

    private static UnirestCapabilitiesTransport transport(int retries, long maxBytes) {
        return new UnirestCapabilitiesTransport(
                ExplorerConfiguration.builder()
                        .retryCount(retries)
                        .retryBackoffFactor(0)
                        .maxResponseBytes(maxBytes)
                        .userAgent("explorer-test")
                        .build());
    }

    private static UnirestCapabilitiesTransport transport(
            int retries, double backoffFactor, int readTimeoutMs) {
        return new UnirestCapabilitiesTransport(
                ExplorerConfiguration.builder()
                        .retryCount(retries)
                        .retryBackoffFactor(backoffFactor)
                        .readTimeoutMs(readTimeoutMs)
                        .userAgent("explorer-test")
                        .build());
    }

    @Test
    public void returnsTheBody() {
        try (UnirestCapabilitiesTransport transport = transport(2, 1024)) {
            Assertions.assertArrayEquals(DOCUMENT, transport.get(url()));
        }
        Assertions.assertEquals(1, requests.get());
        Assertions.assertEquals("explorer-test", userAgent.get());
    }

    @Test
    public void clientErrorsAreNotRetried() {
        statuses.add(400);
        try (UnirestCapabilitiesTransport transport = transport(2, 1024)) {
            HttpStatusException exception =
                    Assertions.assertThrows(HttpStatusException.class, () -> transport.get(url()));
            Assertions.assertEquals(400, exception.getStatus());
        }
        Assertions.assertEquals(1, requests.get());
    }

    @Test
    public void transientErrorsAreRetried() {
        statuses.add(503);
        statuses.add(502);
        try (UnirestCapabilitiesTransport transport = transport(2, 1024)) {
            Assertions.assertArrayEquals(DOCUMENT, transport.get(url()));
        }
        Assertions.assertEquals(3, requests.get());
    }

    @Test
    public void givesUpAfterTheLastRetry() {
        statuses.add(503);
        statuses.add(503);
        statuses.add(503);
        try (UnirestCapabilitiesTransport transport = transport(2, 1024)) {
            HttpStatusException exception =
                    Assertions.assertThrows(HttpStatusException.class, () -> transport.get(url()));
            Assertions.assertEquals(503, exception.getStatus());
        }
        Assertions.assertEquals(3, requests.get());
    }

    @Test
    public void bodyAtTheLimitIsAccepted() {
        try (UnirestCapabilitiesTransport transport = transport(0, DOCUMENT.length)) {
            Assertions.assertArrayEquals(DOCUMENT, transport.get(url()));
        }
    }

    @Test
    public void oversizedBodyIsRejectedWithoutRetry() {
        try (UnirestCapabilitiesTransport transport = transport(2, DOCUMENT.length - 1)) {
            PayloadTooLargeException exception =
                    Assertions.assertThrows(PayloadTooLargeException.class, () -> transport.get(url()));
            Assertions.assertEquals(DOCUMENT.length - 1, exception.getLimit());
        }
        Assertions.assertEquals(1, requests.get());
    }

    @Test
    public void slowServerTimesOutAndIsRetried() {
        String slow = "http://localhost:" + server.getAddress().getPort() + "/slow";
        try (UnirestCapabilitiesTransport transport = transport(1, 0, 300)) {
            TransportTimeoutException exception =
                    Assertions.assertThrows(
                            TransportTimeoutException.class, () -> transport.get(slow));
            Assertions.assertEquals("Timeout while retrieving " + slow, exception.getMessage());
            Assertions.assertEquals(slow, exception.getUrl());
        }
        Assertions.assertEquals(2, requests.get());
    }

    @Test
    public void refusedConnectionIsRetriedWithBackoff() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        String url = "http://localhost:" + port + "/ows";
        // two retries back off 100 and 200 ms
        long started = System.nanoTime();
        try (UnirestCapabilitiesTransport transport = transport(2, 0.1, 1000)) {
            TransportException exception =
                    Assertions.assertThrows(TransportException.class, () -> transport.get(url));
            Assertions.assertFalse(exception instanceof TransportTimeoutException);
            Assertions.assertTrue(exception.getMessage().startsWith("Cannot connect to " + url));
        }
        Assertions.assertTrue(
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 300);
    }

    @Test
    public void droppedConnectionsAreRetried() throws Exception {
        AtomicInteger connections = new AtomicInteger();
        try (ServerSocket socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            Thread acceptor =
                    new Thread(
                            () -> {
                                while (!socket.isClosed()) {
                                    try (Socket accepted = socket.accept()) {
                                        connections.incrementAndGet();
                                    } catch (IOException e) {
                                        return;
                                    }
                                }
                            });
            acceptor.setDaemon(true);
            acceptor.start();

            String url = "http://127.0.0.1:" + socket.getLocalPort() + "/ows";
            try (UnirestCapabilitiesTransport transport = transport(2, 0, 1000)) {
                TransportException exception =
                        Assertions.assertThrows(
                                TransportException.class, () -> transport.get(url));
                Assertions.assertFalse(exception instanceof HttpStatusException);
            }
        }
        Assertions.assertEquals(3, connections.get());
    }
}
