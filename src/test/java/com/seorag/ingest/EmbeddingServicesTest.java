package com.seorag.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.seorag.runtime.AppConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import okhttp3.OkHttpClient;

class EmbeddingServicesTest {
    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", exchange -> respond(exchange, 200, """
                {"data":[
                  {"index":1,"embedding":[0.0,1.0]},
                  {"index":0,"embedding":[1.0,0.0]}
                ]}
                """));
        server.createContext("/short", exchange -> respond(exchange, 200, "{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}"));
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void shouldUseLocalModelWhenNoEndpointConfigured() {
        AppConfig.ProviderConfig provider = new AppConfig.ProviderConfig();
        provider.setEmbeddingUrl("");
        provider.setLocalEmbeddingDimension(32);

        EmbeddingService service = EmbeddingServices.fromConfig(provider, "key", new OkHttpClient());

        assertInstanceOf(LocalModelEmbeddingService.class, service);
        assertEquals("local-seo-v1-32", service.version());
    }

    @Test
    void shouldOrderProviderVectorsByIndex() throws Exception {
        EmbeddingService service = external("/v1/embeddings");

        List<float[]> vectors = service.embedBatch(List.of("first", "second"));

        assertArrayEquals(new float[] { 1.0f, 0.0f }, vectors.get(0));
        assertArrayEquals(new float[] { 0.0f, 1.0f }, vectors.get(1));
        assertEquals("external-text-embedding-3-small-v1", service.version());
    }

    @Test
    void shouldFailWhenProviderReturnsFewerVectors() {
        EmbeddingService service = external("/short");

        assertThrows(IOException.class, () -> service.embedBatch(List.of("a", "b")));
    }

    private EmbeddingService external(String path) {
        AppConfig.ProviderConfig provider = new AppConfig.ProviderConfig();
        provider.setEmbeddingUrl("http://127.0.0.1:" + server.getAddress().getPort() + path);
        provider.setEmbeddingModel("text-embedding-3-small");
        return EmbeddingServices.fromConfig(provider, "key", new OkHttpClient());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }
}
