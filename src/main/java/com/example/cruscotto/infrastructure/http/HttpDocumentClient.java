package com.example.cruscotto.infrastructure.http;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin wrapper over {@link HttpClient} used to download report bodies.
 * Status handling and retries are left to the caller.
 */
@Component
public class HttpDocumentClient {

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    /**
     * Issues a GET request and buffers the whole body.
     *
     * @param url     absolute, already encoded URL
     * @param timeout request timeout
     * @return status code and body
     * @throws IOException          on transport failures
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public FetchResponse get(String url, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        return new FetchResponse(response.statusCode(), response.body());
    }

    public record FetchResponse(int status, byte[] body) {

        public boolean successful() {
            return status >= 200 && status < 300;
        }
    }
}
