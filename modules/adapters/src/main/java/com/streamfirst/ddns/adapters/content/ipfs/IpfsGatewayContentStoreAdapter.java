package com.streamfirst.ddns.adapters.content.ipfs;

import com.streamfirst.ddns.adapters.content.RecordSetJsonCodec;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.ports.ContentStoreException;
import com.streamfirst.ddns.ports.ContentStorePort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * ContentStorePort backed by an IPFS HTTP gateway ({@code GET <gateway>/<cid>}). The gateway
 * answers 404 for unknown content; any other non-2xx status is treated as a store failure.
 */
@Slf4j
public class IpfsGatewayContentStoreAdapter implements ContentStorePort {

    private final URI gateway;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final RecordSetJsonCodec codec;

    public IpfsGatewayContentStoreAdapter(@NonNull URI gateway, @NonNull Duration requestTimeout) {
        this(gateway, HttpClient.newBuilder().connectTimeout(requestTimeout).build(),
             requestTimeout, new RecordSetJsonCodec());
    }

    public IpfsGatewayContentStoreAdapter(
            @NonNull URI gateway,
            @NonNull HttpClient httpClient,
            @NonNull Duration requestTimeout,
            @NonNull RecordSetJsonCodec codec) {
        String base = gateway.toString();
        this.gateway = URI.create(base.endsWith("/") ? base : base + "/");
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.codec = codec;
    }

    @Override
    public Optional<RecordSet> fetch(String locator) {
        URI uri = gateway.resolve(locator);
        log.debug("Fetching record set from {}", uri);

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new ContentStoreException("Failed to fetch " + locator + " from " + gateway, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentStoreException("Interrupted while fetching " + locator, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            log.debug("Content {} not found on gateway", locator);
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new ContentStoreException("Gateway returned HTTP " + status + " for " + locator);
        }
        return Optional.of(codec.read(response.body()));
    }
}
