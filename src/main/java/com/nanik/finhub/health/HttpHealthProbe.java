package com.nanik.finhub.health;

import com.nanik.finhub.catalog.WorkerInstance;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * GET on the instance's health-check URL; any 2xx counts as healthy.
 */
public class HttpHealthProbe implements HealthProbe {

    private final HttpClient client;

    public HttpHealthProbe() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpHealthProbe(HttpClient client) {
        this.client = client;
    }

    @Override
    public boolean probe(WorkerInstance instance, Duration timeout) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(instance.getHealthCheckUrl()))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        int status = response.statusCode();
        return status >= 200 && status < 300;
    }
}
