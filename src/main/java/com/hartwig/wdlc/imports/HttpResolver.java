package com.hartwig.wdlc.imports;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import com.hartwig.wdlc.frontend.ImportResolver;
import com.hartwig.wdlc.frontend.ResolutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches imports given as http(s) URLs. Last resort of the resolver chain, no retries.
 */
public class HttpResolver implements ImportResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpResolver.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpResolver(final Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build(), timeout);
    }

    public HttpResolver(final HttpClient httpClient, final Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public ResolutionResult resolve(String path) {
        if (!isUrl(path)) {
            return ResolutionResult.failed(String.format("'%s' is not an http(s) URL", path));
        }
        try {
            var uri = new URI(path);
            var request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
            LOGGER.debug("Fetching import {}", uri);
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return ResolutionResult.failed(String.format("Fetching '%s' returned HTTP status %d", path, response.statusCode()));
            }
            return ResolutionResult.found(uri.toString(), response.body());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return ResolutionResult.failed(String.format("'%s' is not a valid URL: %s", path, e.getMessage()));
        } catch (IOException e) {
            return ResolutionResult.failed(String.format("Could not fetch '%s': %s", path, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResolutionResult.failed(String.format("Interrupted while fetching '%s'", path));
        }
    }

    static boolean isUrl(String path) {
        return path.startsWith("http://") || path.startsWith("https://");
    }
}
