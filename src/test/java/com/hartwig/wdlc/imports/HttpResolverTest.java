package com.hartwig.wdlc.imports;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpResolverTest {
    private static final String URL = "https://raw.example.org/wdl/lib.wdl";

    private HttpClient httpClient;
    private HttpResponse<?> response;
    private HttpResolver resolver;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        resolver = new HttpResolver(httpClient, Duration.ofSeconds(5));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void fetchesUrl() throws Exception {
        when(response.statusCode()).thenReturn(200);
        doReturn("version 1.0\n").when(response).body();
        doReturn(response).when(httpClient).send(any(), any());

        var result = resolver.resolve(URL);

        assertThat(result.resolved()).hasValueSatisfying(resolved -> {
            assertThat(resolved.canonicalPath()).isEqualTo(URL);
            assertThat(resolved.source()).isEqualTo("version 1.0\n");
        });
        verify(httpClient).send(argThat(request -> request.uri().equals(URI.create(URL))
                && request.timeout().equals(Optional.of(Duration.ofSeconds(5)))), any());
    }

    @Test
    void errorStatusFails() throws Exception {
        when(response.statusCode()).thenReturn(404);
        doReturn(response).when(httpClient).send(any(), any());

        var result = resolver.resolve(URL);

        assertThat(result.isResolved()).isFalse();
        assertThat(result.errors()).containsExactly("Fetching '" + URL + "' returned HTTP status 404");
    }

    @Test
    void ioErrorFails() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

        assertThat(resolver.resolve(URL).errors()).containsExactly("Could not fetch '" + URL + "': connection reset");
    }

    @Test
    void interruptIsKept() throws Exception {
        doThrow(new InterruptedException()).when(httpClient).send(any(), any());

        assertThat(resolver.resolve(URL).isResolved()).isFalse();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void localPathsAreNotFetched() {
        assertThat(resolver.resolve("lib/tasks.wdl").isResolved()).isFalse();
        verifyNoInteractions(httpClient);
    }
}
