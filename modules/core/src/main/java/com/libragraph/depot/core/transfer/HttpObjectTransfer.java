package com.libragraph.depot.core.transfer;

import com.libragraph.depot.core.IntegrityException;
import com.libragraph.depot.core.registry.RegistryException;
import com.libragraph.depot.util.ContentHash;
import com.libragraph.depot.util.buffer.Buffer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ObjectTransfer} for S3-style pre-signed URLs.
 *
 * <p>Uploads carry the part's SHA-256 in {@code x-amz-checksum-sha256} so the store rejects
 * corrupted bodies. No credentials are sent; the URL is the authorization.
 */
public class HttpObjectTransfer implements ObjectTransfer {

    private static final Logger log = Logger.getLogger(HttpObjectTransfer.class);

    private final HttpClient http;
    private final Duration timeout;

    public HttpObjectTransfer(Duration timeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    public HttpObjectTransfer(HttpClient http, Duration timeout) {
        this.http = http;
        this.timeout = timeout;
    }

    @Override
    public void put(URI url, byte[] body, ContentHash hash) {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("x-amz-checksum-sha256", hash.toBase64())
                .header("Content-Type", "application/octet-stream")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RegistryException("Upload to object storage failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException("Interrupted while uploading to object storage", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RegistryException("Object storage rejected upload of " + body.length + " bytes",
                    status, response.body());
        }
        log.debugf("Uploaded %d bytes (sha256 %s)", body.length, hash.toHex());
    }

    @Override
    public Buffer download(URI url, long expectedSize) {
        HttpRequest request = HttpRequest.newBuilder(url).timeout(timeout).GET().build();
        HttpResponse<InputStream> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new RegistryException("Download from object storage failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException("Interrupted while downloading from object storage", e);
        }

        try (InputStream in = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new RegistryException("Object storage refused download", status,
                        new String(in.readNBytes(4096)));
            }
            Buffer buffer;
            try {
                buffer = Buffer.spool(in, expectedSize);
            } catch (UncheckedIOException e) {
                throw new IntegrityException("Download ended before " + expectedSize + " bytes", e);
            }
            if (in.read() != -1) {
                buffer.close();
                throw new IntegrityException("Download is longer than the expected " + expectedSize + " bytes");
            }
            log.debugf("Downloaded %d bytes", expectedSize);
            return buffer;
        } catch (IOException e) {
            throw new RegistryException("Failed to read download body: " + e.getMessage(), e);
        }
    }
}
