package com.sintajournals.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Minimal client for the HDFS WebHDFS REST API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code MKDIRS}: a single {@code PUT} against the namenode; the JSON body
 *       {@code {"boolean": true}} confirms the directory exists.</li>
 *   <li>{@code CREATE}: a {@code PUT} against the namenode answers with a redirect to a
 *       datanode, the content is then {@code PUT} to that location (201 Created).</li>
 *   <li>When a user is configured it is sent as the {@code user.name} query parameter
 *       (simple authentication).</li>
 * </ul>
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class WebHdfsClient {
    private static final Logger logger = LoggerFactory.getLogger(WebHdfsClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String user;
    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public WebHdfsClient(String baseUrl, String user) {
        this(baseUrl, user, HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(15))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    WebHdfsClient(String baseUrl, String user, HttpClient client) {
        String trimmed = baseUrl == null ? "" : baseUrl.trim();
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        this.baseUrl = trimmed;
        this.user = user == null ? "" : user.trim();
        this.client = client;
    }

    /**
     * Creates the directory and any missing parents.
     * @throws IOException if the namenode rejects the request
     */
    public void mkdirs(String path) throws IOException {
        HttpResponse<String> response = send(HttpRequest.newBuilder(operationUri(path, "MKDIRS", ""))
            .timeout(REQUEST_TIMEOUT)
            .PUT(HttpRequest.BodyPublishers.noBody())
            .build());
        if (response.statusCode() != 200) {
            throw new IOException("MKDIRS " + path + " failed with HTTP " + response.statusCode() + ": " + response.body());
        }
        JsonNode root = mapper.readTree(response.body());
        if (!root.path("boolean").asBoolean(false)) {
            throw new IOException("MKDIRS " + path + " was not confirmed: " + response.body());
        }
        logger.debug("Ensured HDFS directory {}", path);
    }

    /**
     * Uploads the content, replacing any existing file.
     * @throws IOException if the namenode or datanode rejects the upload
     */
    public void create(String path, byte[] content) throws IOException {
        HttpResponse<String> first = send(HttpRequest.newBuilder(operationUri(path, "CREATE", "&overwrite=true"))
            .timeout(REQUEST_TIMEOUT)
            .PUT(HttpRequest.BodyPublishers.noBody())
            .build());
        int status = first.statusCode();
        if (status == 201) {
            return;
        }
        if (status != 307 && status != 302) {
            throw new IOException("CREATE " + path + " failed with HTTP " + status + ": " + first.body());
        }
        String location = first.headers().firstValue("Location")
            .orElseThrow(() -> new IOException("CREATE " + path + " redirect without Location header"));
        HttpResponse<String> upload = send(HttpRequest.newBuilder(URI.create(location))
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/octet-stream")
            .PUT(HttpRequest.BodyPublishers.ofByteArray(content))
            .build());
        if (upload.statusCode() != 201 && upload.statusCode() != 200) {
            throw new IOException("Upload of " + path + " failed with HTTP " + upload.statusCode() + ": " + upload.body());
        }
        logger.debug("Uploaded {} bytes to HDFS {}", content.length, path);
    }

    URI operationUri(String path, String op, String extra) {
        String normalized = path.startsWith("/") ? path : "/" + path;
        StringBuilder uri = new StringBuilder(baseUrl).append("/webhdfs/v1").append(normalized)
            .append("?op=").append(op).append(extra);
        if (!user.isEmpty()) {
            uri.append("&user.name=").append(URLEncoder.encode(user, StandardCharsets.UTF_8));
        }
        return URI.create(uri.toString());
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + request.uri(), e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
