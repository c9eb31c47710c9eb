package com.face.attendance.model;

import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.detection.DetectionException;
import com.face.attendance.detection.FaceDetector;
import com.face.attendance.embedding.EmbeddingException;
import com.face.attendance.embedding.EmbeddingGenerator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Face detector and embedding generator backed by a remote model server.
 *
 * <p>The server speaks JSON over HTTP:</p>
 * <ul>
 *   <li>{@code POST {base}/detect} with {@code {"image": "<base64>"}} returns
 *       {@code {"faces": [{"left":..,"top":..,"width":..,"height":..,"confidence":..}]}}</li>
 *   <li>{@code POST {base}/embed} with {@code {"image": "<base64>", "region": {...}}} returns
 *       {@code {"embedding": [..]}}</li>
 *   <li>{@code GET {base}/health} answers 200 when the models are loaded</li>
 * </ul>
 *
 * Usage:
 * <pre>
 * HttpFaceModelClient client = HttpFaceModelClient.builder()
 *     .baseUrl("http://localhost:8500")
 *     .dimension(128)
 *     .build();
 *
 * AttendanceEngine engine = AttendanceEngine.builder()
 *     .faceDetector(client)
 *     .embeddingGenerator(client)
 *     ...
 *     .build();
 * </pre>
 */
public class HttpFaceModelClient implements FaceDetector, EmbeddingGenerator {
    private static final Logger log = LoggerFactory.getLogger(HttpFaceModelClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:8500";
    private static final int DEFAULT_DIMENSION = 128;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final int dimension;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpFaceModelClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.dimension = builder.dimension > 0 ? builder.dimension : DEFAULT_DIMENSION;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<FaceRegion> detect(DecodedImage image) throws DetectionException {
        try {
            String body = objectMapper.writeValueAsString(new DetectRequest(encode(image)));
            String response = post("/detect", body);
            DetectResponse parsed = objectMapper.readValue(response, DetectResponse.class);
            List<FaceRegion> faces = new ArrayList<>();
            if (parsed.faces() != null) {
                for (RegionDto dto : parsed.faces()) {
                    faces.add(dto.toRegion());
                }
            }
            log.debug("model.detect faces={} image={}", faces.size(), image);
            return faces;
        } catch (ModelServerException | IOException | IllegalArgumentException e) {
            throw new DetectionException("Face detection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectionException("Face detection interrupted", e);
        }
    }

    @Override
    public Signature embed(DecodedImage image, FaceRegion region) throws EmbeddingException {
        try {
            String body = objectMapper.writeValueAsString(
                    new EmbedRequest(encode(image), RegionDto.from(region)));
            String response = post("/embed", body);
            EmbedResponse parsed = objectMapper.readValue(response, EmbedResponse.class);
            if (parsed.embedding() == null || parsed.embedding().length != dimension) {
                throw new EmbeddingException("Model server returned an embedding of dimension "
                        + (parsed.embedding() == null ? 0 : parsed.embedding().length)
                        + ", expected " + dimension);
            }
            return Signature.of(parsed.embedding());
        } catch (ModelServerException | IOException | IllegalArgumentException e) {
            throw new EmbeddingException("Embedding failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding interrupted", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String getName() {
        return "HttpFaceModel(" + baseUrl + ")";
    }

    /**
     * Checks {@code GET {base}/health}.
     */
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/health"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Model server not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private String post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new ModelServerException("Model server returned status "
                    + response.statusCode() + " for " + path);
        }
        return response.body();
    }

    private static String encode(DecodedImage image) {
        return Base64.getEncoder().encodeToString(image.getData());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private int dimension;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpFaceModelClient build() {
            return new HttpFaceModelClient(this);
        }
    }

    private static class ModelServerException extends RuntimeException {
        ModelServerException(String message) {
            super(message);
        }
    }

    // Wire DTOs
    private record DetectRequest(String image) {}

    private record EmbedRequest(String image, RegionDto region) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RegionDto(int left, int top, int width, int height, Double confidence) {
        static RegionDto from(FaceRegion region) {
            return new RegionDto(region.left(), region.top(), region.width(), region.height(),
                    region.confidence());
        }

        FaceRegion toRegion() {
            return new FaceRegion(left, top, width, height, confidence != null ? confidence : 1.0);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DetectResponse(List<RegionDto> faces) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbedResponse(double[] embedding) {}
}
