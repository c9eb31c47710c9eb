package com.face.attendance.cdi;

import com.face.attendance.api.AttendanceEngine;
import com.face.attendance.api.EngineOptions;
import com.face.attendance.detection.FaceDetector;
import com.face.attendance.detection.FallbackFaceDetector;
import com.face.attendance.graph.PoolConfig;
import com.face.attendance.health.ModelServerHealthCheck;
import com.face.attendance.matching.RetryPolicy;
import com.face.attendance.model.HttpFaceModelClient;
import com.face.attendance.registry.SimilarityMetric;
import com.face.attendance.roster.CachingRosterProvider;
import com.face.attendance.roster.InMemoryRosterProvider;
import com.face.attendance.roster.RosterCacheConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the attendance engine from MicroProfile Config properties.
 *
 * <h2>Minimal configuration</h2>
 * <pre>
 * face-attendance.model-server.base-url=http://face-model:8500
 * face-attendance.registry.backend=falkordb
 * face-attendance.falkordb.host=localhost
 * face-attendance.falkordb.port=6379
 * </pre>
 *
 * <p>With {@code registry.backend=memory} signatures and attendance rows are kept
 * in process, which is only suitable for development.</p>
 */
@ApplicationScoped
public class AttendanceEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(AttendanceEngineProducer.class);

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.matching.threshold", defaultValue = "0.6")
    double threshold;

    @Inject
    @ConfigProperty(name = "face-attendance.matching.top-k", defaultValue = "5")
    int topK;

    @Inject
    @ConfigProperty(name = "face-attendance.matching.metric", defaultValue = "cosine")
    String metric;

    @Inject
    @ConfigProperty(name = "face-attendance.matching.restrict-to-roster", defaultValue = "true")
    boolean restrictToRoster;

    // ── Registry ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.registry.backend", defaultValue = "falkordb")
    String registryBackend;

    @Inject
    @ConfigProperty(name = "face-attendance.registry.timeout-ms", defaultValue = "2000")
    long registryTimeoutMs;

    @Inject
    @ConfigProperty(name = "face-attendance.registry.max-attempts", defaultValue = "3")
    int registryMaxAttempts;

    @Inject
    @ConfigProperty(name = "face-attendance.registry.initial-backoff-ms", defaultValue = "100")
    long registryInitialBackoffMs;

    @Inject
    @ConfigProperty(name = "face-attendance.registry.max-backoff-ms", defaultValue = "2000")
    long registryMaxBackoffMs;

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "face-attendance.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "face-attendance.falkordb.graph-name", defaultValue = "face-attendance")
    String falkordbGraphName;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.pool.max-total", defaultValue = "16")
    int poolMaxTotal;

    @Inject
    @ConfigProperty(name = "face-attendance.pool.max-idle", defaultValue = "8")
    int poolMaxIdle;

    @Inject
    @ConfigProperty(name = "face-attendance.pool.min-idle", defaultValue = "1")
    int poolMinIdle;

    @Inject
    @ConfigProperty(name = "face-attendance.pool.max-wait-millis", defaultValue = "3000")
    long poolMaxWaitMillis;

    // ── Model server ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.model-server.base-url", defaultValue = "http://localhost:8500")
    String modelServerBaseUrl;

    @Inject
    @ConfigProperty(name = "face-attendance.model-server.dimension", defaultValue = "128")
    int embeddingDimension;

    @Inject
    @ConfigProperty(name = "face-attendance.model-server.timeout-seconds", defaultValue = "30")
    int modelServerTimeoutSeconds;

    /** Slower, more thorough detector consulted when the primary finds no faces. */
    @Inject
    @ConfigProperty(name = "face-attendance.model-server.fallback-base-url")
    Optional<String> fallbackDetectorBaseUrl;

    // ── Roster cache ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.roster-cache.max-size", defaultValue = "1000")
    int rosterCacheMaxSize;

    @Inject
    @ConfigProperty(name = "face-attendance.roster-cache.ttl-seconds", defaultValue = "60")
    int rosterCacheTtlSeconds;

    // ── Workers ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "face-attendance.workers.embedding-threads", defaultValue = "0")
    int embeddingThreads;

    @Inject
    @ConfigProperty(name = "face-attendance.workers.embedding-timeout-ms", defaultValue = "30000")
    long embeddingTimeoutMs;

    @Inject
    @ConfigProperty(name = "face-attendance.workers.registry-threads", defaultValue = "4")
    int registryThreads;

    @Inject
    @ConfigProperty(name = "face-attendance.workers.max-image-bytes", defaultValue = "10485760")
    int maxImageBytes;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public InMemoryRosterProvider rosterSource() {
        return new InMemoryRosterProvider();
    }

    @Produces
    @ApplicationScoped
    public CachingRosterProvider rosterProvider(InMemoryRosterProvider source) {
        return new CachingRosterProvider(source, new RosterCacheConfig(rosterCacheMaxSize, rosterCacheTtlSeconds));
    }

    @Produces
    @ApplicationScoped
    public HttpFaceModelClient faceModelClient() {
        return HttpFaceModelClient.builder()
                .baseUrl(modelServerBaseUrl)
                .dimension(embeddingDimension)
                .timeout(Duration.ofSeconds(modelServerTimeoutSeconds))
                .build();
    }

    @Produces
    @ApplicationScoped
    public AttendanceEngine attendanceEngine(HttpFaceModelClient modelClient, CachingRosterProvider roster) {
        log.info("Producing AttendanceEngine: backend={} falkordb={}:{}/{} modelServer={}",
                registryBackend, falkordbHost, falkordbPort, falkordbGraphName, modelServerBaseUrl);

        AttendanceEngine.Builder builder = AttendanceEngine.builder()
                .faceDetector(faceDetector(modelClient))
                .embeddingGenerator(modelClient)
                .rosterProvider(roster)
                .similarityMetric(SimilarityMetric.fromString(metric))
                .options(buildOptions())
                .healthCheck(new ModelServerHealthCheck(modelClient));

        if ("falkordb".equalsIgnoreCase(registryBackend)) {
            builder.falkorDBPool(PoolConfig.builder()
                    .host(falkordbHost)
                    .port(falkordbPort)
                    .graphName(falkordbGraphName)
                    .maxTotal(poolMaxTotal)
                    .maxIdle(poolMaxIdle)
                    .minIdle(poolMinIdle)
                    .maxWaitMillis(poolMaxWaitMillis)
                    .build());
        } else if (!"memory".equalsIgnoreCase(registryBackend)) {
            log.warn("Unknown registry backend '{}', falling back to memory", registryBackend);
        }
        return builder.build();
    }

    public void closeEngine(@Disposes AttendanceEngine engine) {
        log.info("Closing AttendanceEngine");
        engine.close();
    }

    FaceDetector faceDetector(HttpFaceModelClient modelClient) {
        if (fallbackDetectorBaseUrl == null || fallbackDetectorBaseUrl.isEmpty()
                || fallbackDetectorBaseUrl.get().isBlank()) {
            return modelClient;
        }
        HttpFaceModelClient fallback = HttpFaceModelClient.builder()
                .baseUrl(fallbackDetectorBaseUrl.get())
                .dimension(embeddingDimension)
                .timeout(Duration.ofSeconds(modelServerTimeoutSeconds))
                .build();
        log.info("Fallback face detector enabled: {}", fallback.getBaseUrl());
        return new FallbackFaceDetector(modelClient, fallback);
    }

    EngineOptions buildOptions() {
        EngineOptions.Builder options = EngineOptions.builder()
                .threshold(threshold)
                .topK(topK)
                .registryTimeout(Duration.ofMillis(registryTimeoutMs))
                .retryPolicy(new RetryPolicy(registryMaxAttempts, registryInitialBackoffMs, 2.0, registryMaxBackoffMs))
                .restrictToRoster(restrictToRoster)
                .embeddingTimeout(Duration.ofMillis(embeddingTimeoutMs))
                .registryThreads(registryThreads)
                .maxImageBytes(maxImageBytes);
        // 0 keeps the processor-count default
        if (embeddingThreads > 0) {
            options.embeddingThreads(embeddingThreads);
        }
        return options.build();
    }
}
