package com.face.attendance.api;

import com.face.attendance.audit.AuditRepository;
import com.face.attendance.audit.AuditService;
import com.face.attendance.audit.GraphAuditRepository;
import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.decision.AttendanceConflictPolicy;
import com.face.attendance.decision.AttendanceDecisionBuilder;
import com.face.attendance.detection.FaceDetector;
import com.face.attendance.detection.ImageDecoder;
import com.face.attendance.embedding.EmbeddingGenerator;
import com.face.attendance.embedding.ParallelEmbedder;
import com.face.attendance.graph.FalkorDBConnection;
import com.face.attendance.graph.GraphConnection;
import com.face.attendance.graph.GraphConnectionPool;
import com.face.attendance.graph.InputSanitizer;
import com.face.attendance.graph.PoolConfig;
import com.face.attendance.graph.PooledFalkorDBConnection;
import com.face.attendance.graph.SimpleGraphConnectionPool;
import com.face.attendance.health.ConnectionPoolHealthCheck;
import com.face.attendance.health.FalkorDBHealthCheck;
import com.face.attendance.health.HealthCheck;
import com.face.attendance.health.HealthCheckRegistry;
import com.face.attendance.health.HealthStatus;
import com.face.attendance.health.MemoryHealthCheck;
import com.face.attendance.health.SignatureRegistryHealthCheck;
import com.face.attendance.matching.AssignmentResolver;
import com.face.attendance.matching.SimilarityMatcher;
import com.face.attendance.metrics.MetricsService;
import com.face.attendance.metrics.NoOpMetricsService;
import com.face.attendance.registry.GraphSignatureRegistry;
import com.face.attendance.registry.InMemorySignatureRegistry;
import com.face.attendance.registry.SignatureRegistry;
import com.face.attendance.registry.SimilarityMetric;
import com.face.attendance.roster.InMemoryRosterProvider;
import com.face.attendance.roster.RosterProvider;
import com.face.attendance.store.AttendanceStore;
import com.face.attendance.store.GraphAttendanceStore;
import com.face.attendance.store.InMemoryAttendanceStore;
import com.face.attendance.tracing.NoOpTracingService;
import com.face.attendance.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the face-match attendance engine.
 *
 * <p>Without a graph connection everything is kept in memory. With one, the
 * signature registry, attendance rows and audit trail live in FalkorDB.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (AttendanceEngine engine = AttendanceEngine.builder()
 *         .faceDetector(modelClient)
 *         .embeddingGenerator(modelClient)
 *         .rosterProvider(roster)
 *         .falkorDB("localhost", 6379, "face-attendance")
 *         .build()) {
 *
 *     engine.enroll(EnrollmentRequest.of("student-17", portraitBytes));
 *
 *     SubmissionResult result = engine.submit(
 *             SubmissionRequest.of("math-101", LocalDate.now(), groupPhotoBytes));
 *     result.getRecognizedStudents().forEach(System.out::println);
 * }
 * </pre>
 */
public class AttendanceEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AttendanceEngine.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final EngineOptions options;
    private final SignatureRegistry registry;
    private final AttendanceStore store;
    private final RosterProvider rosterProvider;
    private final AuditService auditService;
    private final ExecutorService embeddingWorkers;
    private final ExecutorService registryWorkers;
    private final AttendanceSubmissionService submissionService;
    private final EnrollmentService enrollmentService;
    private final HealthCheckRegistry healthCheckRegistry;

    private AttendanceEngine(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;

        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }

        int dimension = builder.embeddingGenerator.dimension();
        if (builder.signatureRegistry != null) {
            this.registry = builder.signatureRegistry;
        } else if (connection != null) {
            GraphSignatureRegistry graphRegistry =
                    new GraphSignatureRegistry(connection, dimension, builder.similarityMetric);
            if (builder.createIndexes) {
                graphRegistry.createVectorIndex();
            }
            this.registry = graphRegistry;
        } else {
            this.registry = new InMemorySignatureRegistry(dimension, builder.similarityMetric);
        }
        if (registry.dimension() != dimension) {
            throw new IllegalStateException("Embedding dimension " + dimension
                    + " does not match registry dimension " + registry.dimension());
        }

        AttendanceConflictPolicy conflictPolicy = new AttendanceConflictPolicy();
        if (builder.attendanceStore != null) {
            this.store = builder.attendanceStore;
        } else if (connection != null) {
            this.store = new GraphAttendanceStore(connection);
        } else {
            this.store = new InMemoryAttendanceStore(conflictPolicy);
        }

        this.rosterProvider = builder.rosterProvider != null
                ? builder.rosterProvider : new InMemoryRosterProvider();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else if (connection != null) {
            this.auditService = new AuditService(new GraphAuditRepository(connection));
        } else {
            this.auditService = new AuditService();
        }

        this.embeddingWorkers = Executors.newFixedThreadPool(options.getEmbeddingThreads(),
                namedThreads("attendance-embed"));
        // registry deadlines must not include time spent queued behind embedding work
        this.registryWorkers = Executors.newFixedThreadPool(options.getRegistryThreads(),
                namedThreads("attendance-registry"));

        ImageDecoder imageDecoder = new ImageDecoder(options.getMaxImageBytes());
        SimilarityMatcher matcher = new SimilarityMatcher(registry, registryWorkers, options.getTopK(),
                options.getRegistryTimeout(), options.getRetryPolicy(), metrics, builder.sleeper);
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.submissionService = new AttendanceSubmissionService(
                imageDecoder,
                builder.faceDetector,
                new ParallelEmbedder(builder.embeddingGenerator, embeddingWorkers, dimension,
                        options.getEmbeddingTimeout()),
                matcher,
                new AssignmentResolver(),
                new AttendanceDecisionBuilder(conflictPolicy, clock),
                store,
                rosterProvider,
                auditService,
                metrics,
                tracing,
                options);
        this.enrollmentService = new EnrollmentService(imageDecoder, builder.faceDetector,
                builder.embeddingGenerator, registry, auditService, metrics, tracing,
                options.getDefaultActorId());

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new SignatureRegistryHealthCheck(registry));
        healthCheckRegistry.register(new MemoryHealthCheck());
        if (connection != null) {
            healthCheckRegistry.register(new FalkorDBHealthCheck(connection));
        }
        if (builder.connectionPool != null) {
            healthCheckRegistry.register(new ConnectionPoolHealthCheck(builder.connectionPool));
        }
        builder.extraHealthChecks.forEach(healthCheckRegistry::register);

        log.info("AttendanceEngine initialized: registry={}, store={}, options={}",
                registry.getClass().getSimpleName(), store.getClass().getSimpleName(), options);
    }

    // ========== Submission and enrollment ==========

    /**
     * Marks attendance for a class session from one group photo.
     *
     * @throws IllegalArgumentException if the request itself is malformed
     */
    public SubmissionResult submit(SubmissionRequest request) {
        InputSanitizer.validateIdentifier("classId", request.classId());
        return submissionService.submit(request);
    }

    /**
     * Enrolls or re-enrolls an identity from a portrait.
     */
    public EnrollmentResult enroll(EnrollmentRequest request) {
        return enrollmentService.enroll(request);
    }

    public boolean removeEnrollment(String identityId) {
        return enrollmentService.removeEnrollment(identityId, null);
    }

    public boolean removeEnrollment(String identityId, String actorId) {
        return enrollmentService.removeEnrollment(identityId, actorId);
    }

    // ========== Attendance queries ==========

    public List<AttendanceRecord> getAttendance(String classId, LocalDate date) {
        InputSanitizer.validateIdentifier("classId", classId);
        return store.findBySession(classId, date);
    }

    public List<AttendanceRecord> getAttendance(String classId) {
        InputSanitizer.validateIdentifier("classId", classId);
        return store.findByClass(classId);
    }

    public List<AttendanceRecord> getAttendanceForIdentity(String identityId) {
        InputSanitizer.validateIdentifier("identityId", identityId);
        return store.findByIdentity(identityId);
    }

    /**
     * Totals of a class over all recorded sessions.
     */
    public AttendanceSummary summarize(String classId) {
        InputSanitizer.validateIdentifier("classId", classId);
        List<AttendanceRecord> rows = store.findByClass(classId);
        Set<LocalDate> sessions = new HashSet<>();
        long present = 0;
        long absent = 0;
        long late = 0;
        long faceMatch = 0;
        for (AttendanceRecord row : rows) {
            sessions.add(row.getDate());
            if (row.getStatus() == AttendanceStatus.PRESENT) {
                present++;
            } else if (row.getStatus() == AttendanceStatus.ABSENT) {
                absent++;
            } else if (row.getStatus() == AttendanceStatus.LATE) {
                late++;
            }
            if (row.getMethod() == AttendanceMethod.FACE_MATCH) {
                faceMatch++;
            }
        }
        return new AttendanceSummary(classId, rosterProvider.rosterFor(classId).size(),
                sessions.size(), present, absent, late, faceMatch);
    }

    // ========== Operations ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    /**
     * Returns an async view of this engine. The caller owns and must close it.
     */
    public AsyncAttendanceEngine async() {
        return new AsyncAttendanceEngineImpl(this, options.getAsyncThreads(), options.getAsyncTimeoutMs());
    }

    public EngineOptions getOptions() {
        return options;
    }

    public SignatureRegistry getSignatureRegistry() {
        return registry;
    }

    public AttendanceStore getAttendanceStore() {
        return store;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    @Override
    public void close() {
        shutdown(embeddingWorkers);
        shutdown(registryWorkers);
        if (ownsConnection && connection != null) {
            connection.close();
        }
        log.info("AttendanceEngine closed");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private GraphConnectionPool connectionPool;
        private FaceDetector faceDetector;
        private EmbeddingGenerator embeddingGenerator;
        private SignatureRegistry signatureRegistry;
        private SimilarityMetric similarityMetric = SimilarityMetric.COSINE;
        private AttendanceStore attendanceStore;
        private RosterProvider rosterProvider;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private TracingService tracingService;
        private EngineOptions options = EngineOptions.defaults();
        private boolean createIndexes = true;
        private Clock clock;
        private SimilarityMatcher.Sleeper sleeper = SimilarityMatcher.Sleeper.THREAD;
        private final List<HealthCheck> extraHealthChecks = new ArrayList<>();

        /**
         * Uses an existing graph connection; the caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned by the engine.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Opens a pooled FalkorDB connection owned by the engine.
         */
        public Builder falkorDBPool(PoolConfig poolConfig) {
            this.connectionPool = new SimpleGraphConnectionPool(poolConfig);
            this.connection = new PooledFalkorDBConnection(connectionPool, poolConfig.graphName());
            this.ownsConnection = true;
            return this;
        }

        /**
         * Uses an existing pool; the caller keeps ownership.
         */
        public Builder connectionPool(GraphConnectionPool pool, String graphName) {
            this.connectionPool = pool;
            this.connection = new PooledFalkorDBConnection(pool, graphName);
            this.ownsConnection = false;
            return this;
        }

        public Builder faceDetector(FaceDetector faceDetector) {
            this.faceDetector = faceDetector;
            return this;
        }

        public Builder embeddingGenerator(EmbeddingGenerator embeddingGenerator) {
            this.embeddingGenerator = embeddingGenerator;
            return this;
        }

        /**
         * Overrides the registry chosen from the connection settings.
         */
        public Builder signatureRegistry(SignatureRegistry signatureRegistry) {
            this.signatureRegistry = signatureRegistry;
            return this;
        }

        public Builder similarityMetric(SimilarityMetric similarityMetric) {
            this.similarityMetric = similarityMetric;
            return this;
        }

        /**
         * Overrides the store chosen from the connection settings.
         */
        public Builder attendanceStore(AttendanceStore attendanceStore) {
            this.attendanceStore = attendanceStore;
            return this;
        }

        public Builder rosterProvider(RosterProvider rosterProvider) {
            this.rosterProvider = rosterProvider;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Replaces the pause between registry retries.
         */
        public Builder retrySleeper(SimilarityMatcher.Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder healthCheck(HealthCheck check) {
            this.extraHealthChecks.add(check);
            return this;
        }

        public AttendanceEngine build() {
            if (faceDetector == null) {
                throw new IllegalStateException("FaceDetector is required");
            }
            if (embeddingGenerator == null) {
                throw new IllegalStateException("EmbeddingGenerator is required");
            }
            if (options == null) {
                throw new IllegalStateException("EngineOptions are required");
            }
            return new AttendanceEngine(this);
        }
    }
}
