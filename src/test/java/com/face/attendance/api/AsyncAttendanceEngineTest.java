package com.face.attendance.api;

import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.embedding.EmbeddingException;
import com.face.attendance.embedding.EmbeddingGenerator;
import com.face.attendance.matching.RetryPolicy;
import com.face.attendance.roster.InMemoryRosterProvider;
import com.face.attendance.testing.FakeFaceModel;
import com.face.attendance.testing.TestImages;
import com.face.attendance.testing.Vectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AsyncAttendanceEngine")
class AsyncAttendanceEngineTest {

    private static final byte[] PHOTO = TestImages.png(300, 100);

    private FakeFaceModel model;
    private AttendanceEngine engine;
    private AsyncAttendanceEngine async;

    @BeforeEach
    void setUp() {
        model = new FakeFaceModel();
        engine = AttendanceEngine.builder()
                .faceDetector(model)
                .embeddingGenerator(model)
                .rosterProvider(new InMemoryRosterProvider()
                        .enrollAll("bio-101", List.of("alice", "bob"))
                        .enroll("chem-2", "alice"))
                .options(EngineOptions.builder().embeddingThreads(2).asyncThreads(2).build())
                .build();
        engine.getSignatureRegistry().upsert("alice", Vectors.enrolled(0));
        engine.getSignatureRegistry().upsert("bob", Vectors.enrolled(1));
        model.face(FaceRegion.of(10, 10, 50, 50), Vectors.capture(0, 0.9));
        async = engine.async();
    }

    @AfterEach
    void tearDown() {
        async.close();
        engine.close();
    }

    @Test
    @DisplayName("Submissions complete asynchronously")
    void submitAsync() throws Exception {
        SubmissionResult result = async.submitAsync(SubmissionRequest.of("bio-101", LocalDate.of(2024, 9, 2), PHOTO))
                .get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("alice", result.getRecognizedStudents().get(0).identityId());
    }

    @Test
    @DisplayName("Batch results come back in request order")
    void submitAll() throws Exception {
        List<SubmissionRequest> requests = List.of(
                SubmissionRequest.of("bio-101", LocalDate.of(2024, 9, 2), PHOTO),
                SubmissionRequest.of("chem-2", LocalDate.of(2024, 9, 2), PHOTO),
                SubmissionRequest.of("bio-101", LocalDate.of(2024, 9, 3), new byte[0]));

        List<SubmissionResult> results = async.submitAllAsync(requests).get(10, TimeUnit.SECONDS);

        assertEquals(3, results.size());
        assertEquals("bio-101", results.get(0).getClassId());
        assertEquals("chem-2", results.get(1).getClassId());
        assertFalse(results.get(2).isSuccess());
        assertEquals(ErrorCode.INVALID_IMAGE, results.get(2).getErrorCode());
    }

    @Test
    @DisplayName("Enrollment runs asynchronously")
    void enrollAsync() throws Exception {
        model.clear().face(FaceRegion.of(20, 20, 80, 80), Vectors.enrolled(2));

        EnrollmentResult result = async.enrollAsync(EnrollmentRequest.of("carol", PHOTO)).get(10, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertTrue(engine.getSignatureRegistry().contains("carol"));
    }

    @Test
    @DisplayName("A backlog of slow embeddings does not make registry queries time out")
    void embeddingBacklogDoesNotStarveRegistry() throws Exception {
        EmbeddingGenerator slowEmbedder = new EmbeddingGenerator() {
            @Override
            public Signature embed(DecodedImage image, FaceRegion region) throws EmbeddingException {
                try {
                    Thread.sleep(400);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingException("interrupted", e);
                }
                return model.embed(image, region);
            }

            @Override
            public int dimension() {
                return model.dimension();
            }
        };
        EngineOptions options = EngineOptions.builder()
                .embeddingThreads(1)
                .registryTimeout(Duration.ofMillis(300))
                .retryPolicy(RetryPolicy.none())
                .asyncThreads(4)
                .build();

        try (AttendanceEngine busyEngine = AttendanceEngine.builder()
                .faceDetector(model)
                .embeddingGenerator(slowEmbedder)
                .rosterProvider(new InMemoryRosterProvider().enrollAll("bio-101", List.of("alice", "bob")))
                .options(options)
                .build();
             AsyncAttendanceEngine busyAsync = busyEngine.async()) {
            busyEngine.getSignatureRegistry().upsert("alice", Vectors.enrolled(0));
            busyEngine.getSignatureRegistry().upsert("bob", Vectors.enrolled(1));

            List<CompletableFuture<SubmissionResult>> futures = new ArrayList<>();
            for (int day = 2; day <= 5; day++) {
                futures.add(busyAsync.submitAsync(
                        SubmissionRequest.of("bio-101", LocalDate.of(2024, 9, day), PHOTO)));
            }

            for (CompletableFuture<SubmissionResult> future : futures) {
                SubmissionResult result = future.get(20, TimeUnit.SECONDS);
                assertTrue(result.isSuccess(), "failed with " + result.getErrorCode());
                assertEquals("alice", result.getRecognizedStudents().get(0).identityId());
            }
        }
    }
}
