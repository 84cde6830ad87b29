package com.pipeline.healthtrend;

import com.pipeline.healthtrend.model.PipelineConfig;
import com.pipeline.healthtrend.model.SchemaDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path dir;

    private Path write(String... lines) throws IOException {
        Path file = dir.resolve("application.properties");
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void load_shouldReadValuesFromFile() throws IOException {
        Path file = write(
                "worker.parallelism=6",
                "storage.type=memory",
                "schema=case_counts",
                "bucket.width.minutes=15",
                "detection.window=5",
                "detection.min.samples=2",
                "retry.max.attempts=4",
                "kafka.enabled=true",
                "kafka.upload.topic=clinic-uploads");

        AppConfig config = AppConfig.load(file.toString());

        assertEquals(6, config.getWorkerParallelism());
        assertEquals("memory", config.getStorageType());
        assertEquals("case_counts", config.getSchemaName());
        assertEquals(15, config.getBucketWidthMinutes());
        assertEquals(5, config.getDetectionWindow());
        assertEquals(2, config.getMinimumSampleThreshold());
        assertEquals(4, config.getRetryMaxAttempts());
        assertTrue(config.isKafkaEnabled());
        assertEquals("clinic-uploads", config.getKafkaUploadTopic());
    }

    @Test
    void load_shouldFallBackToClasspathConfigWhenFileMissing() {
        AppConfig config = AppConfig.load(dir.resolve("missing.properties").toString());

        assertEquals(4, config.getWorkerParallelism());
        assertEquals("sqlite", config.getStorageType());
        assertFalse(config.isKafkaEnabled());
    }

    @Test
    void load_shouldUseDefaultsWhenValueIsBroken() throws IOException {
        Path file = write("detection.window=ten", "storage.type=memory");

        AppConfig config = AppConfig.load(file.toString());

        assertEquals(10, config.getDetectionWindow());
        assertEquals("sqlite", config.getStorageType());
    }

    @Test
    void toPipelineConfig_shouldCarryDetectionAndRetrySettings() throws IOException {
        Path file = write(
                "bucket.width.minutes=30",
                "detection.window=4",
                "severity.low=1.5",
                "retry.backoff.base.ms=50",
                "sink.call.timeout.ms=750",
                "retry.deadline.ms=5000");

        PipelineConfig pipelineConfig = AppConfig.load(file.toString()).toPipelineConfig();

        assertEquals(Duration.ofMinutes(30), pipelineConfig.getBucketWidth());
        assertEquals(4, pipelineConfig.getDetectionWindow());
        assertEquals(1.5, pipelineConfig.getSeverityThresholds().getLow());
        assertEquals(Duration.ofMillis(50), pipelineConfig.getRetryBackoffBase());
        assertEquals(Duration.ofMillis(750), pipelineConfig.getSinkCallTimeout());
        assertEquals(Duration.ofSeconds(5), pipelineConfig.retryPolicy().getDeadline());
    }

    @Test
    void resolveSchema_shouldMapKnownNames() {
        assertNotNull(HealthTrendApplication.resolveSchema("standard").getRecordIdField());
        SchemaDescriptor caseCounts = HealthTrendApplication.resolveSchema("CASE_COUNTS");
        assertEquals(1.0, caseCounts.getConstantValue());
        assertThrows(IllegalArgumentException.class, () -> HealthTrendApplication.resolveSchema("vitals"));
    }
}
