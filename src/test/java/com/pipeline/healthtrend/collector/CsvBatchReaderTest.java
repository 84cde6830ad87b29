package com.pipeline.healthtrend.collector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvBatchReaderTest {

    private final CsvBatchReader reader = new CsvBatchReader();

    @Test
    void read_shouldMapEachRowByHeader() throws IOException {
        String csv = "source_record_id, metric_name ,timestamp,value\n"
                + "r1,heart_rate,2024-03-01T00:01:00Z,70\n"
                + "r2,heart_rate,2024-03-01T00:02:00Z,72\n";

        List<Map<String, Object>> records = reader.read(new StringReader(csv));

        assertEquals(2, records.size());
        assertEquals("r1", records.get(0).get("source_record_id"));
        assertEquals("heart_rate", records.get(0).get("metric_name"));
        assertEquals("72", records.get(1).get("value"));
    }

    @Test
    void read_shouldLoadFileFromDisk(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("upload.csv");
        Files.write(file, List.of("metric_name,timestamp,value", "spo2,2024-03-01T00:00:00Z,98"),
                StandardCharsets.UTF_8);

        List<Map<String, Object>> records = reader.read(file);

        assertEquals(1, records.size());
        assertEquals("98", records.get(0).get("value"));
    }

    @Test
    void read_shouldReturnEmptyForHeaderOnly() throws IOException {
        assertTrue(reader.read(new StringReader("metric_name,timestamp,value\n")).isEmpty());
    }
}
