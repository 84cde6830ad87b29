package com.pipeline.healthtrend.collector;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV上传文件读取器。
 * 首行为表头，每行转换为一条原始记录（字段名 -> 文本值），类型转换交由归一化器完成。
 */
public class CsvBatchReader {

    private static final Logger log = LoggerFactory.getLogger(CsvBatchReader.class);

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    public List<Map<String, Object>> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Map<String, Object>> records = read(reader);
            log.info("Read {} records from {}", records.size(), file);
            return records;
        }
    }

    public List<Map<String, Object>> read(Reader reader) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows =
                     csvMapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                Map<String, Object> record = new LinkedHashMap<>();
                for (Map.Entry<String, String> cell : row.entrySet()) {
                    record.put(cell.getKey().trim(), cell.getValue());
                }
                records.add(record);
            }
        }
        return records;
    }
}
