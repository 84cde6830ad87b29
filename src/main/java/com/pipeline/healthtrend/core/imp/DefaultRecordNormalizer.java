package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.RecordNormalizer;
import com.pipeline.healthtrend.exception.RecordTypeException;
import com.pipeline.healthtrend.exception.RecordValidationException;
import com.pipeline.healthtrend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * 记录归一化器默认实现。
 * 单条归一化为纯函数；批量归一化按块切分，可选地在阶段线程池上并行执行。
 */
public class DefaultRecordNormalizer implements RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DefaultRecordNormalizer.class);

    /** 十进制数字（可带符号、小数、指数），拒绝 NaN、Infinity、十六进制等 */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{1,19}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PipelineConfig config;
    private final Clock clock;
    /** 并行归一化线程池；为null时串行执行 */
    private final ExecutorService stagePool;

    public DefaultRecordNormalizer(PipelineConfig config, Clock clock) {
        this(config, clock, null);
    }

    public DefaultRecordNormalizer(PipelineConfig config, Clock clock, ExecutorService stagePool) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stagePool = stagePool;
    }

    @Override
    public MetricSample normalize(Map<String, Object> rawRecord, SchemaDescriptor schema) {
        if (rawRecord == null) {
            throw new RecordValidationException(null, ValidationReason.MISSING_FIELD, "Record is null");
        }
        Map<String, FieldValue> fields = parseFields(rawRecord, schema);

        String metricName = fields.get(schema.getMetricNameField()).asText();
        Instant timestamp = fields.get(schema.getTimestampField()).asTimestamp();
        double value = schema.getValueField() != null
                ? fields.get(schema.getValueField()).asNumber()
                : schema.getConstantValue();

        checkRetention(schema.getTimestampField(), timestamp);

        String recordId = extractRecordId(rawRecord, schema);
        if (recordId == null) {
            recordId = contentId(metricName, timestamp, value, fields, schema);
        }
        return new MetricSample(metricName, timestamp, value, recordId);
    }

    @Override
    public NormalizationResult normalizeBatch(List<Map<String, Object>> rawRecords, SchemaDescriptor schema) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            return new NormalizationResult(List.of(), List.of());
        }

        int chunkSize = config.getNormalizationChunkSize();
        List<ChunkResult> chunks = new ArrayList<>();

        if (stagePool == null || rawRecords.size() <= chunkSize) {
            chunks.add(normalizeChunk(rawRecords, 0, rawRecords.size(), schema));
        } else {
            // 按块并行，结果按块序拼接以保持输入顺序
            List<Future<ChunkResult>> futures = new ArrayList<>();
            for (int from = 0; from < rawRecords.size(); from += chunkSize) {
                final int start = from;
                final int end = Math.min(from + chunkSize, rawRecords.size());
                futures.add(stagePool.submit(() -> normalizeChunk(rawRecords, start, end, schema)));
            }
            for (Future<ChunkResult> future : futures) {
                chunks.add(await(future));
            }
        }

        List<MetricSample> samples = new ArrayList<>(rawRecords.size());
        List<RecordError> errors = new ArrayList<>();
        for (ChunkResult chunk : chunks) {
            samples.addAll(chunk.samples);
            errors.addAll(chunk.errors);
        }

        log.info("Normalized batch of {} records: {} accepted, {} rejected.",
                rawRecords.size(), samples.size(), errors.size());
        return new NormalizationResult(samples, errors);
    }

    private ChunkResult normalizeChunk(List<Map<String, Object>> records, int from, int to, SchemaDescriptor schema) {
        ChunkResult result = new ChunkResult();
        for (int i = from; i < to; i++) {
            Map<String, Object> raw = records.get(i);
            try {
                result.samples.add(normalize(raw, schema));
            } catch (RecordValidationException e) {
                String recordId = errorRecordId(raw, schema, i);
                log.debug("Record '{}' rejected: {} [{}] {}", recordId, e.getReason(), e.getField(), e.getMessage());
                result.errors.add(new RecordError(recordId, e.getField(), e.getReason(), e.getMessage()));
            }
        }
        return result;
    }

    private ChunkResult await(Future<ChunkResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while normalizing batch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Normalization chunk failed", cause);
        }
    }

    // ==================== 字段解析 ====================

    /**
     * 将原始记录解析为带标签的字段值：已声明字段完成类型转换，未声明字段标记为 IGNORED
     */
    private Map<String, FieldValue> parseFields(Map<String, Object> raw, SchemaDescriptor schema) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();

        fields.put(schema.getMetricNameField(),
                FieldValue.text(parseMetricName(schema.getMetricNameField(), raw.get(schema.getMetricNameField()))));
        fields.put(schema.getTimestampField(),
                FieldValue.timestamp(parseTimestamp(schema.getTimestampField(), raw.get(schema.getTimestampField()))));
        if (schema.getValueField() != null) {
            Object rawValue = requirePresent(schema.getValueField(), raw.get(schema.getValueField()));
            fields.put(schema.getValueField(), FieldValue.number(parseNumber(schema.getValueField(), rawValue)));
        }

        for (FieldSpec spec : schema.getOptionalFields().values()) {
            Object rawValue = raw.get(spec.getName());
            if (isBlank(rawValue)) {
                if (spec.isRequired()) {
                    throw missing(spec.getName());
                }
                continue;
            }
            fields.put(spec.getName(), parseDeclared(spec, rawValue));
        }

        for (String name : raw.keySet()) {
            if (name != null && !schema.isRecognized(name)) {
                fields.put(name, FieldValue.ignored());
            }
        }
        return fields;
    }

    private String parseMetricName(String field, Object rawValue) {
        Object present = requirePresent(field, rawValue);
        if (!(present instanceof CharSequence)) {
            throw new RecordTypeException(field, "Metric name must be text, got: " + present.getClass().getSimpleName());
        }
        String canonical = WHITESPACE.matcher(present.toString().trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        if (canonical.isEmpty()) {
            throw missing(field);
        }
        return canonical;
    }

    Instant parseTimestamp(String field, Object rawValue) {
        Object present = requirePresent(field, rawValue);
        if (present instanceof Instant) {
            return (Instant) present;
        }
        if (present instanceof java.sql.Date) {
            // java.sql.Date 不支持 toInstant，按 UTC 当日零点解释
            return ((java.sql.Date) present).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (present instanceof Date) {
            try {
                return ((Date) present).toInstant();
            } catch (UnsupportedOperationException e) {
                // java.sql.Time 等只有时间部分的类型
                throw invalidTimestamp(field, present);
            }
        }
        if (present instanceof Number) {
            return Instant.ofEpochMilli(((Number) present).longValue());
        }
        if (present instanceof TemporalAccessor) {
            return temporalToInstant(field, (TemporalAccessor) present);
        }
        if (present instanceof CharSequence) {
            return parseTimestampText(field, present.toString().trim());
        }
        throw invalidTimestamp(field, present);
    }

    private Instant parseTimestampText(String field, String text) {
        if (EPOCH_MILLIS.matcher(text).matches()) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw invalidTimestamp(field, text);
            }
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // 继续尝试带偏移量的格式
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // 继续尝试本地时间格式
        }
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // 继续尝试纯日期格式
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw invalidTimestamp(field, text);
        }
    }

    private Instant temporalToInstant(String field, TemporalAccessor temporal) {
        if (temporal instanceof OffsetDateTime) {
            return ((OffsetDateTime) temporal).toInstant();
        }
        if (temporal instanceof ZonedDateTime) {
            return ((ZonedDateTime) temporal).toInstant();
        }
        if (temporal instanceof LocalDateTime) {
            return ((LocalDateTime) temporal).toInstant(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDate) {
            return ((LocalDate) temporal).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        throw invalidTimestamp(field, temporal);
    }

    double parseNumber(String field, Object rawValue) {
        double number;
        if (rawValue instanceof Number) {
            number = ((Number) rawValue).doubleValue();
        } else if (rawValue instanceof CharSequence) {
            String text = rawValue.toString().trim();
            if (!DECIMAL.matcher(text).matches()) {
                throw new RecordTypeException(field, "Non-numeric content: '" + text + "'");
            }
            number = Double.parseDouble(text);
        } else {
            throw new RecordTypeException(field,
                    "Expected a number, got: " + rawValue.getClass().getSimpleName());
        }
        if (!Double.isFinite(number)) {
            throw new RecordTypeException(field, "Value is not finite: " + number);
        }
        return number;
    }

    private FieldValue parseDeclared(FieldSpec spec, Object rawValue) {
        switch (spec.getType()) {
            case TEXT:
                return FieldValue.text(rawValue.toString().trim());
            case TIMESTAMP:
                return FieldValue.timestamp(parseTimestamp(spec.getName(), rawValue));
            case INTEGER: {
                double number = parseNumber(spec.getName(), rawValue);
                if (number != Math.rint(number)) {
                    throw new RecordTypeException(spec.getName(), "Expected an integer, got: " + number);
                }
                checkRange(spec, number);
                return FieldValue.number(number);
            }
            case NUMBER:
            default: {
                double number = parseNumber(spec.getName(), rawValue);
                checkRange(spec, number);
                return FieldValue.number(number);
            }
        }
    }

    private void checkRange(FieldSpec spec, double number) {
        if (spec.getMinValue() != null && number < spec.getMinValue()) {
            throw new RecordValidationException(spec.getName(), ValidationReason.OUT_OF_RANGE,
                    "Value " + number + " is below minimum " + spec.getMinValue());
        }
        if (spec.getMaxValue() != null && number > spec.getMaxValue()) {
            throw new RecordValidationException(spec.getName(), ValidationReason.OUT_OF_RANGE,
                    "Value " + number + " exceeds maximum " + spec.getMaxValue());
        }
    }

    private void checkRetention(String field, Instant timestamp) {
        Instant now = clock.instant();
        if (timestamp.isBefore(now.minus(config.getRetentionMaxAge()))) {
            throw new RecordValidationException(field, ValidationReason.TOO_OLD,
                    "Timestamp " + timestamp + " is older than retention window " + config.getRetentionMaxAge());
        }
        if (timestamp.isAfter(now.plus(config.getFutureSkew()))) {
            throw new RecordValidationException(field, ValidationReason.FUTURE_DATED,
                    "Timestamp " + timestamp + " is in the future");
        }
    }

    // ==================== 记录标识 ====================

    private String extractRecordId(Map<String, Object> raw, SchemaDescriptor schema) {
        if (schema.getRecordIdField() == null || raw == null) {
            return null;
        }
        Object id = raw.get(schema.getRecordIdField());
        return isBlank(id) ? null : id.toString().trim();
    }

    private String errorRecordId(Map<String, Object> raw, SchemaDescriptor schema, int index) {
        String id = extractRecordId(raw, schema);
        return id != null ? id : "#" + index;
    }

    /**
     * 无显式标识时的内容指纹：规范字段 + 已声明可选字段的 SHA-256
     */
    private String contentId(String metricName, Instant timestamp, double value,
                             Map<String, FieldValue> fields, SchemaDescriptor schema) {
        StringBuilder canonical = new StringBuilder()
                .append(metricName).append('|')
                .append(timestamp).append('|')
                .append(value);
        for (String name : schema.getOptionalFields().keySet()) {
            FieldValue field = fields.get(name);
            canonical.append('|').append(name).append('=').append(field != null ? field.canonical() : "");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    // ==================== 工具方法 ====================

    private static Object requirePresent(String field, Object rawValue) {
        if (isBlank(rawValue)) {
            throw missing(field);
        }
        return rawValue;
    }

    private static boolean isBlank(Object rawValue) {
        return rawValue == null || (rawValue instanceof CharSequence && rawValue.toString().isBlank());
    }

    private static RecordValidationException missing(String field) {
        return new RecordValidationException(field, ValidationReason.MISSING_FIELD,
                "Required field '" + field + "' is missing");
    }

    private static RecordValidationException invalidTimestamp(String field, Object rawValue) {
        return new RecordValidationException(field, ValidationReason.INVALID_TIMESTAMP,
                "Unparseable timestamp: '" + rawValue + "'");
    }

    private static final class ChunkResult {
        final List<MetricSample> samples = new ArrayList<>();
        final List<RecordError> errors = new ArrayList<>();
    }
}
