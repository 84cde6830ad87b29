package com.pipeline.healthtrend.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.healthtrend.core.PipelineOrchestrator;
import com.pipeline.healthtrend.core.UploadSource;
import com.pipeline.healthtrend.model.Job;
import org.apache.kafka.clients.consumer.*;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka上传采集消费者。
 * 从Kafka Topic消费上传批次，每条消息作为一个作业提交给编排器。
 *
 * 消息格式见 {@link UploadMessage}；缺少 batchRef 时以 topic-partition@offset 作为批次引用。
 */
public class KafkaUploadCollector implements UploadSource, Runnable {

    private static final Logger log = LoggerFactory.getLogger(KafkaUploadCollector.class);

    private final String bootstrapServers;
    private final String topic;
    private final String groupId;
    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private KafkaConsumer<String, String> consumer;
    private Thread collectorThread;

    public KafkaUploadCollector(String bootstrapServers, String topic, String groupId,
                                PipelineOrchestrator orchestrator) {
        this(bootstrapServers, topic, groupId, orchestrator, defaultObjectMapper());
    }

    public KafkaUploadCollector(String bootstrapServers, String topic, String groupId,
                                PipelineOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
        this.groupId = groupId;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaUploadCollector is already running.");
            return;
        }

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "100");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));

        collectorThread = new Thread(this, "kafka-upload-collector");
        collectorThread.setDaemon(false);
        collectorThread.start();

        log.info("KafkaUploadCollector started. Topic: {}, Group: {}", topic, groupId);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));

                for (ConsumerRecord<String, String> record : records) {
                    String fallbackRef = record.topic() + "-" + record.partition() + "@" + record.offset();
                    try {
                        processMessage(record.value(), fallbackRef);
                    } catch (RuntimeException e) {
                        log.error("Failed to process Kafka upload at offset {}: {}",
                                record.offset(), e.getMessage(), e);
                    }
                }
            }
        } catch (WakeupException e) {
            // stop() 触发的唤醒
            if (running.get()) {
                log.error("KafkaUploadCollector woken up unexpectedly", e);
            }
        } catch (RuntimeException e) {
            log.error("KafkaUploadCollector encountered fatal error", e);
        } finally {
            if (consumer != null) {
                consumer.close();
            }
            log.info("KafkaUploadCollector stopped.");
        }
    }

    /**
     * 解析一条上传消息并提交为作业。
     *
     * @param json        消息体
     * @param fallbackRef 消息未携带批次引用时使用的引用
     * @return 作业结果；消息无记录时返回null
     */
    Future<Job> processMessage(String json, String fallbackRef) {
        UploadMessage message = parse(json);
        if (message.getRecords() == null || message.getRecords().isEmpty()) {
            log.warn("Upload '{}' contains no records, skipped.", fallbackRef);
            return null;
        }
        String batchRef = message.getBatchRef() != null && !message.getBatchRef().isBlank()
                ? message.getBatchRef()
                : fallbackRef;
        log.info("Received upload '{}' with {} records.", batchRef, message.getRecords().size());
        return orchestrator.submit(batchRef, message.getRecords());
    }

    UploadMessage parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty upload message");
        }
        try {
            return objectMapper.readValue(json, UploadMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed upload message: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (consumer != null) {
            consumer.wakeup();
        }
        if (collectorThread != null) {
            try {
                collectorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for collector thread to finish.");
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
