package com.pipeline.healthtrend.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kafka上传消息体。
 *
 * 消息格式约定（JSON）：
 * {"batchRef":"upload-42","records":[{"metric_name":"heart_rate","timestamp":"2024-03-01T10:00:00Z","value":72}]}
 */
public class UploadMessage {
    private String batchRef;
    private List<Map<String, Object>> records = new ArrayList<>();

    public UploadMessage() {}

    public UploadMessage(String batchRef, List<Map<String, Object>> records) {
        this.batchRef = batchRef;
        this.records = records;
    }

    public String getBatchRef() { return batchRef; }
    public void setBatchRef(String batchRef) { this.batchRef = batchRef; }
    public List<Map<String, Object>> getRecords() { return records; }
    public void setRecords(List<Map<String, Object>> records) { this.records = records; }

    @Override
    public String toString() {
        return "UploadMessage{batchRef='" + batchRef + "', records=" + (records != null ? records.size() : 0) + "}";
    }
}
