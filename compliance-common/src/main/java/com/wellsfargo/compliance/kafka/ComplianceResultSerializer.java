package com.wellsfargo.compliance.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wellsfargo.compliance.canonical.ComplianceResult;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka serializer for ComplianceResult using Jackson JSON serialization.
 * 
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public class ComplianceResultSerializer implements Serializer<ComplianceResult> {
    
    private static final Logger log = LoggerFactory.getLogger(ComplianceResultSerializer.class);
    
    private final ObjectMapper objectMapper;
    
    public ComplianceResultSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }
    
    @Override
    public byte[] serialize(String topic, ComplianceResult data) {
        if (data == null) {
            return null;
        }
        
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (Exception e) {
            log.error("Failed to serialize ComplianceResult for topic: {}", topic, e);
            throw new SerializationException("Failed to serialize ComplianceResult", e);
        }
    }
}
