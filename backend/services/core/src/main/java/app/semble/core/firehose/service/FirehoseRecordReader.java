package app.semble.core.firehose.service;

import app.semble.core.firehose.domain.FirehoseEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class FirehoseRecordReader {

    private static final Logger log = LoggerFactory.getLogger(FirehoseRecordReader.class);

    private final ObjectMapper objectMapper;

    public FirehoseRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> Optional<T> read(FirehoseEvent event, Class<T> type) {
        if (!event.hasRecord()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(event.record(), type));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Unreadable {} in event for {}: {}", type.getSimpleName(), event.atUri(), ex.getMessage());
            return Optional.empty();
        }
    }
}
