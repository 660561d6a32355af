package app.semble.core.firehose.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectionRecord(String name, String description, String accessType, List<String> collaborators, String createdAt) {
}
