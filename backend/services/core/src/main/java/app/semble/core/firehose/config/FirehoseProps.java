package app.semble.core.firehose.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.firehose")
public record FirehoseProps(Boolean deduplicate) {

    public FirehoseProps {
        deduplicate = deduplicate == null ? Boolean.TRUE : deduplicate;
    }
}
