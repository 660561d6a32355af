package app.semble.core.firehose.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FirehoseProps.class)
public class FirehoseConfig {
}
