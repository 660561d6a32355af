package app.semble.core.atproto.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableCaching
@EnableConfigurationProperties(AtprotoProps.class)
public class AtprotoClientConfig {

    @Bean
    public RestClient atprotoRestClient(RestClient.Builder builder, AtprotoProps props) {
        return builder
                .baseUrl(props.pdsBaseUrl())
                .build();
    }
}
