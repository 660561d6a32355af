package app.semble.core.card.adapter;

import app.semble.core.card.api.UrlMetadataService;
import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.value.Url;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class NoopUrlMetadataService implements UrlMetadataService {

    @Override
    public Optional<UrlMetadata> fetchMetadata(Url url) {
        return Optional.empty();
    }
}
