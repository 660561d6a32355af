package app.semble.core.card.api;

import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.value.Url;

import java.util.Optional;

public interface UrlMetadataService {

    Optional<UrlMetadata> fetchMetadata(Url url);
}
