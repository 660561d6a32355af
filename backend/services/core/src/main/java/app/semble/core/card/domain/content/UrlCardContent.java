package app.semble.core.card.domain.content;

import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.Url;

import java.util.Objects;

public record UrlCardContent(Url url, UrlMetadata metadata) implements CardContent {

    public UrlCardContent {
        Objects.requireNonNull(url, "url");
    }

    public static UrlCardContent of(Url url) {
        return new UrlCardContent(url, null);
    }

    @Override
    public CardType type() {
        return CardType.URL;
    }

    public UrlCardContent withMetadata(UrlMetadata metadata) {
        return new UrlCardContent(url, metadata);
    }
}
