package app.semble.core.card.domain.model;

import app.semble.core.card.domain.content.CardContent;
import app.semble.core.card.domain.content.HighlightCardContent;
import app.semble.core.card.domain.content.NoteCardContent;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.Url;

import java.time.Instant;
import java.util.List;

/**
 * Creates new cards. Type, content and parent consistency is enforced by {@link Card}.
 */
public final class CardFactory {

    private CardFactory() {
    }

    public static Card create(CuratorId curatorId, CardContent content, CardId parentCardId, Url url) {
        return new Card(CardId.generate(), curatorId, content, parentCardId, url, List.of(),
                null, Instant.now(), null, null);
    }

    public static Card urlCard(CuratorId curatorId, Url url, UrlMetadata metadata) {
        return create(curatorId, new UrlCardContent(url, metadata), null, url);
    }

    public static Card noteCard(CuratorId curatorId, String text, CardId parentCardId, Url url) {
        return create(curatorId, NoteCardContent.of(text), parentCardId, url);
    }

    public static Card highlightCard(CuratorId curatorId, HighlightCardContent content, CardId parentCardId, Url url) {
        return create(curatorId, content, parentCardId, url);
    }
}
