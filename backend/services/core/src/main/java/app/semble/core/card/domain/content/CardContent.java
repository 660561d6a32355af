package app.semble.core.card.domain.content;

import app.semble.core.card.domain.type.CardType;

/**
 * Type-specific payload of a card. The variant's {@link #type()} must equal the
 * owning card's type tag.
 */
public sealed interface CardContent permits UrlCardContent, NoteCardContent, HighlightCardContent {

    CardType type();
}
