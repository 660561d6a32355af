package app.semble.core.card.domain.content;

import app.semble.core.card.domain.type.CardType;
import app.semble.core.common.error.ValidationException;

import java.util.List;

public record HighlightCardContent(
        String text,
        List<HighlightSelector> selectors,
        String context,
        String documentUrl,
        String documentTitle
) implements CardContent {

    public static final int MAX_TEXT_LENGTH = 5_000;

    public HighlightCardContent {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Highlight text cannot be empty");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("Highlight text cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
        if (selectors == null || selectors.isEmpty()) {
            throw new ValidationException("Highlight must have at least one selector");
        }
        text = text.trim();
        selectors = List.copyOf(selectors);
        context = trimToNull(context);
        documentUrl = trimToNull(documentUrl);
        documentTitle = trimToNull(documentTitle);
    }

    @Override
    public CardType type() {
        return CardType.HIGHLIGHT;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
