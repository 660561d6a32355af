package app.semble.core.card.domain.content;

import app.semble.core.card.domain.type.CardType;
import app.semble.core.common.error.ValidationException;

/**
 * Free text written by a curator, optionally titled. Text is stored trimmed.
 */
public record NoteCardContent(String text, String title) implements CardContent {

    public static final int MAX_TEXT_LENGTH = 10_000;

    public NoteCardContent {
        text = validateText(text);
        title = title == null || title.isBlank() ? null : title.trim();
    }

    public static NoteCardContent of(String text) {
        return new NoteCardContent(text, null);
    }

    @Override
    public CardType type() {
        return CardType.NOTE;
    }

    public NoteCardContent withText(String newText) {
        return new NoteCardContent(newText, title);
    }

    private static String validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Note text cannot be empty");
        }
        String trimmed = text.trim();
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("Note text cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
        return trimmed;
    }
}
