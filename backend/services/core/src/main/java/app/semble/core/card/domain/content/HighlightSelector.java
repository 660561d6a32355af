package app.semble.core.card.domain.content;

import app.semble.core.common.error.ValidationException;

/**
 * Anchors a highlight inside its source document. Several selectors may describe
 * the same highlight so it can be re-anchored when the document changes.
 */
public sealed interface HighlightSelector
        permits HighlightSelector.TextQuote, HighlightSelector.TextPosition, HighlightSelector.Range {

    String kind();

    record TextQuote(String exact, String prefix, String suffix) implements HighlightSelector {
        public TextQuote {
            if (exact == null || exact.isBlank()) {
                throw new ValidationException("TextQuoteSelector must have exact text");
            }
        }

        @Override
        public String kind() {
            return "TextQuoteSelector";
        }
    }

    record TextPosition(int start, int end) implements HighlightSelector {
        public TextPosition {
            if (start < 0 || end < 0 || start >= end) {
                throw new ValidationException("TextPositionSelector must have valid start/end positions");
            }
        }

        @Override
        public String kind() {
            return "TextPositionSelector";
        }
    }

    record Range(String startContainer, int startOffset, String endContainer, int endOffset)
            implements HighlightSelector {
        public Range {
            if (startContainer == null || startContainer.isBlank()
                    || endContainer == null || endContainer.isBlank()) {
                throw new ValidationException("RangeSelector must have start and end containers");
            }
            if (startOffset < 0 || endOffset < 0) {
                throw new ValidationException("RangeSelector offsets must be non-negative");
            }
        }

        @Override
        public String kind() {
            return "RangeSelector";
        }
    }
}
