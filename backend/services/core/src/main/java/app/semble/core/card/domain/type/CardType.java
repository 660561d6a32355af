package app.semble.core.card.domain.type;

public enum CardType {
    URL,
    NOTE,
    HIGHLIGHT
}
