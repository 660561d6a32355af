package app.semble.core.card.domain.type;

public enum CollectionAccessType {
    // anyone may add or remove cards
    OPEN,
    // only the author and collaborators
    CLOSED
}
