package app.semble.core.card.domain.dto;

public enum AtUriResourceType {
    CARD,
    COLLECTION,
    COLLECTION_LINK
}
