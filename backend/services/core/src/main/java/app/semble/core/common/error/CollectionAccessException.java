package app.semble.core.common.error;

import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;

public class CollectionAccessException extends CoreException {

    private final CollectionId collectionId;
    private final CuratorId actorId;

    public CollectionAccessException(CollectionId collectionId, CuratorId actorId, String message) {
        super(message);
        this.collectionId = collectionId;
        this.actorId = actorId;
    }

    public CollectionId getCollectionId() {
        return collectionId;
    }

    public CuratorId getActorId() {
        return actorId;
    }
}
