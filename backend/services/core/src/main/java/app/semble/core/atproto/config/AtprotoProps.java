package app.semble.core.atproto.config;

import app.semble.core.card.domain.value.CuratorId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Optional;

@Validated
@ConfigurationProperties(prefix = "app.atproto")
public record AtprotoProps(
        PublishingMode publishingMode,
        String pdsBaseUrl,
        Collections collections,
        List<@Valid Account> accounts
) {

    public AtprotoProps {
        publishingMode = publishingMode == null ? PublishingMode.LOCAL : publishingMode;
        pdsBaseUrl = pdsBaseUrl == null || pdsBaseUrl.isBlank() ? "https://bsky.social" : pdsBaseUrl;
        collections = collections == null ? new Collections(null, null, null) : collections;
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public Optional<Account> findAccount(CuratorId did) {
        return accounts.stream()
                .filter(a -> did.value().equals(a.did()))
                .findFirst();
    }

    public enum PublishingMode {
        // records are minted locally, nothing leaves the process
        LOCAL,
        PDS
    }

    public record Collections(String card, String collection, String collectionLink) {
        public Collections {
            card = card == null ? "network.cosmik.card" : card;
            collection = collection == null ? "network.cosmik.collection" : collection;
            collectionLink = collectionLink == null ? "network.cosmik.collectionLink" : collectionLink;
        }
    }

    public record Account(@NotBlank String did, @NotBlank String identifier, @NotBlank String password) {
    }
}
