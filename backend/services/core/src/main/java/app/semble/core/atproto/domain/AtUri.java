package app.semble.core.atproto.domain;

import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.common.error.ValidationException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code at://<did>/<collection-nsid>/<record-key>}
 */
public record AtUri(String did, String collection, String rkey) {

    private static final Pattern FORMAT = Pattern.compile("^at://([^/]+)/([^/]+)/([^/]+)$");

    public static AtUri parse(String raw) {
        if (raw == null) {
            throw new ValidationException("AT URI is required");
        }
        Matcher matcher = FORMAT.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new ValidationException("Invalid AT URI: " + raw);
        }
        return new AtUri(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    public static Optional<AtUri> tryParse(String raw) {
        if (raw == null || !FORMAT.matcher(raw.trim()).matches()) {
            return Optional.empty();
        }
        return Optional.of(parse(raw));
    }

    public static AtUri of(CuratorId repo, String collection, String rkey) {
        return new AtUri(repo.value(), collection, rkey);
    }

    /**
     * The repository owner. Fails when the authority is a handle rather than a DID.
     */
    public CuratorId curatorId() {
        return CuratorId.of(did);
    }

    public String value() {
        return "at://" + did + "/" + collection + "/" + rkey;
    }

    @Override
    public String toString() {
        return value();
    }
}
