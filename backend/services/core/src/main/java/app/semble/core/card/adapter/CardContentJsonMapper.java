package app.semble.core.card.adapter;

import app.semble.core.card.domain.content.CardContent;
import app.semble.core.card.domain.content.HighlightCardContent;
import app.semble.core.card.domain.content.HighlightSelector;
import app.semble.core.card.domain.content.NoteCardContent;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.content.UrlMetadata;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.Url;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class CardContentJsonMapper {

    private final ObjectMapper objectMapper;

    public CardContentJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode toJson(CardContent content) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", content.type().name());
        if (content instanceof UrlCardContent url) {
            node.put("url", url.url().value());
            if (url.metadata() != null) {
                node.set("metadata", metadataToJson(url.metadata()));
            }
        } else if (content instanceof NoteCardContent note) {
            node.put("text", note.text());
            putIfPresent(node, "title", note.title());
        } else if (content instanceof HighlightCardContent highlight) {
            node.put("text", highlight.text());
            node.set("selectors", selectorsToJson(highlight.selectors()));
            putIfPresent(node, "context", highlight.context());
            putIfPresent(node, "documentUrl", highlight.documentUrl());
            putIfPresent(node, "documentTitle", highlight.documentTitle());
        }
        return node;
    }

    public CardContent fromJson(CardType type, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new UnexpectedException("Stored content of " + type + " card is not an object");
        }
        return switch (type) {
            case URL -> new UrlCardContent(Url.of(node.path("url").asText()), metadataFromJson(node.get("metadata")));
            case NOTE -> new NoteCardContent(node.path("text").asText(), text(node, "title"));
            case HIGHLIGHT -> new HighlightCardContent(
                    node.path("text").asText(),
                    selectorsFromJson(node.get("selectors")),
                    text(node, "context"),
                    text(node, "documentUrl"),
                    text(node, "documentTitle"));
        };
    }

    public ObjectNode metadataToJson(UrlMetadata metadata) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("url", metadata.url().value());
        putIfPresent(node, "title", metadata.title());
        putIfPresent(node, "description", metadata.description());
        putIfPresent(node, "author", metadata.author());
        putIfPresent(node, "publishedDate", metadata.publishedDate());
        putIfPresent(node, "siteName", metadata.siteName());
        putIfPresent(node, "imageUrl", metadata.imageUrl());
        putIfPresent(node, "type", metadata.type());
        putIfPresent(node, "retrievedAt", metadata.retrievedAt());
        return node;
    }

    public UrlMetadata metadataFromJson(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull("url")) {
            return null;
        }
        return new UrlMetadata(
                Url.of(node.get("url").asText()),
                text(node, "title"),
                text(node, "description"),
                text(node, "author"),
                instant(node, "publishedDate"),
                text(node, "siteName"),
                text(node, "imageUrl"),
                text(node, "type"),
                instant(node, "retrievedAt"));
    }

    public ArrayNode selectorsToJson(List<HighlightSelector> selectors) {
        ArrayNode array = objectMapper.createArrayNode();
        for (HighlightSelector selector : selectors) {
            ObjectNode node = array.addObject();
            node.put("type", selector.kind());
            if (selector instanceof HighlightSelector.TextQuote quote) {
                node.put("exact", quote.exact());
                putIfPresent(node, "prefix", quote.prefix());
                putIfPresent(node, "suffix", quote.suffix());
            } else if (selector instanceof HighlightSelector.TextPosition position) {
                node.put("start", position.start());
                node.put("end", position.end());
            } else if (selector instanceof HighlightSelector.Range range) {
                node.put("startContainer", range.startContainer());
                node.put("startOffset", range.startOffset());
                node.put("endContainer", range.endContainer());
                node.put("endOffset", range.endOffset());
            }
        }
        return array;
    }

    public List<HighlightSelector> selectorsFromJson(JsonNode node) {
        List<HighlightSelector> selectors = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return selectors;
        }
        for (JsonNode item : node) {
            String kind = item.path("type").asText();
            switch (kind) {
                case "TextQuoteSelector" -> selectors.add(new HighlightSelector.TextQuote(
                        item.path("exact").asText(), text(item, "prefix"), text(item, "suffix")));
                case "TextPositionSelector" -> selectors.add(new HighlightSelector.TextPosition(
                        item.path("start").asInt(), item.path("end").asInt()));
                case "RangeSelector" -> selectors.add(new HighlightSelector.Range(
                        item.path("startContainer").asText(), item.path("startOffset").asInt(),
                        item.path("endContainer").asText(), item.path("endOffset").asInt()));
                default -> throw new UnexpectedException("Unknown highlight selector type: " + kind);
            }
        }
        return selectors;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode node, String field, Instant value) {
        if (value != null) {
            node.put(field, value.toString());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? null : Instant.parse(value);
    }
}
