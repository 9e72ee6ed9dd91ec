package com.newsresolver.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Publisher name fragment to registrable domain, loaded from {@code publisher-domains.json}.
 * Entries keep file order; the first matching fragment wins, so more specific names come first.
 */
@Slf4j
@Component
public class PublisherDomainDictionary {

    static final String RESOURCE = "publisher-domains.json";

    /** Fragments this short are matched as whole words only ("ap" must not hit "japan"). */
    private static final int WHOLE_WORD_MAX_LENGTH = 3;

    private final int version;
    private final List<Entry> publishers;
    private final List<Entry> titleMentions;

    public PublisherDomainDictionary(ObjectMapper mapper) {
        this(mapper, RESOURCE);
    }

    PublisherDomainDictionary(ObjectMapper mapper, String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            JsonNode root = mapper.readTree(in);
            this.version = root.path("version").asInt(0);
            this.publishers = readEntries(root.path("publishers"));
            this.titleMentions = readEntries(root.path("titleMentions"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load publisher dictionary " + resource, e);
        }
        log.info("Publisher dictionary loaded version={} publishers={} titleMentions={}",
                version, publishers.size(), titleMentions.size());
    }

    public Optional<String> matchPublisher(String text) {
        return firstMatch(publishers, text);
    }

    public Optional<String> matchTitleMention(String title) {
        return firstMatch(titleMentions, title);
    }

    public int version() {
        return version;
    }

    public int size() {
        return publishers.size();
    }

    private static Optional<String> firstMatch(List<Entry> entries, String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String hay = text.toLowerCase(Locale.ROOT);
        for (Entry e : entries) {
            if (e.matches(hay)) return Optional.of(e.domain());
        }
        return Optional.empty();
    }

    private static List<Entry> readEntries(JsonNode node) {
        List<Entry> out = new ArrayList<>();
        if (node == null || !node.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String key = f.getKey().trim().toLowerCase(Locale.ROOT);
            String domain = f.getValue().asText("").trim().toLowerCase(Locale.ROOT);
            if (key.isEmpty() || domain.isEmpty()) continue;
            out.add(new Entry(key, domain, wordPattern(key)));
        }
        return Collections.unmodifiableList(out);
    }

    private static Pattern wordPattern(String key) {
        if (key.length() > WHOLE_WORD_MAX_LENGTH) return null;
        return Pattern.compile("(^|[^a-z0-9])" + Pattern.quote(key) + "([^a-z0-9]|$)");
    }

    private record Entry(String key, String domain, Pattern wholeWord) {
        boolean matches(String hay) {
            return wholeWord != null ? wholeWord.matcher(hay).find() : hay.contains(key);
        }
    }
}
