package com.techstock.domain.service;

import com.techstock.domain.model.TagIndex;
import com.techstock.domain.model.TagSuggestion;
import com.techstock.domain.model.TagUsage;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tag discovery: key to values index, popularity ranking and suggestions.
 *
 * Both operations rescan the stored tag blobs on every call (bounded by
 * {@code app.tags.scan-limit}); nothing is cached. This is fine for a
 * catalog of modest size, beyond that the index should be maintained
 * incrementally from the resource_tag table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TagIndexService {

    private final ResourceRepository resourceRepository;
    private final TagCodec tagCodec;
    private final MeterRegistry meterRegistry;

    @Value("${app.tags.scan-limit:100000}")
    private int scanLimit = 100_000;

    @Value("${app.tags.popular-limit:20}")
    private int popularLimit = 20;

    @Value("${app.tags.suggestion-limit:10}")
    private int suggestionLimit = 10;

    @Transactional(readOnly = true)
    public TagIndex getAvailableTags() {
        Timer.Sample sample = Timer.start(meterRegistry);

        TagIndex index = buildIndex(loadTagMaps(), popularLimit);

        sample.stop(Timer.builder("catalog.query.latency")
                .tag("type", "tags")
                .register(meterRegistry));
        log.info("Tag index built: {} keys, {} popular tags",
                index.getTagValuesByKey().size(), index.getPopularTags().size());
        return index;
    }

    @Transactional(readOnly = true)
    public List<TagSuggestion> suggest(String query) {
        Timer.Sample sample = Timer.start(meterRegistry);

        List<TagSuggestion> suggestions = suggest(loadTagMaps(), query, suggestionLimit);

        sample.stop(Timer.builder("catalog.query.latency")
                .tag("type", "tag_suggestions")
                .register(meterRegistry));
        log.info("Tag suggestions for '{}': {} matches", query, suggestions.size());
        return suggestions;
    }

    /**
     * Builds the key to values index and the top {@code limit} (key, value)
     * pairs by occurrence count. Ties are ordered by key, then value.
     */
    static TagIndex buildIndex(List<Map<String, String>> tagMaps, int limit) {
        Map<String, Set<String>> valuesByKey = new TreeMap<>();
        Map<String, Map<String, Long>> usage = new HashMap<>();

        for (Map<String, String> tags : tagMaps) {
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                valuesByKey.computeIfAbsent(tag.getKey(), k -> new TreeSet<>()).add(tag.getValue());
                usage.computeIfAbsent(tag.getKey(), k -> new HashMap<>())
                        .merge(tag.getValue(), 1L, Long::sum);
            }
        }

        List<TagUsage> popular = new ArrayList<>();
        usage.forEach((key, values) ->
                values.forEach((value, count) -> popular.add(new TagUsage(key, value, count))));
        popular.sort(Comparator.comparingLong(TagUsage::getCount).reversed()
                .thenComparing(TagUsage::getKey)
                .thenComparing(TagUsage::getValue));

        return new TagIndex(valuesByKey, truncate(popular, limit));
    }

    /**
     * Distinct {@code key:value} pairs whose key or value contains the
     * lower-cased query. Exact key or value matches rank first, then
     * pairs are ordered by their {@code key:value} text.
     */
    static List<TagSuggestion> suggest(List<Map<String, String>> tagMaps, String query, int limit) {
        String term = query == null ? "" : query.toLowerCase(Locale.ROOT);

        Set<String> seen = new LinkedHashSet<>();
        List<TagSuggestion> suggestions = new ArrayList<>();
        for (Map<String, String> tags : tagMaps) {
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                TagSuggestion suggestion = TagSuggestion.of(tag.getKey(), tag.getValue());
                if (seen.contains(suggestion.getDisplay())) {
                    continue;
                }
                if (tag.getKey().toLowerCase(Locale.ROOT).contains(term)
                        || tag.getValue().toLowerCase(Locale.ROOT).contains(term)) {
                    seen.add(suggestion.getDisplay());
                    suggestions.add(suggestion);
                }
            }
        }

        suggestions.sort(Comparator.comparing((TagSuggestion s) -> !isExactMatch(s, term))
                .thenComparing(TagSuggestion::getDisplay));
        return truncate(suggestions, limit);
    }

    private List<Map<String, String>> loadTagMaps() {
        List<String> blobs = resourceRepository.findTagBlobs(PageRequest.of(0, scanLimit));
        if (blobs.size() >= scanLimit) {
            log.warn("Tag scan hit the limit of {} resources, index may be incomplete", scanLimit);
        }

        List<Map<String, String>> tagMaps = new ArrayList<>(blobs.size());
        int skipped = 0;
        for (String blob : blobs) {
            Optional<Map<String, String>> tags = tagCodec.decode(blob);
            if (tags.isPresent()) {
                tagMaps.add(tags.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} resources with unparseable tag blobs", skipped);
        }
        return tagMaps;
    }

    private static boolean isExactMatch(TagSuggestion suggestion, String term) {
        return suggestion.getKey().toLowerCase(Locale.ROOT).equals(term)
                || suggestion.getValue().toLowerCase(Locale.ROOT).equals(term);
    }

    private static <T> List<T> truncate(List<T> items, int limit) {
        return items.size() > limit ? new ArrayList<>(items.subList(0, limit)) : items;
    }
}
