package com.dcruver.notetree.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Filters combined with AND. A blank keyword, an empty tag list or a null
 * date bound does not filter.
 */
@Value
@Builder
public class SearchCriteria {
    String keyword;  // exact-case substring of title or content
    @Singular
    List<String> tagNames;  // note must carry every one
    Instant from;  // inclusive, on last-modified
    Instant to;  // inclusive, on last-modified
    @Builder.Default
    SearchScope scope = SearchScope.ACTIVE;

    public static SearchCriteria keyword(String keyword) {
        return SearchCriteria.builder().keyword(keyword).build();
    }

    public static SearchCriteria tag(String tagName) {
        return SearchCriteria.builder().tagName(tagName).build();
    }
}
