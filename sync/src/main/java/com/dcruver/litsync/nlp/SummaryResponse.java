package com.dcruver.litsync.nlp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generated summary of one paper.
 * {@code sections} holds the named extras (contribution, limitations, ideas).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {

    public static final String CONTRIBUTION = "contribution";
    public static final String LIMITATIONS = "limitations";
    public static final String IDEAS = "ideas";

    private String shortSummary;
    private String longSummary;

    @Builder.Default
    private Map<String, String> sections = new LinkedHashMap<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /**
     * Stand-in used when summarization is skipped: placeholder text, library tags as keywords.
     */
    public static SummaryResponse placeholder(List<String> tags) {
        return SummaryResponse.builder()
            .shortSummary("No text available for summarization.")
            .longSummary("No text available for summarization.")
            .keywords(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
            .build();
    }
}
