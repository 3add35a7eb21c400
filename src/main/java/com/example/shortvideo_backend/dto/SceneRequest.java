package com.example.shortvideo_backend.dto;

import java.util.List;
import java.util.Objects;

/**
 * One abstract scene: the narration text plus hints for the visual.
 *
 * @param text            narration to synthesize
 * @param searchTerms     stock footage search terms, in priority order
 * @param imagePrompt     optional prompt for AI generation
 * @param videoPrompt     optional prompt for AI generation, preferred over {@code imagePrompt}
 * @param useAiGeneration {@code TRUE} forces the AI path, {@code FALSE} opts the scene out, {@code null} lets the ratio decide
 */
public record SceneRequest(String text,
                           List<String> searchTerms,
                           String imagePrompt,
                           String videoPrompt,
                           Boolean useAiGeneration) {

    public SceneRequest {
        searchTerms = searchTerms == null
                ? List.of()
                : searchTerms.stream().filter(Objects::nonNull).toList();
    }

    public static SceneRequest of(String text, String... searchTerms) {
        return new SceneRequest(text, List.of(searchTerms), null, null, null);
    }

    public boolean hasSearchTerm() {
        return searchTerms.stream().anyMatch(t -> !t.isBlank());
    }

    public boolean hasExplicitPrompt() {
        return notBlank(videoPrompt) || notBlank(imagePrompt);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
