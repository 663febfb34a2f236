package com.propertyintel.poi.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a search hit belongs in the dataset.
 *
 * Evaluation order:
 *  1. universal type and name exclusions
 *  2. category-scoped type exclusions
 *  3. category keyword hints
 *  4. accept
 *
 * Defaults to accept: a discarded true positive costs more than a false positive,
 * because the dataset is reviewed by hand afterwards.
 */
@Slf4j
public class RelevanceFilter {

    private final RelevanceProfile profile;

    public RelevanceFilter(RelevanceProfile profile) {
        this.profile = profile;
    }

    public RelevanceProfile getProfile() {
        return profile;
    }

    public boolean isRelevant(String name, Collection<String> types, String category) {
        String nameLower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        Set<String> typesLower = types == null ? Set.of() : types.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        for (String type : typesLower) {
            if (profile.irrelevantTypes().contains(type)) {
                log.debug("Rejecting '{}': irrelevant type {}", name, type);
                return false;
            }
        }

        for (String pattern : profile.irrelevantNamePatterns()) {
            if (nameLower.contains(pattern)) {
                log.debug("Rejecting '{}': name matches '{}'", name, pattern);
                return false;
            }
        }

        for (Map.Entry<String, Set<String>> scoped : profile.scopedTypeExclusions().entrySet()) {
            if (typesLower.contains(scoped.getKey()) && !scoped.getValue().contains(category)) {
                log.debug("Rejecting '{}': type {} not allowed for {}", name, scoped.getKey(), category);
                return false;
            }
        }

        for (RelevanceProfile.CategoryHint hint : profile.categoryHints()) {
            if (!hint.category().equals(category)) continue;
            boolean nameMatches = hint.nameKeywords().stream().anyMatch(nameLower::contains);
            if (nameMatches) {
                return hint.rejectTypes().stream().noneMatch(typesLower::contains);
            }
        }

        return true;
    }
}
