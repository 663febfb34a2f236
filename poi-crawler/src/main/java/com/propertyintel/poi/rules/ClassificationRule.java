package com.propertyintel.poi.rules;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the sub-category refinement table.
 *
 * Matches when the category is equal, the sub-category is in subCategories
 * (empty means any), the lower-cased name contains one of nameContainsAny
 * (if given), contains none of nameContainsNone (if given), the search
 * types include requiredType (if given) and do not include excludedType (if given).
 */
public record ClassificationRule(
        String category,
        Set<String> subCategories,
        List<String> nameContainsAny,
        List<String> nameContainsNone,
        String requiredType,
        String excludedType,
        String result
) {

    public ClassificationRule {
        subCategories = Set.copyOf(subCategories);
        nameContainsAny = nameContainsAny.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        nameContainsNone = nameContainsNone.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        requiredType = requiredType == null ? null : requiredType.toLowerCase(Locale.ROOT);
        excludedType = excludedType == null ? null : excludedType.toLowerCase(Locale.ROOT);
    }

    public static Builder when(String category, String... subCategories) {
        return new Builder(category, Set.of(subCategories));
    }

    boolean matches(String nameLower, Collection<String> typesLower, String category, String subCategory) {
        if (!this.category.equals(category)) return false;
        if (!subCategories.isEmpty() && !subCategories.contains(subCategory)) return false;
        if (!nameContainsAny.isEmpty() && nameContainsAny.stream().noneMatch(nameLower::contains)) return false;
        if (nameContainsNone.stream().anyMatch(nameLower::contains)) return false;
        if (excludedType != null && typesLower.contains(excludedType)) return false;
        return requiredType == null || typesLower.contains(requiredType);
    }

    public static final class Builder {
        private final String category;
        private final Set<String> subCategories;
        private List<String> nameAny = List.of();
        private List<String> nameNone = List.of();
        private String type;
        private String notType;

        private Builder(String category, Set<String> subCategories) {
            this.category = category;
            this.subCategories = subCategories;
        }

        public Builder nameContainsAny(String... words) {
            this.nameAny = List.of(words);
            return this;
        }

        public Builder nameContainsNone(String... words) {
            this.nameNone = List.of(words);
            return this;
        }

        public Builder hasType(String type) {
            this.type = type;
            return this;
        }

        public Builder lacksType(String type) {
            this.notType = type;
            return this;
        }

        public ClassificationRule then(String result) {
            return new ClassificationRule(category, subCategories, nameAny, nameNone, type, notType, result);
        }
    }
}
