package com.propertyintel.poi.rules;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Refines a coarse sub-category using an ordered rule table. First match wins;
 * no match returns the input unchanged.
 */
public class SubCategoryClassifier {

    private final List<ClassificationRule> rules;

    public SubCategoryClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The pet-wellness survey table.
     */
    public static SubCategoryClassifier defaults() {
        return new SubCategoryClassifier(List.of(
                ClassificationRule.when("Competitor", "Clinic_General")
                        .nameContainsAny("grooming", "salon").then("Clinic+Grooming"),
                ClassificationRule.when("Competitor", "Clinic_General")
                        .nameContainsAny("24").then("Emergency_Hospital"),
                ClassificationRule.when("Competitor", "Clinic_General")
                        .then("Clinic_Only"),
                ClassificationRule.when("Competitor", "Emergency_Hospital")
                        .nameContainsNone("24").then("Clinic_Only"),
                // a 24h hospital keeps its sub-category even when tagged veterinary_care
                ClassificationRule.when("Competitor", "Emergency_Hospital")
                        .then("Emergency_Hospital"),
                ClassificationRule.when("Customer")
                        .hasType("pet_store").nameContainsAny("pet").then("Pet_Store"),
                // pet_store takes precedence over veterinary_care
                ClassificationRule.when("Competitor")
                        .hasType("veterinary_care").lacksType("pet_store").then("Clinic_Only")));
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public String refine(String name, Collection<String> types, String category, String subCategory) {
        String nameLower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        Set<String> typesLower = types == null ? Set.of() : types.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        for (ClassificationRule rule : rules) {
            if (rule.matches(nameLower, typesLower, category, subCategory)) {
                return rule.result();
            }
        }
        return subCategory;
    }
}
