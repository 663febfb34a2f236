package com.propertyintel.poi.rules;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Data behind a {@link RelevanceFilter}. All strings are stored lower-case.
 *
 * @param irrelevantTypes        any of these in the search types rejects the place
 * @param irrelevantNamePatterns any of these inside the name rejects the place
 * @param scopedTypeExclusions   type → categories allowed to carry it; rejects in every other category
 * @param categoryHints          name keyword verdicts applied per category after the exclusions
 */
public record RelevanceProfile(
        String name,
        Set<String> irrelevantTypes,
        List<String> irrelevantNamePatterns,
        Map<String, Set<String>> scopedTypeExclusions,
        List<CategoryHint> categoryHints
) {

    public static final String COMMUNITY_INFRASTRUCTURE = "Community_Infrastructure";

    public RelevanceProfile {
        irrelevantTypes = lower(irrelevantTypes);
        irrelevantNamePatterns = List.copyOf(lower(irrelevantNamePatterns));
        Map<String, Set<String>> scoped = new LinkedHashMap<>();
        scopedTypeExclusions.forEach((type, allowed) -> scoped.put(type.toLowerCase(Locale.ROOT), Set.copyOf(allowed)));
        scopedTypeExclusions = Map.copyOf(scoped);
        categoryHints = List.copyOf(categoryHints);
    }

    /**
     * A name-keyword rule for one category. When the name matches, the place is
     * accepted unless it also carries one of the reject types.
     */
    public record CategoryHint(String category, List<String> nameKeywords, Set<String> rejectTypes) {

        public CategoryHint {
            nameKeywords = List.copyOf(lower(nameKeywords));
            rejectTypes = lower(rejectTypes);
        }

        public static CategoryHint accept(String category, String... keywords) {
            return new CategoryHint(category, List.of(keywords), Set.of());
        }

        public CategoryHint rejecting(String... types) {
            return new CategoryHint(category, nameKeywords, Set.of(types));
        }
    }

    /**
     * Market-survey profile: broad exclusion of infrastructure and non-commercial places.
     * place_of_worship is only allowed for community infrastructure searches.
     */
    public static RelevanceProfile comprehensive() {
        return new RelevanceProfile(
                "comprehensive",
                Set.of("loading_dock", "parking", "gas_station", "atm", "bus_station",
                        "subway_station", "train_station", "transit_station", "airport", "lodging",
                        "storage", "warehouse", "construction", "industrial", "utility",
                        "government", "embassy", "cemetery", "funeral_home"),
                List.of("loading dock", "parking lot", "parking area", "gas station",
                        "petrol station", "bank atm", "construction site", "warehouse",
                        "storage facility"),
                Map.of("place_of_worship", Set.of(COMMUNITY_INFRASTRUCTURE)),
                List.of());
    }

    /**
     * Community-infrastructure profile with Indonesian name patterns and per-category keyword hints.
     */
    public static RelevanceProfile community() {
        return new RelevanceProfile(
                "community",
                Set.of("parking", "gas_station", "atm", "storage", "warehouse", "construction",
                        "industrial", "loading_dock", "airport", "subway_station", "train_station",
                        "embassy"),
                List.of("parking", "tempat parkir", "loading dock", "gudang", "konstruksi",
                        "industri", "pabrik"),
                Map.of(),
                List.of(
                        CategoryHint.accept(COMMUNITY_INFRASTRUCTURE, "masjid", "gereja", "vihara", "pura", "musholla"),
                        CategoryHint.accept(COMMUNITY_INFRASTRUCTURE, "pasar", "market").rejecting("shopping_mall"),
                        CategoryHint.accept("Middle_Class_Accessibility", "indomaret", "alfamart", "circle k"),
                        CategoryHint.accept("Middle_Class_Accessibility", "bank", "bri", "bni", "mandiri", "bca"),
                        CategoryHint.accept("Family_Services", "sd", "sekolah", "tk", "paud"),
                        CategoryHint.accept("Family_Services", "apotek", "pharmacy", "kimia farma", "guardian"),
                        CategoryHint.accept("Value_Conscious_Retail", "warung", "warteg", "rumah makan", "padang"),
                        CategoryHint.accept("Value_Conscious_Retail", "laundry", "laundromat", "cuci")));
    }

    /**
     * Copy of this profile with additional universal exclusions.
     */
    public RelevanceProfile withExtraExclusions(Collection<String> types, Collection<String> namePatterns) {
        if ((types == null || types.isEmpty()) && (namePatterns == null || namePatterns.isEmpty())) {
            return this;
        }
        Set<String> allTypes = Stream.concat(irrelevantTypes.stream(), streamOf(types))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> allPatterns = Stream.concat(irrelevantNamePatterns.stream(), streamOf(namePatterns))
                .distinct()
                .toList();
        return new RelevanceProfile(name, allTypes, allPatterns, scopedTypeExclusions, categoryHints);
    }

    private static Stream<String> streamOf(Collection<String> values) {
        return values == null ? Stream.empty() : values.stream();
    }

    private static Set<String> lower(Collection<String> values) {
        return values.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
