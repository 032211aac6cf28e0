package com.dcruver.lifepatterns.domain.anomaly;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered keyword rules that turn an anomalous day into a category.
 * Rules are tried top to bottom; the first match wins.
 */
@Component
public class CategoryRuleTable {

    public static final String UNCLASSIFIED = "unclassified";

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private static final CategoryRule FALLBACK =
        new CategoryRule(UNCLASSIFIED, Set.of(), "Unusual pattern detected on %s");

    private final List<CategoryRule> rules;

    public CategoryRuleTable() {
        this(List.of(
            new CategoryRule("stress surge", Set.of("stress", "pressure", "anxious", "nervous"),
                "Elevated stress levels detected on %s"),
            new CategoryRule("fatigue spike", Set.of("sick", "tired", "exhausted", "drained"),
                "Significant fatigue indicators on %s"),
            new CategoryRule("confidence dip", Set.of("unprepared", "worry", "uncertain", "doubt"),
                "Confidence or self-doubt concerns on %s")));
    }

    public CategoryRuleTable(List<CategoryRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<CategoryRule> getRules() {
        return rules;
    }

    /**
     * @param clusterTerms keywords (and label words) of the nearest theme
     * @param dayText the anomalous day's own text, may be empty
     */
    public CategoryRule categorize(Collection<String> clusterTerms, String dayText) {
        Set<String> terms = new HashSet<>();
        for (String term : clusterTerms) {
            terms.add(term.toLowerCase(Locale.ROOT));
        }
        if (dayText != null) {
            Matcher matcher = WORD.matcher(dayText.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                terms.add(matcher.group());
            }
        }

        return rules.stream()
            .filter(rule -> rule.getTerms().stream().anyMatch(terms::contains))
            .findFirst()
            .orElse(FALLBACK);
    }

    @Value
    public static class CategoryRule {
        String category;
        Set<String> terms;
        String descriptionTemplate;  // %s is the date

        public String describe(LocalDate date) {
            return String.format(descriptionTemplate, date);
        }
    }
}
