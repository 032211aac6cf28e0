package com.dcruver.lifepatterns.domain.clustering;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Names a theme from its keywords using an ordered rule table.
 * The first rule with the highest keyword overlap wins.
 */
@Component
public class ThemeLabeler {

    private final Map<String, Set<String>> rules;

    public ThemeLabeler() {
        this(defaultRules());
    }

    public ThemeLabeler(Map<String, Set<String>> rules) {
        this.rules = new LinkedHashMap<>(rules);
    }

    public static Map<String, Set<String>> defaultRules() {
        Map<String, Set<String>> rules = new LinkedHashMap<>();
        rules.put("Work Performance", Set.of("work", "project", "deadline", "meeting", "team",
            "review", "presentation", "client", "office"));
        rules.put("Social Connection", Set.of("friends", "family", "conversation", "together",
            "people", "colleague", "bonding"));
        rules.put("Rest & Recovery", Set.of("weekend", "relax", "rest", "sleep", "tired",
            "recharged", "break", "vacation"));
        rules.put("Health & Wellness", Set.of("exercise", "health", "sick", "recover", "energy",
            "running", "wellness"));
        rules.put("Personal Growth", Set.of("learning", "mentor", "creative", "goal", "reflection",
            "journey", "growth"));
        rules.put("Leisure & Recreation", Set.of("beach", "hiking", "music", "concert", "movie",
            "fun", "entertainment"));
        return rules;
    }

    public Map<String, Set<String>> getRules() {
        return Map.copyOf(rules);
    }

    public String label(int clusterId, List<String> keywords) {
        String best = null;
        long bestScore = 0;
        for (Map.Entry<String, Set<String>> rule : rules.entrySet()) {
            long score = keywords.stream().filter(rule.getValue()::contains).count();
            if (score > bestScore) {
                bestScore = score;
                best = rule.getKey();
            }
        }
        if (best != null) {
            return best;
        }

        if (keywords.isEmpty()) {
            return "Theme " + (clusterId + 1);
        }
        return keywords.stream()
            .limit(2)
            .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
            .collect(Collectors.joining(" "));
    }
}
