package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.model.ClassificationMethod;
import io.riskwatch.ingestion.api.model.KeywordCategory;
import io.riskwatch.ingestion.api.model.KeywordVerdict;
import io.riskwatch.ingestion.api.model.RiskLabel;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic, side-effect free first layer of classification.
 */
@Service
public class KeywordRuleEngine {

    /** Gazette sections whose publications are legal/regulatory by nature. */
    public static final Map<String, String> SEVERE_SECTIONS = Map.of(
            "JUS", "Justice - court rulings and legal proceedings",
            "CNMC", "Competition authority - antitrust sanctions",
            "AEPD", "Data protection - privacy violations",
            "CNMV", "Securities regulator - market sanctions",
            "BDE", "Bank of Spain - banking sanctions",
            "DGSFP", "Insurance supervisor - insurance sanctions",
            "SEPBLAC", "Anti-money-laundering service - AML sanctions"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<KeywordCategory, Pattern> patterns = new EnumMap<>(KeywordCategory.class);

    @Autowired
    public KeywordRuleEngine(IngestionConfig config) {
        this(config.classification().languages());
    }

    public KeywordRuleEngine(Collection<String> languages) {
        for (KeywordCategory category : KeywordCategory.values()) {
            Set<String> terms = new LinkedHashSet<>();
            languages.forEach(language -> terms.addAll(category.terms(language)));
            if (!terms.isEmpty()) {
                patterns.put(category, compile(terms));
            }
        }
    }

    public KeywordVerdict evaluate(String text, String section) {
        String sectionCode = section == null ? "" : section.trim().toUpperCase(Locale.ROOT);
        if (SEVERE_SECTIONS.containsKey(sectionCode)) {
            return new KeywordVerdict(RiskLabel.HIGH_LEGAL, 0.9, ClassificationMethod.KEYWORD_SECTION,
                    "Severe regulatory section: " + sectionCode + " (" + SEVERE_SECTIONS.get(sectionCode) + ")",
                    Map.of());
        }

        Map<KeywordCategory, Set<String>> matches = detect(text);
        if (matches.isEmpty()) {
            return KeywordVerdict.NO_OPINION;
        }

        if (count(matches, KeywordCategory.CORRUPTION) >= 2) {
            return verdict(RiskLabel.HIGH_LEGAL, 0.90, KeywordCategory.CORRUPTION, matches);
        }
        if (count(matches, KeywordCategory.FINANCIAL_DISTRESS) >= 2) {
            return verdict(RiskLabel.HIGH_FINANCIAL, 0.85, KeywordCategory.FINANCIAL_DISTRESS, matches);
        }
        if (count(matches, KeywordCategory.REGULATORY) >= 2) {
            return verdict(RiskLabel.HIGH_REGULATORY, 0.85, KeywordCategory.REGULATORY, matches);
        }
        if (count(matches, KeywordCategory.DISMISSAL) >= 2) {
            return verdict(RiskLabel.MEDIUM_OPERATIONAL, 0.80, KeywordCategory.DISMISSAL, matches);
        }
        if (count(matches, KeywordCategory.ENVIRONMENTAL) >= 2) {
            return verdict(RiskLabel.MEDIUM_OPERATIONAL, 0.75, KeywordCategory.ENVIRONMENTAL, matches);
        }
        if (count(matches, KeywordCategory.OPERATIONAL) >= 2) {
            return verdict(RiskLabel.LOW_OPERATIONAL, 0.70, KeywordCategory.OPERATIONAL, matches);
        }

        return new KeywordVerdict(RiskLabel.LOW_OTHER, 0.60, ClassificationMethod.KEYWORD_MATCH,
                "Weak keyword signal: " + describe(matches), matches);
    }

    /**
     * Distinct matched terms per category, lowercased with whitespace collapsed. Categories without hits are absent.
     */
    public Map<KeywordCategory, Set<String>> detect(String text) {
        Map<KeywordCategory, Set<String>> matches = new EnumMap<>(KeywordCategory.class);
        if (text == null || text.isBlank()) return matches;

        patterns.forEach((category, pattern) -> {
            Matcher matcher = pattern.matcher(text);
            Set<String> found = new TreeSet<>();
            while (matcher.find()) {
                found.add(normalize(matcher.group(1)));
            }
            if (!found.isEmpty()) {
                matches.put(category, found);
            }
        });
        return matches;
    }

    private KeywordVerdict verdict(RiskLabel label, double confidence, KeywordCategory trigger,
                                   Map<KeywordCategory, Set<String>> matches) {
        String reason = "Matched " + trigger.name().toLowerCase(Locale.ROOT) + " terms: " + matches.get(trigger);
        return new KeywordVerdict(label, confidence, ClassificationMethod.KEYWORD_MATCH, reason, matches);
    }

    private static int count(Map<KeywordCategory, Set<String>> matches, KeywordCategory category) {
        return matches.getOrDefault(category, Set.of()).size();
    }

    private static String describe(Map<KeywordCategory, Set<String>> matches) {
        return matches.entrySet().stream()
                .map(entry -> entry.getKey().name().toLowerCase(Locale.ROOT) + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    private static Pattern compile(Set<String> terms) {
        // longest first so a phrase wins over a shorter term starting at the same position
        List<String> ordered = terms.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(term -> WHITESPACE.splitAsStream(term.trim())
                        .map(Pattern::quote)
                        .collect(Collectors.joining("\\s+")))
                .toList();
        return Pattern.compile("\\b(" + String.join("|", ordered) + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    }

    private static String normalize(String match) {
        return WHITESPACE.matcher(match.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
