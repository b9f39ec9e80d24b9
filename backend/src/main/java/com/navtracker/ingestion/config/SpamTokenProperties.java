package com.navtracker.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spam token filter. Tokens whose name or symbol contains one of the keywords are dropped before valuation.
 */
@ConfigurationProperties(prefix = "navtracker.spam-filter")
@Getter
@Setter
public class SpamTokenProperties {

    /**
     * When false, no token is dropped. Default true.
     */
    private boolean enabled = true;

    /**
     * Case-insensitive substrings typical of airdrop-phishing tokens.
     */
    private List<String> keywords = List.of(
            "visit", "claim", "airdrop", "reward", "www.", "http", ".com", ".io", ".xyz", ".top", ".eu");

    /**
     * Normalized keywords (lowercase, blank entries removed).
     */
    public Set<String> getKeywordsNormalized() {
        if (keywords == null || keywords.isEmpty()) {
            return Set.of();
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
