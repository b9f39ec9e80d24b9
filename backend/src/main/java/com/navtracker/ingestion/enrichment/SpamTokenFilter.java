package com.navtracker.ingestion.enrichment;

import com.navtracker.ingestion.adapter.debank.RawToken;
import com.navtracker.ingestion.config.SpamTokenProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops airdrop-phishing tokens from wallet token lists. A token is spam when its name or symbol contains a
 * configured keyword (case-insensitive).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpamTokenFilter {

    private final SpamTokenProperties properties;

    public boolean isSpam(RawToken token) {
        if (!properties.isEnabled() || token == null) {
            return false;
        }
        Set<String> keywords = properties.getKeywordsNormalized();
        String name = lower(token.name());
        String symbol = lower(token.symbol());
        for (String keyword : keywords) {
            if (name.contains(keyword) || symbol.contains(keyword)) {
                log.debug("Spam filter: dropping token {} ({}) on keyword '{}'", token.symbol(), token.name(), keyword);
                return true;
            }
        }
        return false;
    }

    public List<RawToken> filter(List<RawToken> tokens) {
        if (tokens == null) {
            return List.of();
        }
        return tokens.stream().filter(t -> t != null && !isSpam(t)).toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
