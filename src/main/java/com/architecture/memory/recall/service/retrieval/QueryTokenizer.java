package com.architecture.memory.recall.service.retrieval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls identifier-like tokens out of a natural-language query for the keyword leg.
 */
public final class QueryTokenizer {

    public static final int MAX_TOKENS = 8;

    // a letter or underscore, then at least two of [letters, digits, _ . / -]
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z_][A-Za-z0-9_./-]{2,}");

    private QueryTokenizer() {
    }

    /**
     * Tokens in first-seen order, deduplicated case-insensitively (first casing wins), at most
     * {@value #MAX_TOKENS}.
     */
    public static List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return tokens;
        }
        Set<String> seen = new HashSet<>();
        Matcher matcher = TOKEN.matcher(query);
        while (matcher.find() && tokens.size() < MAX_TOKENS) {
            String token = matcher.group();
            if (seen.add(token.toLowerCase(Locale.ROOT))) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
