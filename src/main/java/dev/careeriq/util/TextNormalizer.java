package dev.careeriq.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-folding tokenizer and light lemmatizer shared by vocabulary indexing and skill extraction.
 * <p>
 * Tokens keep the characters that carry meaning in technology names ({@code + # . / -}),
 * so "c++", "c#", "node.js", ".net" and "ci/cd" survive as single tokens. Plain alphanumeric
 * tokens are reduced to a singular form; tokens with symbols are left as they are.
 */
public final class TextNormalizer {

    private TextNormalizer() {}

    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\.?[a-z0-9][a-z0-9+#./-]*");
    private static final Pattern PLAIN_TOKEN = Pattern.compile("^[a-z0-9]+$");
    private static final Pattern COMPOUND_SEPARATOR = Pattern.compile("[-/]");

    /**
     * Lower-cases and splits text into normalized tokens. Null or blank input yields an empty list.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        Matcher matcher = TOKEN_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = stripTrailingPunctuation(matcher.group());
            if (!token.isEmpty()) {
                tokens.add(lemmatize(token));
            }
        }
        return tokens;
    }

    /**
     * Normalized form of a whole phrase: its tokens joined by single spaces.
     */
    public static String normalizePhrase(String phrase) {
        return String.join(" ", tokenize(phrase));
    }

    /**
     * Reduces a plain token to a singular form ("apis" → "api", "libraries" → "library").
     * Endings that are usually not plurals ("-ss", "-us", "-is") and short tokens are kept.
     */
    public static String lemmatize(String token) {
        if (token == null || !PLAIN_TOKEN.matcher(token).matches()) {
            return token;
        }
        if (token.length() > 4 && token.endsWith("ies")) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.endsWith("ss") || token.endsWith("us") || token.endsWith("is")) {
            return token;
        }
        if (token.length() > 3 && token.endsWith("s")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    /**
     * Whether the token joins several words with "-" or "/" and may be split.
     */
    public static boolean isCompound(String token) {
        return token.indexOf('-') > 0 || token.indexOf('/') > 0;
    }

    /**
     * Splits a compound token into its normalized parts ("react/vue" → [react, vue]).
     */
    public static List<String> splitCompound(String token) {
        List<String> parts = new ArrayList<>();
        for (String part : COMPOUND_SEPARATOR.split(token)) {
            String cleaned = stripTrailingPunctuation(part);
            if (!cleaned.isEmpty()) {
                parts.add(lemmatize(cleaned));
            }
        }
        return parts;
    }

    private static String stripTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0) {
            char c = token.charAt(end - 1);
            if (c == '.' || c == '-' || c == '/') {
                end--;
            } else {
                break;
            }
        }
        return token.substring(0, end);
    }
}
