package com.phonepe.memoria.core.utils;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;
import com.phonepe.memoria.core.model.MemoryType;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalisation, hashing and tokenisation helpers shared by extraction, dedup and lexical recall.
 */
@UtilityClass
public class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final CharMatcher TOKEN_CHARS = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.is('_'));
    private static final int ITEM_HASH_LENGTH = 16;

    public static final Set<String> STOP_WORDS = ImmutableSet.of(
            "a", "an", "the", "and", "or", "but", "is", "are", "was", "were", "be", "been", "am",
            "i", "me", "my", "mine", "we", "our", "you", "your", "he", "she", "they", "them", "their", "it", "its",
            "do", "does", "did", "what", "which", "who", "whom", "where", "when", "why", "how",
            "to", "of", "in", "on", "at", "for", "with", "about", "from", "by", "as", "that", "this", "these",
            "those", "there", "here", "so", "if", "then", "than", "too", "very", "can", "could", "would", "should",
            "will", "just", "have", "has", "had", "not", "no", "any", "some", "all", "also", "into", "up", "out");

    /**
     * Lower-cases and collapses whitespace.
     */
    public static String normalize(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return "";
        }
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Dedup hash of an item: <code>sha256("{type}:{normalized content}")</code>, truncated to 16 hex characters.
     */
    public static String itemContentHash(MemoryType memoryType, String content) {
        final var normalized = normalize(content);
        return Hashing.sha256()
                .hashString("%s:%s".formatted(memoryType.name().toLowerCase(Locale.ROOT), normalized),
                            StandardCharsets.UTF_8)
                .toString()
                .substring(0, ITEM_HASH_LENGTH);
    }

    public static String sha256(byte[] data) {
        return Hashing.sha256().hashBytes(data).toString();
    }

    public static String sha256(String data) {
        return Hashing.sha256().hashString(Strings.nullToEmpty(data), StandardCharsets.UTF_8).toString();
    }

    /**
     * All lower case alphanumeric tokens in order of appearance.
     */
    public static List<String> tokenize(String text) {
        final var tokens = new ArrayList<String>();
        if (Strings.isNullOrEmpty(text)) {
            return tokens;
        }
        final var lower = text.toLowerCase(Locale.ROOT);
        final var current = new StringBuilder();
        for (int i = 0; i < lower.length(); i++) {
            final var ch = lower.charAt(i);
            if (TOKEN_CHARS.matches(ch)) {
                current.append(ch);
            }
            else if (!current.isEmpty()) {
                tokens.add(current.toString());
                current.setLength(0);
            }
        }
        if (!current.isEmpty()) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Distinct tokens without stop words.
     */
    public static Set<String> contentTokens(String text) {
        final var tokens = new LinkedHashSet<String>();
        for (var token : tokenize(text)) {
            if (!STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Fraction of the query's content tokens present in the candidate text. Zero when the query has none.
     */
    public static double coverage(String query, String candidate) {
        final var queryTokens = contentTokens(query);
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        final var candidateTokens = contentTokens(candidate);
        final var matched = queryTokens.stream().filter(candidateTokens::contains).count();
        return (double) matched / queryTokens.size();
    }

    public static List<String> sentences(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return List.of();
        }
        return Splitter.on(SENTENCE_BOUNDARY)
                .trimResults()
                .omitEmptyStrings()
                .splitToList(text);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)).trim() + "...";
    }
}
