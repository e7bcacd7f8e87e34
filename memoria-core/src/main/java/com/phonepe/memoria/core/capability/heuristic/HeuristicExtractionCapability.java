/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoria.core.capability.heuristic;

import com.google.common.base.CaseFormat;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.capability.ExtractedFact;
import com.phonepe.memoria.core.capability.ExtractionCapability;
import com.phonepe.memoria.core.capability.ExtractionRequest;
import com.phonepe.memoria.core.capability.SufficiencyVerdict;
import com.phonepe.memoria.core.capability.SummaryRequest;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.model.ResourceSegment;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule based extraction and reasoning that needs no model. First person statements are matched against a fixed
 * set of patterns; documents additionally yield declarative sentences as knowledge. Ranking and sufficiency use
 * token coverage, summaries are extractive.
 */
@Slf4j
public class HeuristicExtractionCapability implements ExtractionCapability {
    private static final Set<String> IGNORED_SPEAKERS = ImmutableSet.of("assistant", "system", "bot", "agent");
    private static final Set<String> PERSONAL_ATTRIBUTES = ImmutableSet.of(
            "name", "age", "birthday", "email", "phone", "address", "nationality", "gender", "surname");
    private static final Set<String> RELATIONS = ImmutableSet.of(
            "wife", "husband", "son", "daughter", "kids", "children", "child", "brother", "sister", "mother",
            "father", "mom", "dad", "friend", "friends", "partner", "dog", "cat", "pet", "girlfriend", "boyfriend");
    private static final int MIN_KNOWLEDGE_TOKENS = 5;
    private static final double KNOWLEDGE_CONFIDENCE = 0.5;

    private record Rule(Pattern pattern,
                        MemoryType memoryType,
                        Function<Matcher, String> key,
                        Function<Matcher, String> category,
                        double confidence,
                        boolean stable) {
    }

    private final List<Rule> rules = List.of(
            rule("\\bmy (?:favou?rite) (\\w+(?: \\w+)?) (?:is|are) (.+)", MemoryType.PROFILE,
                 m -> "Favorite" + camel(m.group(1)), m -> "preferences", 0.9, true),
            rule("\\bmy (\\w+(?: \\w+)?) (?:is|are) (.+)", MemoryType.PROFILE,
                 m -> camel(m.group(1)),
                 m -> attributeCategory(m.group(1)), 0.85, true),
            rule("\\bi (?:really )?(like|love|enjoy|prefer|adore|hate|dislike|can't stand|don't like) (.+)",
                 MemoryType.PROFILE, m -> null, m -> "preferences", 0.8, true),
            rule("\\bi live in (.+)", MemoryType.PROFILE, m -> "Location", m -> "personal_info", 0.85, true),
            rule("\\bi (?:work|am working) (?:as) (.+)", MemoryType.PROFILE,
                 m -> "Occupation", m -> "work_life", 0.85, true),
            rule("\\bi (?:work|am working) (?:at|for) (.+)", MemoryType.PROFILE,
                 m -> "Employer", m -> "work_life", 0.85, true),
            rule("\\bi am (\\d+) years old", MemoryType.PROFILE, m -> "Age", m -> "personal_info", 0.9, false),
            rule("\\b(?:my goal is|i (?:want|plan|intend|hope|aim|need|would like) to) (.+)", MemoryType.GOAL,
                 m -> "Goal" + camel(firstWords(m.group(1), 2)), m -> "goals", 0.75, false),
            rule("\\bi (?:can't|cannot|must not|mustn't|never|don't|do not|won't) (.+)", MemoryType.GOAL,
                 m -> "Constraint" + camel(firstWords(m.group(1), 2)), m -> "goals", 0.7, true),
            rule("\\bi (?:usually|always|often|normally|every (?:day|morning|evening|night|week)) (.+)",
                 MemoryType.BEHAVIOR, m -> null, m -> "habits", 0.7, true),
            rule("\\bi (?:know how to|am (?:good|skilled|experienced|proficient) (?:at|with|in)) (.+)",
                 MemoryType.SKILL, m -> null, m -> "work_life", 0.75, true),
            rule("\\bi (?:went|visited|met|attended|bought|started|finished|moved|travelled|traveled|joined) (.+)",
                 MemoryType.EVENT, m -> null, m -> "experiences", 0.7, false),
            rule("\\bi (?:think|believe|feel) (?:that )?(.+)", MemoryType.KNOWLEDGE,
                 m -> null, m -> "opinions", 0.6, false),
            rule("\\bi have (?:a|an|two|three|\\d+) (.+)", MemoryType.PROFILE,
                 m -> null, m -> relationCategory(m.group(1)), 0.75, true),
            rule("\\bi am (?:a|an) (.+)", MemoryType.PROFILE, m -> "Identity", m -> "personal_info", 0.8, true));

    @Override
    public CapabilityResponse<List<ExtractedFact>> extract(ExtractionRequest request) {
        final var facts = new ArrayList<ExtractedFact>();
        final var types = request.getMemoryTypes();
        final var maxFacts = request.getMaxFacts() <= 0 ? Integer.MAX_VALUE : request.getMaxFacts();
        for (var segment : request.getSegments()) {
            if (segment.getSpeaker() != null
                    && IGNORED_SPEAKERS.contains(segment.getSpeaker().toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (var fact : extractFromSegment(segment, request)) {
                if (facts.size() >= maxFacts) {
                    break;
                }
                if (types == null || types.isEmpty() || types.contains(fact.getMemoryType())) {
                    facts.add(fact);
                }
            }
        }
        log.debug("Extracted {} facts from {} segments", facts.size(), request.getSegments().size());
        return CapabilityResponse.success(facts);
    }

    @Override
    public CapabilityResponse<SufficiencyVerdict> checkSufficiency(String query, List<String> context) {
        final var queryTokens = TextUtils.contentTokens(query);
        final var contextTokens = new LinkedHashSet<String>();
        context.forEach(text -> contextTokens.addAll(TextUtils.contentTokens(text)));
        final var missing = queryTokens.stream().filter(t -> !contextTokens.contains(t)).toList();
        final var sufficient = !context.isEmpty() && !queryTokens.isEmpty() && missing.isEmpty();
        return CapabilityResponse.success(SufficiencyVerdict.builder()
                                                  .sufficient(sufficient)
                                                  .rewrittenQuery(query)
                                                  .nextStepQuery(sufficient ? null : String.join(" ", missing))
                                                  .build());
    }

    @Override
    public CapabilityResponse<List<Scored<String>>> rank(String query, Map<String, String> candidates) {
        final var ranked = candidates.entrySet()
                .stream()
                .map(e -> Scored.of(e.getKey(), TextUtils.coverage(query, e.getValue())))
                .sorted(Comparator.comparingDouble((Scored<String> s) -> s.getScore()).reversed()
                                .thenComparing(Scored::getValue))
                .toList();
        return CapabilityResponse.success(ranked);
    }

    @Override
    public CapabilityResponse<String> summarize(SummaryRequest request) {
        final var sentences = new LinkedHashMap<String, String>();
        for (var content : request.getContents()) {
            addSentence(sentences, content);
        }
        TextUtils.sentences(Strings.nullToEmpty(request.getPreviousSummary()))
                .forEach(sentence -> addSentence(sentences, sentence));
        final var summary = String.join(" ", sentences.values());
        final var target = request.getTargetLength() <= 0 ? summary.length() : request.getTargetLength();
        return CapabilityResponse.success(TextUtils.truncate(summary, target));
    }

    @Override
    public CapabilityResponse<ExtractedFact> refine(MemoryItem item, String evidenceText) {
        var confidence = Math.min(1.0, item.getConfidence() + 0.05 * item.getReinforcementCount());
        if (!Strings.isNullOrEmpty(evidenceText)
                && !TextUtils.normalize(evidenceText).contains(TextUtils.normalize(item.getContent()))) {
            confidence = Math.max(0.0, confidence - 0.1);
        }
        return CapabilityResponse.success(ExtractedFact.builder()
                                                  .memoryType(item.getMemoryType())
                                                  .key(item.getKey())
                                                  .content(item.getContent())
                                                  .confidence(confidence)
                                                  .stable(item.isStable())
                                                  .build());
    }

    @Override
    public CapabilityResponse<String> describe(Modality modality, String uri, byte[] content) {
        final var name = Strings.isNullOrEmpty(uri) ? "inline" : uri.substring(uri.lastIndexOf('/') + 1);
        return CapabilityResponse.success("%s resource %s".formatted(modality.name().toLowerCase(Locale.ROOT),
                                                                     name));
    }

    private List<ExtractedFact> extractFromSegment(ResourceSegment segment, ExtractionRequest request) {
        final var facts = new ArrayList<ExtractedFact>();
        final var text = segment.getText();
        int searchFrom = 0;
        for (var sentence : TextUtils.sentences(text)) {
            final var position = Math.max(0, text.indexOf(sentence, searchFrom));
            searchFrom = position + sentence.length();
            final var content = stripTerminal(sentence);
            if (content.isEmpty()) {
                continue;
            }
            final var matched = matchRule(content);
            ExtractedFact.ExtractedFactBuilder builder = null;
            if (matched != null) {
                final var rule = matched.rule();
                builder = ExtractedFact.builder()
                        .memoryType(rule.memoryType())
                        .key(rule.key().apply(matched.matcher()))
                        .confidence(rule.confidence())
                        .stable(rule.stable())
                        .category(rule.category().apply(matched.matcher()));
            }
            else if (request.getModality() == Modality.DOCUMENT
                    && TextUtils.contentTokens(content).size() >= MIN_KNOWLEDGE_TOKENS) {
                builder = ExtractedFact.builder()
                        .memoryType(MemoryType.KNOWLEDGE)
                        .confidence(KNOWLEDGE_CONFIDENCE)
                        .stable(true)
                        .category("knowledge");
            }
            if (builder == null) {
                continue;
            }
            mentionedCategories(content, request.getKnownCategories()).forEach(builder::category);
            facts.add(builder.content(content)
                              .segmentIndex(segment.getIndex())
                              .offset(segment.getOffset() + position)
                              .length(sentence.length())
                              .build());
        }
        return facts;
    }

    private record Match(Rule rule, Matcher matcher) {
    }

    private Match matchRule(String sentence) {
        final var lower = sentence.toLowerCase(Locale.ROOT);
        for (var rule : rules) {
            final var matcher = rule.pattern().matcher(lower);
            if (matcher.find()) {
                return new Match(rule, matcher);
            }
        }
        return null;
    }

    private static List<String> mentionedCategories(String content, List<String> knownCategories) {
        if (knownCategories == null) {
            return List.of();
        }
        final var tokens = TextUtils.contentTokens(content.replace('_', ' '));
        return knownCategories.stream()
                .filter(name -> {
                    final var nameTokens = TextUtils.contentTokens(name.replace('_', ' '));
                    return !nameTokens.isEmpty() && tokens.containsAll(nameTokens);
                })
                .toList();
    }

    private static void addSentence(Map<String, String> sentences, String sentence) {
        final var trimmed = Strings.nullToEmpty(sentence).trim();
        if (trimmed.isEmpty()) {
            return;
        }
        final var terminated = trimmed.matches(".*[.!?]$") ? trimmed : trimmed + ".";
        sentences.putIfAbsent(TextUtils.normalize(stripTerminal(trimmed)), terminated);
    }

    private static String stripTerminal(String sentence) {
        return sentence.trim().replaceAll("[.!?]+$", "").trim();
    }

    private static String attributeCategory(String attribute) {
        final var words = TextUtils.tokenize(attribute);
        if (words.stream().anyMatch(RELATIONS::contains)) {
            return "relationships";
        }
        if (words.stream().anyMatch(w -> w.equals("job") || w.equals("role") || w.equals("team")
                || w.equals("company") || w.equals("manager"))) {
            return "work_life";
        }
        if (words.stream().anyMatch(PERSONAL_ATTRIBUTES::contains)) {
            return "personal_info";
        }
        return "preferences";
    }

    private static String relationCategory(String object) {
        return TextUtils.tokenize(object).stream().anyMatch(RELATIONS::contains) ? "relationships" : "personal_info";
    }

    private static String firstWords(String text, int count) {
        return TextUtils.tokenize(text).stream().limit(count).collect(Collectors.joining(" "));
    }

    private static String camel(String words) {
        return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL,
                                              String.join("_", TextUtils.tokenize(words)));
    }

    private static Rule rule(String regex,
                             MemoryType memoryType,
                             Function<Matcher, String> key,
                             Function<Matcher, String> category,
                             double confidence,
                             boolean stable) {
        return new Rule(Pattern.compile(regex), memoryType, key, category, confidence, stable);
    }
}
