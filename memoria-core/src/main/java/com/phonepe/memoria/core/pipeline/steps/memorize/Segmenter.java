package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.model.ResourceSegment;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits resource text into segments: one per turn for conversations, one per paragraph for everything else.
 * Offsets always point into the original text.
 */
@UtilityClass
public class Segmenter {
    private static final Pattern SPEAKER = Pattern.compile("^\\s*([A-Za-z][\\w .'-]{0,40}?)\\s*:\\s+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final char PAGE_BREAK = '\f';

    public static List<ResourceSegment> segment(Modality modality, String text) {
        if (Strings.isNullOrEmpty(text)) {
            return List.of();
        }
        return modality == Modality.CONVERSATION ? conversation(text) : paragraphs(text);
    }

    static List<ResourceSegment> conversation(String text) {
        final var segments = new ArrayList<ResourceSegment>();
        int lineStart = 0;
        while (lineStart <= text.length()) {
            var lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            final var line = text.substring(lineStart, lineEnd);
            if (!line.isBlank()) {
                final var matcher = SPEAKER.matcher(line);
                String speaker = null;
                var bodyStart = 0;
                if (matcher.find()) {
                    speaker = matcher.group(1).trim();
                    bodyStart = matcher.end();
                }
                final var body = line.substring(bodyStart);
                final var leading = body.length() - body.stripLeading().length();
                if (!body.isBlank()) {
                    segments.add(ResourceSegment.builder()
                                         .index(segments.size())
                                         .text(body.strip())
                                         .offset(lineStart + bodyStart + leading)
                                         .speaker(speaker)
                                         .build());
                }
            }
            lineStart = lineEnd + 1;
        }
        return segments;
    }

    static List<ResourceSegment> paragraphs(String text) {
        final var segments = new ArrayList<ResourceSegment>();
        final var paged = text.indexOf(PAGE_BREAK) >= 0;
        int page = 1;
        int pageStart = 0;
        while (pageStart <= text.length()) {
            var pageEnd = text.indexOf(PAGE_BREAK, pageStart);
            if (pageEnd < 0) {
                pageEnd = text.length();
            }
            final var pageText = text.substring(pageStart, pageEnd);
            final var matcher = PARAGRAPH_BREAK.matcher(pageText);
            int paragraphStart = 0;
            while (true) {
                final var found = matcher.find();
                final var paragraphEnd = found ? matcher.start() : pageText.length();
                addParagraph(segments, pageText.substring(paragraphStart, paragraphEnd),
                             pageStart + paragraphStart, paged ? page : null);
                if (!found) {
                    break;
                }
                paragraphStart = matcher.end();
            }
            pageStart = pageEnd + 1;
            page++;
        }
        return segments;
    }

    private static void addParagraph(List<ResourceSegment> segments, String paragraph, int offset, Integer page) {
        if (paragraph.isBlank()) {
            return;
        }
        final var leading = paragraph.length() - paragraph.stripLeading().length();
        segments.add(ResourceSegment.builder()
                             .index(segments.size())
                             .text(paragraph.strip())
                             .offset(offset + leading)
                             .page(page)
                             .build());
    }
}
