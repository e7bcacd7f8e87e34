package com.phonepe.memoria.core.capability;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.model.Scored;

import java.util.List;
import java.util.Map;

/**
 * Language model backed reasoning used by the pipelines. Every call reports success or a classified failure;
 * implementations must not throw for failures they can classify.
 */
public interface ExtractionCapability {

    /**
     * Extract candidate facts from preprocessed resource content
     */
    CapabilityResponse<List<ExtractedFact>> extract(ExtractionRequest request);

    /**
     * Decide whether the context already answers the query
     */
    CapabilityResponse<SufficiencyVerdict> checkSufficiency(String query, List<String> context);

    /**
     * Score candidates (id to text) against the query
     *
     * @return Candidate ids with scores, best first
     */
    CapabilityResponse<List<Scored<String>>> rank(String query, Map<String, String> candidates);

    /**
     * Roll new contents into a category summary
     */
    CapabilityResponse<String> summarize(SummaryRequest request);

    /**
     * Re-score or reword an existing fact given the text of its resource
     */
    CapabilityResponse<ExtractedFact> refine(MemoryItem item, String evidenceText);

    /**
     * Caption or transcript for non textual content
     */
    CapabilityResponse<String> describe(Modality modality, String uri, byte[] content);
}
