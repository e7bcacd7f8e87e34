package com.phonepe.memoria.core.capability;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SummaryRequest {
    String categoryName;
    String previousSummary;
    List<String> contents;
    int targetLength;
}
