package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.model.EvolutionDiff;
import lombok.Value;

@Value
public class EvolveResult {
    EvolutionDiff diff;
}
