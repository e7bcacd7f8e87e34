package com.phonepe.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A retrieved entity with its relevance score
 */
@Value
public class Scored<T> {
    T value;
    double score;

    @JsonCreator
    public Scored(@JsonProperty("value") T value, @JsonProperty("score") double score) {
        this.value = value;
        this.score = score;
    }

    public static <T> Scored<T> of(T value, double score) {
        return new Scored<>(value, score);
    }
}
