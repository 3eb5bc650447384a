package br.edu.ifba.finrag.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
public record EmbeddingApiRequest(
        @JsonProperty("model") String model,
        @JsonProperty("input") List<String> input) {
}
