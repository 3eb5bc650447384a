package br.edu.ifba.finrag.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingApiResponse {

    private String model;
    private List<Embedding> data;

    // Default constructor for Jackson
    public EmbeddingApiResponse() {
    }

    public EmbeddingApiResponse(final String model, final List<Embedding> data) {
        this.model = model;
        this.data = data;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model;
    }

    public List<Embedding> getData() {
        return data;
    }

    public void setData(final List<Embedding> data) {
        this.data = data;
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Embedding {

        private int index;

        @JsonProperty("embedding")
        private List<Double> embedding;

        public Embedding() {
        }

        public Embedding(final int index, final List<Double> embedding) {
            this.index = index;
            this.embedding = embedding;
        }

        public int getIndex() {
            return index;
        }

        public void setIndex(final int index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(final List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
