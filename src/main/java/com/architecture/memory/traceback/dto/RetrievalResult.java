package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one retriever invocation for one source. Failures are carried in
 * {@link #error} instead of being thrown so that one source never hides the others.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    public static final String SUCCESS = "success";
    public static final String NO_RESULTS = "no_results";
    public static final String NO_RETRIEVER = "no_retriever";
    public static final String RETRIEVER_NOT_FOUND = "retriever_not_found";
    public static final String ERROR = "error";

    @Builder.Default
    private List<RetrievedDocument> documents = new ArrayList<>();

    private String retrieverName;
    private String source;
    private String message;
    private String error;

    public static RetrievalResult of(String retrieverName, String source, List<RetrievedDocument> documents) {
        return RetrievalResult.builder()
                .documents(new ArrayList<>(documents))
                .retrieverName(retrieverName)
                .source(source)
                .message(documents.isEmpty() ? NO_RESULTS : SUCCESS)
                .build();
    }

    public static RetrievalResult failure(String retrieverName, String source, String message, String error) {
        return RetrievalResult.builder()
                .retrieverName(retrieverName)
                .source(source)
                .message(message)
                .error(error)
                .build();
    }

    public boolean isFailed() {
        return error != null;
    }
}
