package com.purchasingpower.bookflow.api;

import com.purchasingpower.bookflow.entity.BookCard;
import com.purchasingpower.bookflow.orchestrator.OrchestratorResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String response;

    /** Function name of the executed action, empty when none ran. */
    private String action;

    private String method;
    private double similarity;
    private String error;

    @Builder.Default
    private List<String> stateTrace = new ArrayList<>();

    @Builder.Default
    private List<BookCard> books = new ArrayList<>();

    public static ChatResponse from(OrchestratorResult result) {
        return ChatResponse.builder()
            .success(true)
            .response(result.getResponse())
            .action(result.getFunctionName())
            .method(result.getMethod().label())
            .similarity(result.getSimilarity())
            .stateTrace(new ArrayList<>(result.getStateTrace()))
            .books(new ArrayList<>(result.getBooks()))
            .build();
    }

    public static ChatResponse error(String error) {
        return ChatResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
