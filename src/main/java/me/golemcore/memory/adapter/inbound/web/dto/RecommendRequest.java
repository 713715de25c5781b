package me.golemcore.memory.adapter.inbound.web.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state sent with recommendation and push requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendRequest {
    private String userId;
    private String query;
    private String topic;
    private List<String> keywords = new ArrayList<>();
    private List<String> recentTopics = new ArrayList<>();
    private String userMessage;
    private String lastUsedKnowledgeId;
    @Min(0)
    private int k = 5;
}
