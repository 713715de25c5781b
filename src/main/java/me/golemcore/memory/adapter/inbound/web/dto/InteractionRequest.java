package me.golemcore.memory.adapter.inbound.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionRequest {
    @NotBlank
    private String userMessage;
    @NotBlank
    private String assistantMessage;
    @Builder.Default
    private boolean saveToLongTerm = true;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double importance;
}
