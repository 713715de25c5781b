package me.golemcore.memory.adapter.inbound.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LearnTextRequest {
    @NotBlank
    private String text;
    private String category;
    private String source;
}
