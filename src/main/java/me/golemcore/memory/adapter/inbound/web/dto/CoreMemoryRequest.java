package me.golemcore.memory.adapter.inbound.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoreMemoryRequest {
    @NotBlank
    private String content;
    private String category;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double importance = 0.8;
}
