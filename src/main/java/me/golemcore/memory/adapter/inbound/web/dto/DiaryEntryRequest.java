package me.golemcore.memory.adapter.inbound.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiaryEntryRequest {
    @NotBlank
    private String content;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double importance;
    private String emotion;
    private List<String> people = new ArrayList<>();
    private String location;
    private String event;
}
