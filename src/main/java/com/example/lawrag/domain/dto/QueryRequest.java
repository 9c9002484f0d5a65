package com.example.lawrag.domain.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank
    @Size(min = 3, max = 1000)
    private String question;

    @Builder.Default
    private String country = "egypt";

    private List<String> lawTypes;

    private String sessionId;

    @Min(1)
    @Max(20)
    @Builder.Default
    private Integer topK = 5;
}
