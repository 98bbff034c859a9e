package com.architecture.memory.recall.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RememberRequest {

    @NotBlank
    private String userText;

    @NotNull
    private String assistantText;

    private List<String> files = new ArrayList<>();

    private List<String> tags = new ArrayList<>();
}
