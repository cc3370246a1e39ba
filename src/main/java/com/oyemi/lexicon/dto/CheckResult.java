package com.oyemi.lexicon.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {

    private String name;

    private boolean passed;

    /**
     * Advisory checks report issues but never fail
     */
    private boolean advisory;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
