package com.example.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GamificationResult {
    private double healthScore;
    @Builder.Default
    private List<String> badges = new ArrayList<>();
    private GamificationStreaks streaks;
    private GamificationLevel level;
    @Builder.Default
    private List<String> nextRewards = new ArrayList<>();
}
