package com.example.triage.scoring;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class DomainRiskProfile {
    Map<String, Integer> scores;
    int total;
    List<String> recommendations;
}
