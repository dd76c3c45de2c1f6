package com.example.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainDescriptor {
    private String id;
    private String name;
    private String description;
    private int priority;
    private int estimatedMinutes;
    private int questionCount;
}
