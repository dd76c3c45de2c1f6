package com.example.triage.flow;

import com.example.triage.model.FlowSnapshot;
import com.example.triage.model.FlowStage;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Estado mutável de uma sessão. As transições sempre trabalham sobre uma
 * cópia, que só é adotada quando a transição termina sem erro.
 */
@Data
public class FlowState {
    private FlowStage stage = FlowStage.NOT_STARTED;
    private String currentDomainId;
    private String currentQuestionId;
    private Set<String> visitedDomains = new LinkedHashSet<>();
    private ResponseStore responses = new ResponseStore();

    public FlowState copy() {
        FlowState copy = new FlowState();
        copy.setStage(stage);
        copy.setCurrentDomainId(currentDomainId);
        copy.setCurrentQuestionId(currentQuestionId);
        copy.setVisitedDomains(new LinkedHashSet<>(visitedDomains));
        copy.setResponses(responses.copy());
        return copy;
    }

    public FlowSnapshot toSnapshot() {
        return FlowSnapshot.builder()
                .stage(stage)
                .currentDomainId(currentDomainId)
                .currentQuestionId(currentQuestionId)
                .visitedDomains(new ArrayList<>(visitedDomains))
                .responses(responses.toList())
                .build();
    }

    public static FlowState fromSnapshot(FlowSnapshot snapshot) {
        FlowState state = new FlowState();
        state.setStage(snapshot.getStage());
        state.setCurrentDomainId(snapshot.getCurrentDomainId());
        state.setCurrentQuestionId(snapshot.getCurrentQuestionId());
        if (snapshot.getVisitedDomains() != null) {
            state.setVisitedDomains(new LinkedHashSet<>(snapshot.getVisitedDomains()));
        }
        state.setResponses(ResponseStore.fromList(snapshot.getResponses()));
        return state;
    }
}
