package com.example.triage.registry;

import com.example.triage.exception.FlowDefectException;
import com.example.triage.model.ComparisonOperator;
import com.example.triage.model.ConditionalRule;
import com.example.triage.model.Domain;
import com.example.triage.model.Question;
import com.example.triage.model.QuestionType;
import com.example.triage.model.TriggerRule;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DomainRegistry")
class DomainRegistryTest {

    @Nested
    @DisplayName("Bundled questionnaire")
    class Bundled {

        private final DomainRegistry registry = DomainRegistry.loadDefault();

        @Test
        @DisplayName("Should load domains in declaration order")
        void shouldLoadDomainsInOrder() {
            List<String> ids = registry.getDomains().stream().map(Domain::getId).collect(Collectors.toList());

            assertThat(ids).containsExactly(
                    "mental_health", "pain_management", "chronic_disease", "lifestyle", "family_history", "validation");
            assertThat(registry.getQuestionnaireId()).isEqualTo("health-triage");
        }

        @Test
        @DisplayName("Should expose the fixed triage questions")
        void shouldExposeTriage() {
            List<String> ids = registry.getTriage().getQuestions().stream()
                    .map(Question::getId).collect(Collectors.toList());

            assertThat(ids).containsExactly(
                    "age", "biological_sex", "emergency_check", "pain_severity", "mood_interest", "chronic_conditions_flag");
        }

        @Test
        @DisplayName("Should resolve triggers, terminal and continuation")
        void shouldResolveStructure() {
            Domain mental = registry.requireDomain("mental_health");
            assertThat(mental.getPriority()).isEqualTo(9);
            assertThat(mental.getTrigger().getOperator()).isEqualTo(ComparisonOperator.GREATER_OR_EQUAL);
            assertThat(mental.getTrigger().getQuestionId()).isEqualTo("mood_interest");

            assertThat(registry.getTerminal().getId()).isEqualTo("validation");
            assertThat(registry.findContinuationOf("lifestyle"))
                    .hasValueSatisfying(d -> assertThat(d.getId()).isEqualTo("family_history"));
            assertThat(registry.findContinuationOf("mental_health")).isEmpty();
        }

        @Test
        @DisplayName("Should index every question by id")
        void shouldIndexQuestions() {
            assertThat(registry.totalQuestionCount()).isEqualTo(64);
            assertThat(registry.findQuestion("audit_c_2"))
                    .hasValueSatisfying(q -> assertThat(q.getConditionalOn().getQuestionId()).isEqualTo("audit_c_1"));
            assertThat(registry.findQuestion("emergency_contact"))
                    .hasValueSatisfying(q -> assertThat(q.isRequired()).isFalse());
            assertThat(registry.findQuestion("unknown")).isEmpty();
        }

        @Test
        @DisplayName("Should not allow catalogue entries to be changed")
        void shouldExposeUnmodifiableCatalogue() {
            Domain mental = registry.requireDomain("mental_health");
            Question sex = registry.findQuestion("biological_sex").orElseThrow();
            Question followUp = registry.findQuestion("audit_c_2").orElseThrow();

            assertThatThrownBy(() -> registry.getDomains().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> mental.getQuestions().remove(0))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> sex.getOptions().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> followUp.getConditionalOn().getValues().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(registry.getTriage().getQuestions()).hasSize(6);
        }

        @Test
        @DisplayName("Should fail for unknown domain ids")
        void shouldFailForUnknownDomain() {
            assertThat(registry.findDomain("dermatology")).isEmpty();
            assertThatThrownBy(() -> registry.requireDomain("dermatology"))
                    .isInstanceOf(FlowDefectException.class);
        }

        @Test
        @DisplayName("Should fail when the resource does not exist")
        void shouldFailForMissingResource() {
            assertThatThrownBy(() -> DomainRegistry.fromClasspath("missing.json",
                    new ObjectMapper()))
                    .isInstanceOf(FlowDefectException.class)
                    .hasMessageContaining("missing.json");
        }
    }

    @Nested
    @DisplayName("Definition checks")
    class DefinitionChecks {

        @Test
        @DisplayName("Should accept a minimal valid definition")
        void shouldAcceptMinimalDefinition() {
            DomainRegistry registry = new DomainRegistry(definition(
                    domain("screen", null, question("a"), question("b")),
                    triggered("one", "a", question("c")),
                    terminal("end", question("d"))));

            assertThat(registry.getTerminal().getId()).isEqualTo("end");
            assertThat(registry.totalQuestionCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should reject duplicate question ids")
        void shouldRejectDuplicateQuestion() {
            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    triggered("one", "a", question("a")),
                    terminal("end", question("d")))))
                    .isInstanceOf(FlowDefectException.class)
                    .hasMessageContaining("a");
        }

        @Test
        @DisplayName("Should reject duplicate domain ids")
        void shouldRejectDuplicateDomain() {
            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    triggered("one", "a", question("b")),
                    triggered("one", "a", question("c")),
                    terminal("end", question("d")))))
                    .isInstanceOf(FlowDefectException.class);
        }

        @Test
        @DisplayName("Should require exactly one terminal domain")
        void shouldRequireSingleTerminal() {
            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    triggered("one", "a", question("b")))))
                    .isInstanceOf(FlowDefectException.class);

            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    terminal("end", question("b")),
                    terminal("other", question("c")))))
                    .isInstanceOf(FlowDefectException.class);
        }

        @Test
        @DisplayName("Should reject triggers that point to unknown questions")
        void shouldRejectUnknownTriggerQuestion() {
            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    triggered("one", "ghost", question("b")),
                    terminal("end", question("c")))))
                    .isInstanceOf(FlowDefectException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("Should reject non-terminal domains without trigger")
        void shouldRejectMissingTrigger() {
            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    domain("one", null, question("b")),
                    terminal("end", question("c")))))
                    .isInstanceOf(FlowDefectException.class);
        }

        @Test
        @DisplayName("Should reject conditions on later questions")
        void shouldRejectForwardCondition() {
            Question early = question("b", new ConditionalRule("c", List.of(true)));

            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    triggered("one", "a", early, question("c")),
                    terminal("end", question("d")))))
                    .isInstanceOf(FlowDefectException.class)
                    .hasMessageContaining("b");
        }

        @Test
        @DisplayName("Should reject continuation of an unknown domain")
        void shouldRejectUnknownContinuation() {
            Domain orphan = Domain.builder()
                    .id("child")
                    .name("child")
                    .trigger(new TriggerRule("a", ComparisonOperator.EQUAL, true))
                    .continuationOf("parent")
                    .questions(List.of(question("b")))
                    .build();

            assertThatThrownBy(() -> new DomainRegistry(definition(
                    domain("screen", null, question("a")),
                    orphan,
                    terminal("end", question("c")))))
                    .isInstanceOf(FlowDefectException.class);
        }

        @Test
        @DisplayName("Should reject a definition without triage")
        void shouldRejectMissingTriage() {
            QuestionnaireDefinition definition = new QuestionnaireDefinition();
            definition.setDomains(new ArrayList<>(List.of(terminal("end", question("a")))));

            assertThatThrownBy(() -> new DomainRegistry(definition)).isInstanceOf(FlowDefectException.class);
        }
    }

    private static QuestionnaireDefinition definition(Domain triage, Domain... domains) {
        QuestionnaireDefinition definition = new QuestionnaireDefinition();
        definition.setQuestionnaireId("test");
        definition.setVersion("0");
        definition.setTriage(triage);
        definition.setDomains(new ArrayList<>(List.of(domains)));
        return definition;
    }

    private static Domain domain(String id, TriggerRule trigger, Question... questions) {
        return Domain.builder()
                .id(id)
                .name(id)
                .trigger(trigger)
                .questions(List.of(questions))
                .build();
    }

    private static Domain triggered(String id, String questionId, Question... questions) {
        return domain(id, new TriggerRule(questionId, ComparisonOperator.EQUAL, true), questions);
    }

    private static Domain terminal(String id, Question... questions) {
        return Domain.builder()
                .id(id)
                .name(id)
                .terminal(true)
                .questions(List.of(questions))
                .build();
    }

    private static Question question(String id) {
        return question(id, null);
    }

    private static Question question(String id, ConditionalRule condition) {
        return Question.builder()
                .id(id)
                .text(id)
                .type(QuestionType.BOOLEAN)
                .conditionalOn(condition)
                .build();
    }
}
