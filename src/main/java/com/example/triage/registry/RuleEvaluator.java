package com.example.triage.registry;

import com.example.triage.model.ConditionalRule;
import com.example.triage.model.Question;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.TriggerRule;

import java.util.List;

/**
 * Avalia as regras declaradas no questionário (ativação de domínio e
 * exibição condicional de perguntas) contra as respostas atuais.
 * Resposta ausente sempre resulta em {@code false}.
 */
public final class RuleEvaluator {

    private RuleEvaluator() {
    }

    public static boolean evaluate(TriggerRule rule, ResponseSet responses) {
        if (rule == null || rule.getOperator() == null) return false;
        Object answer = responses.get(rule.getQuestionId());
        if (answer == null) return false;
        Object expected = ResponseSet.normalize(rule.getValue());

        switch (rule.getOperator()) {
            case GREATER_OR_EQUAL:
                return isComparable(answer, expected) && compare(answer, expected) >= 0;
            case GREATER:
                return isComparable(answer, expected) && compare(answer, expected) > 0;
            case LESS_OR_EQUAL:
                return isComparable(answer, expected) && compare(answer, expected) <= 0;
            case LESS:
                return isComparable(answer, expected) && compare(answer, expected) < 0;
            case EQUAL:
                return Question.sameValue(answer, expected);
            case INCLUDES:
                return contains(answer, expected);
            case EXCLUDES:
                return !contains(answer, expected);
            default:
                return false;
        }
    }

    /**
     * Uma pergunta com {@code conditionalOn} só é exibida quando a resposta
     * referenciada é um dos valores esperados; para respostas em lista basta
     * um item coincidir.
     */
    public static boolean isSurfaced(Question question, ResponseSet responses) {
        ConditionalRule condition = question.getConditionalOn();
        if (condition == null) return true;
        Object answer = responses.get(condition.getQuestionId());
        if (answer == null || condition.getValues() == null) return false;
        if (answer instanceof List) {
            for (Object item : (List<?>) answer) {
                if (matchesAny(item, condition.getValues())) return true;
            }
            return false;
        }
        return matchesAny(answer, condition.getValues());
    }

    private static boolean matchesAny(Object answer, List<Object> values) {
        for (Object value : values) {
            if (Question.sameValue(answer, ResponseSet.normalize(value))) return true;
        }
        return false;
    }

    private static boolean contains(Object answer, Object expected) {
        if (answer instanceof List) {
            for (Object item : (List<?>) answer) {
                if (Question.sameValue(item, expected)) return true;
            }
            return false;
        }
        return Question.sameValue(answer, expected);
    }

    private static boolean isComparable(Object answer, Object expected) {
        return answer instanceof Number && expected instanceof Number;
    }

    private static int compare(Object answer, Object expected) {
        return Double.compare(((Number) answer).doubleValue(), ((Number) expected).doubleValue());
    }
}
