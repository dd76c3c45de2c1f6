package com.example.triage.flow;

import com.example.triage.exception.InvalidResponseException;
import com.example.triage.exception.ResponseRangeException;
import com.example.triage.model.Question;
import com.example.triage.model.ValidationRange;

import java.util.List;

/**
 * Valida se a resposta é compatível com a pergunta: obrigatoriedade, tipo,
 * intervalo e, por fim, pertinência às opções declaradas.
 */
public class ResponseValidator {

    public void validate(Question question, Object value) {
        String id = question.getId();

        if (isBlank(value)) {
            if (question.isRequired()) {
                throw new InvalidResponseException(id, "Resposta obrigatória para '" + id + "'");
            }
            return;
        }

        switch (question.getType()) {
            case NUMBER:
            case SCALE:
                if (!(value instanceof Number) || Double.isNaN(((Number) value).doubleValue())) {
                    throw typeMismatch(question);
                }
                checkRange(question, ((Number) value).doubleValue());
                if (question.hasOptions() && !question.hasOption(value)) {
                    throw notAnOption(question);
                }
                return;

            case SELECT:
                if (!(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
                    throw typeMismatch(question);
                }
                if (value instanceof Number) {
                    checkRange(question, ((Number) value).doubleValue());
                }
                if (!question.hasOption(value)) {
                    throw notAnOption(question);
                }
                return;

            case MULTISELECT:
                if (!(value instanceof List)) {
                    throw typeMismatch(question);
                }
                List<?> items = (List<?>) value;
                if (items.isEmpty() && question.isRequired()) {
                    throw new InvalidResponseException(id, "Selecione ao menos uma opção para '" + id + "'");
                }
                for (Object item : items) {
                    if (!question.hasOption(item)) {
                        throw notAnOption(question);
                    }
                }
                return;

            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    throw typeMismatch(question);
                }
                return;

            case TEXT:
                if (!(value instanceof String)) {
                    throw typeMismatch(question);
                }
                return;

            default:
                throw typeMismatch(question);
        }
    }

    private void checkRange(Question question, double value) {
        ValidationRange range = question.getValidation();
        if (range != null && !range.contains(value)) {
            throw new ResponseRangeException(question.getId(), range.getMin(), range.getMax());
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).trim().isEmpty());
    }

    private static InvalidResponseException typeMismatch(Question question) {
        return new InvalidResponseException(question.getId(), String.format(
                "Resposta para '%s' não é do tipo %s", question.getId(), question.getType().getCode()));
    }

    private static InvalidResponseException notAnOption(Question question) {
        return new InvalidResponseException(question.getId(),
                "Resposta para '" + question.getId() + "' não corresponde a nenhuma opção");
    }
}
