package com.example.triage.exception;

public class ResponseRangeException extends InvalidResponseException {

    private final Double min;
    private final Double max;

    public ResponseRangeException(String questionId, Double min, Double max) {
        super(questionId, String.format("Resposta para '%s' fora do intervalo permitido [%s, %s]",
                questionId, format(min), format(max)));
        this.min = min;
        this.max = max;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    private static String format(Double bound) {
        if (bound == null) return "-";
        return bound == Math.rint(bound) ? String.valueOf(bound.longValue()) : String.valueOf(bound);
    }
}
