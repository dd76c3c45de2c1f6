package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QuestionType {
    NUMBER("number"),
    SCALE("scale"),
    SELECT("select"),
    MULTISELECT("multiselect"),
    BOOLEAN("boolean"),
    TEXT("text");

    private final String code;

    QuestionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static QuestionType fromCode(String code) {
        for (QuestionType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo de pergunta desconhecido: " + code);
    }
}
