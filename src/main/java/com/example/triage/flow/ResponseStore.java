package com.example.triage.flow;

import com.example.triage.model.Response;
import com.example.triage.model.ResponseSet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Respostas de uma sessão, indexadas pelo id da pergunta. Uma nova resposta
 * substitui a anterior; não há histórico.
 */
public class ResponseStore {

    private final Map<String, Response> responses = new LinkedHashMap<>();

    public static ResponseStore fromList(List<Response> saved) {
        ResponseStore store = new ResponseStore();
        if (saved != null) {
            for (Response response : saved) {
                store.record(response.getQuestionId(), response.getValue(), response.getTimestamp());
            }
        }
        return store;
    }

    public void record(String questionId, Object value, Instant timestamp) {
        responses.put(questionId, new Response(questionId, ResponseSet.normalize(value), timestamp));
    }

    public int size() {
        return responses.size();
    }

    public ResponseSet view() {
        Map<String, Object> values = new LinkedHashMap<>();
        responses.forEach((id, response) -> values.put(id, response.getValue()));
        return ResponseSet.of(values);
    }

    public List<Response> toList() {
        List<Response> list = new ArrayList<>();
        for (Response response : responses.values()) {
            list.add(new Response(response.getQuestionId(), response.getValue(), response.getTimestamp()));
        }
        return list;
    }

    public ResponseStore copy() {
        return fromList(toList());
    }
}
