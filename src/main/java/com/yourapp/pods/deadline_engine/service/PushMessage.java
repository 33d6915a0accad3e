package com.yourapp.pods.deadline_engine.service;

import java.util.Map;

public class PushMessage {
    private final String title;
    private final String body;
    private final Map<String, String> data;

    public PushMessage(String title, String body, Map<String, String> data) {
        this.title = title;
        this.body = body;
        this.data = data != null ? Map.copyOf(data) : Map.of();
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "PushMessage{title='" + title + "', data=" + data + '}';
    }
}
