package com.example.mcpgateway.model;

public enum RouteMethod {
    GET,
    POST;

    public static RouteMethod from(String method) {
        if (method == null) return null;
        for (RouteMethod m : values()) {
            if (m.name().equalsIgnoreCase(method)) return m;
        }
        return null;
    }
}
