package com.example.mcpgateway.model;

import lombok.Value;

@Value
public class RouteKey {
    RouteMethod method;
    String path;

    @Override
    public String toString() {
        return method + " " + path;
    }
}
