package com.example.mcpgateway.registry;

import com.example.mcpgateway.backend.BackendSession;
import com.example.mcpgateway.model.RouteDescriptor;
import lombok.Value;

@Value
public class RouteEntry {
    RouteDescriptor route;
    BackendSession session;
}
