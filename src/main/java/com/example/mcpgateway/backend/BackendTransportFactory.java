package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.BackendIdentity;

public interface BackendTransportFactory {
    BackendTransport create(BackendIdentity identity);
}
