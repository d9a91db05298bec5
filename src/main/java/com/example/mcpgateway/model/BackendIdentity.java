package com.example.mcpgateway.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackendIdentity {
    private String id;
    private String url;
    // overrides gateway.concurrency-limit when set
    private Integer concurrencyLimit;
    // subscribe to the backend's SSE stream for list_changed notifications
    private boolean notifications;

    public BackendIdentity(String id, String url) {
        this.id = id;
        this.url = url;
    }
}
