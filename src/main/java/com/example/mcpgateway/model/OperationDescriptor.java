package com.example.mcpgateway.model;

import lombok.*;

import java.util.Map;

/**
 * One callable operation as a backend reports it from {@code tools/list}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OperationDescriptor {
    private String name;
    private String description;
    private Map<String, Object> inputSchema;
    private Map<String, Object> outputSchema;
    // null when the backend does not classify the operation
    private Boolean readOnly;
}
