package com.purchasingpower.agentmail.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the operator endpoints that act on a single flow.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowActionRequest {

    /**
     * Reason recorded when failing a flow.
     */
    private String reason;

    /**
     * Minutes to add when extending a deadline.
     */
    @Min(1)
    @Max(10080)
    private Integer minutes;
}
