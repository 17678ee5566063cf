package com.purchasingpower.agentmail.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Human on whose behalf a flow runs. For delegated flows this is inherited from the delegating flow.
 */
@Value
@Builder
@Jacksonized
public class Requester {
    String name;
    String address;
}
