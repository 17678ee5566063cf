package com.purchasingpower.agentmail.model.directory;

import lombok.Value;

@Value
public class TeamMember {
    String id;
    String name;
    String email;
}
