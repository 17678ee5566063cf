package com.purchasingpower.agentmail.model.directory;

import lombok.Value;

import java.util.List;

@Value
public class Team {
    String id;
    String name;
    String domain;
    List<TeamMember> members;
}
