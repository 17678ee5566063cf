package com.purchasingpower.agentmail.config;

import com.purchasingpower.agentmail.model.directory.MailPolicyConfig;
import com.purchasingpower.agentmail.model.directory.MultiRoundConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Static agent and team directory bound from {@code app.directory.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.directory")
public class DirectoryProperties {

    @Valid
    private List<TeamEntry> teams = new ArrayList<>();

    @Valid
    private List<AgentEntry> agents = new ArrayList<>();

    @Data
    public static class TeamEntry {
        @NotBlank
        private String id;
        private String name;
        /**
         * Mail domain agents of this team receive mail on.
         */
        private String domain;
        @Valid
        private List<MemberEntry> members = new ArrayList<>();
    }

    @Data
    public static class MemberEntry {
        @NotBlank
        private String id;
        private String name;
        @NotBlank
        private String email;
    }

    @Data
    public static class AgentEntry {
        @NotBlank
        private String id;
        @NotBlank
        private String username;
        private String name;
        @NotBlank
        private String teamId;
        private String prompt;
        private List<String> tools = new ArrayList<>();
        private MailPolicyConfig mailPolicy = new MailPolicyConfig();
        private MultiRoundConfig multiRound = new MultiRoundConfig();
    }
}
