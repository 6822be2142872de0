package com.arenabox.dispatch.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Names of the headers through which the host platform forwards the caller's identity.
 */
@Component
@ConfigurationProperties(prefix = "arenabox.identity")
public class IdentityProperties {

    private String participantKindHeader = "X-Participant-Kind";
    private String participantIdHeader = "X-Participant-Id";
    private String adminHeader = "X-Admin-User";

    public String getParticipantKindHeader() { return participantKindHeader; }
    public void setParticipantKindHeader(String participantKindHeader) { this.participantKindHeader = participantKindHeader; }
    public String getParticipantIdHeader() { return participantIdHeader; }
    public void setParticipantIdHeader(String participantIdHeader) { this.participantIdHeader = participantIdHeader; }
    public String getAdminHeader() { return adminHeader; }
    public void setAdminHeader(String adminHeader) { this.adminHeader = adminHeader; }
}
