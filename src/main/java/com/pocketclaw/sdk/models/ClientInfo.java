package com.pocketclaw.sdk.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Static client descriptor sent in the {@code connect} handshake.
 */
public class ClientInfo {

    public static final ClientInfo DEFAULT = new ClientInfo(
            "gateway-client", "PocketClaw", "1.0.0", "java", "backend", "operator");

    @JsonProperty("id")
    private final String id;

    @JsonProperty("displayName")
    private final String displayName;

    @JsonProperty("version")
    private final String version;

    @JsonProperty("platform")
    private final String platform;

    @JsonProperty("mode")
    private final String mode;

    @JsonIgnore
    private final String role;

    public ClientInfo(String id, String displayName, String version, String platform, String mode, String role) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.role = Objects.requireNonNull(role, "role must not be null");
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getVersion() {
        return version;
    }

    public String getPlatform() {
        return platform;
    }

    public String getMode() {
        return mode;
    }

    /**
     * Connection role; sent beside, not inside, the client block.
     */
    @JsonIgnore
    public String getRole() {
        return role;
    }

    @Override
    public String toString() {
        return "ClientInfo{id='" + id + "', version='" + version + "', platform='" + platform + "'}";
    }
}
