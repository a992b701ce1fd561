package org.harvest.traits.server;

public record ServerInfo(String service, String version, String status) {

    public static ServerInfo running() {
        return new ServerInfo("HARVEST Trait Extraction Server", "1.0.0", "running");
    }
}
