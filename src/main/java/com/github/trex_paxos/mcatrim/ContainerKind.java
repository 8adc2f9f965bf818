package com.github.trex_paxos.mcatrim;

/// The container directories found under a world directory.
public enum ContainerKind {
    REGION("region"),
    POI("poi"),
    ENTITIES("entities");

    private final String directoryName;

    ContainerKind(String directoryName) {
        this.directoryName = directoryName;
    }

    public String getDirectoryName() {
        return directoryName;
    }
}
