package com.cueleague.scoring.client;

import java.util.UUID;

@FunctionalInterface
public interface PlayerDirectory {

    String displayName(UUID playerId);

    static PlayerDirectory byId() {
        return playerId -> playerId == null ? "Unknown player" : playerId.toString();
    }
}
