package com.questrail.bridge.commands;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Application-level state shared by the UI commands: the currently selected
 * profile, initially none.
 */
public final class AppState
{
    private final AtomicReference<String> currentProfileId = new AtomicReference<>();

    public Optional<String> currentProfileId() {
        return Optional.ofNullable(currentProfileId.get());
    }

    public void selectProfile(String profileId) {
        currentProfileId.set(profileId);
    }

    public void clearProfile() {
        currentProfileId.set(null);
    }
}
