package com.interngenie.gateway.recommend.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ProfileNotFoundException extends RuntimeException {
    private final long profileId;

    public ProfileNotFoundException(long profileId) {
        super("Profile not found: " + profileId);
        this.profileId = profileId;
    }

    public long getProfileId() {
        return profileId;
    }
}
