package com.arenabox.core.model;

/**
 * Uniqueness key of an instance. Challenge ids can be reused after a challenge is deleted and
 * recreated, so the image is part of the key.
 */
public record InstanceKey(Participant participant, long challengeId, String image) {

    @Override
    public String toString() {
        return participant.key() + "/" + challengeId + "/" + image;
    }
}
