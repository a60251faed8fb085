package com.pickalert.domain.model;

/**
 * Links a draft host user to a chat member.
 *
 * @param externalId  user id on the draft host
 * @param memberId    chat member id used for mentions
 * @param displayName chat display name, may equal the member id
 */
public record PlayerMapping(String externalId, String memberId, String displayName) {
}
