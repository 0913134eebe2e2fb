package com.gauge.repository;

/**
 * Set membership of one gauge read without loading the entity, so that a later
 * SELECT ... FOR UPDATE hydrates fresh state.
 */
public record MembershipRef(Long id, String setId, Long companionId) {}
