package com.talkwire.realtime.auth;

import java.util.Optional;

/**
 * Resolves a client credential to a user id.
 */
public interface IdentityVerifier {

    /**
     * Returns the authenticated user id, or empty if the credential is missing,
     * malformed or rejected.
     */
    Optional<Long> verify(String credential);
}
