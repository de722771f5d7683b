package com.landrecords.ec.session;

import com.landrecords.ec.model.SessionArtifact;

/**
 * External, human-assisted login. Implementations block until a session is available;
 * the search core never automates the login itself.
 */
@FunctionalInterface
public interface SessionAcquirer {

    SessionArtifact acquireSession();
}
