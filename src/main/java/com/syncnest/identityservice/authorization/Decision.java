package com.syncnest.identityservice.authorization;

public enum Decision {
    ALLOW,
    /** No principal; maps to 401. */
    UNAUTHENTICATED,
    /** Principal present but a capability failed; maps to 403. */
    FORBIDDEN
}
