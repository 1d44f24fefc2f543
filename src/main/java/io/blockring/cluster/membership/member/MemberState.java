package io.blockring.cluster.membership.member;

/**
 * Lifecycle states a ring member moves through. Only {@link #ACTIVE} members are
 * considered stable owners; {@link #JOINING} and {@link #LEAVING} members still own
 * their tokens but cause one extra stable replica to be added while they transition.
 */
public enum MemberState {
    /**
     * Fully joined and serving its share of the ring.
     */
    ACTIVE,
    /**
     * Tokens claimed, but the member may not have loaded its blocks yet.
     */
    JOINING,
    /**
     * About to be decommissioned; still serving until removed.
     */
    LEAVING,
    /**
     * Removed from the ring. Never part of a published snapshot.
     */
    LEFT;

    public boolean isTransitioning() {
        return this == JOINING || this == LEAVING;
    }
}
