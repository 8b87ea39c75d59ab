package com.stealthradar.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Typed stealth-address event decoded from an ERC-5564 announcer or ERC-6538 registry log.
 */
public sealed interface StealthEvent permits StealthEvent.Announcement, StealthEvent.Registration {

    enum Kind {
        ANNOUNCEMENT,
        REGISTRATION
    }

    EventIdentity identity();

    /** Chain name from configuration. */
    String chain();

    long blockNumber();

    /** Wall clock at processing time. */
    Instant timestampApprox();

    /** Caller of an announcement, registrant of a registration. */
    String subjectAddress();

    Kind kind();

    default long chainId() {
        return identity().chainId();
    }

    default String txHash() {
        return identity().txHash();
    }

    /**
     * Stealth payment announced: {@code caller} sent funds to {@code stealthAddress}. Metadata byte 0 is the view tag.
     */
    record Announcement(
            EventIdentity identity,
            String chain,
            long blockNumber,
            Instant timestampApprox,
            BigInteger schemeId,
            String stealthAddress,
            String caller,
            String ephemeralPubKey,
            String metadata
    ) implements StealthEvent {

        @Override
        public String subjectAddress() {
            return caller;
        }

        @Override
        public Kind kind() {
            return Kind.ANNOUNCEMENT;
        }
    }

    /**
     * Stealth meta-address published by {@code registrant}.
     */
    record Registration(
            EventIdentity identity,
            String chain,
            long blockNumber,
            Instant timestampApprox,
            BigInteger schemeId,
            String registrant,
            String stealthMetaAddress
    ) implements StealthEvent {

        @Override
        public String subjectAddress() {
            return registrant;
        }

        @Override
        public Kind kind() {
            return Kind.REGISTRATION;
        }
    }
}
