package com.stealthradar.monitor.event;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;

/**
 * ABI of the tracked stealth events and their topic-0 hashes.
 */
public final class StealthContracts {

    /** ERC-5564 {@code Announcement(uint256 indexed schemeId, address indexed stealthAddress, address indexed caller, bytes ephemeralPubKey, bytes metadata)}. */
    public static final Event ANNOUNCEMENT = new Event("Announcement", Arrays.asList(
            TypeReference.create(Uint256.class, true),
            TypeReference.create(Address.class, true),
            TypeReference.create(Address.class, true),
            TypeReference.create(DynamicBytes.class),
            TypeReference.create(DynamicBytes.class)
    ));

    /** ERC-6538 {@code StealthMetaAddressSet(address indexed registrant, uint256 indexed schemeId, bytes stealthMetaAddress)}. */
    public static final Event STEALTH_META_ADDRESS_SET = new Event("StealthMetaAddressSet", Arrays.asList(
            TypeReference.create(Address.class, true),
            TypeReference.create(Uint256.class, true),
            TypeReference.create(DynamicBytes.class)
    ));

    public static final String ANNOUNCEMENT_TOPIC = EventEncoder.encode(ANNOUNCEMENT);
    public static final String STEALTH_META_ADDRESS_SET_TOPIC = EventEncoder.encode(STEALTH_META_ADDRESS_SET);

    private StealthContracts() {
    }
}
