package com.stealthradar.monitor.event;

import com.stealthradar.domain.ChainDescriptor;
import com.stealthradar.domain.EventIdentity;
import com.stealthradar.domain.StealthEvent;
import com.stealthradar.monitor.adapter.RawLog;
import com.stealthradar.monitor.event.ProcessingResult.Processed;
import com.stealthradar.monitor.event.ProcessingResult.SkipReason;
import com.stealthradar.monitor.event.ProcessingResult.Skipped;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Decodes announcer and registry logs into {@link StealthEvent}s. Never throws: logs from external contracts
 * that do not match the ABI come back as {@link Skipped}.
 */
@Component
public class StealthEventDecoder {

    public ProcessingResult decode(RawLog rawLog, ChainDescriptor chain, EventIdentity identity, Instant processedAt) {
        String topic0 = rawLog.topic(0);
        if (topic0 == null) {
            return new Skipped(identity, SkipReason.MALFORMED, "log has no topics");
        }
        try {
            if (StealthContracts.ANNOUNCEMENT_TOPIC.equalsIgnoreCase(topic0)) {
                return decodeAnnouncement(rawLog, chain, identity, processedAt);
            }
            if (StealthContracts.STEALTH_META_ADDRESS_SET_TOPIC.equalsIgnoreCase(topic0)) {
                return decodeRegistration(rawLog, chain, identity, processedAt);
            }
            return new Skipped(identity, SkipReason.UNKNOWN_EVENT, "unknown topic " + topic0);
        } catch (RuntimeException e) {
            return new Skipped(identity, SkipReason.MALFORMED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ProcessingResult decodeAnnouncement(RawLog rawLog, ChainDescriptor chain, EventIdentity identity, Instant processedAt) {
        if (rawLog.topics().size() < 4) {
            return new Skipped(identity, SkipReason.MALFORMED, "announcement expects 4 topics, got " + rawLog.topics().size());
        }
        List<Type> data = FunctionReturnDecoder.decode(rawLog.data(), StealthContracts.ANNOUNCEMENT.getNonIndexedParameters());
        if (data.size() != 2) {
            return new Skipped(identity, SkipReason.MALFORMED, "announcement data does not decode to (bytes, bytes)");
        }
        return new Processed(new StealthEvent.Announcement(
                identity,
                chain.name(),
                rawLog.blockNumber(),
                processedAt,
                uint256(rawLog.topic(1)),
                address(rawLog.topic(2)),
                address(rawLog.topic(3)),
                bytesHex(data.get(0)),
                bytesHex(data.get(1))
        ));
    }

    private ProcessingResult decodeRegistration(RawLog rawLog, ChainDescriptor chain, EventIdentity identity, Instant processedAt) {
        if (rawLog.topics().size() < 3) {
            return new Skipped(identity, SkipReason.MALFORMED, "registration expects 3 topics, got " + rawLog.topics().size());
        }
        List<Type> data = FunctionReturnDecoder.decode(rawLog.data(), StealthContracts.STEALTH_META_ADDRESS_SET.getNonIndexedParameters());
        if (data.size() != 1) {
            return new Skipped(identity, SkipReason.MALFORMED, "registration data does not decode to (bytes)");
        }
        return new Processed(new StealthEvent.Registration(
                identity,
                chain.name(),
                rawLog.blockNumber(),
                processedAt,
                uint256(rawLog.topic(2)),
                address(rawLog.topic(1)),
                bytesHex(data.get(0))
        ));
    }

    private static String address(String topic) {
        Address address = (Address) FunctionReturnDecoder.decodeIndexedValue(topic, TypeReference.create(Address.class));
        return address.getValue();
    }

    private static BigInteger uint256(String topic) {
        Uint256 value = (Uint256) FunctionReturnDecoder.decodeIndexedValue(topic, TypeReference.create(Uint256.class));
        return value.getValue();
    }

    private static String bytesHex(Type value) {
        return Numeric.toHexString(((DynamicBytes) value).getValue());
    }
}
