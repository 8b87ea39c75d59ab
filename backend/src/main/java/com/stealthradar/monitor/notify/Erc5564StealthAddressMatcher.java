package com.stealthradar.monitor.notify;

import com.stealthradar.domain.StealthEvent;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECPoint;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * ERC-5564 scheme 1 (secp256k1 with view tags) recipient check.
 *
 * <p>A scan key is {@code <viewingPrivateKeyHex>:<spendingPublicKeyHex>}. For an announcement with ephemeral
 * public key {@code P_e}: {@code S = p_view * P_e}, {@code s_h = keccak256(compressed(S))}; the view tag
 * (metadata byte 0) must equal {@code s_h[0]}, and the stealth address is the address of
 * {@code P_spend + s_h * G}. Malformed keys or announcements never match.
 */
@Slf4j
@Component
public class Erc5564StealthAddressMatcher implements StealthAddressMatcher {

    static final BigInteger SCHEME_SECP256K1 = BigInteger.ONE;
    static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");

    @Override
    public boolean matches(StealthEvent.Announcement announcement, List<String> scanKeys) {
        if (scanKeys == null || scanKeys.isEmpty() || !SCHEME_SECP256K1.equals(announcement.schemeId())) {
            return false;
        }
        ECPoint ephemeral;
        byte[] metadata;
        try {
            ephemeral = CURVE.getCurve().decodePoint(Numeric.hexStringToByteArray(announcement.ephemeralPubKey()));
            metadata = Numeric.hexStringToByteArray(announcement.metadata() != null ? announcement.metadata() : "0x");
        } catch (RuntimeException e) {
            log.debug("Announcement {} has an invalid ephemeral key: {}", announcement.identity(), e.getMessage());
            return false;
        }
        for (String raw : scanKeys) {
            ScanKey key = ScanKey.parse(raw);
            if (key == null) {
                continue;
            }
            byte[] hashedSecret = hashedSharedSecret(key.viewingPrivateKey(), ephemeral);
            if (metadata.length > 0 && metadata[0] != hashedSecret[0]) {
                continue;
            }
            String derived = stealthAddress(key.spendingPublicKey(), hashedSecret);
            if (derived.equalsIgnoreCase(announcement.stealthAddress())) {
                return true;
            }
        }
        return false;
    }

    /**
     * keccak256 of the compressed ECDH point. Symmetric: {@code p_view * P_e == p_e * P_view}.
     */
    static byte[] hashedSharedSecret(BigInteger privateKey, ECPoint publicKey) {
        ECPoint shared = publicKey.multiply(privateKey).normalize();
        return Hash.sha3(shared.getEncoded(true));
    }

    static String stealthAddress(ECPoint spendingPublicKey, byte[] hashedSecret) {
        BigInteger tweak = new BigInteger(1, hashedSecret).mod(CURVE.getN());
        ECPoint stealthPublicKey = spendingPublicKey.add(CURVE.getG().multiply(tweak)).normalize();
        byte[] uncompressed = stealthPublicKey.getEncoded(false);
        byte[] hash = Hash.sha3(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        return Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }

    record ScanKey(BigInteger viewingPrivateKey, ECPoint spendingPublicKey) {

        static ScanKey parse(String raw) {
            if (raw == null) {
                return null;
            }
            int sep = raw.indexOf(':');
            if (sep <= 0 || sep == raw.length() - 1) {
                return null;
            }
            try {
                BigInteger viewing = Numeric.toBigInt(raw.substring(0, sep).trim());
                if (viewing.signum() <= 0 || viewing.compareTo(CURVE.getN()) >= 0) {
                    return null;
                }
                ECPoint spending = CURVE.getCurve().decodePoint(Numeric.hexStringToByteArray(raw.substring(sep + 1).trim()));
                return new ScanKey(viewing, spending);
            } catch (RuntimeException e) {
                return null;
            }
        }
    }
}
