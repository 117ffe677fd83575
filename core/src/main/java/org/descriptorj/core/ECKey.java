/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.descriptorj.core;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.UnsignedBytes;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.math.ec.FixedPointUtil;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Represents an elliptic curve public and (optionally) private key on secp256k1. The public key is always
 * present; the private key is {@code null} for watching-only keys parsed from hex or from an xpub.</p>
 *
 * <p>A key remembers whether its public key is serialized in compressed (33 byte) or uncompressed (65 byte)
 * form, because the serialization is what goes into scripts and what gets hashed into addresses. Instances
 * are immutable.</p>
 */
public class ECKey {

    /** Compares pub key bytes using {@link com.google.common.primitives.UnsignedBytes#lexicographicalComparator()} */
    public static final Comparator<ECKey> PUBKEY_COMPARATOR = new Comparator<ECKey>() {
        private final Comparator<byte[]> comparator = UnsignedBytes.lexicographicalComparator();

        @Override
        public int compare(ECKey k1, ECKey k2) {
            return comparator.compare(k1.getPubKey(), k2.getPubKey());
        }
    };

    // The parameters of the secp256k1 curve that Bitcoin uses.
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** The parameters of the secp256k1 curve that Bitcoin uses. */
    public static final ECDomainParameters CURVE;

    static {
        // Tell Bouncy Castle to precompute data that's needed during secp256k1 calculations.
        FixedPointUtil.precompute(CURVE_PARAMS.getG());
        CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(),
                CURVE_PARAMS.getH());
    }

    @Nullable protected final BigInteger priv;
    protected final ECPoint pub;
    protected final boolean compressed;

    protected ECKey(@Nullable BigInteger priv, ECPoint pub, boolean compressed) {
        if (priv != null) {
            checkArgument(isPrivKeyInRange(priv), "private key out of range");
        }
        this.priv = priv;
        this.pub = checkNotNull(pub).normalize();
        this.compressed = compressed;
    }

    /**
     * Creates an ECKey given the private key only. The public key is calculated from it.
     *
     * @param compressed whether the public key should be serialized in compressed form
     */
    public static ECKey fromPrivate(BigInteger privKey, boolean compressed) {
        return new ECKey(privKey, publicPointFromPrivate(privKey), compressed);
    }

    /**
     * Creates an ECKey that cannot be used for signing, only verifying signatures, from the given encoded point.
     * The compression state of pub will be preserved.
     *
     * @throws IllegalArgumentException if the bytes are not a valid compressed or uncompressed point on secp256k1
     */
    public static ECKey fromPublicOnly(byte[] pub) {
        checkArgument(isPubKeyCanonical(pub), "public key is not canonical");
        ECPoint point = CURVE.getCurve().decodePoint(pub); // throws IllegalArgumentException for points off the curve
        checkArgument(!point.isInfinity() && point.isValid(), "public key is not on the curve");
        return new ECKey(null, point, pub.length == 33);
    }

    /**
     * Returns public key point from the given private key. To convert a byte array into a BigInteger,
     * use {@code new BigInteger(1, bytes);}
     */
    public static ECPoint publicPointFromPrivate(BigInteger privKey) {
        // FixedPointCombMultiplier does not support scalars longer than the group order.
        if (privKey.bitLength() > CURVE.getN().bitLength()) {
            privKey = privKey.mod(CURVE.getN());
        }
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    /** Returns true if the given integer is a usable private key, that is within {@code [1, n)}. */
    public static boolean isPrivKeyInRange(BigInteger priv) {
        return priv.signum() > 0 && priv.compareTo(CURVE.getN()) < 0;
    }

    /**
     * Returns true if the given pubkey is canonical, i.e. the correct length taking into account compression.
     */
    public static boolean isPubKeyCanonical(byte[] pubkey) {
        if (pubkey.length < 33)
            return false;
        if (pubkey[0] == 0x04) {
            // Uncompressed pubkey
            if (pubkey.length != 65)
                return false;
        } else if (pubkey[0] == 0x02 || pubkey[0] == 0x03) {
            // Compressed pubkey
            if (pubkey.length != 33)
                return false;
        } else
            return false;
        return true;
    }

    /** Returns true if this key has access to private key bytes. */
    public boolean hasPrivKey() {
        return priv != null;
    }

    /** Returns true if this key is watch only, meaning it has a public key but no private key. */
    public boolean isPubKeyOnly() {
        return priv == null;
    }

    /**
     * Gets the private key in the form of an integer field element.
     *
     * @throws IllegalStateException if the private key is not available.
     */
    public BigInteger getPrivKey() {
        if (priv == null)
            throw new IllegalStateException("This key has no private key");
        return priv;
    }

    /**
     * Returns a 32 byte array containing the private key.
     *
     * @throws IllegalStateException if the private key bytes are missing.
     */
    public byte[] getPrivKeyBytes() {
        return Utils.bigIntegerToBytes(getPrivKey(), 32);
    }

    /** Gets the raw public key value. This appears in transaction scriptSigs. Note that this is <b>not</b> the same as the pubKeyHash/address. */
    public byte[] getPubKey() {
        return pub.getEncoded(compressed);
    }

    /** Gets the public key in the form of an elliptic curve point object from Bouncy Castle. */
    public ECPoint getPubKeyPoint() {
        return pub;
    }

    /** Gets the hash160 form of the public key (as seen in addresses). */
    public byte[] getPubKeyHash() {
        return Utils.sha256hash160(getPubKey());
    }

    /** Returns whether this key is using the compressed form or not. */
    public boolean isCompressed() {
        return compressed;
    }

    public String getPublicKeyAsHex() {
        return Utils.HEX.encode(getPubKey());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || !(o instanceof ECKey)) return false;
        ECKey other = (ECKey) o;
        return Objects.equals(this.priv, other.priv)
                && Objects.equals(this.pub, other.pub)
                && this.compressed == other.compressed;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getPubKey());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("pub", getPublicKeyAsHex())
                .add("isPubKeyOnly", isPubKeyOnly())
                .toString();
    }
}
