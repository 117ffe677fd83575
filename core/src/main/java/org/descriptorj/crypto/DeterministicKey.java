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


package org.descriptorj.crypto;

import com.google.common.base.MoreObjects;
import org.descriptorj.core.AddressFormatException;
import org.descriptorj.core.Base58;
import org.descriptorj.core.ECKey;
import org.descriptorj.core.NetworkParameters;
import org.descriptorj.core.Utils;
import org.bouncycastle.math.ec.ECPoint;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A deterministic key is a node in a BIP32 key tree. As per
 * <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">the BIP 32 specification</a> it is a pair
 * (key, chaincode). If you know its chain code you can derive more keys from it.
 *
 * <p>Unlike a full wallet hierarchy, a key here does not know its ancestors. It only carries the fields of the
 * serialized form: depth, parent fingerprint and the child number it was derived with. Public keys are always
 * compressed.</p>
 */
public class DeterministicKey extends ECKey {
    /** Length of a decoded extended key, without the base58 checksum. */
    public static final int SERIALIZED_LENGTH = 78;

    private final int depth;
    private final int parentFingerprint; // 0 if this key is root node of key hierarchy
    private final ChildNumber childNumber;

    /** 32 bytes */
    private final byte[] chainCode;

    /** Constructs a public-only key from its components. */
    public DeterministicKey(ECPoint publicAsPoint, byte[] chainCode, int depth, int parentFingerprint,
                            ChildNumber childNumber) {
        this(null, publicAsPoint, chainCode, depth, parentFingerprint, childNumber);
    }

    /** Constructs a private key from its components. The public key is calculated from it. */
    public DeterministicKey(BigInteger priv, byte[] chainCode, int depth, int parentFingerprint,
                            ChildNumber childNumber) {
        this(priv, ECKey.publicPointFromPrivate(priv), chainCode, depth, parentFingerprint, childNumber);
    }

    private DeterministicKey(@Nullable BigInteger priv, ECPoint pub, byte[] chainCode, int depth,
                             int parentFingerprint, ChildNumber childNumber) {
        super(priv, pub, true);
        checkArgument(chainCode.length == 32);
        checkArgument(depth >= 0 && depth <= 255, "depth out of range: %s", depth);
        this.chainCode = Arrays.copyOf(chainCode, chainCode.length);
        this.depth = depth;
        this.parentFingerprint = parentFingerprint;
        this.childNumber = checkNotNull(childNumber);
    }

    /**
     * Returns the number of derivation steps between the master key and this key. The master key has depth 0.
     */
    public int getDepth() {
        return depth;
    }

    /** Returns the last element of the path used to derive this key, {@link ChildNumber#ZERO} for the master. */
    public ChildNumber getChildNumber() {
        return childNumber;
    }

    /** Returns a copy of the 32 byte chain code. */
    public byte[] getChainCode() {
        return Arrays.copyOf(chainCode, chainCode.length);
    }

    /**
     * Returns RIPE-MD160(SHA256(pub key bytes)).
     */
    public byte[] getIdentifier() {
        return Utils.sha256hash160(getPubKey());
    }

    /**
     * Return this key's fingerprint: the first four bytes of its identifier, as an int.
     */
    public int getFingerprint() {
        return ByteBuffer.wrap(Arrays.copyOfRange(getIdentifier(), 0, 4)).getInt();
    }

    /**
     * Return the fingerprint of the key from which this key was derived, if this is a
     * child key, or else an array of four zero-value bytes.
     */
    public int getParentFingerprint() {
        return parentFingerprint;
    }

    /**
     * Returns a copy of this key with the private key removed.
     */
    public DeterministicKey dropPrivateBytes() {
        if (isPubKeyOnly())
            return this;
        return new DeterministicKey(getPubKeyPoint(), chainCode, depth, parentFingerprint, childNumber);
    }

    /**
     * Derives a descendant of this key by following the given relative path.
     *
     * @throws HDDerivationException if a step is hardened and this key has no private key, if a derived key is
     *         invalid, or if the result would be deeper than 255 levels
     */
    public DeterministicKey derive(List<ChildNumber> path) {
        DeterministicKey key = this;
        for (ChildNumber step : path)
            key = HDKeyDerivation.deriveChildKey(key, step);
        return key;
    }

    /** Derives the direct child of this key with the given child number. */
    public DeterministicKey derive(ChildNumber child) {
        return HDKeyDerivation.deriveChildKey(this, child);
    }

    public String serializePubB58(NetworkParameters params) {
        return Base58.encodeChecked(serialize(params, true));
    }

    public String serializePrivB58(NetworkParameters params) {
        return Base58.encodeChecked(serialize(params, false));
    }

    private byte[] serialize(NetworkParameters params, boolean pub) {
        ByteBuffer ser = ByteBuffer.allocate(SERIALIZED_LENGTH);
        ser.putInt(pub ? params.getBip32HeaderP2PKHpub() : params.getBip32HeaderP2PKHpriv());
        ser.put((byte) depth);
        ser.putInt(parentFingerprint);
        ser.putInt(childNumber.i());
        ser.put(chainCode);
        if (pub) {
            ser.put(getPubKey());
        } else {
            ser.put((byte) 0);
            ser.put(getPrivKeyBytes());
        }
        return ser.array();
    }

    /**
     * Deserialize a base-58-encoded HD Key.
     *
     * @throws AddressFormatException if the string is not valid base58check, is not 78 bytes long, has a version
     *         header other than the xpub or xprv header of the given network, or encodes an invalid key
     */
    public static DeterministicKey deserializeB58(String base58, NetworkParameters params) {
        return deserialize(params, Base58.decodeChecked(base58));
    }

    /**
     * Deserialize an HD Key.
     */
    public static DeterministicKey deserialize(NetworkParameters params, byte[] serializedKey) {
        if (serializedKey.length != SERIALIZED_LENGTH)
            throw new AddressFormatException.InvalidDataLength(
                    "Found " + serializedKey.length + " bytes in extended key, expected " + SERIALIZED_LENGTH);
        ByteBuffer buffer = ByteBuffer.wrap(serializedKey);
        int header = buffer.getInt();
        final boolean pub = header == params.getBip32HeaderP2PKHpub();
        final boolean priv = header == params.getBip32HeaderP2PKHpriv();
        if (!(pub || priv))
            throw new AddressFormatException.InvalidPrefix(
                    String.format(Locale.US, "Unknown extended key version for this network: 0x%08x", header));
        int depth = buffer.get() & 0xFF;
        final int parentFingerprint = buffer.getInt();
        final int i = buffer.getInt();
        final ChildNumber childNumber = new ChildNumber(i);
        if (depth == 0 && parentFingerprint != 0)
            throw new AddressFormatException("Zero depth with non-zero parent fingerprint");
        if (depth == 0 && i != 0)
            throw new AddressFormatException("Zero depth with non-zero child number");
        byte[] chainCode = new byte[32];
        buffer.get(chainCode);
        byte[] data = new byte[33];
        buffer.get(data);
        if (pub) {
            if (data[0] != 0x02 && data[0] != 0x03)
                throw new AddressFormatException("Invalid public key prefix: " + (data[0] & 0xFF));
            ECPoint point;
            try {
                point = ECKey.fromPublicOnly(data).getPubKeyPoint();
            } catch (IllegalArgumentException x) {
                throw new AddressFormatException("Public key is not on the curve");
            }
            return new DeterministicKey(point, chainCode, depth, parentFingerprint, childNumber);
        } else {
            if (data[0] != 0x00)
                throw new AddressFormatException("Invalid private key prefix: " + (data[0] & 0xFF));
            BigInteger key = new BigInteger(1, Arrays.copyOfRange(data, 1, 33));
            if (!ECKey.isPrivKeyInRange(key))
                throw new AddressFormatException("Private key out of range");
            return new DeterministicKey(key, chainCode, depth, parentFingerprint, childNumber);
        }
    }

    /**
     * Verifies equality of the key material and of every field of the serialized form.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeterministicKey other = (DeterministicKey) o;
        return super.equals(other)
                && Arrays.equals(this.chainCode, other.chainCode)
                && depth == other.depth
                && parentFingerprint == other.parentFingerprint
                && childNumber.equals(other.childNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), Arrays.hashCode(chainCode), depth, childNumber);
    }

    @Override
    public String toString() {
        final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).omitNullValues();
        helper.add("pub", getPublicKeyAsHex());
        helper.add("chainCode", Utils.HEX.encode(chainCode));
        helper.add("depth", depth);
        helper.add("childNumber", childNumber);
        helper.add("isPubKeyOnly", isPubKeyOnly());
        return helper.toString();
    }
}
