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

import java.math.BigInteger;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses and generates private keys in the form used by the Bitcoin "dumpprivkey" command, also known as the
 * Wallet Import Format (WIF). This is the private key bytes with a header byte and 4 checksum bytes at the end.
 * If there are 33 private key bytes instead of 32, then the last byte is a discriminator value for the
 * compressed pubkey.
 */
public class DumpedPrivateKey {
    private final NetworkParameters params;
    private final byte[] bytes;

    /**
     * Construct a private key from its Base58 representation.
     *
     * @param params the expected network parameters
     * @param base58 the textual form of the private key
     * @throws AddressFormatException if the given base58 doesn't parse or the checksum is invalid
     * @throws AddressFormatException.WrongNetwork if the given private key is valid but for a different chain (eg testnet vs mainnet)
     */
    public static DumpedPrivateKey fromBase58(NetworkParameters params, String base58)
            throws AddressFormatException {
        byte[] versionAndDataBytes = Base58.decodeChecked(base58);
        if (versionAndDataBytes.length == 0)
            throw new AddressFormatException.InvalidDataLength("Empty private key");
        int version = versionAndDataBytes[0] & 0xFF;
        byte[] bytes = Arrays.copyOfRange(versionAndDataBytes, 1, versionAndDataBytes.length);
        if (version != params.getDumpedPrivateKeyHeader())
            throw new AddressFormatException.WrongNetwork(version);
        boolean compressed = bytes.length == 33 && bytes[32] == 1;
        if (!compressed && bytes.length != 32) {
            throw new AddressFormatException.InvalidDataLength(
                    "Wrong number of bytes for a private key (32 or 33): " + bytes.length);
        }
        BigInteger priv = new BigInteger(1, Arrays.copyOf(bytes, 32));
        if (!ECKey.isPrivKeyInRange(priv))
            throw new AddressFormatException("Private key out of range");
        return new DumpedPrivateKey(params, bytes);
    }

    private DumpedPrivateKey(NetworkParameters params, byte[] bytes) {
        this.params = checkNotNull(params);
        this.bytes = bytes;
    }

    /** Creates the WIF form of the given key. */
    public static DumpedPrivateKey fromKey(NetworkParameters params, ECKey key) {
        byte[] keyBytes = key.getPrivKeyBytes();
        if (key.isCompressed()) {
            byte[] withFlag = Arrays.copyOf(keyBytes, 33);
            withFlag[32] = 1;
            keyBytes = withFlag;
        }
        return new DumpedPrivateKey(params, keyBytes);
    }

    /**
     * Returns an ECKey created from this encoded private key.
     */
    public ECKey getKey() {
        return ECKey.fromPrivate(new BigInteger(1, Arrays.copyOf(bytes, 32)), isPubKeyCompressed());
    }

    /**
     * Returns true if the public key corresponding to this private key is compressed.
     */
    public boolean isPubKeyCompressed() {
        return bytes.length == 33 && bytes[32] == 1;
    }

    public String toBase58() {
        return Base58.encodeChecked(params.getDumpedPrivateKeyHeader(), bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
