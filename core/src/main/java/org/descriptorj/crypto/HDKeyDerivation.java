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

import org.descriptorj.core.ECKey;
import org.descriptorj.core.Utils;
import org.bouncycastle.math.ec.ECPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Implementation of the <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP 32</a>
 * deterministic wallet child key generation algorithm.
 *
 * <p>A derivation that produces an invalid key is reported with {@link HDDerivationException.Reason#INVALID_CHILD_KEY}
 * and is not retried with the next index: the caller asked for a specific child and gets exactly that child or an
 * error.</p>
 */
public final class HDKeyDerivation {
    private static final Logger log = LoggerFactory.getLogger(HDKeyDerivation.class);

    /** Deepest level a key can be serialized at, since depth is stored in a single byte. */
    public static final int MAX_DEPTH = 255;

    private HDKeyDerivation() { }

    /**
     * Derives a key given the "extended" child number, ie. the 0x80000000 bit of the value that you
     * pass for {@code childNumber} will determine whether to use hardened derivation or not.
     */
    public static DeterministicKey deriveChildKey(DeterministicKey parent, int childNumber) {
        return deriveChildKey(parent, new ChildNumber(childNumber));
    }

    /**
     * @throws HDDerivationException if private derivation is attempted for a public-only parent key, if the
     * resulting derived key is invalid (eg. private key == 0) or if the parent is already at depth 255.
     */
    public static DeterministicKey deriveChildKey(DeterministicKey parent, ChildNumber childNumber)
            throws HDDerivationException {
        if (parent.getDepth() >= MAX_DEPTH)
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_PATH,
                    "Cannot derive below depth " + MAX_DEPTH);
        if (!parent.hasPrivKey()) {
            RawKeyBytes rawKey = deriveChildKeyBytesFromPublic(parent, childNumber);
            ECPoint point = ECKey.CURVE.getCurve().decodePoint(rawKey.keyBytes);
            return new DeterministicKey(point, rawKey.chainCode, parent.getDepth() + 1, parent.getFingerprint(),
                    childNumber);
        } else {
            RawKeyBytes rawKey = deriveChildKeyBytesFromPrivate(parent, childNumber);
            return new DeterministicKey(new BigInteger(1, rawKey.keyBytes), rawKey.chainCode,
                    parent.getDepth() + 1, parent.getFingerprint(), childNumber);
        }
    }

    public static RawKeyBytes deriveChildKeyBytesFromPrivate(DeterministicKey parent,
                                                              ChildNumber childNumber) throws HDDerivationException {
        checkArgument(parent.hasPrivKey(), "Parent key must have private key bytes for this method.");
        byte[] parentPublicKey = parent.getPubKey();
        checkState(parentPublicKey.length == 33, "Parent pubkey must be 33 bytes, but is " + parentPublicKey.length);
        ByteBuffer data = ByteBuffer.allocate(37);
        if (childNumber.isHardened()) {
            data.put((byte) 0);
            data.put(parent.getPrivKeyBytes());
        } else {
            data.put(parentPublicKey);
        }
        data.putInt(childNumber.i());
        byte[] i = HDUtils.hmacSha512(parent.getChainCode(), data.array());
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        BigInteger ilInt = new BigInteger(1, il);
        assertLessThanN(ilInt, childNumber);
        final BigInteger priv = parent.getPrivKey();
        BigInteger ki = priv.add(ilInt).mod(ECKey.CURVE.getN());
        if (ki.signum() == 0) {
            log.debug("Child {} has a zero private key", childNumber);
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_CHILD_KEY,
                    "Illegal derived key: derived private key equals 0.");
        }
        return new RawKeyBytes(Utils.bigIntegerToBytes(ki, 32), chainCode);
    }

    public static RawKeyBytes deriveChildKeyBytesFromPublic(DeterministicKey parent, ChildNumber childNumber)
            throws HDDerivationException {
        if (childNumber.isHardened())
            throw new HDDerivationException(HDDerivationException.Reason.HARDENED_FROM_PUBLIC,
                    "Can't use private derivation with public keys only: " + childNumber);
        byte[] parentPublicKey = parent.getPubKey();
        checkState(parentPublicKey.length == 33, "Parent pubkey must be 33 bytes, but is " + parentPublicKey.length);
        ByteBuffer data = ByteBuffer.allocate(37);
        data.put(parentPublicKey);
        data.putInt(childNumber.i());
        byte[] i = HDUtils.hmacSha512(parent.getChainCode(), data.array());
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        BigInteger ilInt = new BigInteger(1, il);
        assertLessThanN(ilInt, childNumber);
        ECPoint Ki = ECKey.publicPointFromPrivate(ilInt).add(parent.getPubKeyPoint());
        if (Ki.isInfinity()) {
            log.debug("Child {} is the point at infinity", childNumber);
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_CHILD_KEY,
                    "Illegal derived key: derived public key equals infinity.");
        }
        return new RawKeyBytes(Ki.getEncoded(true), chainCode);
    }

    private static void assertLessThanN(BigInteger integer, ChildNumber childNumber) {
        if (integer.compareTo(ECKey.CURVE.getN()) >= 0) {
            log.debug("Child {} has IL >= n", childNumber);
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_CHILD_KEY,
                    "Illegal derived key: I_L >= n");
        }
    }

    public static class RawKeyBytes {
        public final byte[] keyBytes, chainCode;

        public RawKeyBytes(byte[] keyBytes, byte[] chainCode) {
            this.keyBytes = keyBytes;
            this.chainCode = chainCode;
        }
    }
}
