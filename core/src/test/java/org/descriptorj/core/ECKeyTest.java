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

import com.google.common.collect.Lists;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

import static org.descriptorj.core.Utils.HEX;
import static org.junit.Assert.*;

public class ECKeyTest {
    private static final String G_COMPRESSED =
            "0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";
    private static final String G_UNCOMPRESSED =
            "0479be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798"
            + "483ada7726a3c4655da4fbfc0e1108a8fd17b448a68554199c47d08ffb10d4b8";

    @Test
    public void fromPrivate() {
        ECKey compressed = ECKey.fromPrivate(BigInteger.ONE, true);
        assertEquals(G_COMPRESSED, compressed.getPublicKeyAsHex());
        assertEquals("751e76e8199196d454941c45d1b3a323f1433bd6", HEX.encode(compressed.getPubKeyHash()));
        assertTrue(compressed.hasPrivKey());
        assertFalse(compressed.isPubKeyOnly());

        ECKey uncompressed = ECKey.fromPrivate(BigInteger.ONE, false);
        assertEquals(G_UNCOMPRESSED, uncompressed.getPublicKeyAsHex());
        assertFalse(uncompressed.isCompressed());
        assertNotEquals(compressed, uncompressed);
    }

    @Test
    public void fromPublicOnly() {
        ECKey key = ECKey.fromPublicOnly(HEX.decode(G_UNCOMPRESSED));
        assertFalse(key.isCompressed());
        assertTrue(key.isPubKeyOnly());
        assertEquals(G_UNCOMPRESSED, key.getPublicKeyAsHex());
        assertEquals(ECKey.fromPrivate(BigInteger.ONE, true).getPubKeyPoint(),
                ECKey.fromPublicOnly(HEX.decode(G_COMPRESSED)).getPubKeyPoint());
    }

    @Test(expected = IllegalStateException.class)
    public void noPrivateKey() {
        ECKey.fromPublicOnly(HEX.decode(G_COMPRESSED)).getPrivKeyBytes();
    }

    @Test
    public void nonCanonicalPublicKeys() {
        assertFalse(ECKey.isPubKeyCanonical(new byte[32]));
        assertFalse(ECKey.isPubKeyCanonical(HEX.decode("01" + G_COMPRESSED.substring(2))));
        assertFalse(ECKey.isPubKeyCanonical(HEX.decode("04" + G_COMPRESSED.substring(2))));
        assertFalse(ECKey.isPubKeyCanonical(HEX.decode("02" + G_UNCOMPRESSED.substring(2))));
        assertTrue(ECKey.isPubKeyCanonical(HEX.decode(G_COMPRESSED)));
        assertTrue(ECKey.isPubKeyCanonical(HEX.decode(G_UNCOMPRESSED)));
    }

    @Test
    public void pointNotOnCurve() {
        // x = 5 has no square root of x^3 + 7 on secp256k1
        byte[] compressed = new byte[33];
        compressed[0] = 0x02;
        compressed[32] = 0x05;
        try {
            ECKey.fromPublicOnly(compressed);
            fail();
        } catch (IllegalArgumentException x) {
            // expected
        }
        // G with its y coordinate altered
        byte[] uncompressed = HEX.decode(G_UNCOMPRESSED);
        uncompressed[64] ^= 1;
        try {
            ECKey.fromPublicOnly(uncompressed);
            fail();
        } catch (IllegalArgumentException x) {
            // expected
        }
    }

    @Test
    public void privateKeyRange() {
        assertFalse(ECKey.isPrivKeyInRange(BigInteger.ZERO));
        assertTrue(ECKey.isPrivKeyInRange(BigInteger.ONE));
        assertFalse(ECKey.isPrivKeyInRange(ECKey.CURVE.getN()));
        assertTrue(ECKey.isPrivKeyInRange(ECKey.CURVE.getN().subtract(BigInteger.ONE)));
    }

    @Test
    public void pubkeyComparator() {
        ECKey k1 = ECKey.fromPublicOnly(HEX.decode(
                "04a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bd"
                + "5b8dec5235a0fa8722476c7709c02559e3aa73aa03918ba2d492eea75abea235"));
        ECKey k2 = ECKey.fromPublicOnly(HEX.decode(
                "03a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bd"));
        ECKey k3 = ECKey.fromPublicOnly(HEX.decode(G_COMPRESSED));
        List<ECKey> keys = Lists.newArrayList(k1, k2, k3);
        Collections.sort(keys, ECKey.PUBKEY_COMPARATOR);
        assertEquals(Lists.newArrayList(k3, k2, k1), keys);
    }
}
