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


package org.descriptorj.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>The checksum of output script descriptors as defined by
 * <a href="https://github.com/bitcoin/bips/blob/master/bip-0380.mediawiki">BIP 380</a>.</p>
 *
 * <p>Every character of the descriptor is mapped to its position in {@link #INPUT_CHARSET}. The low five bits of
 * the position form one symbol, and the group number (position divided by 32) of each run of three characters forms
 * one more. The symbols are fed to a BCH code over GF(32) whose eight-symbol remainder is the checksum, written in
 * the bech32 alphabet.</p>
 */
public final class DescriptorChecksum {
    /** Characters a descriptor may contain, ordered so that case errors only change the group number. */
    public static final String INPUT_CHARSET =
            "0123456789()[],'/*abcdefgh@:$%{}" +
            "IJKLMNOPQRSTUVWXYZ&+-.;<=>?!^_|~" +
            "ijklmnopqrstuvwxyzABCDEFGH`#\"\\ ";

    /** The bech32 alphabet the checksum is written in. */
    public static final String CHECKSUM_CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    /** Number of symbols in a checksum. */
    public static final int LENGTH = 8;

    private static final long[] GENERATOR = {
            0xf5dee51989L, 0xa9fdca3312L, 0x1bab10e32dL, 0x3706b1677aL, 0x644d626ffdL
    };

    private DescriptorChecksum() { }

    private static long polymod(long c, int val) {
        long c0 = c >> 35;
        c = ((c & 0x7ffffffffL) << 5) ^ val;
        for (int i = 0; i < GENERATOR.length; i++) {
            if (((c0 >> i) & 1) != 0)
                c ^= GENERATOR[i];
        }
        return c;
    }

    /**
     * Feeds the symbols of the given text into the checksum engine.
     *
     * @return the engine state, or -1 if the text contains a character outside {@link #INPUT_CHARSET}
     */
    private static long expand(String text) {
        long c = 1;
        int cls = 0;
        int clsCount = 0;
        for (int i = 0; i < text.length(); i++) {
            int pos = INPUT_CHARSET.indexOf(text.charAt(i));
            if (pos < 0)
                return -1;
            c = polymod(c, pos & 31);
            cls = cls * 3 + (pos >> 5);
            if (++clsCount == 3) {
                c = polymod(c, cls);
                cls = 0;
                clsCount = 0;
            }
        }
        if (clsCount > 0)
            c = polymod(c, cls);
        return c;
    }

    /**
     * Computes the eight character checksum of a descriptor.
     *
     * @param text the descriptor, without {@code #} and checksum
     * @throws IllegalArgumentException if the text contains a character outside {@link #INPUT_CHARSET}
     */
    public static String create(String text) {
        long c = expand(text);
        checkArgument(c >= 0, "Descriptor contains a character outside the descriptor character set: %s", text);
        for (int j = 0; j < LENGTH; j++)
            c = polymod(c, 0);
        c ^= 1;
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int j = 0; j < LENGTH; j++)
            sb.append(CHECKSUM_CHARSET.charAt((int) ((c >> (5 * (7 - j))) & 31)));
        return sb.toString();
    }

    /**
     * Returns true if the checksum is valid for the given descriptor text. Malformed input of any kind yields
     * false.
     */
    public static boolean verify(String text, String checksum) {
        if (checksum.length() != LENGTH)
            return false;
        long c = expand(text);
        if (c < 0)
            return false;
        for (int j = 0; j < LENGTH; j++) {
            int value = CHECKSUM_CHARSET.indexOf(checksum.charAt(j));
            if (value < 0)
                return false;
            c = polymod(c, value);
        }
        return c == 1;
    }

    /** Appends {@code #} and the checksum to the given descriptor text. */
    public static String addChecksum(String text) {
        return text + "#" + create(text);
    }
}
