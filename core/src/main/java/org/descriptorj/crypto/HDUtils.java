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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static utilities used in BIP 32 Hierarchical Deterministic Wallets (HDW).
 */
public final class HDUtils {
    private static final Joiner PATH_JOINER = Joiner.on("/");
    private static final Splitter PATH_SPLITTER = Splitter.on('/');

    private HDUtils() { }

    static HMac createHmacSha512Digest(byte[] key) {
        SHA512Digest digest = new SHA512Digest();
        HMac hMac = new HMac(digest);
        hMac.init(new KeyParameter(key));
        return hMac;
    }

    static byte[] hmacSha512(HMac hmacSha512, byte[] input) {
        hmacSha512.reset();
        hmacSha512.update(input, 0, input.length);
        byte[] out = new byte[64];
        hmacSha512.doFinal(out, 0);
        return out;
    }

    public static byte[] hmacSha512(byte[] key, byte[] data) {
        return hmacSha512(createHmacSha512Digest(key), data);
    }

    /** Append a derivation level to an existing path */
    public static ImmutableList<ChildNumber> append(List<ChildNumber> path, ChildNumber childNumber) {
        return ImmutableList.<ChildNumber>builder().addAll(path).add(childNumber).build();
    }

    /** Concatenate two derivation paths */
    public static ImmutableList<ChildNumber> concat(List<ChildNumber> path, List<ChildNumber> path2) {
        return ImmutableList.<ChildNumber>builder().addAll(path).addAll(path2).build();
    }

    /** Convert to a string path, starting with "m/" and using {@code h} for hardened steps */
    public static String formatPath(List<ChildNumber> path) {
        return PATH_JOINER.join(ImmutableList.builder().add("m").addAll(path).build());
    }

    /**
     * The path is a human-friendly representation of the deterministic path. For example:
     *
     * "m/44h/0h/0h" or "/44'/0'" or "0H/1"
     *
     * An optional leading {@code m} is skipped. Each step is a decimal index of at most 2^31-1 followed by
     * an optional hardened marker, one of {@code h}, {@code H} or {@code '}.
     *
     * @throws HDDerivationException with reason {@link HDDerivationException.Reason#INVALID_PATH} if the path
     *         cannot be parsed
     */
    public static List<ChildNumber> parsePath(String path) {
        String trimmed = path.trim();
        if (trimmed.equals("m") || trimmed.equals("M"))
            return ImmutableList.of();
        if (trimmed.startsWith("m/") || trimmed.startsWith("M/"))
            trimmed = trimmed.substring(2);
        else if (trimmed.startsWith("/"))
            trimmed = trimmed.substring(1);
        List<ChildNumber> nodes = new ArrayList<>();
        if (trimmed.isEmpty())
            return nodes;
        for (String n : PATH_SPLITTER.split(trimmed)) {
            nodes.add(parseStep(n, path));
        }
        return nodes;
    }

    private static ChildNumber parseStep(String step, String path) {
        boolean isHard = step.endsWith("'") || step.endsWith("h") || step.endsWith("H");
        String digits = isHard ? step.substring(0, step.length() - 1) : step;
        if (digits.isEmpty() || digits.length() > 10)
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_PATH,
                    "Invalid path step '" + step + "' in " + path);
        for (int i = 0; i < digits.length(); i++) {
            if (digits.charAt(i) < '0' || digits.charAt(i) > '9')
                throw new HDDerivationException(HDDerivationException.Reason.INVALID_PATH,
                        "Invalid path step '" + step + "' in " + path);
        }
        long value = Long.parseLong(digits);
        if (value > Integer.MAX_VALUE)
            throw new HDDerivationException(HDDerivationException.Reason.INVALID_PATH,
                    "Path step out of range: " + step);
        return new ChildNumber((int) value, isHard);
    }
}
