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

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;

import static org.descriptorj.core.Utils.HEX;
import static org.junit.Assert.*;

public class HDUtilsTest {

    @Test
    public void testHmac() {
        // RFC 4231 test case 2
        byte[] hmac = HDUtils.hmacSha512("Jefe".getBytes(), "what do ya want for nothing?".getBytes());
        assertEquals("164b7a7bfcf819e2e395fbe73b56e0a387bd64222e831fd610270cd7ea250554"
                + "9758bf75c05a994a6d034f65f8f0e6fdcaeab1a34d4a6b4b636e070a38bce737", HEX.encode(hmac));
    }

    @Test
    public void testFormatPath() {
        assertEquals("m", HDUtils.formatPath(ImmutableList.<ChildNumber>of()));
        assertEquals("m/44h/0h/0h/1/1", HDUtils.formatPath(ImmutableList.of(new ChildNumber(44, true),
                new ChildNumber(0, true), new ChildNumber(0, true), new ChildNumber(1, false),
                new ChildNumber(1, false))));
    }

    @Test
    public void testParsePath() {
        List<ChildNumber> expected = ImmutableList.of(new ChildNumber(44, true), new ChildNumber(0, true),
                new ChildNumber(0, true), new ChildNumber(1, false), new ChildNumber(1, false));
        assertEquals(expected, HDUtils.parsePath("m/44h/0h/0h/1/1"));
        assertEquals(expected, HDUtils.parsePath("M/44H/0H/0H/1/1"));
        assertEquals(expected, HDUtils.parsePath("/44'/0'/0'/1/1"));
        assertEquals(expected, HDUtils.parsePath("44h/0'/0H/1/1"));
        assertEquals(expected, HDUtils.parsePath(" m/44h/0h/0h/1/1 "));

        assertEquals(ImmutableList.of(), HDUtils.parsePath("m"));
        assertEquals(ImmutableList.of(), HDUtils.parsePath(""));
        assertEquals(ImmutableList.of(), HDUtils.parsePath("m/"));
        assertEquals(ImmutableList.of(new ChildNumber(Integer.MAX_VALUE, true)),
                HDUtils.parsePath("2147483647h"));
    }

    @Test
    public void testParseInvalidPaths() {
        String[] invalid = {
                "0//1",
                "0/1/",
                "m/x",
                "m/1hh",
                "m/-1",
                "m/+1",
                "m/2147483648",
                "m/99999999999",
                "m/1 /2",
        };
        for (String path : invalid) {
            try {
                HDUtils.parsePath(path);
                fail(path);
            } catch (HDDerivationException x) {
                assertEquals(path, HDDerivationException.Reason.INVALID_PATH, x.getReason());
            }
        }
    }

    @Test
    public void testAppendAndConcat() {
        List<ChildNumber> path = HDUtils.parsePath("m/1h");
        assertEquals(HDUtils.parsePath("m/1h/2"), HDUtils.append(path, new ChildNumber(2)));
        assertEquals(HDUtils.parsePath("m/1h/1h"), HDUtils.concat(path, path));
    }
}
