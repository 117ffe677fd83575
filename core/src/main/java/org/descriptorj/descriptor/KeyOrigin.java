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

import com.google.common.collect.ImmutableList;
import org.descriptorj.crypto.ChildNumber;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The {@code [fingerprint/path]} prefix of a key expression: the fingerprint of the master key the key descends
 * from and the path that leads to it. It is informational and does not take part in deriving scripts.
 */
public final class KeyOrigin {
    private final int fingerprint;
    private final ImmutableList<ChildNumber> path;

    public KeyOrigin(int fingerprint, List<ChildNumber> path) {
        this.fingerprint = fingerprint;
        this.path = ImmutableList.copyOf(path);
    }

    public int getFingerprint() {
        return fingerprint;
    }

    public ImmutableList<ChildNumber> getPath() {
        return path;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        sb.append(String.format(Locale.US, "%08x", fingerprint));
        for (ChildNumber step : path)
            sb.append('/').append(step);
        return sb.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyOrigin other = (KeyOrigin) o;
        return fingerprint == other.fingerprint && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, path);
    }
}
