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

import org.descriptorj.core.ECKey;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/** A public key written as 66 or 130 hex characters. */
public class RawPublicKeyExpression extends KeyExpression {
    private final ECKey key;

    public RawPublicKeyExpression(@Nullable KeyOrigin origin, ECKey key) {
        super(origin);
        this.key = checkNotNull(key);
    }

    @Override
    public Type getType() {
        return Type.RAW_PUBLIC_KEY;
    }

    public ECKey getKey() {
        return key;
    }

    @Override
    public boolean isCompressed() {
        return key.isCompressed();
    }

    @Override
    public ECKey resolve() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawPublicKeyExpression other = (RawPublicKeyExpression) o;
        return Objects.equals(origin, other.origin) && Arrays.equals(key.getPubKey(), other.key.getPubKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, Arrays.hashCode(key.getPubKey()));
    }
}
