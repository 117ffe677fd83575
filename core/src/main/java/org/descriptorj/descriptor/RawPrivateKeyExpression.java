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

import org.descriptorj.core.DumpedPrivateKey;
import org.descriptorj.core.ECKey;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/** A private key in wallet import format. It stands for the corresponding public key. */
public class RawPrivateKeyExpression extends KeyExpression {
    private final DumpedPrivateKey privateKey;

    public RawPrivateKeyExpression(@Nullable KeyOrigin origin, DumpedPrivateKey privateKey) {
        super(origin);
        this.privateKey = checkNotNull(privateKey);
    }

    @Override
    public Type getType() {
        return Type.RAW_PRIVATE_KEY;
    }

    public DumpedPrivateKey getPrivateKey() {
        return privateKey;
    }

    @Override
    public boolean isCompressed() {
        return privateKey.isPubKeyCompressed();
    }

    @Override
    public ECKey resolve() {
        return privateKey.getKey();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawPrivateKeyExpression other = (RawPrivateKeyExpression) o;
        return Objects.equals(origin, other.origin) && privateKey.toBase58().equals(other.privateKey.toBase58());
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, privateKey.toBase58());
    }
}
