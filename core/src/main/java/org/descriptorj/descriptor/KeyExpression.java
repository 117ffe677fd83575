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

/**
 * A key argument of a descriptor function: a hex encoded public key, a WIF private key, or an extended key with an
 * optional derivation path. Any of them may carry a {@link KeyOrigin}. Instances are immutable; operations that
 * change a key return a new instance.
 */
public abstract class KeyExpression {

    public enum Type {
        RAW_PUBLIC_KEY,
        RAW_PRIVATE_KEY,
        EXTENDED_KEY
    }

    @Nullable protected final KeyOrigin origin;

    protected KeyExpression(@Nullable KeyOrigin origin) {
        this.origin = origin;
    }

    public abstract Type getType();

    @Nullable
    public KeyOrigin getOrigin() {
        return origin;
    }

    /** Whether the public key this expression resolves to is serialized in compressed form. */
    public abstract boolean isCompressed();

    /** True if the key ends in a wildcard step. */
    public boolean isRange() {
        return false;
    }

    /** Number of alternatives of the key's multipath step, or 1 if it has none. */
    public int getMultipathCount() {
        return 1;
    }

    /** Returns this key with its wildcard replaced by the given index. */
    public KeyExpression atIndex(int index) {
        return this;
    }

    /** Returns this key with its multipath step replaced by the alternative at the given position. */
    public KeyExpression selectMultipath(int position) {
        return this;
    }

    /**
     * Returns the public key this expression stands for.
     *
     * @throws DescriptorDerivationException if the key has unresolved wildcard or multipath steps, or derivation
     *         fails
     */
    public abstract ECKey resolve() throws DescriptorDerivationException;

    /** Returns the canonical text of this key expression. */
    @Override
    public String toString() {
        return DescriptorSerializer.serialize(this);
    }
}
