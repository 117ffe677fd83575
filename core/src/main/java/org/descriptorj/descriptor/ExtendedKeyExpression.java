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
import org.descriptorj.crypto.DeterministicKey;
import org.descriptorj.crypto.HDDerivationException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An extended public or private key followed by an optional derivation path. The path may end in a wildcard and
 * may contain one multipath step.
 */
public class ExtendedKeyExpression extends KeyExpression {
    private final DeterministicKey key;
    private final String encoded;
    private final ImmutableList<DerivationStep> path;

    /**
     * @param key the decoded extended key
     * @param encoded the base58 form of the key, as written in the descriptor
     * @param path the steps that follow the key
     */
    public ExtendedKeyExpression(@Nullable KeyOrigin origin, DeterministicKey key, String encoded,
                                 List<DerivationStep> path) {
        super(origin);
        this.key = checkNotNull(key);
        this.encoded = checkNotNull(encoded);
        this.path = ImmutableList.copyOf(path);
    }

    @Override
    public Type getType() {
        return Type.EXTENDED_KEY;
    }

    public DeterministicKey getKey() {
        return key;
    }

    /** Returns the base58 form of the extended key. */
    public String getEncoded() {
        return encoded;
    }

    public ImmutableList<DerivationStep> getPath() {
        return path;
    }

    /** True for an xprv, false for an xpub. */
    public boolean isPrivate() {
        return key.hasPrivKey();
    }

    @Override
    public boolean isCompressed() {
        return true;
    }

    @Override
    public boolean isRange() {
        for (DerivationStep step : path) {
            if (step.getType() == DerivationStep.Type.WILDCARD)
                return true;
        }
        return false;
    }

    public boolean hasMultipath() {
        return getMultipathCount() > 1;
    }

    @Override
    public int getMultipathCount() {
        for (DerivationStep step : path) {
            if (step.getType() == DerivationStep.Type.MULTIPATH)
                return step.getAlternatives().size();
        }
        return 1;
    }

    @Override
    public ExtendedKeyExpression atIndex(int index) {
        checkArgument(index >= 0, "Index must not be negative: %s", index);
        if (!isRange())
            return this;
        List<DerivationStep> steps = new ArrayList<>(path.size());
        for (DerivationStep step : path)
            steps.add(step.atIndex(index));
        return new ExtendedKeyExpression(origin, key, encoded, steps);
    }

    @Override
    public ExtendedKeyExpression selectMultipath(int position) {
        if (!hasMultipath())
            return this;
        List<DerivationStep> steps = new ArrayList<>(path.size());
        for (DerivationStep step : path)
            steps.add(step.selectAlternative(position));
        return new ExtendedKeyExpression(origin, key, encoded, steps);
    }

    /**
     * Derives the key at the end of the path.
     *
     * @throws DescriptorDerivationException if the path still has a wildcard or multipath step, if a hardened step
     *         follows a public key, or if a derived key is invalid
     */
    @Override
    public DeterministicKey resolve() throws DescriptorDerivationException {
        List<ChildNumber> childNumbers = new ArrayList<>(path.size());
        for (DerivationStep step : path) {
            if (step.getType() != DerivationStep.Type.FIXED)
                throw new DescriptorDerivationException("Key " + this + " has an unresolved " + step + " step");
            childNumbers.add(step.getChildNumber());
        }
        try {
            return key.derive(childNumbers);
        } catch (HDDerivationException x) {
            throw new DescriptorDerivationException("Cannot derive " + this + ": " + x.getMessage(), x);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExtendedKeyExpression other = (ExtendedKeyExpression) o;
        return Objects.equals(origin, other.origin) && encoded.equals(other.encoded) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, encoded, path);
    }
}
