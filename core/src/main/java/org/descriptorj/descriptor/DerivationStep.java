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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.descriptorj.crypto.ChildNumber;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * One element of the derivation path written after an extended key: a fixed child number, a wildcard {@code *}
 * standing for the index the descriptor is evaluated at, or a multipath group {@code <a;b;...>} standing for one of
 * several alternative branches. Instances are immutable.
 */
public final class DerivationStep {

    public enum Type {
        FIXED,
        WILDCARD,
        MULTIPATH
    }

    private final Type type;
    private final ImmutableList<ChildNumber> alternatives;
    private final boolean hardenedWildcard;

    private DerivationStep(Type type, ImmutableList<ChildNumber> alternatives, boolean hardenedWildcard) {
        this.type = type;
        this.alternatives = alternatives;
        this.hardenedWildcard = hardenedWildcard;
    }

    public static DerivationStep fixed(ChildNumber childNumber) {
        return new DerivationStep(Type.FIXED, ImmutableList.of(childNumber), false);
    }

    public static DerivationStep wildcard(boolean hardened) {
        return new DerivationStep(Type.WILDCARD, ImmutableList.<ChildNumber>of(), hardened);
    }

    /**
     * @throws IllegalArgumentException if there are fewer than two alternatives or two of them are equal
     */
    public static DerivationStep multipath(List<ChildNumber> alternatives) {
        checkArgument(alternatives.size() >= 2, "A multipath step needs at least two alternatives");
        checkArgument(alternatives.size() == alternatives.stream().distinct().count(),
                "Multipath alternatives must be distinct: %s", alternatives);
        return new DerivationStep(Type.MULTIPATH, ImmutableList.copyOf(alternatives), false);
    }

    public Type getType() {
        return type;
    }

    /** Returns the child number of a {@link Type#FIXED} step. */
    public ChildNumber getChildNumber() {
        checkState(type == Type.FIXED, "Not a fixed step: %s", this);
        return alternatives.get(0);
    }

    /** Returns the alternatives of a {@link Type#MULTIPATH} step. */
    public ImmutableList<ChildNumber> getAlternatives() {
        checkState(type == Type.MULTIPATH, "Not a multipath step: %s", this);
        return alternatives;
    }

    /** True for a wildcard that derives hardened children, {@code *h}. */
    public boolean isHardenedWildcard() {
        return type == Type.WILDCARD && hardenedWildcard;
    }

    /** Replaces a wildcard by the fixed step for the given index. Other steps are returned unchanged. */
    public DerivationStep atIndex(int index) {
        if (type != Type.WILDCARD)
            return this;
        return fixed(new ChildNumber(index, hardenedWildcard));
    }

    /** Replaces a multipath step by its alternative with the given position. Other steps are returned unchanged. */
    public DerivationStep selectAlternative(int position) {
        if (type != Type.MULTIPATH)
            return this;
        return fixed(alternatives.get(position));
    }

    /** Canonical text of the step, with {@code h} as hardened marker. */
    @Override
    public String toString() {
        switch (type) {
            case FIXED:
                return alternatives.get(0).toString();
            case WILDCARD:
                return hardenedWildcard ? "*h" : "*";
            case MULTIPATH:
                return "<" + Joiner.on(';').join(alternatives) + ">";
            default:
                throw new IllegalStateException("Unknown step type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DerivationStep other = (DerivationStep) o;
        return type == other.type && hardenedWildcard == other.hardenedWildcard
                && alternatives.equals(other.alternatives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, alternatives, hardenedWildcard);
    }
}
