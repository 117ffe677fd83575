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
import org.descriptorj.core.Address;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/** {@code addr(ADDR)}: the output script of an address. */
public class AddrScriptExpression extends ScriptExpression {
    private final Address address;

    public AddrScriptExpression(Address address) {
        super(Type.ADDR);
        this.address = checkNotNull(address);
    }

    public Address getAddress() {
        return address;
    }

    @Override
    public ImmutableList<KeyExpression> getKeys() {
        return ImmutableList.of();
    }

    @Override
    public AddrScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return address.equals(((AddrScriptExpression) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }
}
