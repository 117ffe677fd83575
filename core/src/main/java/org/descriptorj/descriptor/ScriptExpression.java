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

import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * A node of the descriptor syntax tree: one function such as {@code pkh(KEY)} or {@code sh(SCRIPT)} with its
 * arguments. A node owns its children exclusively and is immutable.
 */
public abstract class ScriptExpression {

    public enum Type {
        PK("pk"),
        PKH("pkh"),
        WPKH("wpkh"),
        SH("sh"),
        WSH("wsh"),
        MULTI("multi"),
        SORTED_MULTI("sortedmulti"),
        ADDR("addr"),
        RAW("raw"),
        COMBO("combo");

        private final String functionName;

        Type(String functionName) {
            this.functionName = functionName;
        }

        /** The name the function is written with in a descriptor. */
        public String functionName() {
            return functionName;
        }

        /** Returns the type written with the given function name, or null if there is none. */
        @Nullable
        public static Type fromFunctionName(String name) {
            for (Type type : values()) {
                if (type.functionName.equals(name))
                    return type;
            }
            return null;
        }
    }

    protected final Type type;

    protected ScriptExpression(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /** Returns every key of this expression and its descendants, in the order they are written. */
    public abstract ImmutableList<KeyExpression> getKeys();

    /** Returns a copy of this expression with every key replaced by the result of the given function. */
    public abstract ScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation);

    /** Returns the canonical text of this expression, without checksum. */
    @Override
    public String toString() {
        return DescriptorSerializer.serialize(this);
    }
}
